package github.sarthakdev143.timeline_compiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * All timelines of one export, keyed and iterated in (layer, medium) order, plus the text clips that are
 * composited as drawtext items. {@code totalDuration} spans every timeline and every text clip.
 */
public record LayeredTimeline(Map<TimelineKey, Timeline> timelines, List<Segment> textSegments, double fps) {

    public LayeredTimeline {
        timelines = Collections.unmodifiableMap(new TreeMap<>(timelines == null ? Map.of() : timelines));
        textSegments = textSegments == null ? List.of() : List.copyOf(textSegments);
    }

    public List<Timeline> byMedium(MediaKind medium) {
        List<Timeline> result = new ArrayList<>();
        for (Timeline timeline : timelines.values()) {
            if (timeline.key().medium() == medium) {
                result.add(timeline);
            }
        }
        return result;
    }

    public double totalDuration() {
        double total = 0.0;
        for (Timeline timeline : timelines.values()) {
            total = Math.max(total, timeline.totalDuration());
        }
        for (Segment segment : textSegments) {
            total = Math.max(total, segment.endTime());
        }
        return total;
    }

    public boolean hasAudio() {
        return !byMedium(MediaKind.AUDIO).isEmpty();
    }

    public double frameDuration() {
        return 1.0 / fps;
    }
}
