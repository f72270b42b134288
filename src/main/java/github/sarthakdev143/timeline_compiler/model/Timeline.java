package github.sarthakdev143.timeline_compiler.model;

import java.util.List;

/**
 * Ordered segments for one (layer, medium) pair.
 */
public record Timeline(TimelineKey key, List<Segment> segments) {

    public Timeline {
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    public double totalDuration() {
        double total = 0.0;
        for (Segment segment : segments) {
            total = Math.max(total, segment.endTime());
        }
        return total;
    }

    public double firstStart() {
        return segments.isEmpty() ? 0.0 : segments.get(0).startTime();
    }

    public boolean hasMedia() {
        return segments.stream().anyMatch(segment -> !segment.isGap());
    }

    public long gapCount() {
        return segments.stream().filter(Segment::isGap).count();
    }
}
