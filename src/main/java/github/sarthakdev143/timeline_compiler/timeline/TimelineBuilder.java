package github.sarthakdev143.timeline_compiler.timeline;

import github.sarthakdev143.timeline_compiler.config.TimelineCompilerProperties;
import github.sarthakdev143.timeline_compiler.exception.TimelineContractException;
import github.sarthakdev143.timeline_compiler.model.LayeredTimeline;
import github.sarthakdev143.timeline_compiler.model.MediaKind;
import github.sarthakdev143.timeline_compiler.model.Segment;
import github.sarthakdev143.timeline_compiler.model.Timeline;
import github.sarthakdev143.timeline_compiler.model.TimelineKey;
import github.sarthakdev143.timeline_compiler.model.TrackDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns frame placements into per-(layer, medium) timelines without coverage holes.
 * <p>
 * The lowest video layer and every audio timeline are covered from t=0. Upper video layers are covered from their
 * first segment on, so the compositor can keep them invisible before it. Image timelines are never filled because
 * every image segment is composited on its own.
 */
@Component
public class TimelineBuilder {

    private static final Logger logger = LoggerFactory.getLogger(TimelineBuilder.class);
    private static final Comparator<Segment> BY_START = Comparator.comparingDouble(Segment::startTime);

    private final TimelineCompilerProperties properties;

    public TimelineBuilder(TimelineCompilerProperties properties) {
        this.properties = properties;
    }

    public LayeredTimeline build(List<TrackDescriptor> tracks, double fps) {
        if (fps <= 0) {
            throw new IllegalArgumentException("Frame rate must be greater than 0.");
        }

        Map<TimelineKey, List<Segment>> grouped = new TreeMap<>();
        List<TrackDescriptor> declaredGaps = new ArrayList<>();
        List<Segment> textSegments = new ArrayList<>();

        for (TrackDescriptor track : tracks) {
            requireWellFormed(track);
            switch (track.kind()) {
                case GAP -> declaredGaps.add(track);
                case TEXT -> {
                    if (track.visible() && track.textContent() != null && !track.textContent().isBlank()
                            && track.timelineEndFrame() > track.timelineStartFrame()) {
                        textSegments.add(Segment.of(track, fps));
                    }
                }
                case VIDEO, AUDIO, IMAGE -> {
                    if (track.timelineEndFrame() <= track.timelineStartFrame()) {
                        logger.warn("Skipping {} track {} with empty placement {}-{}",
                                track.kind(), track.index(), track.timelineStartFrame(), track.timelineEndFrame());
                        continue;
                    }
                    grouped.computeIfAbsent(new TimelineKey(track.layer(), track.kind()), key -> new ArrayList<>())
                            .add(Segment.of(track, fps));
                }
            }
        }

        Integer bottomVideoLayer = bottomVisualLayer(grouped);
        Map<TimelineKey, List<Segment>> filled = new TreeMap<>();
        for (Map.Entry<TimelineKey, List<Segment>> entry : grouped.entrySet()) {
            TimelineKey key = entry.getKey();
            List<Segment> segments = new ArrayList<>(entry.getValue());
            segments.sort(BY_START);
            if (key.medium() != MediaKind.IMAGE) {
                boolean fromZero = key.medium() == MediaKind.AUDIO
                        || (bottomVideoLayer != null && key.layer() == bottomVideoLayer);
                segments = fillGaps(key.medium(), segments, fps, fromZero);
            }
            filled.put(key, segments);
        }

        applyDeclaredGaps(filled, declaredGaps, fps, tracks.size());

        Map<TimelineKey, Timeline> timelines = new TreeMap<>();
        filled.forEach((key, segments) -> timelines.put(key, new Timeline(key, segments)));
        textSegments.sort(BY_START);

        LayeredTimeline result = new LayeredTimeline(timelines, textSegments, fps);
        logger.info("Built {} timelines and {} text clips, total duration {}s",
                timelines.size(), textSegments.size(), String.format(Locale.ROOT, "%.3f", result.totalDuration()));
        return result;
    }

    /**
     * Inserts gap segments over holes longer than the configured epsilon and snaps shorter holes shut. Overlapping
     * segments are trimmed at their head so the result never overlaps. Filling a filled timeline is a no-op.
     */
    public List<Segment> fillGaps(MediaKind medium, List<Segment> segments, double fps, boolean fromZero) {
        List<Segment> sorted = new ArrayList<>(segments);
        sorted.sort(BY_START);
        List<Segment> result = new ArrayList<>();
        if (sorted.isEmpty()) {
            return result;
        }

        double threshold = properties.getGapEpsilonFrames() / fps;
        double current = fromZero ? 0.0 : sorted.get(0).startTime();

        for (Segment segment : sorted) {
            double hole = segment.startTime() - current;
            if (hole > threshold) {
                result.add(Segment.gap(medium, current, segment.startTime()));
                result.add(segment);
            } else if (hole > 0) {
                result.add(segment.withStart(current));
            } else if (hole < 0) {
                if (segment.endTime() - current <= threshold) {
                    logger.warn("Dropping {} segment of track {} hidden behind earlier content at {}s",
                            medium, segment.trackIndex(), current);
                    continue;
                }
                double overlap = current - segment.startTime();
                result.add(segment.withWindow(current, segment.endTime(), segment.sourceStart() + overlap));
            } else {
                result.add(segment);
            }
            current = Math.max(current, segment.endTime());
        }
        return result;
    }

    /**
     * Inserts one declared gap, splitting a segment it starts inside of and shifting everything after it.
     *
     * @return the next free synthetic track index
     */
    int insertDeclaredGap(List<Segment> segments, MediaKind medium, double gapStart, double gapDuration, int nextSyntheticIndex) {
        int insertIndex = segments.size();
        Integer splitIndex = null;
        for (int i = 0; i < segments.size(); i++) {
            Segment segment = segments.get(i);
            if (gapStart < segment.startTime()) {
                insertIndex = i;
                break;
            }
            if (gapStart < segment.endTime()) {
                insertIndex = i + 1;
                splitIndex = i;
                break;
            }
        }

        double minimum = properties.getMinimumSplitSeconds();
        List<Segment> toInsert = new ArrayList<>();
        double actualStart;

        if (splitIndex != null) {
            Segment segment = segments.get(splitIndex);
            double splitOffset = gapStart - segment.startTime();
            Segment before = segment.withWindow(segment.startTime(), gapStart, segment.sourceStart());
            Segment after = segment.isGap()
                    ? Segment.gap(medium, gapStart, segment.endTime())
                    : new Segment(
                            segment.source(),
                            segment.medium(),
                            nextSyntheticIndex++,
                            gapStart,
                            segment.endTime(),
                            segment.sourceStart() + splitOffset);

            if (before.duration() > minimum) {
                segments.set(splitIndex, before);
            } else {
                segments.remove((int) splitIndex);
                insertIndex--;
            }
            actualStart = gapStart;
            toInsert.add(Segment.gap(medium, actualStart, actualStart + gapDuration));
            if (after.duration() > minimum) {
                toInsert.add(after);
            }
            logger.debug("Split {} segment at {}s for declared gap of {}s", medium, gapStart, gapDuration);
        } else {
            actualStart = insertIndex < segments.size()
                    ? segments.get(insertIndex).startTime()
                    : segments.stream().mapToDouble(Segment::endTime).max().orElse(0.0);
            toInsert.add(Segment.gap(medium, actualStart, actualStart + gapDuration));
        }

        segments.addAll(insertIndex, toInsert);
        for (int i = insertIndex + 1; i < segments.size(); i++) {
            segments.set(i, segments.get(i).shiftedBy(gapDuration));
        }
        return nextSyntheticIndex;
    }

    private void applyDeclaredGaps(
            Map<TimelineKey, List<Segment>> timelines,
            List<TrackDescriptor> declaredGaps,
            double fps,
            int firstSyntheticIndex) {
        List<TrackDescriptor> ordered = new ArrayList<>(declaredGaps);
        ordered.sort(Comparator.comparingInt(TrackDescriptor::timelineStartFrame));

        int nextSyntheticIndex = firstSyntheticIndex;
        for (TrackDescriptor gap : ordered) {
            TimelineKey key = new TimelineKey(gap.layer(), gap.gapMedium());
            List<Segment> segments = timelines.computeIfAbsent(key, ignored -> new ArrayList<>());
            double gapStart = gap.startSeconds(fps);
            double gapDuration = gap.endSeconds(fps) - gapStart;
            nextSyntheticIndex = insertDeclaredGap(segments, gap.gapMedium(), gapStart, gapDuration, nextSyntheticIndex);
        }
    }

    private void requireWellFormed(TrackDescriptor track) {
        if (track.layer() < 0) {
            throw new TimelineContractException("Track " + track.index() + " declares negative layer " + track.layer() + ".");
        }
        if (track.timelineEndFrame() < track.timelineStartFrame()) {
            throw new TimelineContractException(
                    "Track " + track.index() + " ends at frame " + track.timelineEndFrame()
                            + " before its start frame " + track.timelineStartFrame() + ".");
        }
        if (track.kind() == MediaKind.GAP
                && track.gapMedium() != MediaKind.VIDEO
                && track.gapMedium() != MediaKind.AUDIO) {
            throw new TimelineContractException(
                    "Gap track " + track.index() + " must be declared on a video or audio timeline, got " + track.gapMedium() + ".");
        }
    }

    private Integer bottomVisualLayer(Map<TimelineKey, List<Segment>> grouped) {
        Integer bottom = null;
        for (TimelineKey key : grouped.keySet()) {
            if (key.medium() == MediaKind.VIDEO || key.medium() == MediaKind.IMAGE) {
                bottom = bottom == null ? key.layer() : Math.min(bottom, key.layer());
            }
        }
        return bottom;
    }
}
