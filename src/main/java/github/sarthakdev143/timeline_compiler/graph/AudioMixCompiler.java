package github.sarthakdev143.timeline_compiler.graph;

import github.sarthakdev143.timeline_compiler.catalog.CatalogedInputs;
import github.sarthakdev143.timeline_compiler.config.TimelineCompilerProperties;
import github.sarthakdev143.timeline_compiler.exception.UnresolvableSegmentException;
import github.sarthakdev143.timeline_compiler.model.LayeredTimeline;
import github.sarthakdev143.timeline_compiler.model.MediaKind;
import github.sarthakdev143.timeline_compiler.model.Segment;
import github.sarthakdev143.timeline_compiler.model.Timeline;
import github.sarthakdev143.timeline_compiler.model.TrackDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Audio side of the graph. Every clip is placed by delay rather than concatenation so overlapping clips blend, and
 * the result is always padded and trimmed to exactly the export duration.
 */
@Component
public class AudioMixCompiler {

    static final String AUDIO_OUTPUT = "audio";

    private static final Logger logger = LoggerFactory.getLogger(AudioMixCompiler.class);
    private static final double EPSILON = 1e-6;

    private final TimelineCompilerProperties properties;

    public AudioMixCompiler(TimelineCompilerProperties properties) {
        this.properties = properties;
    }

    /**
     * @return the terminal audio label, or {@code null} when no audio timeline exists
     */
    public GraphLabel compile(
            FilterGraphBuilder graph,
            LayeredTimeline timelines,
            CatalogedInputs inputs,
            double totalDuration,
            SkippedSegments skipped) {
        if (!timelines.hasAudio()) {
            return null;
        }

        List<GraphLabel> streams = new ArrayList<>();
        for (Timeline timeline : timelines.byMedium(MediaKind.AUDIO)) {
            for (Segment segment : timeline.segments()) {
                if (segment.isGap()) {
                    continue;
                }
                int inputIndex;
                try {
                    inputIndex = inputs.indexFor(segment);
                } catch (UnresolvableSegmentException ex) {
                    logger.warn("Skipping audio segment: {}", ex.getMessage());
                    skipped.record(segment);
                    continue;
                }
                streams.add(graph.chain(
                        List.of(graph.audioInput(inputIndex)),
                        "aseg",
                        segmentFilters(segment, totalDuration)));
            }
        }

        String total = FilterText.time(totalDuration);
        GraphLabel output = graph.named(AUDIO_OUTPUT);
        if (streams.isEmpty()) {
            graph.chainInto(List.of(), output, List.of(
                    "anullsrc=channel_layout=" + properties.getAudioChannelLayout()
                            + ":sample_rate=" + properties.getAudioSampleRate(),
                    "atrim=duration=" + total,
                    "asetpts=PTS-STARTPTS"));
            return output;
        }

        if (streams.size() == 1) {
            graph.chainInto(streams, output, List.of("apad=pad_dur=" + total, "atrim=duration=" + total));
            return output;
        }

        GraphLabel mixed = graph.chain(
                streams,
                "mixed",
                List.of("amix=inputs=" + streams.size() + ":duration=longest:dropout_transition=0:normalize=0"));
        graph.chainInto(List.of(mixed), output, List.of("apad=pad_dur=" + total, "atrim=duration=" + total));
        return output;
    }

    List<String> segmentFilters(Segment segment, double totalDuration) {
        TrackDescriptor track = segment.source();
        double duration = segment.duration();
        List<String> filters = new ArrayList<>();
        filters.add("atrim=start=" + FilterText.time(segment.sourceStart()) + ":duration=" + FilterText.time(duration));
        filters.add("asetpts=PTS-STARTPTS");

        if (track.muted() || (Double.isInfinite(track.volumeDb()) && track.volumeDb() < 0)) {
            filters.add("volume=" + FilterText.twoDecimals(properties.getMuteVolumeDb()) + "dB");
        } else if (Math.abs(track.volumeDb()) > EPSILON) {
            filters.add("volume=" + FilterText.twoDecimals(track.volumeDb()) + "dB");
        }

        if (track.fadeInSec() > 0) {
            filters.add("afade=t=in:st=0:d=" + FilterText.twoDecimals(track.fadeInSec()));
        }
        if (track.fadeOutSec() > 0 && duration > track.fadeOutSec()) {
            filters.add("afade=t=out:st=" + FilterText.twoDecimals(duration - track.fadeOutSec())
                    + ":d=" + FilterText.twoDecimals(track.fadeOutSec()));
        }

        if (segment.startTime() > EPSILON) {
            String delay = FilterText.millis(segment.startTime());
            filters.add("adelay=" + delay + "|" + delay);
        }
        if (segment.endTime() > totalDuration + EPSILON) {
            filters.add("atrim=duration=" + FilterText.time(totalDuration));
        }
        return filters;
    }
}
