package github.sarthakdev143.timeline_compiler.timeline;

import github.sarthakdev143.timeline_compiler.config.TimelineCompilerProperties;
import github.sarthakdev143.timeline_compiler.exception.TimelineContractException;
import github.sarthakdev143.timeline_compiler.model.LayeredTimeline;
import github.sarthakdev143.timeline_compiler.model.MediaKind;
import github.sarthakdev143.timeline_compiler.model.Segment;
import github.sarthakdev143.timeline_compiler.model.Timeline;
import github.sarthakdev143.timeline_compiler.model.TimelineKey;
import github.sarthakdev143.timeline_compiler.model.TrackDescriptor;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static github.sarthakdev143.timeline_compiler.TrackFixtures.audio;
import static github.sarthakdev143.timeline_compiler.TrackFixtures.gap;
import static github.sarthakdev143.timeline_compiler.TrackFixtures.image;
import static github.sarthakdev143.timeline_compiler.TrackFixtures.text;
import static github.sarthakdev143.timeline_compiler.TrackFixtures.video;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TimelineBuilderTest {

    private static final double FPS = 30.0;

    private final TimelineBuilder builder = new TimelineBuilder(new TimelineCompilerProperties());

    @Test
    void twoSequentialClipsProduceNoGaps() {
        LayeredTimeline timelines = builder.build(List.of(
                video(0, "a.mp4", 0, 150).build(),
                video(1, "b.mp4", 150, 300).build()), FPS);

        Timeline layer = timelines.timelines().get(new TimelineKey(0, MediaKind.VIDEO));
        assertThat(layer.segments()).hasSize(2);
        assertThat(layer.gapCount()).isZero();
        assertThat(timelines.totalDuration()).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void textClipsCountTowardsTotalDuration() {
        LayeredTimeline timelines = builder.build(List.of(text(0, "Title", 0, 90).build()), FPS);

        assertThat(timelines.timelines()).isEmpty();
        assertThat(timelines.totalDuration()).isCloseTo(3.0, within(1e-9));
    }

    @Test
    void audioTimelineIsFilledFromZero() {
        LayeredTimeline timelines = builder.build(List.of(audio(0, "music.mp3", 60, 210).build()), FPS);

        List<Segment> segments = timelines.timelines().get(new TimelineKey(0, MediaKind.AUDIO)).segments();
        assertThat(segments).hasSize(2);
        assertThat(segments.get(0).isGap()).isTrue();
        assertThat(segments.get(0).endTime()).isCloseTo(2.0, within(1e-9));
        assertThat(segments.get(1).startTime()).isCloseTo(2.0, within(1e-9));
        assertThat(segments.get(1).endTime()).isCloseTo(7.0, within(1e-9));
    }

    @Test
    void upperVideoLayerStartsAtItsFirstSegment() {
        LayeredTimeline timelines = builder.build(List.of(
                video(0, "base.mp4", 0, 300).build(),
                video(1, "pip.mp4", 60, 120).layer(1).build()), FPS);

        Timeline upper = timelines.timelines().get(new TimelineKey(1, MediaKind.VIDEO));
        assertThat(upper.segments()).singleElement().satisfies(segment -> assertThat(segment.isGap()).isFalse());
        assertThat(upper.firstStart()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void imageTimelinesAreNeverFilled() {
        LayeredTimeline timelines = builder.build(List.of(
                video(0, "base.mp4", 0, 300).build(),
                image(1, "a.png", 60, 90).layer(1).build(),
                image(2, "b.png", 150, 180).layer(1).build()), FPS);

        assertThat(timelines.timelines().get(new TimelineKey(1, MediaKind.IMAGE)).segments()).hasSize(2);
    }

    @Test
    void fillGapsSnapsHolesShorterThanHalfAFrame() {
        TrackDescriptor a = video(0, "a.mp4", 0, 150).build();
        TrackDescriptor b = video(1, "b.mp4", 150, 300).build();
        Segment first = Segment.of(a, FPS);
        Segment second = new Segment(b, MediaKind.VIDEO, 1, 5.01, 10.0, 0.0);

        List<Segment> filled = builder.fillGaps(MediaKind.VIDEO, List.of(first, second), FPS, true);

        assertThat(filled).hasSize(2);
        assertThat(filled.get(1).startTime()).isEqualTo(5.0);
    }

    @Test
    void fillGapsTrimsOverlappingSegmentAtItsHead() {
        Segment first = Segment.of(video(0, "a.mp4", 0, 150).build(), FPS);
        Segment second = Segment.of(video(1, "b.mp4", 120, 300).sourceStart(2.0).build(), FPS);

        List<Segment> filled = builder.fillGaps(MediaKind.VIDEO, List.of(first, second), FPS, true);

        assertThat(filled).hasSize(2);
        assertThat(filled.get(1).startTime()).isCloseTo(5.0, within(1e-9));
        assertThat(filled.get(1).sourceStart()).isCloseTo(3.0, within(1e-9));
    }

    @Test
    void fillingAFilledTimelineIsANoOp() {
        List<Segment> segments = List.of(
                Segment.of(video(0, "a.mp4", 30, 90).build(), FPS),
                Segment.of(video(1, "b.mp4", 150, 210).build(), FPS));

        List<Segment> once = builder.fillGaps(MediaKind.VIDEO, segments, FPS, true);
        List<Segment> twice = builder.fillGaps(MediaKind.VIDEO, once, FPS, true);

        assertThat(once).hasSize(4);
        assertThat(twice).containsExactlyElementsOf(once);
    }

    @Test
    void filledSegmentDurationsSumToTotalDuration() {
        LayeredTimeline timelines = builder.build(List.of(
                video(0, "a.mp4", 15, 100).build(),
                video(1, "b.mp4", 130, 200).build(),
                video(2, "c.mp4", 260, 301).build()), FPS);

        Timeline layer = timelines.timelines().get(new TimelineKey(0, MediaKind.VIDEO));
        double sum = layer.segments().stream().mapToDouble(Segment::duration).sum();
        assertThat(sum).isCloseTo(layer.totalDuration(), within(1.0 / FPS));
    }

    @Test
    void declaredGapSplitsSegmentAndShiftsTheRest() {
        LayeredTimeline timelines = builder.build(List.of(
                video(0, "a.mp4", 0, 300).build(),
                gap(1, MediaKind.VIDEO, 150, 180).build()), FPS);

        List<Segment> segments = timelines.timelines().get(new TimelineKey(0, MediaKind.VIDEO)).segments();
        assertThat(segments).hasSize(3);
        assertThat(segments.get(0).endTime()).isCloseTo(5.0, within(1e-9));
        assertThat(segments.get(1).isGap()).isTrue();
        assertThat(segments.get(1).duration()).isCloseTo(1.0, within(1e-9));
        assertThat(segments.get(2).startTime()).isCloseTo(6.0, within(1e-9));
        assertThat(segments.get(2).endTime()).isCloseTo(11.0, within(1e-9));
        assertThat(segments.get(2).sourceStart()).isCloseTo(5.0, within(1e-9));
        assertThat(segments.get(2).trackIndex()).isEqualTo(2);
    }

    @Test
    void declaredGapDropsSplitPartsBelowTheMinimum() {
        List<Segment> segments = new ArrayList<>(List.of(Segment.of(video(0, "a.mp4", 0, 300).build(), FPS)));

        builder.insertDeclaredGap(segments, MediaKind.VIDEO, 0.0, 1.0, 10);

        assertThat(segments).hasSize(2);
        assertThat(segments.get(0).isGap()).isTrue();
        assertThat(segments.get(1).startTime()).isCloseTo(1.0, within(1e-9));
        assertThat(segments.get(1).endTime()).isCloseTo(11.0, within(1e-9));
    }

    @Test
    void declaredGapOnEmptyAudioTimelineCreatesIt() {
        LayeredTimeline timelines = builder.build(List.of(
                video(0, "a.mp4", 0, 300).build(),
                gap(1, MediaKind.AUDIO, 0, 300).build()), FPS);

        Timeline audio = timelines.timelines().get(new TimelineKey(0, MediaKind.AUDIO));
        assertThat(audio.segments()).singleElement().satisfies(segment -> assertThat(segment.isGap()).isTrue());
        assertThat(timelines.hasAudio()).isTrue();
    }

    @Test
    void hiddenAndEmptyTextClipsAreSkipped() {
        LayeredTimeline timelines = builder.build(List.of(
                video(0, "a.mp4", 0, 300).build(),
                text(1, "Shown", 0, 60).build(),
                text(2, "Hidden", 0, 60).hidden().build(),
                text(3, "  ", 0, 60).build()), FPS);

        assertThat(timelines.textSegments()).singleElement()
                .satisfies(segment -> assertThat(segment.source().textContent()).isEqualTo("Shown"));
    }

    @Test
    void negativeLayerIsAContractViolation() {
        assertThatThrownBy(() -> builder.build(List.of(video(0, "a.mp4", 0, 30).layer(-1).build()), FPS))
                .isInstanceOf(TimelineContractException.class)
                .hasMessageContaining("negative layer");
    }

    @Test
    void endBeforeStartIsAContractViolation() {
        assertThatThrownBy(() -> builder.build(List.of(video(0, "a.mp4", 60, 30).build()), FPS))
                .isInstanceOf(TimelineContractException.class)
                .hasMessageContaining("before its start frame");
    }

    @Test
    void gapOnImageTimelineIsAContractViolation() {
        assertThatThrownBy(() -> builder.build(List.of(gap(0, MediaKind.IMAGE, 0, 30).build()), FPS))
                .isInstanceOf(TimelineContractException.class)
                .hasMessageContaining("video or audio timeline");
    }

    @Test
    void frameRateMustBePositive() {
        assertThatThrownBy(() -> builder.build(List.of(), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Frame rate");
    }
}
