package github.sarthakdev143.timeline_compiler.dimension;

import github.sarthakdev143.timeline_compiler.config.TimelineCompilerProperties;
import github.sarthakdev143.timeline_compiler.model.Canvas;
import github.sarthakdev143.timeline_compiler.model.ExportJob;
import github.sarthakdev143.timeline_compiler.model.LayeredTimeline;
import github.sarthakdev143.timeline_compiler.model.TrackDescriptor;
import github.sarthakdev143.timeline_compiler.model.Transform;
import github.sarthakdev143.timeline_compiler.timeline.TimelineBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static github.sarthakdev143.timeline_compiler.TrackFixtures.audio;
import static github.sarthakdev143.timeline_compiler.TrackFixtures.job;
import static github.sarthakdev143.timeline_compiler.TrackFixtures.video;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DimensionNegotiatorTest {

    private final TimelineCompilerProperties properties = new TimelineCompilerProperties();
    private final TimelineBuilder timelineBuilder = new TimelineBuilder(properties);
    private final DimensionNegotiator negotiator = new DimensionNegotiator(properties);

    @Test
    void matchingRatiosNeedNoCrop() {
        CanvasPlan plan = negotiator.negotiate(timelines(video(0, "a.mp4", 0, 300).build()),
                job(30, null, new Canvas(1280, 720)));

        assertThat(plan.policy()).isEqualTo(CropPolicy.NONE);
        assertThat(plan.working()).isEqualTo(new Canvas(1920, 1080));
        assertThat(plan.needsFinalResize()).isTrue();
    }

    @Test
    void ratiosWithinToleranceNeedNoCrop() {
        CanvasPlan plan = negotiator.negotiate(timelines(video(0, "a.mp4", 0, 300).build()),
                job(30, null, new Canvas(1920, 1070)));

        assertThat(plan.policy()).isEqualTo(CropPolicy.NONE);
        assertThat(plan.crop()).isNull();
    }

    @Test
    void toleranceIsConfigurable() {
        properties.setAspectTolerance(0.3);

        CanvasPlan plan = negotiator.negotiate(timelines(video(0, "a.mp4", 0, 300).build()),
                job(30, null, new Canvas(1440, 1080)));

        assertThat(plan.policy()).isEqualTo(CropPolicy.NONE);
    }

    @Test
    void differentRatioSameOrientationIsCenterCropped() {
        CanvasPlan plan = negotiator.negotiate(timelines(video(0, "a.mp4", 0, 300).build()),
                job(30, null, new Canvas(1440, 1080)));

        assertThat(plan.policy()).isEqualTo(CropPolicy.CROP);
        CropWindow crop = plan.crop();
        assertThat(crop.height()).isEqualTo(1080);
        assertThat(Math.abs(crop.width() - crop.height() * (4.0 / 3.0))).isLessThanOrEqualTo(1.0);
        assertThat(crop.x()).isEqualTo(240);
        assertThat(crop.y()).isZero();
    }

    @Test
    void orientationFlipLetterboxesInsteadOfCropping() {
        CanvasPlan plan = negotiator.negotiate(timelines(video(0, "a.mp4", 0, 300).size(1080, 1920).build()),
                job(30, null, new Canvas(1920, 1080)));

        assertThat(plan.policy()).isEqualTo(CropPolicy.LETTERBOX);
        assertThat(plan.crop()).isNull();
        assertThat(plan.working()).isEqualTo(new Canvas(1080, 1920));
        assertThat(plan.desired()).isEqualTo(new Canvas(1920, 1080));
    }

    @Test
    void scaledPrimaryTrackBypassesNegotiation() {
        CanvasPlan plan = negotiator.negotiate(
                timelines(video(0, "a.mp4", 0, 300).transform(0.0, 0.0, 0.5, 0.0).build()),
                job(30, null, new Canvas(1440, 1080)));

        assertThat(plan.policy()).isEqualTo(CropPolicy.TRANSFORM_BYPASS);
    }

    @Test
    void pannedPrimaryTrackMovesCropWindowAndLosesItsPosition() {
        TrackDescriptor panned = video(0, "a.mp4", 0, 300).transform(1.0, 0.0, 1.0, 0.0).build();

        CanvasPlan plan = negotiator.negotiate(timelines(panned), job(30, null, new Canvas(1440, 1080)));

        assertThat(plan.crop().x()).isZero();
        assertThat(plan.panTrack()).isEqualTo(0);
        assertThat(plan.effectiveTransform(panned)).isEqualTo(Transform.IDENTITY);
    }

    @Test
    void panOffsetMapsEdgesAndCenter() {
        assertThat(DimensionNegotiator.panOffset(480, 1.0)).isZero();
        assertThat(DimensionNegotiator.panOffset(480, -1.0)).isEqualTo(480);
        assertThat(DimensionNegotiator.panOffset(480, 0.0)).isEqualTo(240);
        assertThat(DimensionNegotiator.panOffset(480, 0.5)).isEqualTo(120);
    }

    @Test
    void targetAspectDerivesDesiredCanvas() {
        ExportJob square = new ExportJob(
                30, false, null, null, "1:1", null, null, null, false, null, false, null, 0, "out.mp4");

        CanvasPlan plan = negotiator.negotiate(timelines(video(0, "a.mp4", 0, 300).build()), square);

        assertThat(plan.desired()).isEqualTo(new Canvas(1080, 1080));
        assertThat(plan.policy()).isEqualTo(CropPolicy.CROP);
        assertThat(plan.crop()).isEqualTo(new CropWindow(1080, 1080, 420, 0));
        assertThat(plan.needsFinalResize()).isFalse();
    }

    @Test
    void withoutVideoTheDefaultCanvasIsUsed() {
        CanvasPlan plan = negotiator.negotiate(timelines(audio(0, "music.mp3", 0, 300).build()), job());

        assertThat(plan.policy()).isEqualTo(CropPolicy.NONE);
        assertThat(plan.working()).isEqualTo(new Canvas(1920, 1080));
        assertThat(plan.needsFinalResize()).isFalse();
    }

    @Test
    void parseAspectAcceptsCommonNotations() {
        assertThat(DimensionNegotiator.parseAspect("16:9")).isCloseTo(16.0 / 9.0, within(1e-9));
        assertThat(DimensionNegotiator.parseAspect("9/16")).isCloseTo(9.0 / 16.0, within(1e-9));
        assertThat(DimensionNegotiator.parseAspect("1.5")).isCloseTo(1.5, within(1e-9));
        assertThat(DimensionNegotiator.parseAspect(" ")).isNull();
        assertThatThrownBy(() -> DimensionNegotiator.parseAspect("wide"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported aspect ratio");
    }

    private LayeredTimeline timelines(TrackDescriptor... tracks) {
        return timelineBuilder.build(List.of(tracks), 30);
    }
}
