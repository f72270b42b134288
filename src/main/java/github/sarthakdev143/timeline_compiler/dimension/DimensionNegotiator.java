package github.sarthakdev143.timeline_compiler.dimension;

import github.sarthakdev143.timeline_compiler.config.TimelineCompilerProperties;
import github.sarthakdev143.timeline_compiler.model.Canvas;
import github.sarthakdev143.timeline_compiler.model.ExportJob;
import github.sarthakdev143.timeline_compiler.model.LayeredTimeline;
import github.sarthakdev143.timeline_compiler.model.MediaKind;
import github.sarthakdev143.timeline_compiler.model.Segment;
import github.sarthakdev143.timeline_compiler.model.Timeline;
import github.sarthakdev143.timeline_compiler.model.TrackDescriptor;
import github.sarthakdev143.timeline_compiler.model.Transform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the working and output canvases and decides between crop, letterbox and no-op.
 */
@Component
public class DimensionNegotiator {

    private static final Logger logger = LoggerFactory.getLogger(DimensionNegotiator.class);
    private static final Pattern ASPECT_PATTERN = Pattern.compile("^\\s*(\\d+(?:\\.\\d+)?)\\s*[:/x]\\s*(\\d+(?:\\.\\d+)?)\\s*$");

    private final TimelineCompilerProperties properties;

    public DimensionNegotiator(TimelineCompilerProperties properties) {
        this.properties = properties;
    }

    public CanvasPlan negotiate(LayeredTimeline timelines, ExportJob job) {
        TrackDescriptor primary = primaryTrack(timelines);
        Canvas working = workingCanvas(timelines, job);
        Canvas desired = desiredCanvas(working, job, primary);

        if (primary == null) {
            logger.info("No video content, output {} from working canvas {}", desired.sizeExpression(), working.sizeExpression());
            return new CanvasPlan(working, desired, CropPolicy.NONE, null, -1);
        }

        Transform transform = primary.transform();
        if (transform.hasScale()) {
            logger.info("Primary track {} is scaled by its transform, skipping aspect crop", primary.index());
            return new CanvasPlan(working, desired, CropPolicy.TRANSFORM_BYPASS, null, -1);
        }

        double sourceRatio = working.ratio();
        double desiredRatio = desired.ratio();
        double ratioDifference = Math.abs(desiredRatio - sourceRatio) / sourceRatio;
        if (ratioDifference <= properties.getAspectTolerance()) {
            return new CanvasPlan(working, desired, CropPolicy.NONE, null, -1);
        }

        boolean orientationFlip = (working.isPortrait() && desired.isLandscape())
                || (working.isLandscape() && desired.isPortrait());
        if (orientationFlip) {
            logger.info("Orientation flips from {} to {}, letterboxing instead of cropping",
                    working.sizeExpression(), desired.sizeExpression());
            return new CanvasPlan(working, desired, CropPolicy.LETTERBOX, null, -1);
        }

        CropWindow crop = cropWindow(working, desiredRatio, transform);
        logger.info("Cropping {} to {}x{} at {},{} for output {}",
                working.sizeExpression(), crop.width(), crop.height(), crop.x(), crop.y(), desired.sizeExpression());
        return new CanvasPlan(working, desired, CropPolicy.CROP, crop, transform.hasPosition() ? primary.index() : -1);
    }

    CropWindow cropWindow(Canvas source, double desiredRatio, Transform pan) {
        int cropWidth;
        int cropHeight;
        if (desiredRatio > source.ratio()) {
            cropWidth = source.width();
            cropHeight = (int) Math.round(cropWidth / desiredRatio);
            if (cropHeight > source.height()) {
                cropHeight = source.height();
                cropWidth = (int) Math.round(cropHeight * desiredRatio);
            }
            cropHeight = (int) Math.round(cropWidth / desiredRatio);
        } else {
            cropHeight = source.height();
            cropWidth = (int) Math.round(cropHeight * desiredRatio);
            if (cropWidth > source.width()) {
                cropWidth = source.width();
                cropHeight = (int) Math.round(cropWidth / desiredRatio);
            }
            cropWidth = (int) Math.round(cropHeight * desiredRatio);
        }

        int x = panOffset(source.width() - cropWidth, pan.x());
        int y = panOffset(source.height() - cropHeight, pan.y());
        return new CropWindow(cropWidth, cropHeight, x, y);
    }

    /**
     * A pan of +1 reveals the left/top edge, -1 the right/bottom edge, 0 centers.
     */
    static int panOffset(int maxPanRange, double pan) {
        if (pan == 0.0) {
            return (int) Math.round(maxPanRange / 2.0);
        }
        double normalized = (pan + 1.0) / 2.0;
        int offset = (int) Math.round(maxPanRange * (1.0 - normalized));
        return Math.max(0, Math.min(maxPanRange, offset));
    }

    private Canvas workingCanvas(LayeredTimeline timelines, ExportJob job) {
        if (job.exportSize() != null) {
            return job.exportSize();
        }
        for (Timeline timeline : timelines.byMedium(MediaKind.VIDEO)) {
            for (Segment segment : timeline.segments()) {
                if (!segment.isGap() && segment.source().hasDeclaredSize()) {
                    return new Canvas(segment.source().width(), segment.source().height());
                }
            }
        }
        return new Canvas(properties.getDefaultWidth(), properties.getDefaultHeight());
    }

    private Canvas desiredCanvas(Canvas working, ExportJob job, TrackDescriptor primary) {
        if (job.customOutputSize() != null) {
            return job.customOutputSize();
        }
        String aspect = job.targetAspect();
        if ((aspect == null || aspect.isBlank()) && primary != null) {
            aspect = primary.aspectRatio();
        }
        Double ratio = parseAspect(aspect);
        if (ratio == null) {
            return working;
        }
        return fitRatio(working, ratio);
    }

    /**
     * Largest even-sized canvas of the given ratio that fits inside {@code working}.
     */
    static Canvas fitRatio(Canvas working, double ratio) {
        if (Math.abs(ratio - working.ratio()) < 1e-9) {
            return working;
        }
        if (ratio > working.ratio()) {
            int height = even((int) Math.round(working.width() / ratio));
            return new Canvas(working.width(), Math.max(2, height));
        }
        int width = even((int) Math.round(working.height() * ratio));
        return new Canvas(Math.max(2, width), working.height());
    }

    public static Double parseAspect(String aspect) {
        if (aspect == null || aspect.isBlank()) {
            return null;
        }
        Matcher matcher = ASPECT_PATTERN.matcher(aspect);
        if (matcher.matches()) {
            double width = Double.parseDouble(matcher.group(1));
            double height = Double.parseDouble(matcher.group(2));
            if (width > 0 && height > 0) {
                return width / height;
            }
            throw new IllegalArgumentException("Aspect ratio must have positive sides, got " + aspect + ".");
        }
        try {
            double value = Double.parseDouble(aspect.trim());
            if (value > 0) {
                return value;
            }
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Unsupported aspect ratio: " + aspect + ".", ex);
        }
        throw new IllegalArgumentException("Unsupported aspect ratio: " + aspect + ".");
    }

    private TrackDescriptor primaryTrack(LayeredTimeline timelines) {
        List<Timeline> videoLayers = timelines.byMedium(MediaKind.VIDEO);
        if (videoLayers.isEmpty()) {
            return null;
        }
        for (Segment segment : videoLayers.get(0).segments()) {
            if (!segment.isGap()) {
                return segment.source();
            }
        }
        return null;
    }

    private static int even(int value) {
        return value % 2 == 0 ? value : value - 1;
    }
}
