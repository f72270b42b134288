package github.sarthakdev143.timeline_compiler.service.impl;

import github.sarthakdev143.timeline_compiler.config.TimelineCompilerProperties;
import github.sarthakdev143.timeline_compiler.dimension.DimensionNegotiator;
import github.sarthakdev143.timeline_compiler.dto.ExportRequest;
import github.sarthakdev143.timeline_compiler.dto.JobRequest;
import github.sarthakdev143.timeline_compiler.dto.TextStyleRequest;
import github.sarthakdev143.timeline_compiler.dto.TrackRequest;
import github.sarthakdev143.timeline_compiler.dto.TransformRequest;
import github.sarthakdev143.timeline_compiler.model.Canvas;
import github.sarthakdev143.timeline_compiler.model.ExportDefinition;
import github.sarthakdev143.timeline_compiler.model.ExportJob;
import github.sarthakdev143.timeline_compiler.model.HardwareType;
import github.sarthakdev143.timeline_compiler.model.MediaKind;
import github.sarthakdev143.timeline_compiler.model.TextAlign;
import github.sarthakdev143.timeline_compiler.model.TextCase;
import github.sarthakdev143.timeline_compiler.model.TextStyle;
import github.sarthakdev143.timeline_compiler.model.TrackDescriptor;
import github.sarthakdev143.timeline_compiler.model.Transform;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Normalizes an export request into tracks and a job. Every rejection names the offending field.
 */
@Component
public class ExportRequestValidator {

    private static final int MAX_TRACKS = 500;
    private static final int MAX_FRAME_RATE = 240;
    private static final int MAX_DIMENSION = 8192;
    private static final int MAX_THREADS = 64;
    private static final double MAX_ROTATION_DEGREES = 360.0;
    private static final Set<String> SUBTITLE_FORMATS = Set.of("srt", "ass", "ssa", "vtt");
    private static final List<String> SOFTWARE_PRESETS = List.of(
            "ultrafast", "superfast", "veryfast", "faster", "fast", "medium", "slow", "slower", "veryslow");

    private final TimelineCompilerProperties properties;

    public ExportRequestValidator(TimelineCompilerProperties properties) {
        this.properties = properties;
    }

    public ExportDefinition normalizeAndValidate(ExportRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required.");
        }
        List<TrackRequest> tracks = request.tracks();
        if (tracks == null || tracks.isEmpty()) {
            throw new IllegalArgumentException("tracks must contain at least one track.");
        }
        if (tracks.size() > MAX_TRACKS) {
            throw new IllegalArgumentException("tracks supports at most " + MAX_TRACKS + " entries.");
        }

        List<TrackDescriptor> descriptors = new ArrayList<>();
        for (int index = 0; index < tracks.size(); index++) {
            descriptors.add(normalizeTrack(index, tracks.get(index)));
        }
        return new ExportDefinition(descriptors, normalizeJob(request.job()));
    }

    private TrackDescriptor normalizeTrack(int index, TrackRequest track) {
        String field = "tracks[" + index + "]";
        if (track == null) {
            throw new IllegalArgumentException(field + " must not be null.");
        }

        MediaKind kind = resolveKind(field, track);
        MediaKind gapMedium = kind == MediaKind.GAP ? resolveGapMedium(field, track.gapType()) : null;

        String path = blankToNull(track.path());
        if ((kind == MediaKind.VIDEO || kind == MediaKind.AUDIO || kind == MediaKind.IMAGE) && path == null) {
            throw new IllegalArgumentException(field + ".path is required for " + lower(kind) + " tracks.");
        }
        if (kind == MediaKind.TEXT && blankToNull(track.textContent()) == null) {
            throw new IllegalArgumentException(field + ".textContent is required for text tracks.");
        }

        int startFrame = requireNonNegative(track.timelineStartFrame(), field + ".timelineStartFrame");
        int endFrame = requireNonNegative(track.timelineEndFrame(), field + ".timelineEndFrame");
        if (endFrame < startFrame) {
            throw new IllegalArgumentException(
                    field + ".timelineEndFrame must not be before timelineStartFrame (" + startFrame + ").");
        }

        int layer = track.layer() == null ? 0 : track.layer();
        if (layer < 0) {
            throw new IllegalArgumentException(field + ".layer must be 0 or greater.");
        }

        double sourceStart = nonNegativeOrDefault(track.startTime(), 0.0, field + ".startTime");
        Double sourceDuration = track.duration();
        if (sourceDuration != null && sourceDuration <= 0) {
            throw new IllegalArgumentException(field + ".duration must be greater than 0.");
        }

        Integer width = optionalDimension(track.width(), field + ".width");
        Integer height = optionalDimension(track.height(), field + ".height");

        double volumeDb = track.volumeDb() == null ? 0.0 : track.volumeDb();
        if (Double.isNaN(volumeDb) || (volumeDb > 0 && Double.isInfinite(volumeDb))) {
            throw new IllegalArgumentException(field + ".volumeDb must be a finite number or -Infinity.");
        }

        String aspectRatio = blankToNull(track.aspectRatio());
        if (aspectRatio != null) {
            parseAspect(field + ".aspectRatio", aspectRatio);
        }

        return new TrackDescriptor(
                index,
                kind,
                gapMedium,
                kind == MediaKind.GAP ? MediaKind.GAP_MARKER : path,
                blankToNull(track.audioPath()),
                sourceStart,
                sourceDuration,
                startFrame,
                endFrame,
                layer,
                normalizeTransform(field + ".transform", track.transform()),
                Boolean.TRUE.equals(track.muted()),
                track.visible() == null || track.visible(),
                volumeDb,
                nonNegativeOrDefault(track.fadeInSec(), 0.0, field + ".fadeInSec"),
                nonNegativeOrDefault(track.fadeOutSec(), 0.0, field + ".fadeOutSec"),
                width,
                height,
                aspectRatio,
                track.textContent(),
                normalizeTextStyle(field + ".textStyle", track.textStyle()));
    }

    /**
     * Explicit type first, then the gap marker, then the file extension.
     */
    private MediaKind resolveKind(String field, TrackRequest track) {
        if (blankToNull(track.trackType()) != null) {
            try {
                return MediaKind.fromInput(track.trackType());
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException(
                        field + ".trackType must be one of gap, video, audio, image, text.", ex);
            }
        }
        if (MediaKind.GAP_MARKER.equals(track.path()) || blankToNull(track.gapType()) != null) {
            return MediaKind.GAP;
        }
        if (blankToNull(track.path()) == null && blankToNull(track.textContent()) != null) {
            return MediaKind.TEXT;
        }
        MediaKind fromExtension = MediaKind.fromPath(track.path());
        if (fromExtension == null) {
            throw new IllegalArgumentException(
                    field + ".trackType is required when the path has no recognized media extension.");
        }
        return fromExtension;
    }

    private MediaKind resolveGapMedium(String field, String gapType) {
        if (blankToNull(gapType) == null) {
            return MediaKind.VIDEO;
        }
        String normalized = gapType.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "video" -> MediaKind.VIDEO;
            case "audio" -> MediaKind.AUDIO;
            default -> throw new IllegalArgumentException(field + ".gapType must be video or audio.");
        };
    }

    private Transform normalizeTransform(String field, TransformRequest transform) {
        if (transform == null) {
            return Transform.IDENTITY;
        }
        double x = withinOrDefault(transform.x(), 0.0, -1.0, 1.0, field + ".x");
        double y = withinOrDefault(transform.y(), 0.0, -1.0, 1.0, field + ".y");
        double scale = transform.scale() == null ? 1.0 : transform.scale();
        if (scale <= 0 || Double.isNaN(scale) || Double.isInfinite(scale)) {
            throw new IllegalArgumentException(field + ".scale must be greater than 0.");
        }
        double rotation = withinOrDefault(
                transform.rotation(), 0.0, -MAX_ROTATION_DEGREES, MAX_ROTATION_DEGREES, field + ".rotation");
        return new Transform(x, y, scale, rotation);
    }

    private TextStyle normalizeTextStyle(String field, TextStyleRequest style) {
        if (style == null) {
            return TextStyle.DEFAULT;
        }
        int fontSize = TextStyle.DEFAULT_FONT_SIZE;
        if (style.fontSize() != null) {
            if (style.fontSize() <= 0) {
                throw new IllegalArgumentException(field + ".fontSize must be greater than 0.");
            }
            fontSize = style.fontSize();
        }

        TextAlign align;
        TextCase textCase;
        try {
            align = TextAlign.fromInput(style.textAlign());
            textCase = TextCase.fromInput(style.textTransform());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(field + "." + ex.getMessage(), ex);
        }

        String fontFile = blankToNull(style.fontFile());
        return new TextStyle(
                blankToNull(style.fontFamily()) == null ? TextStyle.DEFAULT.fontFamily() : style.fontFamily().trim(),
                fontFile == null ? null : Path.of(fontFile),
                fontSize,
                blankToNull(style.color()) == null ? TextStyle.DEFAULT.color() : style.color().trim(),
                blankToNull(style.strokeColor()),
                blankToNull(style.backgroundColor()),
                Boolean.TRUE.equals(style.shadow()),
                align,
                textCase);
    }

    private ExportJob normalizeJob(JobRequest job) {
        if (job == null) {
            throw new IllegalArgumentException("job is required.");
        }

        int frameRate = job.frameRate() == null ? properties.getDefaultFps() : job.frameRate();
        if (frameRate < 1 || frameRate > MAX_FRAME_RATE) {
            throw new IllegalArgumentException("job.frameRate must be between 1 and " + MAX_FRAME_RATE + ".");
        }

        Canvas exportSize = optionalCanvas(job.width(), job.height(), "job.width", "job.height");
        Canvas outputSize = optionalCanvas(job.outputWidth(), job.outputHeight(), "job.outputWidth", "job.outputHeight");

        String targetAspect = blankToNull(job.targetAspect());
        if (targetAspect != null) {
            parseAspect("job.targetAspect", targetAspect);
        }

        String subtitlePath = blankToNull(job.subtitlePath());
        String subtitleFormat = null;
        if (subtitlePath != null) {
            subtitleFormat = blankToNull(job.subtitleFormat()) == null
                    ? extensionOf(subtitlePath)
                    : job.subtitleFormat().trim().toLowerCase(Locale.ROOT);
            if (!SUBTITLE_FORMATS.contains(subtitleFormat)) {
                throw new IllegalArgumentException("job.subtitleFormat must be one of srt, ass, ssa, vtt.");
            }
        }

        HardwareType preferredHardware;
        try {
            preferredHardware = HardwareType.fromInput(job.hwaccelType());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("job." + ex.getMessage(), ex);
        }

        String preset = blankToNull(job.preset());
        if (preset != null) {
            preset = preset.toLowerCase(Locale.ROOT);
            if (!SOFTWARE_PRESETS.contains(preset)) {
                throw new IllegalArgumentException("job.preset must be one of " + String.join(", ", SOFTWARE_PRESETS) + ".");
            }
        }

        int threads = job.threads() == null ? 0 : job.threads();
        if (threads < 0 || threads > MAX_THREADS) {
            throw new IllegalArgumentException("job.threads must be between 0 and " + MAX_THREADS + ".");
        }

        String outputPath = blankToNull(job.outputPath());
        if (outputPath == null) {
            throw new IllegalArgumentException("job.outputPath is required.");
        }

        List<String> fontFamilies = new ArrayList<>();
        if (job.fontFamilies() != null) {
            for (String family : job.fontFamilies()) {
                if (blankToNull(family) != null) {
                    fontFamilies.add(family.trim());
                }
            }
        }

        return new ExportJob(
                frameRate,
                Boolean.TRUE.equals(job.normalizeFrameRate()),
                exportSize,
                outputSize,
                targetAspect,
                subtitlePath == null ? null : Path.of(subtitlePath),
                subtitleFormat,
                fontFamilies,
                job.hardwareAcceleration() == null || job.hardwareAcceleration(),
                preferredHardware,
                Boolean.TRUE.equals(job.preferHevc()),
                preset,
                threads,
                outputPath);
    }

    private Canvas optionalCanvas(Integer width, Integer height, String widthField, String heightField) {
        if (width == null && height == null) {
            return null;
        }
        if (width == null || height == null) {
            throw new IllegalArgumentException(widthField + " and " + heightField + " must be provided together.");
        }
        return new Canvas(
                requireDimension(width, widthField),
                requireDimension(height, heightField));
    }

    private Integer optionalDimension(Integer value, String field) {
        return value == null ? null : requireDimension(value, field);
    }

    private int requireDimension(int value, String field) {
        if (value < 2 || value > MAX_DIMENSION) {
            throw new IllegalArgumentException(field + " must be between 2 and " + MAX_DIMENSION + ".");
        }
        return value;
    }

    private void parseAspect(String field, String aspect) {
        try {
            DimensionNegotiator.parseAspect(aspect);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(field + " must look like 16:9, 9:16 or 1.7778.", ex);
        }
    }

    private int requireNonNegative(Integer value, String field) {
        if (value == null) {
            throw new IllegalArgumentException(field + " is required.");
        }
        if (value < 0) {
            throw new IllegalArgumentException(field + " must be 0 or greater.");
        }
        return value;
    }

    private double nonNegativeOrDefault(Double value, double defaultValue, String field) {
        if (value == null) {
            return defaultValue;
        }
        if (value < 0 || Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(field + " must be 0 or greater.");
        }
        return value;
    }

    private double withinOrDefault(Double value, double defaultValue, double min, double max, String field) {
        if (value == null) {
            return defaultValue;
        }
        if (Double.isNaN(value) || value < min || value > max) {
            throw new IllegalArgumentException(field + " must be between " + min + " and " + max + ".");
        }
        return value;
    }

    private static String extensionOf(String path) {
        int dot = path.lastIndexOf('.');
        return dot < 0 ? "" : path.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static String lower(MediaKind kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
