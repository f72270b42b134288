package github.sarthakdev143.timeline_compiler.dto;

/**
 * One editor track as submitted. {@code trackType} wins over extension-based detection; {@code gapType} names the
 * medium of a gap marker.
 */
public record TrackRequest(
        String path,
        String audioPath,
        String trackType,
        String gapType,
        Double startTime,
        Double duration,
        Integer timelineStartFrame,
        Integer timelineEndFrame,
        Integer layer,
        TransformRequest transform,
        Boolean muted,
        Boolean visible,
        Double volumeDb,
        Double fadeInSec,
        Double fadeOutSec,
        Integer width,
        Integer height,
        String aspectRatio,
        String textContent,
        TextStyleRequest textStyle) {
}
