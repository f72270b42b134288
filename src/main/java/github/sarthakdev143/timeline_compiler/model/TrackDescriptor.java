package github.sarthakdev143.timeline_compiler.model;

/**
 * One editor track after ingestion. {@code index} is the declaration position and stays stable for the whole build.
 * {@code gapMedium} is only set for {@link MediaKind#GAP} tracks and names the medium the gap is declared on.
 */
public record TrackDescriptor(
        int index,
        MediaKind kind,
        MediaKind gapMedium,
        String path,
        String audioPath,
        double sourceStart,
        Double sourceDuration,
        int timelineStartFrame,
        int timelineEndFrame,
        int layer,
        Transform transform,
        boolean muted,
        boolean visible,
        double volumeDb,
        double fadeInSec,
        double fadeOutSec,
        Integer width,
        Integer height,
        String aspectRatio,
        String textContent,
        TextStyle textStyle) {

    public TrackDescriptor {
        transform = transform == null ? Transform.IDENTITY : transform;
        textStyle = textStyle == null ? TextStyle.DEFAULT : textStyle;
    }

    public boolean isGap() {
        return kind == MediaKind.GAP;
    }

    public boolean hasSeparateAudio() {
        return audioPath != null && !audioPath.isBlank();
    }

    public boolean hasDeclaredSize() {
        return width != null && height != null && width > 0 && height > 0;
    }

    public double startSeconds(double fps) {
        return timelineStartFrame / fps;
    }

    public double endSeconds(double fps) {
        return timelineEndFrame / fps;
    }
}
