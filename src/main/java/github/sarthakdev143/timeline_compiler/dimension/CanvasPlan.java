package github.sarthakdev143.timeline_compiler.dimension;

import github.sarthakdev143.timeline_compiler.model.Canvas;
import github.sarthakdev143.timeline_compiler.model.TrackDescriptor;
import github.sarthakdev143.timeline_compiler.model.Transform;

/**
 * Negotiated geometry for one export.
 *
 * @param working     canvas every segment is normalized to before compositing
 * @param desired     final output canvas
 * @param policy      how the composited frame is brought to the desired ratio
 * @param crop        crop window, only set for {@link CropPolicy#CROP}
 * @param panTrack    index of the track whose position was turned into the crop offset, or -1
 */
public record CanvasPlan(Canvas working, Canvas desired, CropPolicy policy, CropWindow crop, int panTrack) {

    public Canvas afterCrop() {
        return crop == null ? working : new Canvas(crop.width(), crop.height());
    }

    public boolean needsFinalResize() {
        return !afterCrop().equals(desired);
    }

    /**
     * Transform the compositor should apply to a track. A position already consumed by the crop is dropped.
     */
    public Transform effectiveTransform(TrackDescriptor track) {
        Transform transform = track.transform();
        if (track.index() == panTrack) {
            return new Transform(0.0, 0.0, transform.scale(), transform.rotation());
        }
        return transform;
    }
}
