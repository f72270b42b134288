package github.sarthakdev143.timeline_compiler.dimension;

public enum CropPolicy {
    /**
     * Source and output ratios are compatible.
     */
    NONE,
    /**
     * Orientation flips, so the whole frame is kept and padded by the final resize.
     */
    LETTERBOX,
    CROP,
    /**
     * The primary track is scaled by its own transform and renders onto its own background canvas.
     */
    TRANSFORM_BYPASS
}
