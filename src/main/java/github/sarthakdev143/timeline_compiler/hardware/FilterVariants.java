package github.sarthakdev143.timeline_compiler.hardware;

import github.sarthakdev143.timeline_compiler.dimension.CropWindow;

import java.util.Optional;

/**
 * Geometric filter primitives. The graph compiler asks for these by intent and never names a CPU or GPU filter itself.
 */
public interface FilterVariants {

    /**
     * Scales into the box preserving aspect ratio, without padding.
     */
    String scaleToFit(int width, int height);

    /**
     * Scales into the box preserving aspect ratio and pads the remainder with {@code fillColor}.
     */
    String scaleAndPad(int width, int height, String fillColor);

    /**
     * @param enable an {@code enable='...'} expression, or {@code null} for always-on
     */
    String overlay(String x, String y, String enable);

    String crop(CropWindow window);

    /**
     * Last-stage resize to the output canvas.
     */
    String finalResize(int width, int height, String fillColor);

    /**
     * Filters that move the finished video onto the encoder's device, if it needs that.
     */
    default Optional<String> outputUpload() {
        return Optional.empty();
    }
}
