package github.sarthakdev143.timeline_compiler.hardware;

import github.sarthakdev143.timeline_compiler.dimension.CropWindow;

public class CpuFilterVariants implements FilterVariants {

    @Override
    public String scaleToFit(int width, int height) {
        return "scale=" + width + ":" + height + ":force_original_aspect_ratio=decrease";
    }

    @Override
    public String scaleAndPad(int width, int height, String fillColor) {
        return scaleToFit(width, height) + "," + pad(width, height, fillColor);
    }

    @Override
    public String overlay(String x, String y, String enable) {
        String overlay = "overlay=x=" + x + ":y=" + y;
        return enable == null ? overlay : overlay + ":" + enable;
    }

    @Override
    public String crop(CropWindow window) {
        return "crop=" + window.width() + ":" + window.height() + ":" + window.x() + ":" + window.y();
    }

    @Override
    public String finalResize(int width, int height, String fillColor) {
        return "scale=" + width + ":" + height + ":force_original_aspect_ratio=decrease:flags=fast_bilinear,"
                + pad(width, height, fillColor);
    }

    protected String pad(int width, int height, String fillColor) {
        return "pad=" + width + ":" + height + ":(ow-iw)/2:(oh-ih)/2:" + fillColor;
    }
}
