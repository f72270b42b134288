package github.sarthakdev143.timeline_compiler.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Export settings for one compilation. {@code preferredHardware} is {@code null} for automatic selection.
 */
public record ExportJob(
        int frameRate,
        boolean normalizeFrameRate,
        Canvas exportSize,
        Canvas customOutputSize,
        String targetAspect,
        Path subtitlePath,
        String subtitleFormat,
        List<String> fontFamilies,
        boolean hardwareAccelerationEnabled,
        HardwareType preferredHardware,
        boolean preferHevc,
        String preset,
        int threads,
        String outputPath) {

    public ExportJob {
        fontFamilies = fontFamilies == null ? List.of() : List.copyOf(fontFamilies);
    }

    public boolean hasSubtitles() {
        return subtitlePath != null;
    }
}
