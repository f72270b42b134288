package github.sarthakdev143.timeline_compiler.dto;

import java.util.List;

public record JobRequest(
        Integer frameRate,
        Boolean normalizeFrameRate,
        Integer width,
        Integer height,
        Integer outputWidth,
        Integer outputHeight,
        String targetAspect,
        String subtitlePath,
        String subtitleFormat,
        List<String> fontFamilies,
        Boolean hardwareAcceleration,
        String hwaccelType,
        Boolean preferHevc,
        String preset,
        Integer threads,
        String outputPath) {
}
