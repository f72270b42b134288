package github.sarthakdev143.timeline_compiler.dto;

import github.sarthakdev143.timeline_compiler.dimension.CropPolicy;
import github.sarthakdev143.timeline_compiler.model.HardwareType;

import java.util.List;

public record ExportCommandResponse(
        List<String> argv,
        String filterComplex,
        HardwareType hardwareType,
        String videoCodec,
        double totalDurationSec,
        int workingWidth,
        int workingHeight,
        int outputWidth,
        int outputHeight,
        CropPolicy cropPolicy,
        int skippedSegments) {
}
