package github.sarthakdev143.timeline_compiler.dto;

import github.sarthakdev143.timeline_compiler.model.HardwareCapabilities;
import github.sarthakdev143.timeline_compiler.model.HardwareProfile;
import github.sarthakdev143.timeline_compiler.model.HardwareType;

import java.util.List;

public record HardwareCapabilitiesResponse(
        HardwareType primary,
        String primaryCodec,
        List<HardwareType> available,
        HardwareType fallback) {

    public static HardwareCapabilitiesResponse from(HardwareCapabilities capabilities) {
        return new HardwareCapabilitiesResponse(
                capabilities.primary().type(),
                capabilities.primary().codecName(),
                capabilities.all().stream().map(HardwareProfile::type).toList(),
                capabilities.fallback().type());
    }
}
