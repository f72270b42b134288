package github.sarthakdev143.timeline_compiler.model;

import java.util.List;

/**
 * A functionally verified encoder capability. {@code device} is only set for profiles that need a render node.
 */
public record HardwareProfile(
        HardwareType type,
        String codecName,
        String hevcCodecName,
        List<String> encoderFlags,
        String hwaccel,
        String device,
        FilterVariant filterVariant) {

    public HardwareProfile {
        encoderFlags = encoderFlags == null ? List.of() : List.copyOf(encoderFlags);
        filterVariant = filterVariant == null ? FilterVariant.CPU : filterVariant;
    }

    public static HardwareProfile of(HardwareType type, String device) {
        return new HardwareProfile(
                type,
                type.codecName(),
                type.hevcCodecName(),
                type.encoderFlags(),
                type.hwaccel(),
                device,
                type.filterVariant());
    }

    public static HardwareProfile software() {
        return of(HardwareType.SOFTWARE, null);
    }

    public boolean isSoftware() {
        return type == HardwareType.SOFTWARE;
    }

    public String codecFor(boolean preferHevc) {
        return preferHevc && hevcCodecName != null ? hevcCodecName : codecName;
    }
}
