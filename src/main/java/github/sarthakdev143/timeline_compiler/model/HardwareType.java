package github.sarthakdev143.timeline_compiler.model;

import java.util.List;
import java.util.Locale;

/**
 * Encoder families in detection priority order. {@link #SOFTWARE} is never probed and always available.
 */
public enum HardwareType {
    NVENC("h264_nvenc", "hevc_nvenc", List.of("-preset", "p6", "-cq", "32", "-maxrate", "3M", "-bufsize", "6M"), "cuda", FilterVariant.CUDA),
    QSV("h264_qsv", "hevc_qsv", List.of("-preset", "medium", "-b:v", "2M"), "qsv", FilterVariant.CPU),
    VIDEOTOOLBOX("h264_videotoolbox", "hevc_videotoolbox", List.of("-b:v", "5M"), "videotoolbox", FilterVariant.CPU),
    AMF("h264_amf", "hevc_amf", List.of("-quality", "balanced", "-b:v", "2M"), null, FilterVariant.CPU),
    VAAPI("h264_vaapi", "hevc_vaapi", List.of("-compression_level", "2"), "vaapi", FilterVariant.CPU),
    SOFTWARE("libx264", "libx265", List.of("-preset", "medium", "-crf", "23"), null, FilterVariant.CPU);

    private final String codecName;
    private final String hevcCodecName;
    private final List<String> encoderFlags;
    private final String hwaccel;
    private final FilterVariant filterVariant;

    HardwareType(String codecName, String hevcCodecName, List<String> encoderFlags, String hwaccel, FilterVariant filterVariant) {
        this.codecName = codecName;
        this.hevcCodecName = hevcCodecName;
        this.encoderFlags = encoderFlags;
        this.hwaccel = hwaccel;
        this.filterVariant = filterVariant;
    }

    public String codecName() {
        return codecName;
    }

    public String hevcCodecName() {
        return hevcCodecName;
    }

    public List<String> encoderFlags() {
        return encoderFlags;
    }

    public String hwaccel() {
        return hwaccel;
    }

    public FilterVariant filterVariant() {
        return filterVariant;
    }

    public static List<HardwareType> detectionOrder() {
        return List.of(NVENC, QSV, VIDEOTOOLBOX, AMF, VAAPI);
    }

    /**
     * Parses a job preference. {@code null}, blank and {@code auto} mean no explicit choice.
     */
    public static HardwareType fromInput(String value) {
        if (value == null || value.isBlank() || "auto".equalsIgnoreCase(value.trim())) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("NONE".equals(normalized)) {
            return SOFTWARE;
        }
        try {
            return HardwareType.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(
                    "hwaccelType must be one of auto, none, nvenc, qsv, videotoolbox, amf, vaapi.", ex);
        }
    }
}
