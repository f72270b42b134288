package github.sarthakdev143.timeline_compiler.config;

/**
 * Resolves the FFmpeg executable from {@code FFMPEG_PATH}, falling back to the one on {@code PATH}.
 */
public final class FfmpegBinary {

    public static final String FFMPEG_PATH_ENV = "FFMPEG_PATH";
    public static final String DEFAULT_FFMPEG_BINARY = "ffmpeg";

    private FfmpegBinary() {
    }

    public static String resolve() {
        String configuredPath = System.getenv(FFMPEG_PATH_ENV);
        if (configuredPath != null && !configuredPath.isBlank()) {
            return configuredPath;
        }
        return DEFAULT_FFMPEG_BINARY;
    }
}
