package github.sarthakdev143.timeline_compiler.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Closed set of track kinds. Resolved once when a track is ingested and carried through every later stage.
 */
public enum MediaKind {
    GAP,
    VIDEO,
    AUDIO,
    IMAGE,
    TEXT;

    public static final String GAP_MARKER = "__GAP__";

    private static final Pattern VIDEO_EXTENSIONS = Pattern.compile("\\.(mp4|mov|mkv|avi|webm)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern AUDIO_EXTENSIONS = Pattern.compile("\\.(mp3|wav|aac|flac|m4a|ogg)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern IMAGE_EXTENSIONS = Pattern.compile("\\.(png|jpg|jpeg|gif|bmp|tiff|webp)$", Pattern.CASE_INSENSITIVE);

    /**
     * Kinds that are composited on the video side.
     */
    public boolean isVisual() {
        return this == VIDEO || this == IMAGE || this == TEXT;
    }

    /**
     * Kinds that own a (layer, medium) timeline.
     */
    public boolean isTimelineMedium() {
        return this == VIDEO || this == AUDIO || this == IMAGE;
    }

    public static MediaKind fromInput(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return MediaKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported track type: " + value + ".", ex);
        }
    }

    /**
     * Extension fallback, used only when a track does not declare its type.
     */
    public static MediaKind fromPath(String path) {
        if (path == null || path.isBlank()) {
            return null;
        }
        if (GAP_MARKER.equals(path)) {
            return GAP;
        }
        if (VIDEO_EXTENSIONS.matcher(path).find()) {
            return VIDEO;
        }
        if (AUDIO_EXTENSIONS.matcher(path).find()) {
            return AUDIO;
        }
        if (IMAGE_EXTENSIONS.matcher(path).find()) {
            return IMAGE;
        }
        return null;
    }
}
