package github.sarthakdev143.timeline_compiler.model;

import java.util.Locale;

public enum TextAlign {
    LEFT,
    CENTER,
    RIGHT;

    public static TextAlign fromInput(String value) {
        if (value == null || value.isBlank()) {
            return CENTER;
        }
        try {
            return TextAlign.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("textAlign must be one of LEFT, CENTER, RIGHT.", ex);
        }
    }
}
