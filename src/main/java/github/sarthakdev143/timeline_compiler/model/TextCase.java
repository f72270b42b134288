package github.sarthakdev143.timeline_compiler.model;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public enum TextCase {
    NONE,
    UPPERCASE,
    LOWERCASE,
    CAPITALIZE;

    private static final Pattern WORD_START = Pattern.compile("\\b(\\w)");

    public String apply(String text) {
        return switch (this) {
            case NONE -> text;
            case UPPERCASE -> text.toUpperCase(Locale.ROOT);
            case LOWERCASE -> text.toLowerCase(Locale.ROOT);
            case CAPITALIZE -> capitalize(text);
        };
    }

    public static TextCase fromInput(String value) {
        if (value == null || value.isBlank() || "none".equalsIgnoreCase(value.trim())) {
            return NONE;
        }
        try {
            return TextCase.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("textTransform must be one of none, uppercase, lowercase, capitalize.", ex);
        }
    }

    private static String capitalize(String text) {
        Matcher matcher = WORD_START.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(result, matcher.group(1).toUpperCase(Locale.ROOT));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
