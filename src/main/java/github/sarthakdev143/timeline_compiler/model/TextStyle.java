package github.sarthakdev143.timeline_compiler.model;

import java.nio.file.Path;

/**
 * Pre-resolved drawtext parameters for a text clip. {@code fontFile} wins over {@code fontFamily} when both are set.
 */
public record TextStyle(
        String fontFamily,
        Path fontFile,
        int fontSize,
        String color,
        String strokeColor,
        String backgroundColor,
        boolean shadow,
        TextAlign align,
        TextCase textCase) {

    public static final int DEFAULT_FONT_SIZE = 40;
    public static final TextStyle DEFAULT = new TextStyle(
            "Arial", null, DEFAULT_FONT_SIZE, "#FFFFFF", null, null, false, TextAlign.CENTER, TextCase.NONE);

    public TextStyle {
        align = align == null ? TextAlign.CENTER : align;
        textCase = textCase == null ? TextCase.NONE : textCase;
        fontSize = fontSize <= 0 ? DEFAULT_FONT_SIZE : fontSize;
    }
}
