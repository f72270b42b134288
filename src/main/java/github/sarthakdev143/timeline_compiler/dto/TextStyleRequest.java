package github.sarthakdev143.timeline_compiler.dto;

public record TextStyleRequest(
        String fontFamily,
        String fontFile,
        Integer fontSize,
        String color,
        String strokeColor,
        String backgroundColor,
        Boolean shadow,
        String textAlign,
        String textTransform) {
}
