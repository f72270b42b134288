package github.sarthakdev143.timeline_compiler.dto;

public record TransformRequest(
        Double x,
        Double y,
        Double scale,
        Double rotation) {
}
