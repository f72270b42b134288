package github.sarthakdev143.timeline_compiler.graph;

import java.util.List;

/**
 * Rendered filter graph. {@code audioLabel} is {@code null} when the export has no audio-bearing layer.
 */
public record CompiledGraph(List<String> stages, String videoLabel, String audioLabel, int skippedSegments) {

    public CompiledGraph {
        stages = List.copyOf(stages);
    }

    public String filterComplex() {
        return String.join(";", stages);
    }

    public boolean hasAudio() {
        return audioLabel != null;
    }
}
