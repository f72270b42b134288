package github.sarthakdev143.timeline_compiler.model;

import github.sarthakdev143.timeline_compiler.dimension.CanvasPlan;
import github.sarthakdev143.timeline_compiler.graph.CompiledGraph;

import java.util.List;

/**
 * Everything one compilation produced: the argument vector plus the decisions behind it.
 */
public record CompiledCommand(
        List<String> argv,
        CompiledGraph graph,
        CanvasPlan canvasPlan,
        HardwareProfile hardware,
        String videoCodec,
        double totalDurationSec) {

    public CompiledCommand {
        argv = List.copyOf(argv);
    }
}
