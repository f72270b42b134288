package github.sarthakdev143.timeline_compiler.graph;

import java.util.List;

/**
 * One {@code ;}-separated stage of a filter graph: input pins, a comma-joined filter list and one output pin.
 */
record FilterChain(List<GraphLabel> inputs, List<String> filters, GraphLabel output) {

    FilterChain {
        inputs = List.copyOf(inputs);
        filters = List.copyOf(filters);
    }

    String render() {
        StringBuilder builder = new StringBuilder();
        for (GraphLabel input : inputs) {
            builder.append(input.render());
        }
        builder.append(String.join(",", filters));
        builder.append(output.render());
        return builder.toString();
    }
}
