package github.sarthakdev143.timeline_compiler.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Accumulates filter chains against typed labels. Internal labels are numbered by the builder, so two chains can
 * never collide on a pin name, and every internal label must be produced before it is consumed and consumed exactly
 * once before the graph renders.
 */
public final class FilterGraphBuilder {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z][a-z_]*[a-z]$|^[a-z]$");
    private static final Pattern HINT_CLEANUP = Pattern.compile("[^a-z_]");

    private final List<FilterChain> chains = new ArrayList<>();
    private final Set<GraphLabel> produced = new HashSet<>();
    private final Set<GraphLabel> consumed = new HashSet<>();
    private final Set<String> names = new HashSet<>();
    private int nextId;

    public GraphLabel videoInput(int inputIndex) {
        return streamInput(inputIndex, "v");
    }

    public GraphLabel audioInput(int inputIndex) {
        return streamInput(inputIndex, "a");
    }

    /**
     * Reserves a terminal label with a fixed name, such as {@code video}. Names contain letters and underscores only,
     * which keeps them disjoint from numbered internal labels.
     */
    public GraphLabel named(String name) {
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid graph output name: " + name);
        }
        if (!names.add(name)) {
            throw new IllegalStateException("Graph output name already used: " + name);
        }
        return new GraphLabel(GraphLabel.Kind.NAMED, name, -1, this);
    }

    /**
     * Appends a chain and returns its freshly allocated output label.
     */
    public GraphLabel chain(List<GraphLabel> inputs, String hint, List<String> filters) {
        GraphLabel output = new GraphLabel(GraphLabel.Kind.INTERNAL, cleanHint(hint), nextId++, this);
        append(inputs, filters, output);
        return output;
    }

    public GraphLabel chain(GraphLabel input, String hint, String... filters) {
        return chain(List.of(input), hint, Arrays.asList(filters));
    }

    public GraphLabel source(String hint, String... filters) {
        return chain(List.of(), hint, Arrays.asList(filters));
    }

    /**
     * Appends a chain that writes into a label reserved with {@link #named(String)}.
     */
    public void chainInto(List<GraphLabel> inputs, GraphLabel output, List<String> filters) {
        if (output.kind() != GraphLabel.Kind.NAMED) {
            throw new IllegalArgumentException("Only named labels can be targeted explicitly.");
        }
        append(inputs, filters, output);
    }

    /**
     * Re-targets the chain that produced {@code label} so it writes into {@code name} instead. Used to give the last
     * stage of a path its terminal name without an extra pass-through filter.
     */
    public GraphLabel promote(GraphLabel label, String name) {
        requireOwned(label);
        if (label.kind() != GraphLabel.Kind.INTERNAL || consumed.contains(label)) {
            throw new IllegalStateException("Only an unconsumed internal label can be promoted: " + label.render());
        }
        for (int index = chains.size() - 1; index >= 0; index--) {
            FilterChain chain = chains.get(index);
            if (chain.output() == label) {
                GraphLabel target = named(name);
                chains.set(index, new FilterChain(chain.inputs(), chain.filters(), target));
                produced.remove(label);
                produced.add(target);
                return target;
            }
        }
        throw new IllegalStateException("Label was never produced: " + label.render());
    }

    public boolean isEmpty() {
        return chains.isEmpty();
    }

    /**
     * Renders every chain in append order.
     *
     * @throws IllegalStateException when an internal label is left dangling
     */
    public List<String> render() {
        List<String> stages = new ArrayList<>();
        for (FilterChain chain : chains) {
            GraphLabel output = chain.output();
            if (output.kind() == GraphLabel.Kind.INTERNAL && !consumed.contains(output)) {
                throw new IllegalStateException("Filter graph label is never consumed: " + output.render());
            }
            stages.add(chain.render());
        }
        return stages;
    }

    private GraphLabel streamInput(int inputIndex, String type) {
        if (inputIndex < 0) {
            throw new IllegalArgumentException("Input index must not be negative: " + inputIndex);
        }
        return new GraphLabel(GraphLabel.Kind.STREAM, inputIndex + ":" + type, -1, this);
    }

    private void append(List<GraphLabel> inputs, List<String> filters, GraphLabel output) {
        if (filters.isEmpty()) {
            throw new IllegalArgumentException("A filter chain needs at least one filter.");
        }
        for (GraphLabel input : inputs) {
            requireOwned(input);
            if (input.kind() == GraphLabel.Kind.STREAM) {
                continue;
            }
            if (!produced.contains(input)) {
                throw new IllegalStateException("Label consumed before it was produced: " + input.render());
            }
            if (!consumed.add(input)) {
                throw new IllegalStateException("Label consumed twice: " + input.render());
            }
        }
        requireOwned(output);
        if (!produced.add(output)) {
            throw new IllegalStateException("Label produced twice: " + output.render());
        }
        chains.add(new FilterChain(inputs, filters, output));
    }

    private void requireOwned(GraphLabel label) {
        if (label.owner() != this) {
            throw new IllegalArgumentException("Label belongs to another graph: " + label.render());
        }
    }

    private static String cleanHint(String hint) {
        String cleaned = HINT_CLEANUP.matcher(hint == null ? "" : hint.toLowerCase(Locale.ROOT)).replaceAll("");
        return (cleaned.isEmpty() ? "n" : cleaned) + "_";
    }
}
