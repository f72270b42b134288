package github.sarthakdev143.timeline_compiler.graph;

/**
 * Opaque handle for one pin of a filter graph. Handles are only created by {@link FilterGraphBuilder} and are
 * turned into text when the graph is rendered.
 */
public final class GraphLabel {

    enum Kind {
        STREAM,
        INTERNAL,
        NAMED
    }

    private final Kind kind;
    private final String text;
    private final int id;
    private final FilterGraphBuilder owner;

    GraphLabel(Kind kind, String text, int id, FilterGraphBuilder owner) {
        this.kind = kind;
        this.text = text;
        this.id = id;
        this.owner = owner;
    }

    Kind kind() {
        return kind;
    }

    FilterGraphBuilder owner() {
        return owner;
    }

    String render() {
        return switch (kind) {
            case STREAM, NAMED -> "[" + text + "]";
            case INTERNAL -> "[" + text + id + "]";
        };
    }

    @Override
    public String toString() {
        return render();
    }
}
