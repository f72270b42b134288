package github.sarthakdev143.timeline_compiler.graph;

import github.sarthakdev143.timeline_compiler.model.Segment;

import java.util.ArrayList;
import java.util.List;

/**
 * Segments dropped during one compilation because their source could not be resolved.
 */
public final class SkippedSegments {

    private final List<Segment> segments = new ArrayList<>();

    void record(Segment segment) {
        segments.add(segment);
    }

    public int count() {
        return segments.size();
    }

    public List<Segment> segments() {
        return List.copyOf(segments);
    }
}
