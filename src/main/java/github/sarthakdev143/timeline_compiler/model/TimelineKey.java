package github.sarthakdev143.timeline_compiler.model;

import java.util.Comparator;

public record TimelineKey(int layer, MediaKind medium) implements Comparable<TimelineKey> {

    private static final Comparator<TimelineKey> ORDER = Comparator
            .comparingInt(TimelineKey::layer)
            .thenComparing(TimelineKey::medium);

    @Override
    public int compareTo(TimelineKey other) {
        return ORDER.compare(this, other);
    }
}
