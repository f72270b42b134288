package github.sarthakdev143.timeline_compiler.model;

/**
 * One placed unit on a timeline. Gap segments have no source track. {@code sourceStart} is the offset into the
 * source media, which differs from the track's own offset for the after-part of a split.
 */
public record Segment(
        TrackDescriptor source,
        MediaKind medium,
        int trackIndex,
        double startTime,
        double endTime,
        double sourceStart) {

    public static Segment gap(MediaKind medium, double startTime, double endTime) {
        return new Segment(null, medium, -1, startTime, endTime, 0.0);
    }

    public static Segment of(TrackDescriptor track, double fps) {
        return new Segment(
                track,
                track.kind(),
                track.index(),
                track.startSeconds(fps),
                track.endSeconds(fps),
                track.sourceStart());
    }

    public boolean isGap() {
        return source == null;
    }

    public double duration() {
        return endTime - startTime;
    }

    public Segment withStart(double newStart) {
        return new Segment(source, medium, trackIndex, newStart, endTime, sourceStart);
    }

    public Segment shiftedBy(double offset) {
        return new Segment(source, medium, trackIndex, startTime + offset, endTime + offset, sourceStart);
    }

    public Segment withWindow(double newStart, double newEnd, double newSourceStart) {
        return new Segment(source, medium, trackIndex, newStart, newEnd, newSourceStart);
    }
}
