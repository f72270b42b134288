package github.sarthakdev143.timeline_compiler.exception;

/**
 * A segment's source could not be matched to a cataloged input index.
 */
public class UnresolvableSegmentException extends RuntimeException {

    private final int trackIndex;

    public UnresolvableSegmentException(int trackIndex, String path) {
        super("No cataloged input for track " + trackIndex + " (" + path + ").");
        this.trackIndex = trackIndex;
    }

    public int getTrackIndex() {
        return trackIndex;
    }
}
