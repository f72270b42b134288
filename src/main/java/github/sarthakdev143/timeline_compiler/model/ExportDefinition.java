package github.sarthakdev143.timeline_compiler.model;

import java.util.List;

/**
 * Validated tracks and job settings, ready to compile.
 */
public record ExportDefinition(List<TrackDescriptor> tracks, ExportJob job) {

    public ExportDefinition {
        tracks = List.copyOf(tracks);
    }
}
