package github.sarthakdev143.timeline_compiler.dto;

import java.util.List;

public record ExportRequest(
        List<TrackRequest> tracks,
        JobRequest job) {
}
