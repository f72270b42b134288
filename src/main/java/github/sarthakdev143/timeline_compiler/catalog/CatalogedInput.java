package github.sarthakdev143.timeline_compiler.catalog;

import github.sarthakdev143.timeline_compiler.model.MediaKind;

/**
 * Stream indices assigned to one track. {@code audioIndex} is set only when the track carries a separate audio file.
 */
public record CatalogedInput(int trackIndex, MediaKind kind, String path, int index, String audioPath, Integer audioIndex) {
}
