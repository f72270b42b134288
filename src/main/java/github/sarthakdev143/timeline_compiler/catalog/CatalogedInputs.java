package github.sarthakdev143.timeline_compiler.catalog;

import github.sarthakdev143.timeline_compiler.exception.UnresolvableSegmentException;
import github.sarthakdev143.timeline_compiler.model.MediaKind;
import github.sarthakdev143.timeline_compiler.model.Segment;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Deduplicated engine inputs. {@code inputPaths} is in stream index order, so {@code inputPaths.get(i)} is input i.
 */
public record CatalogedInputs(
        List<CatalogedInput> videoInputs,
        List<CatalogedInput> audioInputs,
        List<String> inputPaths,
        int nextIndex) {

    public CatalogedInputs {
        videoInputs = videoInputs == null ? List.of() : List.copyOf(videoInputs);
        audioInputs = audioInputs == null ? List.of() : List.copyOf(audioInputs);
        inputPaths = inputPaths == null ? List.of() : List.copyOf(inputPaths);
    }

    /**
     * Stream index feeding a media segment. Tries the exact track index first, then the path, because the
     * after-part of a split segment carries a synthetic track index.
     *
     * @throws UnresolvableSegmentException when neither strategy finds a cataloged input
     */
    public int indexFor(Segment segment) {
        if (segment.isGap()) {
            throw new IllegalArgumentException("Gap segments have no input index.");
        }

        if (segment.medium() == MediaKind.AUDIO && segment.source().hasSeparateAudio()) {
            String audioPath = segment.source().audioPath();
            return findAudioFile(segment.trackIndex(), audioPath)
                    .orElseThrow(() -> new UnresolvableSegmentException(segment.trackIndex(), audioPath));
        }

        List<CatalogedInput> candidates = segment.medium() == MediaKind.AUDIO ? audioInputs : videoInputs;
        String path = segment.source().path();
        return byTrackIndex(candidates, segment.trackIndex())
                .or(() -> byPath(candidates, path))
                .map(CatalogedInput::index)
                .orElseThrow(() -> new UnresolvableSegmentException(segment.trackIndex(), path));
    }

    /**
     * Whether stream {@code index} is a still image, which has to be looped to last longer than one frame.
     */
    public boolean isStillImage(int index) {
        return videoInputs.stream().anyMatch(input -> input.index() == index && input.kind() == MediaKind.IMAGE);
    }

    private Optional<Integer> findAudioFile(int trackIndex, String audioPath) {
        Optional<Integer> exact = allInputs()
                .filter(input -> input.trackIndex() == trackIndex && input.audioIndex() != null)
                .map(CatalogedInput::audioIndex)
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return allInputs()
                .filter(input -> input.audioIndex() != null && Objects.equals(input.audioPath(), audioPath))
                .map(CatalogedInput::audioIndex)
                .findFirst();
    }

    private Stream<CatalogedInput> allInputs() {
        return Stream.concat(videoInputs.stream(), audioInputs.stream());
    }

    private static Optional<CatalogedInput> byTrackIndex(List<CatalogedInput> candidates, int trackIndex) {
        return candidates.stream().filter(input -> input.trackIndex() == trackIndex).findFirst();
    }

    private static Optional<CatalogedInput> byPath(List<CatalogedInput> candidates, String path) {
        return candidates.stream().filter(input -> Objects.equals(input.path(), path)).findFirst();
    }
}
