package github.sarthakdev143.timeline_compiler.catalog;

import github.sarthakdev143.timeline_compiler.model.MediaKind;
import github.sarthakdev143.timeline_compiler.model.TrackDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns one stream index per unique source path in first-seen order. Gaps and text clips never consume an index.
 */
@Component
public class InputCataloger {

    private static final Logger logger = LoggerFactory.getLogger(InputCataloger.class);

    public CatalogedInputs catalog(List<TrackDescriptor> tracks) {
        Map<String, Integer> indexByPath = new LinkedHashMap<>();
        List<CatalogedInput> videoInputs = new ArrayList<>();
        List<CatalogedInput> audioInputs = new ArrayList<>();

        for (TrackDescriptor track : tracks) {
            MediaKind kind = track.kind();
            if (kind == MediaKind.GAP || kind == MediaKind.TEXT) {
                continue;
            }

            int index = register(indexByPath, track.path());
            Integer audioIndex = null;
            if (track.hasSeparateAudio()) {
                audioIndex = register(indexByPath, track.audioPath());
                logger.debug("Track {} uses separate audio file {} at input {}", track.index(), track.audioPath(), audioIndex);
            }

            CatalogedInput input = new CatalogedInput(
                    track.index(),
                    kind,
                    track.path(),
                    index,
                    track.audioPath(),
                    audioIndex);
            if (kind == MediaKind.AUDIO) {
                audioInputs.add(input);
            } else {
                videoInputs.add(input);
            }
        }

        logger.info("Cataloged {} unique inputs from {} tracks", indexByPath.size(), tracks.size());
        return new CatalogedInputs(videoInputs, audioInputs, List.copyOf(indexByPath.keySet()), indexByPath.size());
    }

    private int register(Map<String, Integer> indexByPath, String path) {
        Integer existing = indexByPath.get(path);
        if (existing != null) {
            return existing;
        }
        int index = indexByPath.size();
        indexByPath.put(path, index);
        return index;
    }
}
