package github.sarthakdev143.timeline_compiler.exception;

import java.nio.file.Path;

/**
 * A subtitle or font file referenced by the job does not exist. Raised before any graph is built.
 */
public class MissingAssetException extends RuntimeException {

    private final Path assetPath;

    public MissingAssetException(String assetKind, Path assetPath) {
        super(assetKind + " not found at " + assetPath.toAbsolutePath() + ".");
        this.assetPath = assetPath;
    }

    public Path getAssetPath() {
        return assetPath;
    }
}
