package com.lungrisk.common.exception;

import java.nio.file.Path;
import java.util.List;

/**
 * Thrown when required model artifacts are missing or unreadable.
 * Fatal at startup: a scoring process must not come up without its model.
 */
public class ArtifactLoadException extends RiskModelException {

    private final List<String> missingFiles;

    public ArtifactLoadException(String message, Throwable cause) {
        super(message, cause);
        this.missingFiles = List.of();
    }

    private ArtifactLoadException(String message, List<String> missingFiles) {
        super(message);
        this.missingFiles = List.copyOf(missingFiles);
    }

    public List<String> getMissingFiles() {
        return missingFiles;
    }

    public static ArtifactLoadException missingFiles(Path directory, List<String> missingFiles) {
        return new ArtifactLoadException(
            "Missing required model artifact(s) in " + directory.toAbsolutePath() + ": "
                + String.join(", ", missingFiles),
            missingFiles);
    }
}
