package com.agenticImaging.protocolReview.orchestrator.exception;

import java.nio.file.Path;

/**
 * Exception thrown when an intermediate or final artifact cannot be written. Fatal to the run.
 */
public class ArtifactPersistenceException extends RuntimeException {
    
    private final Path path;
    
    public ArtifactPersistenceException(Path path, Throwable cause) {
        super("Failed to write artifact " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }
    
    public Path getPath() {
        return path;
    }
}
