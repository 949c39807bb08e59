package com.agenticImaging.protocolReview.orchestrator.service;

import com.agenticImaging.protocolReview.generation.model.CandidateOutput;
import com.agenticImaging.protocolReview.generation.prompt.EnhancedContextPrompt;
import com.agenticImaging.protocolReview.orchestrator.exception.ArtifactPersistenceException;
import com.agenticImaging.protocolReview.review.model.ReviewReport;
import com.agenticImaging.protocolReview.util.JsonFiles;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Writes run artifacts under {@code <output-dir>/<runId>/}:
 * enhanced_context.json, candidate_loop<N>.json, feedback_loop<N>.json and final.json.
 * 
 * Writes are not rolled back; any failure aborts the run.
 */
@Slf4j
@Service
public class ArtifactStore {
    
    public static final String FINAL_FILE = "final.json";
    public static final String CONTEXT_FILE = "enhanced_context.json";
    
    private final Path outputDir;
    
    public ArtifactStore(@Value("${pipeline.output-dir:outputs}") String outputDir) {
        this.outputDir = Paths.get(outputDir);
    }
    
    public Path runDirectory(String runId) {
        return outputDir.resolve(runId);
    }
    
    public Path saveContext(String runId, String context) {
        return write(runDirectory(runId).resolve(CONTEXT_FILE), Map.of(EnhancedContextPrompt.CONTEXT_KEY, context));
    }
    
    public Path saveCandidate(String runId, int iteration, CandidateOutput candidate) {
        return write(runDirectory(runId).resolve("candidate_loop" + iteration + ".json"), candidate);
    }
    
    public Path saveFeedback(String runId, int iteration, ReviewReport report) {
        return write(runDirectory(runId).resolve("feedback_loop" + iteration + ".json"), report);
    }
    
    public Path saveFinal(String runId, CandidateOutput candidate) {
        return write(runDirectory(runId).resolve(FINAL_FILE), candidate);
    }
    
    private Path write(Path path, Object value) {
        try {
            JsonFiles.writePretty(path, value);
        } catch (IOException e) {
            log.error("Artifact write failed - path: {}", path, e);
            throw new ArtifactPersistenceException(path, e);
        }
        log.debug("Artifact saved - path: {}", path);
        return path;
    }
}
