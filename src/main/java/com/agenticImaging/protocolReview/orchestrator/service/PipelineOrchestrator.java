package com.agenticImaging.protocolReview.orchestrator.service;

import com.agenticImaging.protocolReview.completion.service.CompletionClient;
import com.agenticImaging.protocolReview.fhir.service.FhirBundleConverter;
import com.agenticImaging.protocolReview.generation.model.CandidateOutput;
import com.agenticImaging.protocolReview.generation.service.CandidateGenerator;
import com.agenticImaging.protocolReview.orchestrator.model.LoopPhase;
import com.agenticImaging.protocolReview.orchestrator.model.LoopState;
import com.agenticImaging.protocolReview.orchestrator.model.PipelineResult;
import com.agenticImaging.protocolReview.orchestrator.model.StoppingRule;
import com.agenticImaging.protocolReview.review.model.ReviewFeedback;
import com.agenticImaging.protocolReview.review.model.ReviewReport;
import com.agenticImaging.protocolReview.review.service.ReviewStepAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Map;

/**
 * Orchestrator service - owner of the generate/review feedback loop.
 * 
 * Workflow:
 * INIT -> GENERATE -> REVIEW -> (continue ? GENERATE : DONE)
 * 
 * - INIT checks credentials and obtains the shared context; failure aborts the run
 * - GENERATE produces a candidate from (record, context, previous feedback) and persists it
 * - REVIEW reviews the candidate, persists the report, then applies the {@link StoppingRule}
 * - DONE persists final.json and runs the FHIR export, whose failure is only logged
 * 
 * Collaborator failures inside GENERATE/REVIEW are not caught here. Degraded collaborator output
 * (default feedback, missing score) flows through as data and the loop keeps iterating.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineOrchestrator {
    
    private final CompletionClient completionClient;
    private final SharedContextLoader sharedContextLoader;
    private final CandidateGenerator candidateGenerator;
    private final ReviewStepAdapter reviewStepAdapter;
    private final ArtifactStore artifactStore;
    private final StoppingRule stoppingRule;
    private final FhirBundleConverter fhirBundleConverter;
    private final RunIdService runIdService;
    
    @Value("${pipeline.fhir.enabled:true}")
    private boolean fhirEnabled;
    
    /**
     * Runs the pipeline to completion for one patient record.
     * 
     * @param rawRecord Patient record as received
     * @return Final candidate and loop statistics
     * @throws com.agenticImaging.protocolReview.orchestrator.exception.ContextInitializationException if INIT fails
     * @throws com.agenticImaging.protocolReview.orchestrator.exception.ArtifactPersistenceException if an artifact cannot be written
     */
    public PipelineResult run(Map<String, ?> rawRecord) {
        LoopState state = LoopState.builder()
                .runId(runIdService.generateRunId())
                .build();
        log.info("Pipeline start - runId: {}, fields: {}", state.getRunId(), rawRecord.size());
        
        while (state.getPhase() != LoopPhase.DONE) {
            switch (state.getPhase()) {
                case INIT -> init(state, rawRecord);
                case GENERATE -> generate(state, rawRecord);
                case REVIEW -> review(state, rawRecord);
                default -> throw new IllegalStateException("Unexpected phase " + state.getPhase());
            }
        }
        
        return finish(state);
    }
    
    /**
     * INIT - fail fast on missing credentials, then load the shared context.
     */
    private void init(LoopState state, Map<String, ?> rawRecord) {
        log.debug("Step INIT - runId: {}", state.getRunId());
        completionClient.ensureConfigured();
        state.setContext(sharedContextLoader.load(state.getRunId(), rawRecord));
        state.setPhase(LoopPhase.GENERATE);
    }
    
    /**
     * GENERATE - previous feedback is null only on the first iteration.
     */
    private void generate(LoopState state, Map<String, ?> rawRecord) {
        int iteration = state.nextIteration();
        log.info("Step GENERATE - runId: {}, iteration: {}", state.getRunId(), iteration);
        
        ReviewFeedback previousFeedback = state.getLastReview() != null ? state.getLastReview().getFeedback() : null;
        CandidateOutput candidate = candidateGenerator.generate(rawRecord, state.getContext(), previousFeedback);
        state.setLastCandidate(candidate);
        
        artifactStore.saveCandidate(state.getRunId(), iteration, candidate);
        state.setPhase(LoopPhase.REVIEW);
    }
    
    /**
     * REVIEW - review the candidate just produced, then apply the stopping rule.
     */
    private void review(LoopState state, Map<String, ?> rawRecord) {
        int iteration = state.getIteration();
        log.info("Step REVIEW - runId: {}, iteration: {}", state.getRunId(), iteration);
        
        ReviewReport report = reviewStepAdapter.review(rawRecord, state.getLastCandidate());
        state.setLastReview(report);
        artifactStore.saveFeedback(state.getRunId(), iteration, report);
        
        double confidence = report.getConfidence();
        if (stoppingRule.shouldContinue(iteration, confidence)) {
            state.setPhase(LoopPhase.GENERATE);
        } else {
            if (stoppingRule.isConverged(iteration, confidence)) {
                log.info("Confidence {} reached threshold at iteration {} - runId: {}", confidence, iteration, state.getRunId());
            } else {
                log.info("Iteration cap {} reached with confidence {} - runId: {}", iteration, confidence, state.getRunId());
            }
            state.setPhase(LoopPhase.DONE);
        }
    }
    
    /**
     * DONE - persist the final candidate and build the result.
     */
    private PipelineResult finish(LoopState state) {
        Path finalPath = artifactStore.saveFinal(state.getRunId(), state.getLastCandidate());
        log.info("Final output saved - runId: {}, path: {}", state.getRunId(), finalPath);
        
        if (fhirEnabled) {
            exportFhir(state.getRunId(), finalPath);
        }
        
        ReviewReport lastReview = state.getLastReview();
        PipelineResult result = PipelineResult.builder()
                .runId(state.getRunId())
                .finalOutput(state.getLastCandidate())
                .loopsRun(state.getIteration())
                .finalConfidence(lastReview.getConfidence())
                .candidateConfidence(lastReview.getCandidateConfidence())
                .converged(stoppingRule.isConverged(state.getIteration(), lastReview.getConfidence()))
                .build();
        
        log.info("Pipeline complete - runId: {}, loopsRun: {}, converged: {}",
                state.getRunId(), result.getLoopsRun(), result.isConverged());
        return result;
    }
    
    /**
     * Downstream export; the pipeline result stands whatever happens here.
     */
    private void exportFhir(String runId, Path finalPath) {
        Path bundlePath = finalPath.resolveSibling(FhirBundleConverter.BUNDLE_FILE);
        try {
            fhirBundleConverter.convert(finalPath, bundlePath);
        } catch (RuntimeException e) {
            log.error("FHIR conversion failed - runId: {}, error: {}", runId, e.getMessage(), e);
        }
    }
}
