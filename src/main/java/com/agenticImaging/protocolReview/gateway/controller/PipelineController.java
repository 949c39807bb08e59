package com.agenticImaging.protocolReview.gateway.controller;

import com.agenticImaging.protocolReview.gateway.dto.PipelineRequest;
import com.agenticImaging.protocolReview.orchestrator.model.PipelineResult;
import com.agenticImaging.protocolReview.orchestrator.service.PipelineOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Thin HTTP layer over the pipeline: one synchronous request runs one pipeline to completion.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/pipeline")
@RequiredArgsConstructor
public class PipelineController {
    
    private final PipelineOrchestrator pipelineOrchestrator;
    
    /**
     * @param request Raw patient record
     * @return Final candidate and loop statistics
     */
    @PostMapping("/run")
    public ResponseEntity<PipelineResult> run(@Valid @RequestBody PipelineRequest request) {
        log.info("Pipeline request received - fields: {}", request.getSamplePatient().size());
        return ResponseEntity.ok(pipelineOrchestrator.run(request.getSamplePatient()));
    }
}
