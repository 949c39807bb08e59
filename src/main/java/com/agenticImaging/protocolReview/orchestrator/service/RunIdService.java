package com.agenticImaging.protocolReview.orchestrator.service;

import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Service for generating run IDs. The run ID names the artifact directory and tags every log line.
 */
@Service
public class RunIdService {
    
    /**
     * @return A UUID-based run ID
     */
    public String generateRunId() {
        return UUID.randomUUID().toString();
    }
}
