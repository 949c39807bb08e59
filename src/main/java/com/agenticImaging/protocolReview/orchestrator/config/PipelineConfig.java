package com.agenticImaging.protocolReview.orchestrator.config;

import com.agenticImaging.protocolReview.orchestrator.model.StoppingRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class PipelineConfig {
    
    @Bean
    public StoppingRule stoppingRule(
            @Value("${pipeline.loop.max-iterations:6}") int maxIterations,
            @Value("${pipeline.loop.min-iterations:2}") int minIterations,
            @Value("${pipeline.loop.confidence-threshold:0.75}") double confidenceThreshold) {
        log.info("Stopping rule - maxIterations: {}, minIterations: {}, threshold: {}",
                maxIterations, minIterations, confidenceThreshold);
        return new StoppingRule(maxIterations, minIterations, confidenceThreshold);
    }
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
