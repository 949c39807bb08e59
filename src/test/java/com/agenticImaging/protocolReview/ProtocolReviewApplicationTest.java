package com.agenticImaging.protocolReview;

import com.agenticImaging.protocolReview.cli.ReviewCommand;
import com.agenticImaging.protocolReview.orchestrator.model.StoppingRule;
import com.agenticImaging.protocolReview.orchestrator.service.PipelineOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "groq.api.key=",
        "pipeline.loop.max-iterations=4",
        "pipeline.loop.min-iterations=2",
        "pipeline.loop.confidence-threshold=0.8"
})
class ProtocolReviewApplicationTest {
    
    @Autowired
    private ApplicationContext context;
    
    @Test
    void contextStartsWithoutApiKey() {
        assertThat(context.getBean(PipelineOrchestrator.class)).isNotNull();
        assertThat(context.getBean(ReviewCommand.class)).isNotNull();
    }
    
    @Test
    void stoppingRuleIsConfigurable() {
        StoppingRule rule = context.getBean(StoppingRule.class);
        
        assertThat(rule.getMaxIterations()).isEqualTo(4);
        assertThat(rule.getConfidenceThreshold()).isEqualTo(0.8);
    }
}
