package com.agenticImaging.protocolReview.cli;

import com.agenticImaging.protocolReview.generation.model.CandidateOutput;
import com.agenticImaging.protocolReview.review.model.ReviewReport;
import com.agenticImaging.protocolReview.review.service.ReviewStepAdapter;
import com.agenticImaging.protocolReview.util.JsonFiles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * One-shot review of an existing candidate:
 * {@code <raw_patient_input> <candidate.json> <review_output.json>}.
 * 
 * Exit codes: 0 on success, 1 on a usage error or when the review cannot be produced.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReviewCommand {
    
    public static final String USAGE = "Usage: review <raw_patient_input> <candidate.json> <review_output.json>";
    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    
    private final ReviewStepAdapter reviewStepAdapter;
    
    public int execute(String... args) {
        return execute(System.out, System.err, args);
    }
    
    int execute(PrintStream out, PrintStream err, String... args) {
        if (args == null || args.length != 3) {
            err.println(USAGE);
            return EXIT_ERROR;
        }
        Path inputPath = Paths.get(args[0]);
        Path candidatePath = Paths.get(args[1]);
        Path outputPath = Paths.get(args[2]);
        
        try {
            Map<String, Object> rawRecord = JsonFiles.readPatientRecord(inputPath);
            CandidateOutput candidate = CandidateOutput.of(JsonFiles.readObject(candidatePath));
            
            ReviewReport report = reviewStepAdapter.review(rawRecord, candidate);
            JsonFiles.writePretty(outputPath, report);
        } catch (IOException | RuntimeException e) {
            log.error("Review command failed - input: {}, candidate: {}", inputPath, candidatePath, e);
            err.println("Review failed: " + e.getMessage());
            return EXIT_ERROR;
        }
        
        out.println("Review written to " + outputPath);
        return EXIT_OK;
    }
}
