package com.agenticImaging.protocolReview.cli;

import com.agenticImaging.protocolReview.ProtocolReviewApplication;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Command-line entry point for {@link ReviewCommand}; starts the application without the web server.
 */
public class ReviewCommandApplication {
    
    public static void main(String[] args) {
        if (args.length != 3) {
            System.err.println(ReviewCommand.USAGE);
            System.exit(ReviewCommand.EXIT_ERROR);
        }
        
        ConfigurableApplicationContext context = new SpringApplicationBuilder(ProtocolReviewApplication.class)
                .web(WebApplicationType.NONE)
                .logStartupInfo(false)
                .run();
        
        int exitCode = context.getBean(ReviewCommand.class).execute(args);
        System.exit(SpringApplication.exit(context, () -> exitCode));
    }
}
