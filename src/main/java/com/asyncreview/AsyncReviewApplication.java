package com.asyncreview;

import com.asyncreview.dispatch.cli.CliRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

/**
 * Entry point. {@code serve} starts the web server; every other command runs once and exits.
 */
@SpringBootApplication
public class AsyncReviewApplication {

    public static void main(String[] args) {
        boolean serveMode = CliRunner.isServeMode(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(AsyncReviewApplication.class);

        builder.properties(
                "spring.main.web-application-type=" + (serveMode ? "servlet" : "none"),
                "spring.main.banner-mode=off"
        );

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            int exitCode = SpringApplication.exit(ctx, exitCodeGen);
            System.exit(exitCode);
        }
    }
}
