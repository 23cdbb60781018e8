package com.asyncreview.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: asyncreview serve
 * <p>
 * Starts AsyncReview as a long-running HTTP server exposing the review REST API
 * and SSE answer streaming. The web server is enabled by
 * {@link com.asyncreview.AsyncReviewApplication#main} detecting "serve" in args;
 * {@link CliRunner} then skips picocli so the embedded server keeps the JVM alive.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 asyncreview serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the AsyncReview HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8000}")
    private int port;

    @Override
    public void run() {
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("AsyncReview server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/reviews");
        System.out.println("  Health:  http://localhost:" + port + "/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
