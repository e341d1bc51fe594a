package com.gateflow.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: gateflow serve
 * <p>
 * Starts Gateflow as a long-running HTTP server exposing the pipeline REST API. The web
 * server is enabled by {@link com.gateflow.GateflowApplication#main} detecting "serve" in
 * args; {@link CliRunner} then skips picocli and the banner is printed once Tomcat is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Gateflow HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Not called in serve mode; kept for subcommand registration and --help.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Gateflow server running on port " + port);
        System.out.println();
        System.out.println("  API:      http://localhost:" + port + "/api/v1/pipelines");
        System.out.println("  Metrics:  http://localhost:" + port + "/actuator/metrics");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
