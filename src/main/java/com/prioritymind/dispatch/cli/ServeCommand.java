package com.prioritymind.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: prioritymind serve
 * <p>
 * The web server itself is enabled by {@link com.prioritymind.PrioritymindApplication#main}
 * when "serve" is the subcommand; {@link CliRunner} then skips picocli. This class
 * registers the subcommand for help output and prints the banner once Tomcat is up.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Prioritymind HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
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
        ConsoleOutput.info("Prioritymind server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1/sessions");
        System.out.println("  Health:  http://localhost:" + port + "/actuator/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
