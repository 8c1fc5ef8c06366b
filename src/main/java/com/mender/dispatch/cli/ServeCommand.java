package com.mender.dispatch.cli;

import com.mender.core.engine.MenderProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: mender serve
 * <p>
 * Runs Mender as a long-running service: the mission poller plus the REST API.
 * The web server is enabled by {@link com.mender.MenderApplication#main}
 * detecting "serve" in args, and {@link CliRunner} skips picocli in that mode.
 * The startup banner is printed once Tomcat is ready.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 mender serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the mission poller and the HTTP API")
@Component
public class ServeCommand implements Runnable {

    private final MenderProperties properties;

    @Value("${server.port:8080}")
    private int port;

    public ServeCommand(MenderProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run() {
        // Not called in serve mode; kept for subcommand registration and --help.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Mender running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1");
        System.out.println("  Polling:    every " + properties.getPollIntervalMs() + " ms, up to "
                + properties.getMaxConcurrentMissions() + " concurrent missions");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
