/*
 * PLTX Stream — Chunked Time-Series Reader
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pltx.server;

import ai.evacortex.pltx.core.catalog.RegisteredFile;
import ai.evacortex.pltx.core.exceptions.PltxOpenException;
import ai.evacortex.pltx.server.registry.CoreRegistrationException;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command line entry point: loads configuration, optionally registers files given on
 * the command line and serves until the process is terminated or {@code GET /stop}
 * is called.
 */
@Command(
    name = "pltx-server",
    mixinStandardHelpOptions = true,
    version = "PLTX Stream 0.1.0",
    description = "Serves recorded PLTX signal files over HTTP and WebSocket"
)
public class PltxServerCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(PltxServerCommand.class);

    @Option(names = {"-c", "--config"}, description = "HOCON file overriding the bundled defaults")
    private Path configFile;

    @Option(names = "--host", description = "Address to bind (default from configuration)")
    private String host;

    @Option(names = {"-p", "--port"}, description = "Port to bind, 0 for an ephemeral port (default from configuration)")
    private Integer port;

    @Parameters(arity = "0..*", paramLabel = "FILE", description = "PLTX files to register at startup")
    private List<Path> files = new ArrayList<>();

    @Override
    public Integer call() throws InterruptedException {
        ServerConfig config;
        try {
            config = configFile != null ? ServerConfig.load(configFile) : ServerConfig.load();
        } catch (ConfigException | IllegalArgumentException e) {
            LOGGER.error("Failed to load configuration: {}", e.getMessage());
            return 2;
        }
        config = config.withEndpoint(host != null ? host : config.host(), port != null ? port : config.port());

        PltxServer server = new PltxServer(config);
        try {
            server.start();
        } catch (CoreRegistrationException e) {
            LOGGER.error(e.getMessage());
            server.close();
            return 1;
        }
        for (Path file : files) {
            try {
                RegisteredFile registered = server.open(file);
                LOGGER.info("Serving {} as {}", file, registered.publicNames());
            } catch (PltxOpenException e) {
                LOGGER.error(e.getMessage());
                server.close();
                return 1;
            }
        }

        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "pltx-shutdown"));
        server.awaitTermination();
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new PltxServerCommand());
        commandLine.setCommandName("pltx-server");
        return commandLine;
    }
}
