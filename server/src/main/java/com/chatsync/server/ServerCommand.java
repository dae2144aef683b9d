package com.chatsync.server;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Consumer;

/**
 * Command line of the push server. Options become Spring properties for the embedded container.
 */
@Slf4j
@Command(
        name = "chatsync-server",
        mixinStandardHelpOptions = true,
        description = "WebSocket chat server"
)
public class ServerCommand implements Callable<Integer> {

    @Option(names = {"--host"}, description = "Address to bind", defaultValue = "localhost")
    String host;

    @Option(names = {"--port"}, description = "Port to listen on", defaultValue = "8765")
    int port;

    @Option(names = {"--ssl"}, description = "Serve wss:// (requires --cert and --key)")
    boolean ssl;

    @Option(names = {"--cert"}, description = "PEM certificate file")
    Path cert;

    @Option(names = {"--key"}, description = "PEM private key file")
    Path key;

    @Spec
    CommandSpec spec;

    private final Consumer<Map<String, Object>> starter;

    public ServerCommand(Consumer<Map<String, Object>> starter) {
        this.starter = starter;
    }

    @Override
    public Integer call() {
        Map<String, Object> properties = toProperties();
        log.info("Starting chat server: {}://{}:{}", ssl ? "wss" : "ws", host, port);
        starter.accept(properties);
        return 0;
    }

    /**
     * @throws ParameterException when TLS is requested without a readable certificate and key
     */
    Map<String, Object> toProperties() {
        if (port < 1 || port > 65535) {
            throw new ParameterException(spec.commandLine(), "--port must be between 1 and 65535");
        }

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("server.address", host);
        properties.put("server.port", port);

        if (ssl) {
            if (cert == null || key == null) {
                throw new ParameterException(spec.commandLine(), "--ssl requires both --cert and --key");
            }
            requireReadable(cert, "--cert");
            requireReadable(key, "--key");
            properties.put("server.ssl.enabled", true);
            properties.put("server.ssl.certificate", "file:" + cert.toAbsolutePath());
            properties.put("server.ssl.certificate-private-key", "file:" + key.toAbsolutePath());
        }
        return properties;
    }

    private void requireReadable(Path file, String option) {
        if (!Files.isReadable(file)) {
            throw new ParameterException(spec.commandLine(), option + " file not readable: " + file);
        }
    }
}
