package com.chatsync.server;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ServerCommandTest {

    @TempDir
    Path dir;

    private final List<Map<String, Object>> started = new ArrayList<>();

    @Test
    void defaultsBindLocalhostOn8765() {
        int exitCode = commandLine().execute();

        assertThat(exitCode).isZero();
        assertThat(started).hasSize(1);
        assertThat(started.get(0))
                .containsEntry("server.address", "localhost")
                .containsEntry("server.port", 8765)
                .doesNotContainKey("server.ssl.enabled");
    }

    @Test
    void sslWithoutCertificateIsAUsageError() {
        int exitCode = commandLine().execute("--ssl", "--cert", "server.crt");

        assertThat(exitCode).isEqualTo(2);
        assertThat(started).isEmpty();
    }

    @Test
    void sslWithUnreadableFilesIsAUsageError() {
        int exitCode = commandLine().execute("--ssl",
                "--cert", dir.resolve("missing.crt").toString(),
                "--key", dir.resolve("missing.key").toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(started).isEmpty();
    }

    @Test
    void sslOptionsBecomePemProperties() throws Exception {
        Path cert = Files.writeString(dir.resolve("server.crt"), "cert");
        Path key = Files.writeString(dir.resolve("server.key"), "key");

        int exitCode = commandLine().execute("--host", "0.0.0.0", "--port", "9443",
                "--ssl", "--cert", cert.toString(), "--key", key.toString());

        assertThat(exitCode).isZero();
        assertThat(started.get(0))
                .containsEntry("server.address", "0.0.0.0")
                .containsEntry("server.port", 9443)
                .containsEntry("server.ssl.enabled", true)
                .containsEntry("server.ssl.certificate", "file:" + cert.toAbsolutePath())
                .containsEntry("server.ssl.certificate-private-key", "file:" + key.toAbsolutePath());
    }

    @Test
    void rejectsOutOfRangePort() {
        assertThat(commandLine().execute("--port", "70000")).isEqualTo(2);
    }

    private CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(new ServerCommand(started::add));
        commandLine.setErr(new java.io.PrintWriter(new java.io.StringWriter()));
        return commandLine;
    }
}
