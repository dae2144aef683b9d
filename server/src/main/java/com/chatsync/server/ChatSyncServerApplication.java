package com.chatsync.server;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.scheduling.annotation.EnableScheduling;
import picocli.CommandLine;

import java.util.Map;

@Slf4j
@SpringBootApplication
@EnableScheduling
public class ChatSyncServerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ServerCommand(ChatSyncServerApplication::start)).execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static void start(Map<String, Object> properties) {
        log.info("Starting ChatSync Server...");
        new SpringApplicationBuilder(ChatSyncServerApplication.class)
                .properties(properties)
                .run();
        log.info("ChatSync Server started successfully!");
        log.info("Health check: http://{}:{}/health", properties.get("server.address"), properties.get("server.port"));
    }
}
