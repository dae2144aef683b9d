package com.chatsync.core.retention;

import com.chatsync.core.channel.StorageLayout;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.chatsync.core.storage.ObjectStore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.List;

/**
 * Rolling log of sweep runs kept in {@code logs/cleanup_stats.json}.
 */
@Slf4j
public class SweepHistory {

    static final String HISTORY_KEY = StorageLayout.LOGS_DIR + "/cleanup_stats.json";
    static final int MAX_ENTRIES = 30;

    private final ObjectStore store;
    private final ObjectMapper objectMapper;

    public SweepHistory(ObjectStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Appends a run and keeps only the newest {@value #MAX_ENTRIES} entries. Failures are logged
     * only: losing a statistics line must not fail the sweep.
     */
    public void append(Entry entry) {
        try {
            List<Entry> entries = new ArrayList<>(read());
            entries.add(entry);
            if (entries.size() > MAX_ENTRIES) {
                entries = new ArrayList<>(entries.subList(entries.size() - MAX_ENTRIES, entries.size()));
            }
            store.put(HISTORY_KEY, objectMapper.writeValueAsBytes(entries));
        } catch (IOException e) {
            log.error("Failed to record sweep statistics: {}", e.getMessage());
        }
    }

    public List<Entry> read() throws IOException {
        try {
            return objectMapper.readValue(store.get(HISTORY_KEY), new TypeReference<List<Entry>>() {
            });
        } catch (NoSuchFileException e) {
            return List.of();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {

        @JsonProperty("cleanup_time")
        private String cleanupTime;

        @JsonProperty("cutoff")
        private String cutoff;

        @JsonProperty("deleted_files")
        private int deletedFiles;

        @JsonProperty("failed_files")
        private int failedFiles;

        @JsonProperty("days_kept")
        private Double daysKept;

        @JsonProperty("share_path")
        private String sharePath;
    }
}
