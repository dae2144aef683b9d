package com.chatsync.core.storage;

import java.io.IOException;
import java.util.List;

/**
 * Minimal key/value view of the chat room root. Keys are {@code /}-separated and relative to the
 * root; a "directory" is a key prefix.
 */
public interface ObjectStore {

    /**
     * Writes the object atomically, replacing any previous content.
     */
    void put(String key, byte[] content) throws IOException;

    /**
     * @throws java.nio.file.NoSuchFileException when the key does not exist
     */
    byte[] get(String key) throws IOException;

    boolean exists(String key) throws IOException;

    /**
     * Lists the objects directly under {@code directory}, sorted by name. A missing directory is
     * empty.
     */
    List<StoredObject> list(String directory) throws IOException;

    /**
     * Lists the names of the sub-directories directly under {@code directory}, sorted.
     */
    List<String> listDirectories(String directory) throws IOException;

    /**
     * @return true if an object was removed
     */
    boolean delete(String key) throws IOException;

    /**
     * Removes {@code directory} when nothing is left in it.
     *
     * @return true if the directory was removed
     */
    boolean deleteDirectoryIfEmpty(String directory) throws IOException;

    /**
     * Human-readable location for log lines.
     */
    String describe();
}
