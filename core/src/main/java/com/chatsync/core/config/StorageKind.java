package com.chatsync.core.config;

public enum StorageKind {
    /** A local or network-mounted directory. */
    LOCAL,
    /** An S3-compatible object-storage bucket. */
    S3
}
