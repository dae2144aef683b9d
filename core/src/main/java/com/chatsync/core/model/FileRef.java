package com.chatsync.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reference to an attachment uploaded next to the chat directories.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FileRef {

    @JsonProperty("filename")
    private String filename;

    @JsonProperty("original_name")
    private String originalName;

    @JsonProperty("file_type")
    private String fileType;  // "file" or "image"

    @JsonProperty("file_size")
    private long fileSize;

    @JsonProperty("file_hash")
    private String fileHash;  // md5 hex

    @JsonProperty("mime_type")
    private String mimeType;

    @JsonProperty("upload_time")
    private String uploadTime;  // ISO-8601 format

    @JsonProperty("uploader_id")
    private String uploaderId;

    @JsonProperty("uploader_name")
    private String uploaderName;

    @JsonProperty("relative_path")
    private String relativePath;
}
