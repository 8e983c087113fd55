package com.acme.corna.media;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public class MediaDtos {
    public record UploadResponse(String id, String filename, String mimeType, long size, String urlExtension) {}
    public record AvatarResponse(String url, String slug) {}
    public record ChunkResponse(String message, int received, int total, @JsonProperty("uploadId") String uploadId) {}
    public record ChunkStatus(boolean complete, String message) {}
    public record MergeRequest(
            @NotBlank String filename,
            @NotBlank @JsonProperty("uploadId") String uploadId,
            @JsonProperty("contentType") String contentType) {}
}
