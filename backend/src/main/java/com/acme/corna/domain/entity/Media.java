package com.acme.corna.domain.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "media")
public class Media {
    @Id
    private UUID id;

    @Column(nullable = false, length = 1024)
    private String path;

    @Column(nullable = false)
    private long sizeBytes;

    @Column(nullable = false)
    private String bucket;

    @Column(nullable = false)
    private String originalName;

    private String mimeType;

    @Column(nullable = false)
    private String hash;

    @Column(nullable = false)
    private boolean orphaned;

    private UUID postId;

    @Column(unique = true, nullable = false)
    private String urlExtension;

    private Integer width;

    private Integer height;

    private String aspectRatio;

    private UUID uploaderId;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (id == null) id = UUID.randomUUID();
        createdAt = Instant.now();
    }

    public UUID getId() { return id; }
    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }
    public long getSizeBytes() { return sizeBytes; }
    public void setSizeBytes(long sizeBytes) { this.sizeBytes = sizeBytes; }
    public String getBucket() { return bucket; }
    public void setBucket(String bucket) { this.bucket = bucket; }
    public String getOriginalName() { return originalName; }
    public void setOriginalName(String originalName) { this.originalName = originalName; }
    public String getMimeType() { return mimeType; }
    public void setMimeType(String mimeType) { this.mimeType = mimeType; }
    public String getHash() { return hash; }
    public void setHash(String hash) { this.hash = hash; }
    public boolean isOrphaned() { return orphaned; }
    public void setOrphaned(boolean orphaned) { this.orphaned = orphaned; }
    public UUID getPostId() { return postId; }
    public void setPostId(UUID postId) { this.postId = postId; }
    public String getUrlExtension() { return urlExtension; }
    public void setUrlExtension(String urlExtension) { this.urlExtension = urlExtension; }
    public Integer getWidth() { return width; }
    public void setWidth(Integer width) { this.width = width; }
    public Integer getHeight() { return height; }
    public void setHeight(Integer height) { this.height = height; }
    public String getAspectRatio() { return aspectRatio; }
    public void setAspectRatio(String aspectRatio) { this.aspectRatio = aspectRatio; }
    public UUID getUploaderId() { return uploaderId; }
    public void setUploaderId(UUID uploaderId) { this.uploaderId = uploaderId; }
    public Instant getCreatedAt() { return createdAt; }
}
