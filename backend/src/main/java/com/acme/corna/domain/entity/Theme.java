package com.acme.corna.domain.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "themes")
public class Theme {
    @Id
    private UUID id;

    @Column(nullable = false)
    private String name;

    private String description;

    private String path;

    @Column(nullable = false)
    private String status;

    @Column(nullable = false)
    private UUID creatorId;

    private UUID thumbnailMediaId;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (id == null) id = UUID.randomUUID();
        createdAt = Instant.now();
    }

    public UUID getId() { return id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public UUID getCreatorId() { return creatorId; }
    public void setCreatorId(UUID creatorId) { this.creatorId = creatorId; }
    public UUID getThumbnailMediaId() { return thumbnailMediaId; }
    public void setThumbnailMediaId(UUID thumbnailMediaId) { this.thumbnailMediaId = thumbnailMediaId; }
}
