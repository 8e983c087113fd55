package com.acme.corna.domain.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "posts")
public class Post {
    @Id
    private UUID id;

    @Column(unique = true, nullable = false)
    private String urlExtension;

    @Column(nullable = false)
    private String type;

    @Column(nullable = false)
    private boolean deleted;

    @Column(nullable = false)
    private UUID cornaId;

    @Column(nullable = false)
    private UUID authorId;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (id == null) id = UUID.randomUUID();
        createdAt = Instant.now();
    }

    public UUID getId() { return id; }
    public String getUrlExtension() { return urlExtension; }
    public void setUrlExtension(String urlExtension) { this.urlExtension = urlExtension; }
    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public boolean isDeleted() { return deleted; }
    public void setDeleted(boolean deleted) { this.deleted = deleted; }
    public UUID getCornaId() { return cornaId; }
    public void setCornaId(UUID cornaId) { this.cornaId = cornaId; }
    public UUID getAuthorId() { return authorId; }
    public void setAuthorId(UUID authorId) { this.authorId = authorId; }
    public Instant getCreatedAt() { return createdAt; }
}
