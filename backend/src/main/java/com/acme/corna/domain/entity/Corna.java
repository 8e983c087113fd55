package com.acme.corna.domain.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "cornas")
public class Corna {
    @Id
    private UUID id;

    @Column(unique = true, nullable = false)
    private String domainName;

    @Column(nullable = false)
    private String title;

    @Column(unique = true, nullable = false)
    private UUID ownerId;

    private UUID themeId;

    /** Permission bits granted to every visitor. */
    @Column(nullable = false)
    private long permissions;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (id == null) id = UUID.randomUUID();
        createdAt = Instant.now();
    }

    public UUID getId() { return id; }
    public String getDomainName() { return domainName; }
    public void setDomainName(String domainName) { this.domainName = domainName; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public UUID getOwnerId() { return ownerId; }
    public void setOwnerId(UUID ownerId) { this.ownerId = ownerId; }
    public UUID getThemeId() { return themeId; }
    public void setThemeId(UUID themeId) { this.themeId = themeId; }
    public long getPermissions() { return permissions; }
    public void setPermissions(long permissions) { this.permissions = permissions; }
    public Instant getCreatedAt() { return createdAt; }
}
