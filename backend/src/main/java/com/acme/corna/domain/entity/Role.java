package com.acme.corna.domain.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "roles", uniqueConstraints = @UniqueConstraint(columnNames = {"corna_id", "name"}))
public class Role {
    @Id
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private long permissions;

    @Column(nullable = false)
    private UUID creatorId;

    @Column(nullable = false)
    private UUID cornaId;

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
    public long getPermissions() { return permissions; }
    public void setPermissions(long permissions) { this.permissions = permissions; }
    public UUID getCreatorId() { return creatorId; }
    public void setCreatorId(UUID creatorId) { this.creatorId = creatorId; }
    public UUID getCornaId() { return cornaId; }
    public void setCornaId(UUID cornaId) { this.cornaId = cornaId; }
}
