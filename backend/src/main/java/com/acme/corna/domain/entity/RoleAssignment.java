package com.acme.corna.domain.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "role_assignments")
@IdClass(RoleAssignmentId.class)
public class RoleAssignment {
    @Id
    private UUID roleId;

    @Id
    private UUID userId;

    @Column(nullable = false)
    private Instant createdAt;

    protected RoleAssignment() {
    }

    public RoleAssignment(UUID roleId, UUID userId) {
        this.roleId = roleId;
        this.userId = userId;
    }

    @PrePersist
    void onCreate() {
        createdAt = Instant.now();
    }

    public UUID getRoleId() { return roleId; }
    public UUID getUserId() { return userId; }
}
