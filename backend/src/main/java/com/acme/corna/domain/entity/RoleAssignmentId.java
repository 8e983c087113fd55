package com.acme.corna.domain.entity;

import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

public class RoleAssignmentId implements Serializable {
    private UUID roleId;
    private UUID userId;

    public RoleAssignmentId() {
    }

    public RoleAssignmentId(UUID roleId, UUID userId) {
        this.roleId = roleId;
        this.userId = userId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RoleAssignmentId that)) return false;
        return Objects.equals(roleId, that.roleId) && Objects.equals(userId, that.userId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(roleId, userId);
    }
}
