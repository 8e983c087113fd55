package com.acme.corna.permissions;

import com.acme.corna.domain.entity.Corna;
import com.acme.corna.domain.repo.RoleRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Decides whether a user may act on a corna: owners may do anything, everybody gets
 * the corna's public permissions, and role holders get whatever their roles grant.
 */
@Service
@Transactional(readOnly = true)
public class PermissionChecker {
    private final RoleRepository roleRepo;

    public PermissionChecker(RoleRepository roleRepo) {
        this.roleRepo = roleRepo;
    }

    /**
     * @param userId the acting user, or {@code null} for anonymous visitors
     */
    public boolean can(UUID userId, Corna corna, Permission permission) {
        if (userId != null && userId.equals(corna.getOwnerId())) return true;
        if (PermissionMask.has(corna.getPermissions(), permission)) return true;
        if (userId == null) return false;
        return roleRepo.findAssigned(corna.getId(), userId).stream()
                .anyMatch(role -> PermissionMask.has(role.getPermissions(), permission));
    }
}
