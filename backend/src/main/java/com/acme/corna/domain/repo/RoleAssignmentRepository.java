package com.acme.corna.domain.repo;

import com.acme.corna.domain.entity.RoleAssignment;
import com.acme.corna.domain.entity.RoleAssignmentId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;

import java.util.List;
import java.util.UUID;

public interface RoleAssignmentRepository extends JpaRepository<RoleAssignment, RoleAssignmentId> {
    List<RoleAssignment> findByRoleId(UUID roleId);
    List<RoleAssignment> findByRoleIdIn(List<UUID> roleIds);

    @Modifying
    void deleteByRoleId(UUID roleId);
}
