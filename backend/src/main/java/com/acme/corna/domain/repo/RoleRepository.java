package com.acme.corna.domain.repo;

import com.acme.corna.domain.entity.Role;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface RoleRepository extends JpaRepository<Role, UUID> {
    Optional<Role> findByCornaIdAndName(UUID cornaId, String name);
    List<Role> findByCornaIdOrderByNameAsc(UUID cornaId);
    List<Role> findByCreatorIdOrderByNameAsc(UUID creatorId);

    @Query("select r from Role r, RoleAssignment a where a.roleId = r.id and r.cornaId = :cornaId and a.userId = :userId order by r.name")
    List<Role> findAssigned(@Param("cornaId") UUID cornaId, @Param("userId") UUID userId);
}
