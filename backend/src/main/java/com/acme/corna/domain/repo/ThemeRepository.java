package com.acme.corna.domain.repo;

import com.acme.corna.domain.entity.Theme;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ThemeRepository extends JpaRepository<Theme, UUID> {
    List<Theme> findByCreatorIdAndName(UUID creatorId, String name);
    boolean existsByCreatorIdAndName(UUID creatorId, String name);
    List<Theme> findByStatusOrderByNameAsc(String status);
}
