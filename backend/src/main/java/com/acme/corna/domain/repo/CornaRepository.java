package com.acme.corna.domain.repo;

import com.acme.corna.domain.entity.Corna;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface CornaRepository extends JpaRepository<Corna, UUID> {
    Optional<Corna> findByDomainName(String domainName);
    Optional<Corna> findByOwnerId(UUID ownerId);
    boolean existsByDomainName(String domainName);
    boolean existsByOwnerId(UUID ownerId);
}
