package com.acme.corna.domain.repo;

import com.acme.corna.domain.entity.Media;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface MediaRepository extends JpaRepository<Media, UUID> {
    Optional<Media> findByUrlExtension(String urlExtension);
    boolean existsByUrlExtension(String urlExtension);
    List<Media> findByPostIdOrderByCreatedAtAsc(UUID postId);
    List<Media> findByBucket(String bucket);
    long countByBucket(String bucket);
}
