package com.acme.corna.domain.repo;

import com.acme.corna.domain.entity.Post;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PostRepository extends JpaRepository<Post, UUID> {
    List<Post> findByCornaIdAndDeletedFalseOrderByCreatedAtDesc(UUID cornaId);
    Optional<Post> findByUrlExtension(String urlExtension);
    boolean existsByUrlExtension(String urlExtension);
}
