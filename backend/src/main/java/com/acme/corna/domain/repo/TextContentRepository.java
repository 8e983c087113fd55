package com.acme.corna.domain.repo;

import com.acme.corna.domain.entity.TextContent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface TextContentRepository extends JpaRepository<TextContent, UUID> {
    Optional<TextContent> findByPostId(UUID postId);
}
