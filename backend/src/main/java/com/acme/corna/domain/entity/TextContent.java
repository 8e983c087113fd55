package com.acme.corna.domain.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "text_contents")
public class TextContent {
    @Id
    private UUID id;

    @Column(unique = true, nullable = false)
    private UUID postId;

    private String title;

    /** Plain words of the post, kept for indexing. */
    @Column(columnDefinition = "text")
    private String content;

    /** Sanitized markup used for display. */
    @Column(columnDefinition = "text")
    private String innerHtml;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (id == null) id = UUID.randomUUID();
        createdAt = Instant.now();
    }

    public UUID getId() { return id; }
    public UUID getPostId() { return postId; }
    public void setPostId(UUID postId) { this.postId = postId; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }
    public String getInnerHtml() { return innerHtml; }
    public void setInnerHtml(String innerHtml) { this.innerHtml = innerHtml; }
}
