package com.acme.corna.posts;

import com.acme.corna.security.SecurityUtils;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/posts")
public class PostController {
    private final PostService postService;

    public PostController(PostService postService) {
        this.postService = postService;
    }

    @PostMapping("/{domainName}/post")
    public ResponseEntity<Void> create(@PathVariable String domainName, @RequestBody @Valid PostDtos.CreateRequest request) {
        postService.create(SecurityUtils.principal().userId(), domainName, request);
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @GetMapping("/{domainName}")
    public PostDtos.PostList list(@PathVariable String domainName) {
        return postService.list(domainName);
    }

    @DeleteMapping("/{domainName}/{urlExtension}")
    public ResponseEntity<Void> delete(@PathVariable String domainName, @PathVariable String urlExtension) {
        postService.delete(SecurityUtils.principal().userId(), domainName, urlExtension);
        return ResponseEntity.noContent().build();
    }
}
