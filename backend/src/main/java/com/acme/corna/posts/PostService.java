package com.acme.corna.posts;

import com.acme.corna.common.UnauthorizedActionException;
import com.acme.corna.common.UrlExtensionGenerator;
import com.acme.corna.config.LinkProperties;
import com.acme.corna.corna.CornaService;
import com.acme.corna.domain.entity.Corna;
import com.acme.corna.domain.entity.Media;
import com.acme.corna.domain.entity.Post;
import com.acme.corna.domain.entity.TextContent;
import com.acme.corna.domain.repo.MediaRepository;
import com.acme.corna.domain.repo.PostRepository;
import com.acme.corna.domain.repo.TextContentRepository;
import com.acme.corna.media.MediaService;
import com.acme.corna.permissions.Permission;
import com.acme.corna.permissions.PermissionChecker;
import jakarta.persistence.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class PostService {
    private static final Logger log = LoggerFactory.getLogger(PostService.class);

    private final PostRepository postRepo;
    private final TextContentRepository textRepo;
    private final MediaRepository mediaRepo;
    private final MediaService mediaService;
    private final CornaService cornaService;
    private final PermissionChecker permissionChecker;
    private final UrlExtensionGenerator urlExtensions;
    private final HtmlSanitizer sanitizer;
    private final LinkProperties links;

    public PostService(PostRepository postRepo, TextContentRepository textRepo, MediaRepository mediaRepo, MediaService mediaService,
                       CornaService cornaService, PermissionChecker permissionChecker, UrlExtensionGenerator urlExtensions,
                       HtmlSanitizer sanitizer, LinkProperties links) {
        this.postRepo = postRepo;
        this.textRepo = textRepo;
        this.mediaRepo = mediaRepo;
        this.mediaService = mediaService;
        this.cornaService = cornaService;
        this.permissionChecker = permissionChecker;
        this.urlExtensions = urlExtensions;
        this.sanitizer = sanitizer;
        this.links = links;
    }

    @Transactional
    public void create(UUID userId, String domainName, PostDtos.CreateRequest raw) {
        PostDtos.CreateRequest request = raw.normalized();
        Corna corna = cornaService.require(domainName);
        if (!permissionChecker.can(userId, corna, Permission.WRITE)) {
            log.warn("User {} tried to post on {} without write permission", userId, corna.getDomainName());
            throw new UnauthorizedActionException("User unauthorized to create posts");
        }
        PostType type = PostType.fromValue(request.type())
                .orElseThrow(() -> new IllegalArgumentException(request.type() + " is not a valid type of content"));
        if (type == PostType.TEXT && isBlank(request.content())) {
            throw new IllegalArgumentException("Text post needs text");
        }
        if (type == PostType.PICTURE && request.uploadedImages().isEmpty()) {
            throw new IllegalArgumentException("Photo post needs images");
        }

        Post post = new Post();
        post.setUrlExtension(urlExtensions.unique(postRepo::existsByUrlExtension));
        post.setType(type.value());
        post.setDeleted(false);
        post.setCornaId(corna.getId());
        post.setAuthorId(userId);
        postRepo.save(post);

        if (!isBlank(request.title()) || !isBlank(request.content())) {
            TextContent text = new TextContent();
            text.setPostId(post.getId());
            text.setTitle(request.title());
            text.setContent(request.content());
            text.setInnerHtml(sanitizer.sanitize(request.innerHtml()));
            textRepo.save(text);
        }
        for (String urlExtension : request.uploadedImages()) {
            mediaService.linkToPost(urlExtension, post.getId());
        }
        log.info("New {} post {} on {}", type.value(), post.getUrlExtension(), corna.getDomainName());
    }

    @Transactional(readOnly = true)
    public PostDtos.PostList list(String domainName) {
        Corna corna = cornaService.require(domainName);
        List<PostDtos.PostView> posts = visiblePosts(corna).stream().map(post -> view(post, corna)).toList();
        return new PostDtos.PostList(posts);
    }

    @Transactional
    public void delete(UUID userId, String domainName, String urlExtension) {
        Corna corna = cornaService.require(domainName);
        Post post = postRepo.findByUrlExtension(urlExtension)
                .filter(p -> p.getCornaId().equals(corna.getId()) && !p.isDeleted())
                .orElseThrow(() -> new EntityNotFoundException("Post does not exist."));
        if (!permissionChecker.can(userId, corna, Permission.DELETE)) {
            log.warn("User {} tried to delete post {} on {}", userId, urlExtension, corna.getDomainName());
            throw new UnauthorizedActionException("User unauthorized to delete posts");
        }
        post.setDeleted(true);
        log.info("Post {} on {} deleted", urlExtension, corna.getDomainName());
    }

    public List<Post> visiblePosts(Corna corna) {
        return postRepo.findByCornaIdAndDeletedFalseOrderByCreatedAtDesc(corna.getId());
    }

    public Optional<TextContent> text(Post post) {
        return textRepo.findByPostId(post.getId());
    }

    public List<Media> images(Post post) {
        return mediaRepo.findByPostIdOrderByCreatedAtAsc(post.getId());
    }

    private PostDtos.PostView view(Post post, Corna corna) {
        String domain = corna.getDomainName();
        TextContent text = text(post).orElse(null);
        List<String> imageUrls = images(post).stream()
                .map(m -> links.post(domain, "image", m.getUrlExtension()))
                .toList();
        String title = text != null && !isBlank(text.getTitle()) ? text.getTitle() : null;
        String postUrl = links.post(domain, post.getType(), post.getUrlExtension());
        String created = post.getCreatedAt().toString();

        if (PostType.TEXT.value().equals(post.getType())) {
            return new PostDtos.PostView(post.getType(), created, postUrl, title,
                    text == null ? null : text.getContent(), null, imageUrls.isEmpty() ? null : imageUrls);
        }
        String caption = text != null && !isBlank(text.getContent()) ? text.getContent() : null;
        return new PostDtos.PostView(post.getType(), created, postUrl, title, null, caption, imageUrls);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
