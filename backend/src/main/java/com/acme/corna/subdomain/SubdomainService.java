package com.acme.corna.subdomain;

import com.acme.corna.config.LinkProperties;
import com.acme.corna.domain.entity.Corna;
import com.acme.corna.domain.entity.Post;
import com.acme.corna.domain.entity.TextContent;
import com.acme.corna.domain.entity.Theme;
import com.acme.corna.domain.repo.CornaRepository;
import com.acme.corna.domain.repo.PostRepository;
import com.acme.corna.domain.repo.ThemeRepository;
import com.acme.corna.posts.HtmlSanitizer;
import com.acme.corna.posts.PostService;
import com.acme.corna.posts.PostType;
import com.acme.corna.themes.ThemeProperties;
import jakarta.persistence.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Read side of a corna's public site: the homepage payload, single post fragments
 * and the theme assets they reference.
 */
@Service
@Transactional(readOnly = true)
public class SubdomainService {
    private static final Logger log = LoggerFactory.getLogger(SubdomainService.class);

    private final CornaRepository cornaRepo;
    private final ThemeRepository themeRepo;
    private final PostRepository postRepo;
    private final PostService postService;
    private final HtmlSanitizer sanitizer;
    private final LinkProperties links;
    private final ThemeProperties themeProps;

    public SubdomainService(CornaRepository cornaRepo, ThemeRepository themeRepo, PostRepository postRepo, PostService postService,
                            HtmlSanitizer sanitizer, LinkProperties links, ThemeProperties themeProps) {
        this.cornaRepo = cornaRepo;
        this.themeRepo = themeRepo;
        this.postRepo = postRepo;
        this.postService = postService;
        this.sanitizer = sanitizer;
        this.links = links;
        this.themeProps = themeProps;
    }

    public SubdomainDtos.Homepage homepage(String domainName) {
        Corna corna = corna(domainName);
        Theme theme = corna.getThemeId() == null ? null : themeRepo.findById(corna.getThemeId()).orElse(null);
        if (theme == null || theme.getPath() == null) {
            throw new IllegalArgumentException("No theme found for Corna");
        }
        List<SubdomainDtos.ParsedPost> posts = postService.visiblePosts(corna).stream()
                .map(post -> parse(post, corna))
                .toList();
        return new SubdomainDtos.Homepage(corna.getTitle(), theme.getPath(), posts);
    }

    public SubdomainDtos.ParsedPost fragment(String domainName, String urlExtension) {
        Corna corna = corna(domainName);
        Post post = postRepo.findByUrlExtension(urlExtension)
                .filter(p -> p.getCornaId().equals(corna.getId()) && !p.isDeleted())
                .orElseThrow(() -> {
                    log.warn("Post {} requested on {} does not exist", urlExtension, corna.getDomainName());
                    return new EntityNotFoundException("Post does not exist.");
                });
        return parse(post, corna);
    }

    public Resource themeAsset(String relativePath) {
        Path root = themeProps.root();
        Path target = root.resolve(relativePath).normalize();
        if (!target.startsWith(root)) throw new IllegalArgumentException("Invalid path");
        if (!Files.isRegularFile(target)) throw new EntityNotFoundException("Theme file not found");
        return new FileSystemResource(target);
    }

    private Corna corna(String domainName) {
        return cornaRepo.findByDomainName(domainName.toLowerCase(Locale.ROOT))
                .orElseThrow(() -> new EntityNotFoundException("Corna does not exist"));
    }

    private SubdomainDtos.ParsedPost parse(Post post, Corna corna) {
        TextContent text = postService.text(post).orElse(null);
        String title = text == null ? null : text.getTitle();
        // only the rendered HTML is published, never the raw content
        String body = text == null || text.getInnerHtml() == null || text.getInnerHtml().isBlank()
                ? null
                : sanitizer.sanitize(text.getInnerHtml());
        List<String> images = postService.images(post).stream()
                .map(m -> links.mediaDownload(m.getUrlExtension()))
                .toList();
        boolean isText = PostType.TEXT.value().equals(post.getType());
        return new SubdomainDtos.ParsedPost(
                post.getId().toString(),
                post.getUrlExtension(),
                post.getCreatedAt().toString(),
                post.getType(),
                corna.getDomainName(),
                title,
                isText ? body : null,
                isText ? null : body,
                !isText || !images.isEmpty() ? images : null
        );
    }
}
