package com.acme.corna.themes;

import com.acme.corna.common.UnauthorizedActionException;
import com.acme.corna.config.LinkProperties;
import com.acme.corna.domain.entity.Theme;
import com.acme.corna.domain.entity.UserAccount;
import com.acme.corna.domain.repo.MediaRepository;
import com.acme.corna.domain.repo.ThemeRepository;
import com.acme.corna.domain.repo.UserAccountRepository;
import com.acme.corna.media.MediaService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

@Service
public class ThemeService {
    private static final Logger log = LoggerFactory.getLogger(ThemeService.class);
    private static final Set<String> ALLOWED_EXT = Set.of("html", "css", "js");

    private final ThemeRepository themeRepo;
    private final UserAccountRepository userRepo;
    private final MediaRepository mediaRepo;
    private final MediaService mediaService;
    private final ThemeProperties props;
    private final LinkProperties links;

    public ThemeService(ThemeRepository themeRepo, UserAccountRepository userRepo, MediaRepository mediaRepo,
                        MediaService mediaService, ThemeProperties props, LinkProperties links) {
        this.themeRepo = themeRepo;
        this.userRepo = userRepo;
        this.mediaRepo = mediaRepo;
        this.mediaService = mediaService;
        this.props = props;
        this.links = links;
    }

    @Transactional
    public void add(ThemeDtos.AddRequest request) {
        UserAccount creator = creator(request.creator());
        if (themeRepo.existsByCreatorIdAndName(creator.getId(), request.name())) {
            throw new IllegalArgumentException("Theme already exists");
        }
        String path = sanitizePath(request.path());

        Theme theme = new Theme();
        theme.setName(request.name());
        theme.setDescription(request.description());
        theme.setPath(path);
        theme.setStatus(path != null ? ThemeStatus.MERGED.value() : ThemeStatus.UNKNOWN.value());
        theme.setCreatorId(creator.getId());
        if (request.thumbnail() != null && !request.thumbnail().isBlank()) {
            theme.setThumbnailMediaId(mediaService.claimOrphan(request.thumbnail()).getId());
        }
        themeRepo.save(theme);
        log.info("Theme {} added by {} with status {}", theme.getName(), creator.getUsername(), theme.getStatus());
    }

    @Transactional
    public void updateStatus(ThemeDtos.StatusRequest request) {
        UserAccount creator = creator(request.creator());
        ThemeStatus status = ThemeStatus.fromValue(request.status())
                .orElseThrow(() -> new IllegalArgumentException("Unknown theme status " + request.status()));
        List<Theme> matches = themeRepo.findByCreatorIdAndName(creator.getId(), request.name());
        if (matches.isEmpty()) {
            throw new IllegalArgumentException("No theme exists matching given details");
        }
        if (matches.size() > 1) {
            throw new IllegalArgumentException("User has multiple themes that match that name, unable to update");
        }
        Theme theme = matches.get(0);
        String path = sanitizePath(request.path());
        if (path == null && status == ThemeStatus.MERGED) {
            throw new IllegalArgumentException("Cannot set status to merged without valid path");
        }
        if (path != null) theme.setPath(path);

        String previous = theme.getStatus();
        theme.setStatus(status.value());
        log.info("Updated status for {} from {} -> {}", theme.getName(), previous, theme.getStatus());
    }

    @Transactional(readOnly = true)
    public ThemeDtos.ThemeList list() {
        List<ThemeDtos.ThemeView> themes = themeRepo.findByStatusOrderByNameAsc(ThemeStatus.MERGED.value()).stream()
                .map(this::view)
                .toList();
        return new ThemeDtos.ThemeList(themes);
    }

    /**
     * Returns the path unchanged when it names an html, css or js file inside the themes directory.
     */
    String sanitizePath(String path) {
        if (path == null || path.isBlank()) return null;
        Path root = props.root();
        Path target = root.resolve(path).normalize();
        if (!target.startsWith(root) || !Files.isRegularFile(target)) {
            throw new IllegalArgumentException("Theme not in directory");
        }
        int dot = path.lastIndexOf('.');
        String ext = dot < 0 ? "" : path.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (!ALLOWED_EXT.contains(ext)) {
            log.error("Incorrect theme file type attempt: {}", path);
            throw new IllegalArgumentException("Incorrect file type");
        }
        return path;
    }

    private UserAccount creator(String username) {
        return userRepo.findByUsername(username)
                .orElseThrow(() -> new UnauthorizedActionException("Theme creator does not exist"));
    }

    private ThemeDtos.ThemeView view(Theme theme) {
        String thumbnail = theme.getThumbnailMediaId() == null ? null
                : mediaRepo.findById(theme.getThumbnailMediaId()).map(m -> links.mediaDownload(m.getUrlExtension())).orElse(null);
        String creator = userRepo.findById(theme.getCreatorId()).map(UserAccount::getUsername).orElse(null);
        return new ThemeDtos.ThemeView(theme.getName(), theme.getDescription(), thumbnail, creator, theme.getId().toString());
    }
}
