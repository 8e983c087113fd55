package com.acme.corna.corna;

import com.acme.corna.common.UnauthorizedActionException;
import com.acme.corna.domain.entity.Corna;
import com.acme.corna.domain.entity.Theme;
import com.acme.corna.domain.repo.CornaRepository;
import com.acme.corna.domain.repo.ThemeRepository;
import com.acme.corna.permissions.Permission;
import com.acme.corna.permissions.PermissionChecker;
import com.acme.corna.permissions.PermissionMask;
import com.acme.corna.themes.ThemeStatus;
import jakarta.persistence.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

@Service
public class CornaService {
    private static final Logger log = LoggerFactory.getLogger(CornaService.class);
    private static final Pattern DOMAIN = Pattern.compile("[a-z0-9-]{1,63}");

    private final CornaRepository cornaRepo;
    private final ThemeRepository themeRepo;
    private final PermissionChecker permissionChecker;

    public CornaService(CornaRepository cornaRepo, ThemeRepository themeRepo, PermissionChecker permissionChecker) {
        this.cornaRepo = cornaRepo;
        this.themeRepo = themeRepo;
        this.permissionChecker = permissionChecker;
    }

    @Transactional
    public void create(UUID userId, String domainName, String title) {
        String domain = normalize(domainName);
        if (cornaRepo.existsByOwnerId(userId)) {
            throw new IllegalArgumentException("User already has a corna");
        }
        if (cornaRepo.existsByDomainName(domain)) {
            throw new IllegalArgumentException("Domain name already in use");
        }
        Corna corna = new Corna();
        corna.setDomainName(domain);
        corna.setTitle(title.trim());
        corna.setOwnerId(userId);
        corna.setPermissions(0);
        cornaRepo.save(corna);
        log.info("Created corna {} for user {}", domain, userId);
    }

    public CornaDtos.DomainResponse domainOf(UUID userId) {
        Corna corna = cornaRepo.findByOwnerId(userId).orElseThrow(() -> new EntityNotFoundException("User has no corna"));
        return new CornaDtos.DomainResponse(corna.getDomainName());
    }

    /**
     * Looks a corna up for API callers, where an unknown domain is a bad request.
     */
    public Corna require(String domainName) {
        if (domainName == null) throw new IllegalArgumentException("Corna does not exist");
        return cornaRepo.findByDomainName(domainName.toLowerCase(Locale.ROOT))
                .orElseThrow(() -> new IllegalArgumentException("Corna does not exist"));
    }

    @Transactional
    public void changeTheme(UUID userId, String domainName, UUID themeId) {
        Corna corna = require(domainName);
        if (!permissionChecker.can(userId, corna, Permission.CHANGE_THEME)) {
            log.warn("User {} tried to change the theme of {}", userId, corna.getDomainName());
            throw new UnauthorizedActionException("User can not change the theme");
        }
        Theme theme = themeRepo.findById(themeId).orElseThrow(() -> new IllegalArgumentException("Theme does not exist"));
        if (!ThemeStatus.MERGED.value().equals(theme.getStatus())) {
            throw new IllegalArgumentException("Theme is not available");
        }
        corna.setThemeId(theme.getId());
        log.info("Corna {} now uses theme {}", corna.getDomainName(), theme.getName());
    }

    @Transactional
    public void changePublicPermissions(UUID userId, String domainName, List<String> permissions) {
        Corna corna = require(domainName);
        if (!permissionChecker.can(userId, corna, Permission.CHANGE_PERMISSIONS)) {
            log.warn("User {} tried to change public permissions of {}", userId, corna.getDomainName());
            throw new UnauthorizedActionException("User can not change permissions");
        }
        corna.setPermissions(PermissionMask.of(permissions));
    }

    static String normalize(String domainName) {
        String domain = domainName == null ? "" : domainName.trim().toLowerCase(Locale.ROOT);
        if (!DOMAIN.matcher(domain).matches()) {
            throw new IllegalArgumentException("Invalid domain name");
        }
        return domain;
    }
}
