package com.acme.corna.corna;

import com.acme.corna.security.SecurityUtils;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/corna")
public class CornaController {
    private final CornaService cornaService;

    public CornaController(CornaService cornaService) {
        this.cornaService = cornaService;
    }

    @PostMapping("/{domainName}")
    public ResponseEntity<Void> create(@PathVariable String domainName, @RequestBody @Valid CornaDtos.CreateRequest request) {
        cornaService.create(SecurityUtils.principal().userId(), domainName, request.title());
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @GetMapping
    public CornaDtos.DomainResponse domain() {
        return cornaService.domainOf(SecurityUtils.principal().userId());
    }

    @PutMapping("/{domainName}/theme")
    public ResponseEntity<Void> changeTheme(@PathVariable String domainName, @RequestBody @Valid CornaDtos.ThemeRequest request) {
        cornaService.changeTheme(SecurityUtils.principal().userId(), domainName, request.themeId());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{domainName}/permissions")
    public ResponseEntity<Void> changePermissions(@PathVariable String domainName, @RequestBody @Valid CornaDtos.PublicPermissionsRequest request) {
        cornaService.changePublicPermissions(SecurityUtils.principal().userId(), domainName, request.permissions());
        return ResponseEntity.noContent().build();
    }
}
