package com.acme.corna.subdomain;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/subdomain")
public class SubdomainController {
    private static final String STATIC_PREFIX = "/subdomain/static/";

    private final SubdomainService subdomainService;

    public SubdomainController(SubdomainService subdomainService) {
        this.subdomainService = subdomainService;
    }

    @GetMapping("/static/**")
    public ResponseEntity<Resource> themeAsset(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String relative = UriUtils.decode(uri.substring(uri.indexOf(STATIC_PREFIX) + STATIC_PREFIX.length()), StandardCharsets.UTF_8);
        Resource resource = subdomainService.themeAsset(relative);
        MediaType type = MediaTypeFactory.getMediaType(resource).orElse(MediaType.APPLICATION_OCTET_STREAM);
        return ResponseEntity.ok().contentType(type).body(resource);
    }

    @GetMapping("/{domainName}")
    public SubdomainDtos.Homepage homepage(@PathVariable String domainName) {
        return subdomainService.homepage(domainName);
    }

    @GetMapping("/{domainName}/fragment/{urlExtension}")
    public SubdomainDtos.ParsedPost fragment(@PathVariable String domainName, @PathVariable String urlExtension) {
        return subdomainService.fragment(domainName, urlExtension);
    }
}
