package com.acme.corna.themes;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "app.themes")
public record ThemeProperties(String dir) {
    public Path root() {
        return Path.of(dir).toAbsolutePath().normalize();
    }
}
