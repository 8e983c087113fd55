package com.acme.corna.corna;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

public class CornaDtos {
    public record CreateRequest(@NotBlank @Size(max = 200) String title) {}
    public record DomainResponse(String domainName) {}
    public record ThemeRequest(@NotNull UUID themeId) {}
    public record PublicPermissionsRequest(@NotNull List<String> permissions) {}
}
