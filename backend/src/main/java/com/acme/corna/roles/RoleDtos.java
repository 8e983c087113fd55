package com.acme.corna.roles;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;

public class RoleDtos {
    public record RoleRequest(@NotBlank String domainName, @NotBlank @Size(max = 64) String name, @NotNull List<String> permissions) {}
    public record RoleRef(@NotBlank String domainName, @NotBlank String name) {}
    public record PermissionChange(@NotBlank String domainName, @NotBlank String name, @NotBlank String permission) {}
    public record Membership(@NotBlank String domainName, @NotBlank String name, @NotBlank String username) {}

    public record PermissionsResponse(String corna, String name, Map<String, Boolean> permissions) {}
    public record RoleUsersResponse(String corna, String name, List<String> users) {}
    public record CornaRolesResponse(String corna, List<String> roles) {}
    public record UserRolesResponse(String username, String corna, List<String> roles) {}
    public record PermissionUsersResponse(String corna, String permission, List<String> users) {}
}
