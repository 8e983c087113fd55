package com.acme.corna.roles;

import com.acme.corna.security.SecurityUtils;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/roles")
public class RoleController {
    private final RoleService roleService;

    public RoleController(RoleService roleService) {
        this.roleService = roleService;
    }

    @PostMapping
    public ResponseEntity<Void> create(@RequestBody @Valid RoleDtos.RoleRequest request) {
        roleService.create(SecurityUtils.principal().userId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @PutMapping
    public ResponseEntity<Void> update(@RequestBody @Valid RoleDtos.RoleRequest request) {
        roleService.replacePermissions(SecurityUtils.principal().userId(), request);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping
    public ResponseEntity<Void> delete(@RequestBody @Valid RoleDtos.RoleRef request) {
        roleService.delete(SecurityUtils.principal().userId(), request);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/permissions/add")
    public ResponseEntity<Void> addPermission(@RequestBody @Valid RoleDtos.PermissionChange request) {
        roleService.addPermission(SecurityUtils.principal().userId(), request);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/permissions/remove")
    public ResponseEntity<Void> removePermission(@RequestBody @Valid RoleDtos.PermissionChange request) {
        roleService.removePermission(SecurityUtils.principal().userId(), request);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/give")
    public ResponseEntity<Void> give(@RequestBody @Valid RoleDtos.Membership request) {
        roleService.give(SecurityUtils.principal().userId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @PostMapping("/take")
    public ResponseEntity<Void> take(@RequestBody @Valid RoleDtos.Membership request) {
        roleService.take(SecurityUtils.principal().userId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @GetMapping("/{domainName}/{roleName}/permissions")
    public RoleDtos.PermissionsResponse permissions(@PathVariable String domainName, @PathVariable String roleName) {
        return roleService.permissions(domainName, roleName);
    }

    @GetMapping("/{domainName}/{roleName}/users")
    public RoleDtos.RoleUsersResponse users(@PathVariable String domainName, @PathVariable String roleName) {
        return roleService.users(domainName, roleName);
    }

    @GetMapping("/{domainName}")
    public RoleDtos.CornaRolesResponse roles(@PathVariable String domainName) {
        return roleService.roles(domainName);
    }

    @GetMapping("/{domainName}/{username}")
    public RoleDtos.UserRolesResponse rolesOf(@PathVariable String domainName, @PathVariable String username) {
        return roleService.rolesOf(domainName, username);
    }

    /**
     * {@code /{domain}/users/users} matches both user listings equally well. The role name is
     * reserved, so it is answered as a permission lookup.
     */
    @GetMapping("/{domainName}/users/users")
    public RoleDtos.PermissionUsersResponse usersWithPermissionUsers(@PathVariable String domainName) {
        return roleService.usersWithPermission(domainName, RoleService.RESERVED_NAME);
    }

    @GetMapping("/{domainName}/users/{permission}")
    public RoleDtos.PermissionUsersResponse usersWithPermission(@PathVariable String domainName, @PathVariable String permission) {
        return roleService.usersWithPermission(domainName, permission);
    }
}
