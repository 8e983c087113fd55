package com.acme.corna.roles;

import com.acme.corna.common.UnauthorizedActionException;
import com.acme.corna.corna.CornaService;
import com.acme.corna.domain.entity.Corna;
import com.acme.corna.domain.entity.Role;
import com.acme.corna.domain.entity.RoleAssignment;
import com.acme.corna.domain.entity.RoleAssignmentId;
import com.acme.corna.domain.entity.UserAccount;
import com.acme.corna.domain.repo.RoleAssignmentRepository;
import com.acme.corna.domain.repo.RoleRepository;
import com.acme.corna.domain.repo.UserAccountRepository;
import com.acme.corna.permissions.Permission;
import com.acme.corna.permissions.PermissionChecker;
import com.acme.corna.permissions.PermissionMask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Service
public class RoleService {
    private static final Logger log = LoggerFactory.getLogger(RoleService.class);
    /** Collides with the {@code /roles/{domain}/users/{permission}} route. */
    static final String RESERVED_NAME = "users";

    private final RoleRepository roleRepo;
    private final RoleAssignmentRepository assignmentRepo;
    private final UserAccountRepository userRepo;
    private final CornaService cornaService;
    private final PermissionChecker permissionChecker;

    public RoleService(RoleRepository roleRepo, RoleAssignmentRepository assignmentRepo, UserAccountRepository userRepo,
                       CornaService cornaService, PermissionChecker permissionChecker) {
        this.roleRepo = roleRepo;
        this.assignmentRepo = assignmentRepo;
        this.userRepo = userRepo;
        this.cornaService = cornaService;
        this.permissionChecker = permissionChecker;
    }

    @Transactional
    public void create(UUID userId, RoleDtos.RoleRequest request) {
        // the corna lookup must come first so a missing corna is not reported as a permission problem
        Corna corna = cornaService.require(request.domainName());
        requireManager(userId, corna, "create");
        String name = normalize(request.name());
        if (RESERVED_NAME.equals(name)) {
            throw new IllegalArgumentException("Role name '" + RESERVED_NAME + "' is reserved");
        }
        if (roleRepo.findByCornaIdAndName(corna.getId(), name).isPresent()) {
            throw new IllegalArgumentException("Duplicate roles are not permitted");
        }
        Role role = new Role();
        role.setName(name);
        role.setPermissions(PermissionMask.of(request.permissions()));
        role.setCornaId(corna.getId());
        role.setCreatorId(userId);
        roleRepo.save(role);
        log.info("Role {} created on {} by {}", name, corna.getDomainName(), userId);
    }

    @Transactional
    public void replacePermissions(UUID userId, RoleDtos.RoleRequest request) {
        Corna corna = cornaService.require(request.domainName());
        requireManager(userId, corna, "update");
        Role role = role(corna, request.name());
        role.setPermissions(PermissionMask.of(request.permissions()));
    }

    @Transactional
    public void delete(UUID userId, RoleDtos.RoleRef request) {
        Corna corna = cornaService.require(request.domainName());
        requireManager(userId, corna, "delete");
        Role role = role(corna, request.name());
        assignmentRepo.deleteByRoleId(role.getId());
        roleRepo.delete(role);
        log.info("Role {} deleted from {}", role.getName(), corna.getDomainName());
    }

    @Transactional
    public void addPermission(UUID userId, RoleDtos.PermissionChange request) {
        Corna corna = cornaService.require(request.domainName());
        requireManager(userId, corna, "update");
        Role role = role(corna, request.name());
        role.setPermissions(PermissionMask.add(role.getPermissions(), Permission.require(request.permission())));
    }

    @Transactional
    public void removePermission(UUID userId, RoleDtos.PermissionChange request) {
        Corna corna = cornaService.require(request.domainName());
        requireManager(userId, corna, "update");
        Role role = role(corna, request.name());
        role.setPermissions(PermissionMask.remove(role.getPermissions(), Permission.require(request.permission())));
    }

    @Transactional
    public void give(UUID userId, RoleDtos.Membership request) {
        Corna corna = cornaService.require(request.domainName());
        requireManager(userId, corna, "give");
        UserAccount target = user(request.username());
        Role role = role(corna, request.name());
        RoleAssignmentId id = new RoleAssignmentId(role.getId(), target.getId());
        if (!assignmentRepo.existsById(id)) {
            assignmentRepo.save(new RoleAssignment(role.getId(), target.getId()));
            log.info("Gave role {} on {} to {}", role.getName(), corna.getDomainName(), target.getUsername());
        }
    }

    @Transactional
    public void take(UUID userId, RoleDtos.Membership request) {
        Corna corna = cornaService.require(request.domainName());
        requireManager(userId, corna, "take");
        UserAccount target = user(request.username());
        Role role = role(corna, request.name());
        assignmentRepo.deleteById(new RoleAssignmentId(role.getId(), target.getId()));
        log.info("Took role {} on {} from {}", role.getName(), corna.getDomainName(), target.getUsername());
    }

    @Transactional(readOnly = true)
    public RoleDtos.PermissionsResponse permissions(String domainName, String roleName) {
        Corna corna = cornaService.require(domainName);
        Role role = role(corna, roleName);
        return new RoleDtos.PermissionsResponse(corna.getDomainName(), role.getName(), PermissionMask.toMap(role.getPermissions()));
    }

    @Transactional(readOnly = true)
    public RoleDtos.RoleUsersResponse users(String domainName, String roleName) {
        Corna corna = cornaService.require(domainName);
        Role role = role(corna, roleName);
        List<String> users = usernames(assignmentRepo.findByRoleId(role.getId()));
        return new RoleDtos.RoleUsersResponse(corna.getDomainName(), role.getName(), users);
    }

    @Transactional(readOnly = true)
    public RoleDtos.CornaRolesResponse roles(String domainName) {
        Corna corna = cornaService.require(domainName);
        List<String> roles = roleRepo.findByCornaIdOrderByNameAsc(corna.getId()).stream().map(Role::getName).toList();
        return new RoleDtos.CornaRolesResponse(corna.getDomainName(), roles);
    }

    @Transactional(readOnly = true)
    public RoleDtos.UserRolesResponse rolesOf(String domainName, String username) {
        Corna corna = cornaService.require(domainName);
        UserAccount user = user(username);
        List<String> roles = roleRepo.findAssigned(corna.getId(), user.getId()).stream().map(Role::getName).toList();
        return new RoleDtos.UserRolesResponse(user.getUsername(), corna.getDomainName(), roles);
    }

    @Transactional(readOnly = true)
    public RoleDtos.PermissionUsersResponse usersWithPermission(String domainName, String permissionKey) {
        Corna corna = cornaService.require(domainName);
        Permission permission = Permission.require(permissionKey);
        List<UUID> roleIds = roleRepo.findByCornaIdOrderByNameAsc(corna.getId()).stream()
                .filter(role -> PermissionMask.has(role.getPermissions(), permission))
                .map(Role::getId)
                .toList();
        List<String> users = roleIds.isEmpty() ? List.of() : usernames(assignmentRepo.findByRoleIdIn(roleIds));
        return new RoleDtos.PermissionUsersResponse(corna.getDomainName(), permission.key(), users);
    }

    private void requireManager(UUID userId, Corna corna, String action) {
        if (!permissionChecker.can(userId, corna, Permission.CHANGE_PERMISSIONS)) {
            log.warn("Unauthorized role {} attempt by {} on corna {}", action, userId, corna.getDomainName());
            throw new UnauthorizedActionException("User can not " + action + " a role");
        }
    }

    private Role role(Corna corna, String name) {
        String normalized = normalize(name);
        return roleRepo.findByCornaIdAndName(corna.getId(), normalized)
                .orElseThrow(() -> new IllegalArgumentException("Role named " + normalized + " not found"));
    }

    private UserAccount user(String username) {
        return userRepo.findByUsername(username)
                .orElseThrow(() -> new IllegalArgumentException("User " + username + " does not exist"));
    }

    private List<String> usernames(List<RoleAssignment> assignments) {
        List<UUID> ids = assignments.stream().map(RoleAssignment::getUserId).distinct().toList();
        return userRepo.findAllById(ids).stream().map(UserAccount::getUsername).sorted().toList();
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
