package com.acme.corna.user;

import java.util.List;

public class UserDtos {
    public record UserDetails(String username, int cred, String role, String avatar) {}
    public record CreatedRole(String domainName, String name) {}
    public record CreatedRoles(List<CreatedRole> roles) {}
}
