package com.acme.corna.user;

import com.acme.corna.security.SecurityUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/user")
public class UserController {
    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @GetMapping
    public UserDtos.UserDetails details() {
        return userService.details(SecurityUtils.principal().userId());
    }

    @GetMapping("/roles/created")
    public UserDtos.CreatedRoles createdRoles() {
        return userService.createdRoles(SecurityUtils.principal().userId());
    }
}
