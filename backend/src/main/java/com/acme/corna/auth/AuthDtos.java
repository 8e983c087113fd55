package com.acme.corna.auth;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public class AuthDtos {
    public record RegisterRequest(
            @NotBlank @Email String emailAddress,
            @NotBlank @Size(min = 8, max = 128) String password,
            @NotBlank @Size(max = 64) @Pattern(regexp = "[A-Za-z0-9_.-]+", message = "Username may only contain letters, digits, '_', '.' and '-'") String userName) {}
    public record LoginRequest(@NotBlank String emailAddress, @NotBlank String password) {}
    public record UserResponse(String username) {}
    public record LoginStatus(boolean status) {}
}
