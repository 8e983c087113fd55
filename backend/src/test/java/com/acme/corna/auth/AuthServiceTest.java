package com.acme.corna.auth;

import com.acme.corna.domain.entity.Media;
import com.acme.corna.domain.repo.UserAccountRepository;
import com.acme.corna.domain.repo.UserSessionRepository;
import com.acme.corna.media.AvatarService;
import com.acme.corna.security.SessionProperties;
import com.acme.corna.security.SessionTokenService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {
    @Mock
    UserAccountRepository userRepo;

    @Mock
    UserSessionRepository sessionRepo;

    @Mock
    PasswordEncoder passwordEncoder;

    @Mock
    SessionTokenService tokenService;

    @Mock
    SessionProperties sessionProperties;

    @Mock
    AvatarService avatarService;

    @InjectMocks
    AuthService authService;

    @Test
    void newUserGetsRandomAvatar() {
        UUID avatarId = UUID.randomUUID();
        Media avatar = new Media();
        ReflectionTestUtils.setField(avatar, "id", avatarId);
        when(avatarService.randomAvatar()).thenReturn(Optional.of(avatar));
        when(passwordEncoder.encode("Passw0rd!")).thenReturn("hashed");

        var response = authService.register(new AuthDtos.RegisterRequest(" Gina@Example.com ", "Passw0rd!", "gina"));

        assertThat(response.username()).isEqualTo("gina");
        verify(userRepo).save(argThat(user -> avatarId.equals(user.getAvatarMediaId())
                && "gina@example.com".equals(user.getEmail())
                && "hashed".equals(user.getPasswordHash())));
    }

    @Test
    void newUserWithoutAvatarsHasNone() {
        when(avatarService.randomAvatar()).thenReturn(Optional.empty());

        authService.register(new AuthDtos.RegisterRequest("hal@example.com", "Passw0rd!", "hal"));

        verify(userRepo).save(argThat(user -> user.getAvatarMediaId() == null));
    }
}
