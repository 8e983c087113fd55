package com.acme.corna.domain.repo;

import com.acme.corna.domain.entity.UserSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;

import java.util.Optional;
import java.util.UUID;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {
    Optional<UserSession> findByCookieId(String cookieId);

    @Modifying
    void deleteByCookieId(String cookieId);

    @Modifying
    void deleteByUserId(UUID userId);
}
