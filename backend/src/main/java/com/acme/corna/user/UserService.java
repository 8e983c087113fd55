package com.acme.corna.user;

import com.acme.corna.config.LinkProperties;
import com.acme.corna.domain.entity.Corna;
import com.acme.corna.domain.entity.UserAccount;
import com.acme.corna.domain.repo.CornaRepository;
import com.acme.corna.domain.repo.MediaRepository;
import com.acme.corna.domain.repo.RoleRepository;
import com.acme.corna.domain.repo.UserAccountRepository;
import jakarta.persistence.EntityNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

@Service
@Transactional(readOnly = true)
public class UserService {
    static final String DEFAULT_ROLE = "adventurer";
    static final int MAX_CRED = 700;

    private final UserAccountRepository userRepo;
    private final MediaRepository mediaRepo;
    private final RoleRepository roleRepo;
    private final CornaRepository cornaRepo;
    private final LinkProperties links;

    public UserService(UserAccountRepository userRepo, MediaRepository mediaRepo, RoleRepository roleRepo,
                       CornaRepository cornaRepo, LinkProperties links) {
        this.userRepo = userRepo;
        this.mediaRepo = mediaRepo;
        this.roleRepo = roleRepo;
        this.cornaRepo = cornaRepo;
        this.links = links;
    }

    public UserDtos.UserDetails details(UUID userId) {
        UserAccount user = userRepo.findById(userId).orElseThrow(() -> new EntityNotFoundException("User does not exist"));
        String avatar = user.getAvatarMediaId() == null ? null
                : mediaRepo.findById(user.getAvatarMediaId()).map(m -> links.mediaDownload(m.getUrlExtension())).orElse(null);
        // cred is a placeholder until reputation is tracked
        int cred = ThreadLocalRandom.current().nextInt(1, MAX_CRED + 1);
        return new UserDtos.UserDetails(user.getUsername(), cred, DEFAULT_ROLE, avatar);
    }

    public UserDtos.CreatedRoles createdRoles(UUID userId) {
        List<UserDtos.CreatedRole> roles = roleRepo.findByCreatorIdOrderByNameAsc(userId).stream()
                .map(role -> new UserDtos.CreatedRole(
                        cornaRepo.findById(role.getCornaId()).map(Corna::getDomainName).orElse(null),
                        role.getName()))
                .toList();
        return new UserDtos.CreatedRoles(roles);
    }
}
