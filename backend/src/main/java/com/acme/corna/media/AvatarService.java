package com.acme.corna.media;

import com.acme.corna.config.LinkProperties;
import com.acme.corna.domain.entity.Media;
import com.acme.corna.domain.repo.MediaRepository;
import jakarta.persistence.EntityNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

@Service
@Transactional(readOnly = true)
public class AvatarService {
    private final MediaRepository mediaRepo;
    private final LinkProperties links;

    public AvatarService(MediaRepository mediaRepo, LinkProperties links) {
        this.mediaRepo = mediaRepo;
        this.links = links;
    }

    public Optional<Media> randomAvatar() {
        // avatars are few, so picking in memory is cheaper than a random-row query
        List<Media> avatars = mediaRepo.findByBucket(MediaBucket.AVATAR.value());
        if (avatars.isEmpty()) return Optional.empty();
        return Optional.of(avatars.get(ThreadLocalRandom.current().nextInt(avatars.size())));
    }

    public MediaDtos.AvatarResponse randomAvatarLink() {
        Media avatar = randomAvatar().orElseThrow(() -> new EntityNotFoundException("No avatars available"));
        return new MediaDtos.AvatarResponse(links.mediaDownload(avatar.getUrlExtension()), avatar.getUrlExtension());
    }
}
