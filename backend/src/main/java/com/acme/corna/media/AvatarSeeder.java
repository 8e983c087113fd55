package com.acme.corna.media;

import com.acme.corna.domain.repo.MediaRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Imports a directory of stock avatars on first start so new users can be given one.
 */
@Component
public class AvatarSeeder {
    private static final Logger log = LoggerFactory.getLogger(AvatarSeeder.class);

    private final MediaRepository mediaRepo;
    private final MediaService mediaService;

    @Value("${app.media.avatar-seed.enabled:false}")
    private boolean seedEnabled;

    @Value("${app.media.avatar-seed.dir:}")
    private String seedDir;

    public AvatarSeeder(MediaRepository mediaRepo, MediaService mediaService) {
        this.mediaRepo = mediaRepo;
        this.mediaService = mediaService;
    }

    @PostConstruct
    public void seedAvatars() throws IOException {
        if (!seedEnabled || seedDir.isBlank()) return;
        if (mediaRepo.countByBucket(MediaBucket.AVATAR.value()) > 0) return;

        Path dir = Path.of(seedDir);
        if (!Files.isDirectory(dir)) {
            log.warn("Avatar seed directory {} does not exist", dir);
            return;
        }
        List<Path> images;
        try (Stream<Path> files = Files.list(dir)) {
            images = files.filter(Files::isRegularFile)
                    .filter(p -> MediaFiles.isImage(p.getFileName().toString()))
                    .sorted()
                    .toList();
        }
        for (Path image : images) {
            mediaService.save(new FileSystemResource(image), image.getFileName().toString(), Files.size(image), MediaBucket.AVATAR, null);
        }
        log.info("Seeded {} avatars from {}", images.size(), dir);
    }
}
