package com.acme.corna.media;

import com.acme.corna.common.PayloadTooLargeException;
import com.acme.corna.common.UnsupportedFileException;
import com.acme.corna.common.UrlExtensionGenerator;
import com.acme.corna.domain.entity.Media;
import com.acme.corna.domain.repo.MediaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.InputStreamSource;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.DigestUtils;
import org.springframework.web.multipart.MultipartFile;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.UUID;

@Service
public class MediaService {
    private static final Logger log = LoggerFactory.getLogger(MediaService.class);
    private static final SecureRandom RANDOM = new SecureRandom();

    private final MediaRepository mediaRepo;
    private final StorageService storage;
    private final UrlExtensionGenerator urlExtensions;
    private final MediaProperties props;

    public MediaService(MediaRepository mediaRepo, StorageService storage, UrlExtensionGenerator urlExtensions, MediaProperties props) {
        this.mediaRepo = mediaRepo;
        this.storage = storage;
        this.urlExtensions = urlExtensions;
        this.props = props;
    }

    @Transactional
    public MediaDtos.UploadResponse upload(MultipartFile file, MediaBucket bucket, UUID uploaderId) {
        if (file == null || file.isEmpty()) throw new IllegalArgumentException("Media file required");
        Media media = save(file, file.getOriginalFilename(), file.getSize(), bucket, uploaderId);
        return toResponse(media);
    }

    /**
     * Registers an already assembled file, such as the result of a chunked upload.
     */
    @Transactional
    public Media save(InputStreamSource source, String filename, long size, MediaBucket bucket, UUID uploaderId) {
        if (!MediaFiles.isAllowed(filename)) {
            throw new UnsupportedFileException("File extension not allowed: " + filename);
        }
        if (size > props.maxBlobSize().toBytes()) {
            throw new PayloadTooLargeException("File too large for processing");
        }

        boolean image = MediaFiles.isImage(filename);
        String hash = image ? md5(source) : randomHash();
        String path = storage.store(bucket, hash, filename, source);

        Media media = new Media();
        media.setPath(path);
        media.setSizeBytes(sizeOf(path));
        media.setBucket(bucket.value());
        media.setOriginalName(filename);
        media.setMimeType(MediaTypeFactory.getMediaType(filename).map(MediaType::toString).orElse(null));
        media.setHash(hash);
        media.setOrphaned(true);
        media.setUploaderId(uploaderId);
        media.setUrlExtension(urlExtensions.unique(mediaRepo::existsByUrlExtension));
        if (image) readDimensions(media, source);
        mediaRepo.save(media);
        log.info("Stored {} media {} as {}", bucket.value(), filename, media.getUrlExtension());
        return media;
    }

    @Transactional(readOnly = true)
    public Download download(String urlExtension) {
        Media media = mediaRepo.findByUrlExtension(urlExtension).orElseThrow(() -> new IllegalArgumentException("File not found"));
        Resource resource = storage.load(media.getPath());
        if (!resource.exists()) {
            log.warn("Media {} points at missing file {}", urlExtension, media.getPath());
            throw new IllegalArgumentException("File not found");
        }
        MediaType type = media.getMimeType() != null
                ? MediaType.parseMediaType(media.getMimeType())
                : MediaTypeFactory.getMediaType(media.getOriginalName()).orElse(MediaType.APPLICATION_OCTET_STREAM);
        return new Download(resource, type);
    }

    /**
     * Attaches a previously uploaded, still orphaned file to a post.
     */
    @Transactional
    public Media linkToPost(String urlExtension, UUID postId) {
        Media media = claimOrphan(urlExtension);
        media.setPostId(postId);
        return media;
    }

    @Transactional
    public Media claimOrphan(String urlExtension) {
        Media media = mediaRepo.findByUrlExtension(urlExtension)
                .filter(Media::isOrphaned)
                .orElseThrow(() -> new IllegalArgumentException("Unable to find file"));
        media.setOrphaned(false);
        return media;
    }

    public static MediaDtos.UploadResponse toResponse(Media media) {
        return new MediaDtos.UploadResponse(media.getId().toString(), media.getOriginalName(), media.getMimeType(), media.getSizeBytes(), media.getUrlExtension());
    }

    private long sizeOf(String path) {
        try {
            return Files.size(storage.resolve(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read stored file", e);
        }
    }

    private static String md5(InputStreamSource source) {
        try (InputStream in = source.getInputStream()) {
            return DigestUtils.md5DigestAsHex(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read upload", e);
        }
    }

    private static String randomHash() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private static void readDimensions(Media media, InputStreamSource source) {
        try (InputStream in = source.getInputStream()) {
            BufferedImage image = ImageIO.read(in);
            if (image == null || image.getHeight() == 0) return;
            media.setWidth(image.getWidth());
            media.setHeight(image.getHeight());
            media.setAspectRatio(AspectRatios.of(image.getWidth(), image.getHeight()));
        } catch (IOException e) {
            log.warn("Could not read dimensions of {}: {}", media.getOriginalName(), e.getMessage());
        }
    }

    public record Download(Resource resource, MediaType mediaType) {}
}
