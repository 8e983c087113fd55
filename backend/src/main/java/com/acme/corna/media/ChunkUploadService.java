package com.acme.corna.media;

import com.acme.corna.common.PayloadTooLargeException;
import com.acme.corna.common.UnsupportedFileException;
import com.acme.corna.common.UploadMetadataException;
import com.acme.corna.domain.entity.Media;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResource;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Collects the pieces of a large upload under {@code chunks/{uploadId}} and merges them
 * into a single media file once every piece has arrived.
 *
 * <pre>
 * chunks/{uploadId}/meta.json        {"received": [0, 1, ...], "totalChunks": n}
 * chunks/{uploadId}/parts/000000.part
 * chunks/{uploadId}/.merge.lock      present while a merge runs
 * </pre>
 */
@Service
public class ChunkUploadService {
    private static final Logger log = LoggerFactory.getLogger(ChunkUploadService.class);
    private static final Pattern UPLOAD_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");
    private static final String META = "meta.json";
    private static final String PARTS = "parts";
    private static final String LOCK = ".merge.lock";
    private static final int LOCK_STRIPES = 64;

    private final Path chunkDir;
    private final ObjectMapper objectMapper;
    private final MediaService mediaService;
    private final MediaProperties props;

    private final Object[] metaLocks = new Object[LOCK_STRIPES];

    @Value("${app.media.chunk-ttl:PT24H}")
    private Duration chunkTtl;

    public ChunkUploadService(MediaProperties props, ObjectMapper objectMapper, MediaService mediaService) throws IOException {
        this.props = props;
        this.chunkDir = Path.of(props.baseDir()).toAbsolutePath().normalize().resolve("chunks");
        this.objectMapper = objectMapper;
        this.mediaService = mediaService;
        for (int i = 0; i < LOCK_STRIPES; i++) metaLocks[i] = new Object();
        Files.createDirectories(chunkDir);
    }

    public MediaDtos.ChunkResponse store(MultipartFile chunk, int index, int totalChunks, String uploadId) {
        Path uploadDir = uploadDir(uploadId);
        if (chunk == null || chunk.isEmpty()) throw new IllegalArgumentException("Chunk required");
        if (totalChunks <= 0) throw new IllegalArgumentException("totalChunks must be positive");
        if (index < 0 || index >= totalChunks) throw new IllegalArgumentException("chunkIndex out of range");

        if (Files.exists(uploadDir.resolve(META))) {
            requireSameTotal(readMeta(uploadDir), totalChunks);
        }

        Path partsDir = uploadDir.resolve(PARTS);
        try {
            Files.createDirectories(partsDir);
            Path tmp = Files.createTempFile(partsDir, "chunk", ".tmp");
            try (InputStream in = chunk.getInputStream()) {
                Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
            }
            Files.move(tmp, partsDir.resolve(partName(index)), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to store chunk " + index, e);
        }

        int received;
        synchronized (lockFor(uploadId)) {
            ChunkMeta meta = Files.exists(uploadDir.resolve(META)) ? readMeta(uploadDir) : new ChunkMeta(List.of(), totalChunks);
            requireSameTotal(meta, totalChunks);
            TreeSet<Integer> indexes = new TreeSet<>(meta.received());
            indexes.add(index);
            writeMeta(uploadDir, new ChunkMeta(new ArrayList<>(indexes), totalChunks));
            received = indexes.size();
        }

        String message = received >= totalChunks ? "upload complete" : "chunk " + index + " stored";
        return new MediaDtos.ChunkResponse(message, received, totalChunks, uploadId);
    }

    public MediaDtos.ChunkStatus status(String uploadId) {
        Path uploadDir = uploadDir(uploadId);
        if (!Files.exists(uploadDir.resolve(META))) {
            throw new EntityNotFoundException("No upload being processed");
        }
        int missing = missing(readMeta(uploadDir));
        return missing == 0
                ? new MediaDtos.ChunkStatus(true, "upload complete")
                : new MediaDtos.ChunkStatus(false, missing + " chunks missing");
    }

    public MediaDtos.UploadResponse merge(MediaDtos.MergeRequest request, UUID uploaderId) {
        String uploadId = request.uploadId();
        Path uploadDir = uploadDir(uploadId);
        MediaBucket bucket = MediaBucket.fromValue(request.contentType());
        if (!MediaFiles.isAllowed(request.filename())) {
            throw new UnsupportedFileException("File extension not allowed: " + request.filename());
        }
        if (!Files.exists(uploadDir.resolve(META))) {
            throw new IllegalArgumentException("No upload associated with Id '" + uploadId + "'");
        }
        ChunkMeta meta = readMeta(uploadDir);
        int missing = missing(meta);
        if (missing > 0) {
            throw new IllegalArgumentException("Incomplete file, " + missing + " chunks missing");
        }

        Path partsDir = uploadDir.resolve(PARTS);
        long size = totalSize(partsDir, meta.totalChunks());
        if (size > props.maxBlobSize().toBytes()) {
            throw new PayloadTooLargeException("File too large for processing");
        }

        Path lock = uploadDir.resolve(LOCK);
        try {
            Files.createFile(lock);
        } catch (FileAlreadyExistsException e) {
            throw new IllegalArgumentException("Merge in progress");
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to lock upload " + uploadId, e);
        }

        Media media;
        Path merged = null;
        try {
            merged = concat(uploadDir, partsDir, meta.totalChunks());
            media = mediaService.save(new FileSystemResource(merged), request.filename(), size, bucket, uploaderId);
        } finally {
            if (merged != null) deleteQuietly(merged);
            deleteQuietly(lock);
        }
        clean(uploadId);
        log.info("Merged {} chunks of upload {} into {}", meta.totalChunks(), uploadId, media.getUrlExtension());
        return MediaService.toResponse(media);
    }

    public void clean(String uploadId) {
        Path uploadDir = uploadDir(uploadId);
        try {
            FileSystemUtils.deleteRecursively(uploadDir);
        } catch (IOException e) {
            log.warn("Could not remove chunks of upload {}: {}", uploadId, e.getMessage());
        }
    }

    /**
     * Removes uploads that have not received a chunk within {@code app.media.chunk-ttl}.
     */
    @Scheduled(fixedDelayString = "${app.media.chunk-cleanup-interval:PT1H}", initialDelayString = "${app.media.chunk-cleanup-interval:PT1H}")
    public void purgeAbandoned() {
        purgeOlderThan(Instant.now().minus(chunkTtl));
    }

    int purgeOlderThan(Instant cutoff) {
        List<Path> uploads;
        try (Stream<Path> dirs = Files.list(chunkDir)) {
            uploads = dirs.filter(Files::isDirectory).toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to list chunk uploads", e);
        }
        int purged = 0;
        for (Path upload : uploads) {
            if (Files.exists(upload.resolve(LOCK))) continue;
            if (lastActivity(upload).isBefore(cutoff)) {
                clean(upload.getFileName().toString());
                purged++;
            }
        }
        if (purged > 0) log.info("Purged {} abandoned chunk uploads", purged);
        return purged;
    }

    private static Instant lastActivity(Path upload) {
        Path meta = upload.resolve(META);
        try {
            return Files.getLastModifiedTime(Files.exists(meta) ? meta : upload).toInstant();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read chunk upload " + upload.getFileName(), e);
        }
    }

    private Object lockFor(String uploadId) {
        return metaLocks[Math.floorMod(uploadId.hashCode(), LOCK_STRIPES)];
    }

    private static void requireSameTotal(ChunkMeta meta, int totalChunks) {
        if (meta.totalChunks() != totalChunks) {
            throw new IllegalArgumentException("totalChunks " + totalChunks + " does not match the " + meta.totalChunks() + " announced earlier");
        }
    }

    private Path concat(Path uploadDir, Path partsDir, int totalChunks) {
        try {
            Path merged = Files.createTempFile(uploadDir, "merge", ".bin");
            try (OutputStream out = Files.newOutputStream(merged)) {
                for (int i = 0; i < totalChunks; i++) {
                    Files.copy(partsDir.resolve(partName(i)), out);
                }
            }
            return merged;
        } catch (IOException e) {
            throw new IllegalArgumentException("Unable to merge: " + e.getMessage(), e);
        }
    }

    private long totalSize(Path partsDir, int totalChunks) {
        long size = 0;
        try {
            for (int i = 0; i < totalChunks; i++) {
                size += Files.size(partsDir.resolve(partName(i)));
            }
        } catch (IOException e) {
            throw new IllegalArgumentException("Unable to merge: " + e.getMessage(), e);
        }
        return size;
    }

    private int missing(ChunkMeta meta) {
        long present = meta.received().stream().filter(i -> i >= 0 && i < meta.totalChunks()).distinct().count();
        return (int) (meta.totalChunks() - present);
    }

    private ChunkMeta readMeta(Path uploadDir) {
        try {
            ChunkMeta meta = objectMapper.readValue(uploadDir.resolve(META).toFile(), ChunkMeta.class);
            if (meta.received() == null || meta.totalChunks() <= 0) {
                throw new UploadMetadataException("Error processing upload metadata", null);
            }
            return meta;
        } catch (IOException e) {
            throw new UploadMetadataException("Error processing upload metadata", e);
        }
    }

    private void writeMeta(Path uploadDir, ChunkMeta meta) {
        try {
            Path tmp = Files.createTempFile(uploadDir, "meta", ".tmp");
            objectMapper.writeValue(tmp.toFile(), meta);
            Files.move(tmp, uploadDir.resolve(META), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to record chunk metadata", e);
        }
    }

    private Path uploadDir(String uploadId) {
        if (uploadId == null || !UPLOAD_ID.matcher(uploadId).matches()) {
            throw new IllegalArgumentException("Invalid upload id");
        }
        return chunkDir.resolve(uploadId);
    }

    private static String partName(int index) {
        return String.format("%06d.part", index);
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove {}: {}", path, e.getMessage());
        }
    }

    record ChunkMeta(List<Integer> received, @JsonProperty("totalChunks") int totalChunks) {}
}
