package com.acme.corna.media;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.InputStreamSource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@Service
public class LocalStorageService implements StorageService {
    private static final Logger log = LoggerFactory.getLogger(LocalStorageService.class);

    private final Path baseDir;

    public LocalStorageService(MediaProperties props) throws IOException {
        this.baseDir = Path.of(props.baseDir()).toAbsolutePath().normalize();
        Files.createDirectories(this.baseDir);
    }

    @Override
    public String store(MediaBucket bucket, String hash, String filename, InputStreamSource source) {
        String safeName = MediaFiles.secureFilename(filename);
        if (safeName.isEmpty()) throw new IllegalArgumentException("File needs name to be saved");

        String relative = bucket.value() + "/" + MediaFiles.hashToDir(hash) + "/" + safeName;
        Path target = resolve(relative);
        try {
            if (Files.isDirectory(target.getParent())) {
                log.warn("Media directory {} already exists, possible duplicate of {}", target.getParent(), safeName);
            }
            Files.createDirectories(target.getParent());
            try (InputStream in = source.getInputStream()) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            }
            return relative;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to save file " + safeName, e);
        }
    }

    @Override
    public Resource load(String relativePath) {
        return new FileSystemResource(resolve(relativePath));
    }

    @Override
    public Path resolve(String relativePath) {
        Path target = baseDir.resolve(relativePath).normalize();
        if (!target.startsWith(baseDir)) throw new IllegalArgumentException("Invalid path");
        return target;
    }
}
