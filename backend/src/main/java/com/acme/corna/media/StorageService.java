package com.acme.corna.media;

import org.springframework.core.io.InputStreamSource;
import org.springframework.core.io.Resource;

import java.nio.file.Path;

public interface StorageService {
    /**
     * @return the stored file's path relative to the storage root
     */
    String store(MediaBucket bucket, String hash, String filename, InputStreamSource source);
    Resource load(String relativePath);
    Path resolve(String relativePath);
}
