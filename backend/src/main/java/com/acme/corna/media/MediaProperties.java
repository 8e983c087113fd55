package com.acme.corna.media;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

/**
 * @param baseDir root directory of every stored media file and of in-flight chunked uploads
 * @param maxBlobSize largest file accepted, whole or merged from chunks
 */
@ConfigurationProperties(prefix = "app.media")
public record MediaProperties(String baseDir, DataSize maxBlobSize) {
}
