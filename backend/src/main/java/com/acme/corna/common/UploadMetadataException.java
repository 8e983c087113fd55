package com.acme.corna.common;

public class UploadMetadataException extends RuntimeException {
    public UploadMetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
