package com.archivist.sync.core.model;

/**
 * Thrown when a {@link RecordMetadata} block violates its schema.
 */
public class MetadataValidationException extends RuntimeException {

    public MetadataValidationException(String message) {
        super(message);
    }
}
