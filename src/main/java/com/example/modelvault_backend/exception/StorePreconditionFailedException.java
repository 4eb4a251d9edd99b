package com.example.modelvault_backend.exception;

/**
 * A conditional write found a different object (or none) at the key than the caller expected.
 */
public class StorePreconditionFailedException extends StorageException {
    private final String objectKey;

    public StorePreconditionFailedException(String objectKey, String expectedEtag, String actualEtag) {
        super("Precondition failed for " + objectKey + ": expected etag=" + expectedEtag + " actual=" + actualEtag);
        this.objectKey = objectKey;
    }

    public String getObjectKey() {
        return objectKey;
    }
}
