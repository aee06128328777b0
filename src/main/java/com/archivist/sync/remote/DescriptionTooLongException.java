package com.archivist.sync.remote;

/**
 * The remote service refused a description longer than its limit.
 * Not a {@link RemoteServiceException}: the request is invalid, retrying it unchanged cannot succeed.
 */
public class DescriptionTooLongException extends RuntimeException {

    private final int length;
    private final int limit;

    public DescriptionTooLongException(int length, int limit) {
        super("Description has " + length + " characters, limit is " + limit);
        this.length = length;
        this.limit = limit;
    }

    public DescriptionTooLongException(String message) {
        super(message);
        this.length = -1;
        this.limit = -1;
    }

    /**
     * @return the rejected length, or -1 if the service did not report it
     */
    public int getLength() {
        return length;
    }

    public int getLimit() {
        return limit;
    }
}
