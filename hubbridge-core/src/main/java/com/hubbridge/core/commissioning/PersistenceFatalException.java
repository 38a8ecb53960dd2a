package com.hubbridge.core.commissioning;

/**
 * The identity store cannot be reached, so no commissioning identity can be issued.
 * Unrecoverable: the bridge runs a coordinated shutdown when it sees one.
 */
public class PersistenceFatalException extends RuntimeException {

    private final String identityKey;

    public PersistenceFatalException(String identityKey, String message, Throwable cause) {
        super(message, cause);
        this.identityKey = identityKey;
    }

    public String getIdentityKey() {
        return identityKey;
    }
}
