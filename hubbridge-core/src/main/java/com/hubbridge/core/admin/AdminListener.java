package com.hubbridge.core.admin;

/**
 * A network listener of the administration surface (HTTP, HTTPS, push channel). Registered with the bridge so
 * shutdown can close it.
 */
public interface AdminListener {

    String getName();

    /** Stops listening and unregisters every event listener it installed. */
    void close();
}
