package com.dubbi.hostmaster.portal.session;

import java.time.Duration;

/**
 * Raw byte exchange with the portal over one cookie-carrying connection.
 * Implementations must not transcode; bodies go out and come back exactly as given.
 */
public interface PortalTransport {
    byte[] get(String url, Duration timeout);

    byte[] post(String url, byte[] body, String contentType, Duration timeout);
}
