package com.dubbi.hostmaster.portal.session;

/**
 * Opens one authenticated session per workflow call.
 */
public interface PortalSessionFactory {
    PortalSession open(Deadline deadline);
}
