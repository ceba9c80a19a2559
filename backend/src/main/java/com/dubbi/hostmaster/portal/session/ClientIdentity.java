package com.dubbi.hostmaster.portal.session;

import com.dubbi.hostmaster.portal.error.CredentialException;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;

/**
 * Client certificate with its private key plus the CA anchors trusted for the portal.
 */
public record ClientIdentity(KeyStore keyStore, char[] keyPassword, KeyStore trustStore) {

    public SSLContext sslContext() {
        try {
            KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            kmf.init(keyStore, keyPassword);
            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);
            SSLContext ctx = SSLContext.getInstance("TLS");
            ctx.init(kmf.getKeyManagers(), tmf.getTrustManagers(), null);
            return ctx;
        } catch (GeneralSecurityException e) {
            throw new CredentialException("cannot build TLS context: " + e.getMessage(), e);
        }
    }
}
