package com.dubbi.hostmaster.portal.session;

import com.dubbi.hostmaster.config.PortalSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds sessions from the configured client bundle and CA file.
 * Credentials are re-read for every session so a rotated certificate takes effect without restart.
 */
public class MutualTlsSessionFactory implements PortalSessionFactory {
    private static final Logger log = LoggerFactory.getLogger(MutualTlsSessionFactory.class);

    private final PortalSettings settings;
    private final CredentialLoader credentialLoader;
    private final LegacyEncoding encoding;

    public MutualTlsSessionFactory(PortalSettings settings, CredentialLoader credentialLoader, LegacyEncoding encoding) {
        this.settings = settings;
        this.credentialLoader = credentialLoader;
        this.encoding = encoding;
    }

    @Override
    public PortalSession open(Deadline deadline) {
        ClientIdentity identity = credentialLoader.load(settings.pfxPath(), settings.pfxPassword(), settings.caPath());
        var transport = new JsoupPortalTransport(settings.userAgent(), identity.sslContext().getSocketFactory());
        log.debug("[Portal] opened session against {}", settings.baseUrl());
        return new PortalSession(transport, encoding, settings.baseUrl(), settings.timeout(), deadline);
    }
}
