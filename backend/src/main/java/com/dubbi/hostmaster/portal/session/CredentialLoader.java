package com.dubbi.hostmaster.portal.session;

import com.dubbi.hostmaster.portal.error.CredentialException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * PKCS#12 클라이언트 번들과 CA 인증서 파일을 읽어 {@link ClientIdentity}를 만든다.
 */
public class CredentialLoader {

    public ClientIdentity load(Path pfxPath, String password, Path caPath) {
        return load(read(pfxPath, "client bundle"), password, read(caPath, "CA bundle"));
    }

    public ClientIdentity load(byte[] pfxBytes, String password, byte[] caBytes) {
        char[] pass = password == null ? new char[0] : password.toCharArray();
        KeyStore keyStore = loadClientBundle(pfxBytes, pass);
        KeyStore trustStore = loadTrustAnchors(caBytes);
        return new ClientIdentity(keyStore, pass, trustStore);
    }

    private static KeyStore loadClientBundle(byte[] pfxBytes, char[] pass) {
        KeyStore ks;
        try {
            ks = KeyStore.getInstance("PKCS12");
            ks.load(new ByteArrayInputStream(pfxBytes), pass);
        } catch (IOException | GeneralSecurityException e) {
            throw new CredentialException("cannot decode client bundle: " + e.getMessage(), e);
        }

        List<String> keyAliases = new ArrayList<>();
        try {
            for (String alias : Collections.list(ks.aliases())) {
                if (ks.isKeyEntry(alias)) keyAliases.add(alias);
            }
        } catch (GeneralSecurityException e) {
            throw new CredentialException("cannot read client bundle entries: " + e.getMessage(), e);
        }
        if (keyAliases.isEmpty()) {
            throw new CredentialException("client bundle holds no private key entry");
        }
        if (keyAliases.size() > 1) {
            throw new CredentialException("client bundle holds " + keyAliases.size() + " key entries, expected one");
        }
        return ks;
    }

    private static KeyStore loadTrustAnchors(byte[] caBytes) {
        Collection<? extends Certificate> certs;
        try {
            certs = CertificateFactory.getInstance("X.509").generateCertificates(new ByteArrayInputStream(caBytes));
        } catch (GeneralSecurityException e) {
            throw new CredentialException("cannot parse CA bundle: " + e.getMessage(), e);
        }
        if (certs.isEmpty()) {
            throw new CredentialException("CA bundle contains no certificate");
        }
        try {
            KeyStore trust = KeyStore.getInstance(KeyStore.getDefaultType());
            trust.load(null, null);
            int i = 0;
            for (Certificate cert : certs) {
                trust.setCertificateEntry("portal-ca-" + i++, cert);
            }
            return trust;
        } catch (IOException | GeneralSecurityException e) {
            throw new CredentialException("cannot build trust store: " + e.getMessage(), e);
        }
    }

    private static byte[] read(Path path, String what) {
        if (path == null) {
            throw new CredentialException(what + " path is not configured");
        }
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new CredentialException("cannot read " + what + " " + path + ": " + e.getMessage(), e);
        }
    }
}
