/*
 * Copyright 2015 Francois Steyn - Adept Internet (PTY) LTD (francois.s@adept.co.za).
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.adeptnet.saml.redirect;

import java.io.FileInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.KeyStore;
import java.security.KeyStoreException;
import java.security.NoSuchAlgorithmException;
import java.security.UnrecoverableEntryException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.opensaml.xml.security.SecurityException;
import org.opensaml.xml.security.SigningUtil;
import org.opensaml.xml.security.credential.BasicCredential;
import org.opensaml.xml.security.credential.Credential;
import org.opensaml.xml.security.x509.BasicX509Credential;

/**
 * {@link MessageSigner} backed by an OpenSAML credential, built from the
 * configured private key or read from the configured keystore.
 */
public class CredentialMessageSigner implements MessageSigner {

    private static final Log LOG = LogFactory.getLog(CredentialMessageSigner.class);

    public CredentialMessageSigner() throws SAMLException {
        SAMLInit.initialize();
    }

    @Override
    public byte[] sign(final String octetString, final SigningSettings settings) throws SAMLSigningException {
        final Credential credential = getCredential(settings);
        try {
            return SigningUtil.signWithURI(credential, settings.getSignatureAlgorithm(), octetString.getBytes(StandardCharsets.UTF_8));
        } catch (SecurityException ex) {
            throw new SAMLSigningException(String.format("Unable to sign with %s", settings.getSignatureAlgorithm()), ex);
        }
    }

    Credential getCredential(final SigningSettings settings) throws SAMLSigningException {
        if (settings == null || !settings.hasKeyMaterial()) {
            throw new SAMLSigningException("No private key configured for signing");
        }
        if (settings.getPrivateKey() != null) {
            final BasicCredential credential = new BasicCredential();
            credential.setPrivateKey(settings.getPrivateKey());
            return credential;
        }

        final String alias = settings.getCertificateAlias();
        try {
            final char[] jksPassword = settings.getKeystorePassword();
            final KeyStore keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
            try (final FileInputStream fileInputStream = new FileInputStream(settings.getKeystore())) {
                keyStore.load(fileInputStream, jksPassword);
            }
            final KeyStore.Entry entry = keyStore.getEntry(alias, new KeyStore.PasswordProtection(jksPassword));
            if (!(entry instanceof KeyStore.PrivateKeyEntry)) {
                throw new SAMLSigningException(String.format("No private key [%s] in %s", alias, settings.getKeystore()));
            }
            final KeyStore.PrivateKeyEntry privateKeyEntry = (KeyStore.PrivateKeyEntry) entry;
            if (LOG.isDebugEnabled()) {
                LOG.debug(String.format("Signing with key [%s] from %s", alias, settings.getKeystore()));
            }

            final BasicX509Credential credential = new BasicX509Credential();
            credential.setEntityCertificate((X509Certificate) privateKeyEntry.getCertificate());
            credential.setPrivateKey(privateKeyEntry.getPrivateKey());
            return credential;
        } catch (KeyStoreException | IOException | NoSuchAlgorithmException | CertificateException | UnrecoverableEntryException ex) {
            throw new SAMLSigningException(String.format("Unable to read key [%s] from %s", alias, settings.getKeystore()), ex);
        }
    }
}
