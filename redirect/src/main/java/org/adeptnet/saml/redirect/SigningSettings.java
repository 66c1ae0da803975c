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

import java.io.File;
import java.security.PrivateKey;
import org.opensaml.xml.signature.SignatureConstants;

/**
 * Key material and algorithm used to sign outbound redirect messages. The key
 * is either given directly or read from a keystore with a passphrase and an
 * alias.
 */
public class SigningSettings {

    private final String signatureAlgorithm;
    private final PrivateKey privateKey;
    private final File keystore;
    private final char[] keystorePassword;
    private final String certificateAlias;

    private SigningSettings(final Builder builder) {
        this.signatureAlgorithm = builder.signatureAlgorithm;
        this.privateKey = builder.privateKey;
        this.keystore = builder.keystore;
        this.keystorePassword = builder.keystorePassword == null ? null : builder.keystorePassword.clone();
        this.certificateAlias = builder.certificateAlias;
    }

    /**
     * @return the algorithm URI, also sent as SigAlg
     */
    public String getSignatureAlgorithm() {
        return signatureAlgorithm;
    }

    public PrivateKey getPrivateKey() {
        return privateKey;
    }

    public File getKeystore() {
        return keystore;
    }

    public char[] getKeystorePassword() {
        return keystorePassword == null ? null : keystorePassword.clone();
    }

    public String getCertificateAlias() {
        return certificateAlias;
    }

    public boolean hasKeyMaterial() {
        return privateKey != null || keystore != null;
    }

    @Override
    public String toString() {
        return "SigningSettings{" + "signatureAlgorithm=" + signatureAlgorithm + ", keystore=" + keystore + ", certificateAlias=" + certificateAlias + '}';
    }

    public static class Builder {

        private String signatureAlgorithm = SignatureConstants.ALGO_ID_SIGNATURE_RSA_SHA256;
        private PrivateKey privateKey;
        private File keystore;
        private char[] keystorePassword;
        private String certificateAlias;

        public Builder withSignatureAlgorithm(final String signatureAlgorithm) {
            if (signatureAlgorithm == null) {
                throw new NullPointerException("signatureAlgorithm should never be null");
            }
            this.signatureAlgorithm = signatureAlgorithm;
            return this;
        }

        public Builder withPrivateKey(final PrivateKey privateKey) {
            this.privateKey = privateKey;
            return this;
        }

        public Builder withKeystore(final File keystore) {
            this.keystore = keystore;
            return this;
        }

        public Builder withKeystorePassword(final char[] keystorePassword) {
            this.keystorePassword = keystorePassword;
            return this;
        }

        public Builder withKeystorePassword(final String keystorePassword) {
            return withKeystorePassword(keystorePassword == null ? null : keystorePassword.toCharArray());
        }

        public Builder withCertificateAlias(final String certificateAlias) {
            this.certificateAlias = certificateAlias;
            return this;
        }

        public SigningSettings build() {
            if (keystore != null) {
                if (keystorePassword == null) {
                    throw new NullPointerException("keystorePassword should never be null");
                }
                if (certificateAlias == null) {
                    throw new NullPointerException("certificateAlias should never be null");
                }
            }
            return new SigningSettings(this);
        }
    }
}
