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
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.opensaml.xml.signature.SignatureConstants;

/**
 * Service provider deployment read from metadata files and a keystore.
 *
 * The service provider signs its AuthnRequests when its own metadata declares
 * AuthnRequestsSigned or the identity provider declares
 * WantAuthnRequestsSigned.
 */
public class BindingConfigImpl implements BindingConfig {

    private static final Logger LOG = Logger.getLogger(BindingConfigImpl.class.getName());

    private EntityMetadata idpMetadata;
    private String idpMetadataName;
    private EntityMetadata spMetadata;
    private String spMetadataName;
    private File keystore;
    private String keystoreName;
    private char[] keystorePassword;
    private String certificateAlias;
    private String signatureAlgorithm = SignatureConstants.ALGO_ID_SIGNATURE_RSA_SHA256;
    private String nameIDFormat = NameIDFormat.EMAIL_ADDRESS.getName();
    private boolean allowCreate;
    private boolean wantLogoutRequestSigned;
    private boolean wantLogoutResponseSigned;

    private Entity idp;
    private Entity sp;

    @Override
    public Entity getIdp() {
        return idp;
    }

    @Override
    public Entity getSp() {
        return sp;
    }

    public void setIdpMetadata(final EntityMetadata idpMetadata) {
        this.idpMetadata = idpMetadata;
    }

    public BindingConfigImpl withIdpMetadata(final EntityMetadata idpMetadata) {
        setIdpMetadata(idpMetadata);
        return this;
    }

    public void setSpMetadata(final EntityMetadata spMetadata) {
        this.spMetadata = spMetadata;
    }

    public BindingConfigImpl withSpMetadata(final EntityMetadata spMetadata) {
        setSpMetadata(spMetadata);
        return this;
    }

    public String getIdpMetadataName() {
        return idpMetadataName;
    }

    public void setIdpMetadataName(final String idpMetadataName) {
        if (idpMetadataName == null) {
            throw new NullPointerException("idpMetadataName should never be null");
        }
        this.idpMetadataName = idpMetadataName;
    }

    public BindingConfigImpl withIdpMetadataName(final String idpMetadataName) {
        setIdpMetadataName(idpMetadataName);
        return this;
    }

    public String getSpMetadataName() {
        return spMetadataName;
    }

    public void setSpMetadataName(final String spMetadataName) {
        if (spMetadataName == null) {
            throw new NullPointerException("spMetadataName should never be null");
        }
        this.spMetadataName = spMetadataName;
    }

    public BindingConfigImpl withSpMetadataName(final String spMetadataName) {
        setSpMetadataName(spMetadataName);
        return this;
    }

    public void setKeystore(final File keystore) {
        this.keystore = keystore;
    }

    public BindingConfigImpl withKeystore(final File keystore) {
        setKeystore(keystore);
        return this;
    }

    public String getKeystoreName() {
        return keystoreName;
    }

    public void setKeystoreName(final String keystoreName) {
        if (keystoreName == null) {
            throw new NullPointerException("keystoreName should never be null");
        }
        this.keystoreName = keystoreName;
    }

    public BindingConfigImpl withKeystoreName(final String keystoreName) {
        setKeystoreName(keystoreName);
        return this;
    }

    public void setKeystorePassword(final char[] keystorePassword) {
        if (keystorePassword == null) {
            throw new NullPointerException("keystorePassword should never be null");
        }
        this.keystorePassword = keystorePassword;
    }

    public BindingConfigImpl withKeystorePassword(final char[] keystorePassword) {
        setKeystorePassword(keystorePassword);
        return this;
    }

    public void setKeystorePassword(final String keystorePassword) {
        if (keystorePassword == null) {
            throw new NullPointerException("keystorePassword should never be null");
        }
        setKeystorePassword(keystorePassword.toCharArray());
    }

    public BindingConfigImpl withKeystorePassword(final String keystorePassword) {
        setKeystorePassword(keystorePassword);
        return this;
    }

    public String getCertificateAlias() {
        return certificateAlias;
    }

    public void setCertificateAlias(final String certificateAlias) {
        if (certificateAlias == null) {
            throw new NullPointerException("certificateAlias should never be null");
        }
        this.certificateAlias = certificateAlias;
    }

    public BindingConfigImpl withCertificateAlias(final String certificateAlias) {
        setCertificateAlias(certificateAlias);
        return this;
    }

    public String getSignatureAlgorithm() {
        return signatureAlgorithm;
    }

    public void setSignatureAlgorithm(final String signatureAlgorithm) {
        if (signatureAlgorithm == null) {
            throw new NullPointerException("signatureAlgorithm should never be null");
        }
        this.signatureAlgorithm = signatureAlgorithm;
    }

    public BindingConfigImpl withSignatureAlgorithm(final String signatureAlgorithm) {
        setSignatureAlgorithm(signatureAlgorithm);
        return this;
    }

    public String getNameIDFormat() {
        return nameIDFormat;
    }

    public void setNameIDFormat(final String nameIDFormat) {
        if (nameIDFormat == null) {
            throw new NullPointerException("nameIDFormat should never be null");
        }
        this.nameIDFormat = nameIDFormat;
    }

    public BindingConfigImpl withNameIDFormat(final String nameIDFormat) {
        setNameIDFormat(nameIDFormat);
        return this;
    }

    public boolean isAllowCreate() {
        return allowCreate;
    }

    public void setAllowCreate(final boolean allowCreate) {
        this.allowCreate = allowCreate;
    }

    public BindingConfigImpl withAllowCreate(final boolean allowCreate) {
        setAllowCreate(allowCreate);
        return this;
    }

    public boolean isWantLogoutRequestSigned() {
        return wantLogoutRequestSigned;
    }

    public void setWantLogoutRequestSigned(final boolean wantLogoutRequestSigned) {
        this.wantLogoutRequestSigned = wantLogoutRequestSigned;
    }

    public BindingConfigImpl withWantLogoutRequestSigned(final boolean wantLogoutRequestSigned) {
        setWantLogoutRequestSigned(wantLogoutRequestSigned);
        return this;
    }

    public boolean isWantLogoutResponseSigned() {
        return wantLogoutResponseSigned;
    }

    public void setWantLogoutResponseSigned(final boolean wantLogoutResponseSigned) {
        this.wantLogoutResponseSigned = wantLogoutResponseSigned;
    }

    public BindingConfigImpl withWantLogoutResponseSigned(final boolean wantLogoutResponseSigned) {
        setWantLogoutResponseSigned(wantLogoutResponseSigned);
        return this;
    }

    private EntityMetadata loadMetadata(final Function<String, String> function, final String name, final String role) throws SAMLException {
        if (name == null) {
            throw new SAMLConfigurationException(String.format("%s: %s", AbstractRedirectBuilder.MISSING_METADATA, role));
        }
        final String fileName = function.apply(name);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("%s: %s", role, fileName));
        }
        return EntityMetadataConfig.fromFile(new File(fileName));
    }

    private SigningSettings getSigningSettings() throws SAMLConfigurationException {
        final SigningSettings.Builder builder = new SigningSettings.Builder().withSignatureAlgorithm(signatureAlgorithm);
        if (keystore != null) {
            if (keystorePassword == null || certificateAlias == null) {
                throw new SAMLConfigurationException(String.format("Keystore %s needs a password and a certificate alias", keystore));
            }
            builder.withKeystore(keystore)
                    .withKeystorePassword(keystorePassword)
                    .withCertificateAlias(certificateAlias);
        }
        return builder.build();
    }

    public BindingConfigImpl init(final Function<String, String> function) throws SAMLException {
        SAMLInit.initialize();
        if (keystore == null && keystoreName != null) {
            final String fileName = function.apply(getKeystoreName());
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine(String.format("%s: %s", "KeystoreName", fileName));
            }
            keystore = new File(fileName);
        }
        if (idpMetadata == null) {
            idpMetadata = loadMetadata(function, getIdpMetadataName(), "IdpMetadataName");
        }
        if (spMetadata == null) {
            spMetadata = loadMetadata(function, getSpMetadataName(), "SpMetadataName");
        }

        final EntitySettings spSettings = new EntitySettings.Builder()
                .withAuthnRequestsSigned(spMetadata.isAuthnRequestsSigned() || idpMetadata.isWantAuthnRequestsSigned())
                .withAllowCreate(allowCreate)
                .withLoginNameIDFormat(nameIDFormat)
                .withLogoutNameIDFormat(nameIDFormat)
                .withSigningSettings(getSigningSettings())
                .build();
        final EntitySettings idpSettings = new EntitySettings.Builder()
                .withWantLogoutRequestSigned(wantLogoutRequestSigned)
                .withWantLogoutResponseSigned(wantLogoutResponseSigned)
                .build();

        sp = new Entity(spMetadata, spSettings);
        idp = new Entity(idpMetadata, idpSettings);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("idp=%s sp=%s authnRequestsSigned=%s", idpMetadata.getEntityId(), spMetadata.getEntityId(), spSettings.isAuthnRequestsSigned()));
        }
        return this;
    }

    public BindingConfigImpl init() throws SAMLException {
        return init((filename) -> {
            return filename;
        });
    }
}
