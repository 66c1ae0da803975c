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

import java.security.NoSuchAlgorithmException;
import org.opensaml.common.IdentifierGenerator;
import org.opensaml.common.impl.SecureRandomIdentifierGenerator;

/**
 * Operational settings of one entity. Immutable; validated once by
 * {@link Builder#build()}.
 */
public class EntitySettings {

    private final String loginRequestTemplate;
    private final String logoutRequestTemplate;
    private final String logoutResponseTemplate;
    private final IdentifierGenerator identifierGenerator;
    private final String loginNameIDFormat;
    private final String logoutNameIDFormat;
    private final boolean allowCreate;
    private final boolean authnRequestsSigned;
    private final boolean wantLogoutRequestSigned;
    private final boolean wantLogoutResponseSigned;
    private final SigningSettings signingSettings;

    private EntitySettings(final Builder builder) {
        this.loginRequestTemplate = builder.loginRequestTemplate;
        this.logoutRequestTemplate = builder.logoutRequestTemplate;
        this.logoutResponseTemplate = builder.logoutResponseTemplate;
        this.identifierGenerator = builder.identifierGenerator;
        this.loginNameIDFormat = builder.loginNameIDFormat;
        this.logoutNameIDFormat = builder.logoutNameIDFormat;
        this.allowCreate = builder.allowCreate;
        this.authnRequestsSigned = builder.authnRequestsSigned;
        this.wantLogoutRequestSigned = builder.wantLogoutRequestSigned;
        this.wantLogoutResponseSigned = builder.wantLogoutResponseSigned;
        this.signingSettings = builder.signingSettings;
    }

    /**
     * @return custom AuthnRequest template, or null for the default one
     */
    public String getLoginRequestTemplate() {
        return loginRequestTemplate;
    }

    /**
     * @return custom LogoutRequest template, or null for the default one
     */
    public String getLogoutRequestTemplate() {
        return logoutRequestTemplate;
    }

    /**
     * @return custom LogoutResponse template, or null for the default one
     */
    public String getLogoutResponseTemplate() {
        return logoutResponseTemplate;
    }

    public IdentifierGenerator getIdentifierGenerator() {
        return identifierGenerator;
    }

    public String getLoginNameIDFormat() {
        return loginNameIDFormat;
    }

    public String getLogoutNameIDFormat() {
        return logoutNameIDFormat;
    }

    public boolean isAllowCreate() {
        return allowCreate;
    }

    public boolean isAuthnRequestsSigned() {
        return authnRequestsSigned;
    }

    public boolean isWantLogoutRequestSigned() {
        return wantLogoutRequestSigned;
    }

    public boolean isWantLogoutResponseSigned() {
        return wantLogoutResponseSigned;
    }

    public SigningSettings getSigningSettings() {
        return signingSettings;
    }

    public static class Builder {

        private String loginRequestTemplate;
        private String logoutRequestTemplate;
        private String logoutResponseTemplate;
        private IdentifierGenerator identifierGenerator;
        private String loginNameIDFormat = NameIDFormat.EMAIL_ADDRESS.getName();
        private String logoutNameIDFormat = NameIDFormat.EMAIL_ADDRESS.getName();
        private boolean allowCreate;
        private boolean authnRequestsSigned;
        private boolean wantLogoutRequestSigned;
        private boolean wantLogoutResponseSigned;
        private SigningSettings signingSettings;

        public Builder withLoginRequestTemplate(final String loginRequestTemplate) {
            this.loginRequestTemplate = loginRequestTemplate;
            return this;
        }

        public Builder withLogoutRequestTemplate(final String logoutRequestTemplate) {
            this.logoutRequestTemplate = logoutRequestTemplate;
            return this;
        }

        public Builder withLogoutResponseTemplate(final String logoutResponseTemplate) {
            this.logoutResponseTemplate = logoutResponseTemplate;
            return this;
        }

        public Builder withIdentifierGenerator(final IdentifierGenerator identifierGenerator) {
            this.identifierGenerator = identifierGenerator;
            return this;
        }

        public Builder withLoginNameIDFormat(final String loginNameIDFormat) {
            this.loginNameIDFormat = loginNameIDFormat;
            return this;
        }

        public Builder withLogoutNameIDFormat(final String logoutNameIDFormat) {
            this.logoutNameIDFormat = logoutNameIDFormat;
            return this;
        }

        public Builder withAllowCreate(final boolean allowCreate) {
            this.allowCreate = allowCreate;
            return this;
        }

        public Builder withAuthnRequestsSigned(final boolean authnRequestsSigned) {
            this.authnRequestsSigned = authnRequestsSigned;
            return this;
        }

        public Builder withWantLogoutRequestSigned(final boolean wantLogoutRequestSigned) {
            this.wantLogoutRequestSigned = wantLogoutRequestSigned;
            return this;
        }

        public Builder withWantLogoutResponseSigned(final boolean wantLogoutResponseSigned) {
            this.wantLogoutResponseSigned = wantLogoutResponseSigned;
            return this;
        }

        public Builder withSigningSettings(final SigningSettings signingSettings) {
            this.signingSettings = signingSettings;
            return this;
        }

        public EntitySettings build() {
            if (identifierGenerator == null) {
                try {
                    identifierGenerator = new SecureRandomIdentifierGenerator();
                } catch (NoSuchAlgorithmException ex) {
                    throw new IllegalStateException("No SecureRandom available for message identifiers", ex);
                }
            }
            if (signingSettings == null) {
                signingSettings = new SigningSettings.Builder().build();
            }
            return new EntitySettings(this);
        }
    }
}
