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

/**
 * Read-only view of the metadata of one SAML entity. Endpoint lookups take a
 * binding URI such as {@code SAMLConstants.SAML2_REDIRECT_BINDING_URI} and
 * return {@code null} when no endpoint is declared for it.
 */
public interface EntityMetadata {

    String getEntityId();

    String getSingleSignOnService(String binding);

    String getSingleLogoutService(String binding);

    String getAssertionConsumerService(String binding);

    /**
     * @return the SP role declares AuthnRequestsSigned
     */
    boolean isAuthnRequestsSigned();

    /**
     * @return the IdP role declares WantAuthnRequestsSigned
     */
    boolean isWantAuthnRequestsSigned();
}
