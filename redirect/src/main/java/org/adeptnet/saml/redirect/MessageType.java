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
 * The protocol messages that can be sent over the redirect binding.
 */
public enum MessageType {

    AUTHN_REQUEST(SAMLParameters.SAML_REQUEST),
    LOGOUT_REQUEST(SAMLParameters.SAML_REQUEST),
    LOGOUT_RESPONSE(SAMLParameters.SAML_RESPONSE);

    private final String queryParameter;

    MessageType(final String queryParameter) {
        this.queryParameter = queryParameter;
    }

    /**
     * @return the query parameter that carries the encoded message
     */
    public String getQueryParameter() {
        return queryParameter;
    }
}
