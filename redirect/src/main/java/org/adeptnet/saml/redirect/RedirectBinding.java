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
 * Entry point of the HTTP-Redirect binding. Each call is independent and
 * returns the message ID with the URL the browser has to be redirected to.
 *
 * To integrate a service provider, one must generally do the following:
 *
 * 1. Call loginRequestRedirectUrl() and redirect the browser to the returned
 * URL; keep the returned ID to correlate the response.
 *
 * 2. On logout, call logoutRequestRedirectUrl() with the NameID and
 * SessionIndex of the user; answer a LogoutRequest of the identity provider
 * with logoutResponseRedirectUrl().
 */
public class RedirectBinding {

    private final LoginRequestBuilder loginRequestBuilder;
    private final LogoutRequestBuilder logoutRequestBuilder;
    private final LogoutResponseBuilder logoutResponseBuilder;

    /**
     * Create a binding that signs with {@link CredentialMessageSigner}.
     *
     * @throws SAMLException if OpenSAML cannot be initialized
     */
    public RedirectBinding() throws SAMLException {
        this(new RedirectEncoder());
    }

    public RedirectBinding(final RedirectEncoder encoder) {
        this.loginRequestBuilder = new LoginRequestBuilder(encoder);
        this.logoutRequestBuilder = new LogoutRequestBuilder(encoder);
        this.logoutResponseBuilder = new LogoutResponseBuilder(encoder);
    }

    public BindingContext loginRequestRedirectUrl(final Entity idp, final Entity sp) throws SAMLException {
        return loginRequestRedirectUrl(idp, sp, null, null);
    }

    public BindingContext loginRequestRedirectUrl(final Entity idp, final Entity sp, final String relayState,
            final TemplateTransformer customTagReplacement) throws SAMLException {
        return loginRequestBuilder.build(idp, sp, relayState, customTagReplacement);
    }

    public BindingContext logoutRequestRedirectUrl(final LogoutUser user, final Entity init, final Entity target,
            final String relayState) throws SAMLException {
        return logoutRequestRedirectUrl(user, init, target, relayState, null);
    }

    public BindingContext logoutRequestRedirectUrl(final LogoutUser user, final Entity init, final Entity target,
            final String relayState, final TemplateTransformer customTagReplacement) throws SAMLException {
        return logoutRequestBuilder.build(user, init, target, relayState, customTagReplacement);
    }

    public BindingContext logoutResponseRedirectUrl(final String inResponseTo, final Entity init, final Entity target,
            final String relayState) throws SAMLException {
        return logoutResponseRedirectUrl(inResponseTo, init, target, relayState, null);
    }

    public BindingContext logoutResponseRedirectUrl(final String inResponseTo, final Entity init, final Entity target,
            final String relayState, final TemplateTransformer customTagReplacement) throws SAMLException {
        return logoutResponseBuilder.build(inResponseTo, init, target, relayState, customTagReplacement);
    }
}
