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
package org.adeptnet.saml.sso;

import java.io.IOException;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.servlet.http.HttpServletResponse;
import org.adeptnet.saml.redirect.BindingConfigImpl;
import org.adeptnet.saml.redirect.BindingContext;
import org.adeptnet.saml.redirect.LogoutUser;
import org.adeptnet.saml.redirect.RedirectBinding;
import org.adeptnet.saml.redirect.SAMLException;

/**
 * Sends the browser to the identity provider over the HTTP-Redirect binding,
 * configured from provider options.
 */
public class SSORedirect {

    private static final Logger LOG = Logger.getLogger(SSORedirect.class.getName());

    public final static String SAML_ENABLE = "saml-enable";
    public final static String SAML_IDP_METADATA = "saml-idp-metadata";
    public final static String SAML_SP_METADATA = "saml-sp-metadata";
    public final static String SAML_KEYSTORE_NAME = "saml-keystore-name";
    public final static String SAML_KEYSTORE_PASSWORD = "saml-keystore-password";
    public final static String SAML_CERTIFICATE_ALIAS = "saml-certificate-alias";
    public final static String SAML_SIGNATURE_ALGORITHM = "saml-signature-algorithm";
    public final static String SAML_NAMEID_FORMAT = "saml-nameid-format";
    public final static String SAML_ALLOW_CREATE = "saml-allow-create";
    public final static String SAML_WANT_LOGOUT_REQUEST_SIGNED = "saml-want-logout-request-signed";
    public final static String SAML_WANT_LOGOUT_RESPONSE_SIGNED = "saml-want-logout-response-signed";

    private static SSORedirect instance;

    private RedirectBinding binding;
    private final BindingConfigImpl samlCfg;
    private final boolean samlEnabled;

    private SSORedirect(final BindingConfigImpl samlCfg, final boolean samlEnabled) {
        this.samlCfg = samlCfg;
        this.samlEnabled = samlEnabled;
    }

    static synchronized void init(final BindingConfigImpl samlCfg, final boolean samlEnabled) {
        instance = new SSORedirect(samlCfg, samlEnabled);
    }

    private static String getOption(final Map<?, ?> options, final String optionName) throws SAMLException {
        if (!options.containsKey(optionName)) {
            throw new SAMLException(String.format("Option [%s] not found", optionName));
        }
        final Object result = options.get(optionName);
        if (result instanceof String) {
            return (String) result;
        }
        throw new SAMLException(String.format("Option [%s] is not String [%s] - %s", optionName, result == null ? "NULL" : result.getClass(), result));
    }

    private static String getOption(final Map<?, ?> options, final String optionName, final String defaultValue) throws SAMLException {
        if (!options.containsKey(optionName)) {
            return defaultValue;
        }
        return getOption(options, optionName);
    }

    static synchronized void init(final Map<?, ?> options) throws SAMLException {
        final BindingConfigImpl samlCfg = new BindingConfigImpl();
        samlCfg.setIdpMetadataName(getOption(options, SAML_IDP_METADATA));
        samlCfg.setSpMetadataName(getOption(options, SAML_SP_METADATA));

        final String keystoreName = getOption(options, SAML_KEYSTORE_NAME, null);
        if (keystoreName != null) {
            samlCfg.setKeystoreName(keystoreName);
            samlCfg.setKeystorePassword(getOption(options, SAML_KEYSTORE_PASSWORD));
            samlCfg.setCertificateAlias(getOption(options, SAML_CERTIFICATE_ALIAS));
        }
        samlCfg.setSignatureAlgorithm(getOption(options, SAML_SIGNATURE_ALGORITHM, samlCfg.getSignatureAlgorithm()));
        samlCfg.setNameIDFormat(getOption(options, SAML_NAMEID_FORMAT, samlCfg.getNameIDFormat()));
        samlCfg.setAllowCreate(Boolean.parseBoolean(getOption(options, SAML_ALLOW_CREATE, "false")));
        samlCfg.setWantLogoutRequestSigned(Boolean.parseBoolean(getOption(options, SAML_WANT_LOGOUT_REQUEST_SIGNED, "false")));
        samlCfg.setWantLogoutResponseSigned(Boolean.parseBoolean(getOption(options, SAML_WANT_LOGOUT_RESPONSE_SIGNED, "false")));
        init(samlCfg, Boolean.parseBoolean(getOption(options, SAML_ENABLE)));
    }

    public static synchronized SSORedirect getInstance() throws SAMLException {
        if (instance == null) {
            throw new SAMLException("please init");
        }
        return instance;
    }

    public static synchronized SSORedirect getInstance(final Map<?, ?> options) throws SAMLException {
        if (instance == null) {
            init(options);
        }
        return instance;
    }

    private synchronized RedirectBinding getBinding() throws SAMLException {
        if (!samlEnabled) {
            throw new SAMLException("SAML is not enabled");
        }
        if (binding == null) {
            samlCfg.init();
            binding = new RedirectBinding();
        }
        return binding;
    }

    private BindingContext sendRedirect(final HttpServletResponse response, final BindingContext context) throws IOException {
        if (LOG.isLoggable(Level.FINER)) {
            LOG.finer(String.format("sendRedirect: %s", context.getContext()));
        }
        response.sendRedirect(context.getContext());
        return context;
    }

    /**
     * Redirect to the single sign-on service of the identity provider.
     *
     * @param response the response to redirect
     * @param relayState may be null
     * @return the sent AuthnRequest ID and URL
     * @throws SAMLException if SAML is disabled or the request cannot be built
     * @throws IOException if the redirect cannot be sent
     */
    public BindingContext doLoginRedirect(final HttpServletResponse response, final String relayState) throws SAMLException, IOException {
        final RedirectBinding redirectBinding = getBinding();
        return sendRedirect(response, redirectBinding.loginRequestRedirectUrl(samlCfg.getIdp(), samlCfg.getSp(), relayState, null));
    }

    public BindingContext doLogoutRedirect(final HttpServletResponse response, final LogoutUser user, final String relayState) throws SAMLException, IOException {
        final RedirectBinding redirectBinding = getBinding();
        return sendRedirect(response, redirectBinding.logoutRequestRedirectUrl(user, samlCfg.getSp(), samlCfg.getIdp(), relayState));
    }

    public BindingContext doLogoutResponseRedirect(final HttpServletResponse response, final String inResponseTo, final String relayState) throws SAMLException, IOException {
        final RedirectBinding redirectBinding = getBinding();
        return sendRedirect(response, redirectBinding.logoutResponseRedirectUrl(inResponseTo, samlCfg.getSp(), samlCfg.getIdp(), relayState));
    }
}
