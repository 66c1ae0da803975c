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

import java.util.HashMap;
import java.util.Map;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.opensaml.common.xml.SAMLConstants;

/**
 * Builds the redirect URL of an AuthnRequest from a service provider to the
 * single sign-on service of an identity provider.
 */
public class LoginRequestBuilder extends AbstractRedirectBuilder {

    private static final Log LOG = LogFactory.getLog(LoginRequestBuilder.class);

    public LoginRequestBuilder(final RedirectEncoder encoder) {
        super(encoder);
    }

    /**
     * @param idp identity provider, its metadata gives the destination
     * @param sp service provider, issuer of the request
     * @param relayState may be null
     * @param customTagReplacement required when the SP declares a custom
     * login request template
     * @return message ID and redirect URL
     * @throws SAMLException if metadata is missing or the request cannot be
     * encoded or signed
     */
    public BindingContext build(final Entity idp, final Entity sp, final String relayState,
            final TemplateTransformer customTagReplacement) throws SAMLException {
        final EntityMetadata idpMetadata = requireMetadata(idp);
        final EntityMetadata spMetadata = requireMetadata(sp);
        final EntitySettings spSettings = requireSettings(sp, "service provider");

        final String base = idpMetadata.getSingleSignOnService(SAMLConstants.SAML2_REDIRECT_BINDING_URI);
        if (base == null) {
            throw new SAMLConfigurationException(String.format("No acceptable Single Sign-on Service found for %s", idpMetadata.getEntityId()));
        }

        final String id;
        final String rawSamlRequest;
        if (spSettings.getLoginRequestTemplate() != null) {
            final BindingContext info = transform(customTagReplacement, spSettings.getLoginRequestTemplate(), MessageType.AUTHN_REQUEST);
            id = info.getId();
            rawSamlRequest = info.getContext();
        } else {
            id = spSettings.getIdentifierGenerator().generateIdentifier();
            final Map<String, String> values = new HashMap<>();
            values.put(TemplateEngine.TAG_ID, id);
            values.put(TemplateEngine.TAG_DESTINATION, base);
            values.put(TemplateEngine.TAG_ISSUER, spMetadata.getEntityId());
            values.put(TemplateEngine.TAG_ISSUE_INSTANT, issueInstant());
            values.put(TemplateEngine.TAG_NAME_ID_FORMAT, NameIDFormat.toURI(spSettings.getLoginNameIDFormat()));
            values.put(TemplateEngine.TAG_ASSERTION_CONSUMER_SERVICE_URL, getAssertionConsumerService(spMetadata));
            values.put(TemplateEngine.TAG_ENTITY_ID, spMetadata.getEntityId());
            values.put(TemplateEngine.TAG_ALLOW_CREATE, Boolean.toString(spSettings.isAllowCreate()));
            rawSamlRequest = TemplateEngine.replaceTagsByValue(TemplateEngine.getDefaultTemplate(MessageType.AUTHN_REQUEST), values);
        }

        if (LOG.isDebugEnabled()) {
            LOG.debug(String.format("AuthnRequest %s from %s to %s", id, spMetadata.getEntityId(), base));
        }
        return encode(id, new EncodingRequest(base, MessageType.AUTHN_REQUEST, spSettings.isAuthnRequestsSigned(),
                rawSamlRequest, relayState, spSettings.getSigningSettings()));
    }

    // the default template asks for the response over HTTP-POST
    private String getAssertionConsumerService(final EntityMetadata spMetadata) {
        final String acs = spMetadata.getAssertionConsumerService(SAMLConstants.SAML2_POST_BINDING_URI);
        if (acs != null) {
            return acs;
        }
        return spMetadata.getAssertionConsumerService(SAMLConstants.SAML2_REDIRECT_BINDING_URI);
    }
}
