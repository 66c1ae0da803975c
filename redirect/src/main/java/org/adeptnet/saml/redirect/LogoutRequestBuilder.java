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
 * Builds the redirect URL of a LogoutRequest sent by the initiating entity to
 * the single logout service of the target entity.
 */
public class LogoutRequestBuilder extends AbstractRedirectBuilder {

    private static final Log LOG = LogFactory.getLog(LogoutRequestBuilder.class);

    public LogoutRequestBuilder(final RedirectEncoder encoder) {
        super(encoder);
    }

    /**
     * @param user subject whose session ends, required for the default
     * template
     * @param init entity sending the request
     * @param target entity receiving the request, decides about signing
     * @param relayState may be null
     * @param customTagReplacement required when the initiator declares a
     * custom logout request template
     * @return message ID and redirect URL
     * @throws SAMLException if metadata is missing or the request cannot be
     * encoded or signed
     */
    public BindingContext build(final LogoutUser user, final Entity init, final Entity target, final String relayState,
            final TemplateTransformer customTagReplacement) throws SAMLException {
        final EntityMetadata initMetadata = requireMetadata(init);
        final EntityMetadata targetMetadata = requireMetadata(target);
        final EntitySettings initSettings = requireSettings(init, "initiator");
        final EntitySettings targetSettings = requireSettings(target, "target");

        final String base = targetMetadata.getSingleLogoutService(SAMLConstants.SAML2_REDIRECT_BINDING_URI);
        if (base == null) {
            throw new SAMLConfigurationException(String.format("No acceptable Single Logout Service found for %s", targetMetadata.getEntityId()));
        }

        final String id;
        final String rawSamlRequest;
        if (initSettings.getLogoutRequestTemplate() != null) {
            final BindingContext info = transform(customTagReplacement, initSettings.getLogoutRequestTemplate(), MessageType.LOGOUT_REQUEST);
            id = info.getId();
            rawSamlRequest = info.getContext();
        } else {
            if (user == null) {
                throw new SAMLException("A LogoutRequest requires the NameID and SessionIndex of the user");
            }
            id = initSettings.getIdentifierGenerator().generateIdentifier();
            final Map<String, String> values = new HashMap<>();
            values.put(TemplateEngine.TAG_ID, id);
            values.put(TemplateEngine.TAG_DESTINATION, base);
            values.put(TemplateEngine.TAG_ENTITY_ID, initMetadata.getEntityId());
            values.put(TemplateEngine.TAG_ISSUER, initMetadata.getEntityId());
            values.put(TemplateEngine.TAG_ISSUE_INSTANT, issueInstant());
            values.put(TemplateEngine.TAG_NAME_ID_FORMAT, NameIDFormat.toURI(initSettings.getLogoutNameIDFormat()));
            values.put(TemplateEngine.TAG_NAME_ID, user.getNameId());
            values.put(TemplateEngine.TAG_SESSION_INDEX, user.getSessionIndex());
            rawSamlRequest = TemplateEngine.replaceTagsByValue(TemplateEngine.getDefaultTemplate(MessageType.LOGOUT_REQUEST), values);
        }

        if (LOG.isDebugEnabled()) {
            LOG.debug(String.format("LogoutRequest %s from %s to %s", id, initMetadata.getEntityId(), base));
        }
        return encode(id, new EncodingRequest(base, MessageType.LOGOUT_REQUEST, targetSettings.isWantLogoutRequestSigned(),
                rawSamlRequest, relayState, initSettings.getSigningSettings()));
    }
}
