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
import org.opensaml.saml2.core.StatusCode;

/**
 * Builds the redirect URL of a successful LogoutResponse sent by the
 * initiating entity to the single logout service of the target entity.
 */
public class LogoutResponseBuilder extends AbstractRedirectBuilder {

    private static final Log LOG = LogFactory.getLog(LogoutResponseBuilder.class);

    public LogoutResponseBuilder(final RedirectEncoder encoder) {
        super(encoder);
    }

    /**
     * @param inResponseTo ID of the LogoutRequest being answered, null or
     * empty when unknown; InResponseTo is then left out
     * @param init entity sending the response
     * @param target entity receiving the response, decides about signing
     * @param relayState may be null
     * @param customTagReplacement required when the initiator declares a
     * custom logout response template
     * @return message ID and redirect URL
     * @throws SAMLException if metadata is missing or the response cannot be
     * encoded or signed
     */
    public BindingContext build(final String inResponseTo, final Entity init, final Entity target, final String relayState,
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
        final String rawSamlResponse;
        if (initSettings.getLogoutResponseTemplate() != null) {
            final BindingContext info = transform(customTagReplacement, initSettings.getLogoutResponseTemplate(), MessageType.LOGOUT_RESPONSE);
            id = info.getId();
            rawSamlResponse = info.getContext();
        } else {
            id = initSettings.getIdentifierGenerator().generateIdentifier();
            final Map<String, String> values = new HashMap<>();
            values.put(TemplateEngine.TAG_ID, id);
            values.put(TemplateEngine.TAG_DESTINATION, base);
            values.put(TemplateEngine.TAG_ISSUER, initMetadata.getEntityId());
            values.put(TemplateEngine.TAG_ENTITY_ID, initMetadata.getEntityId());
            values.put(TemplateEngine.TAG_ISSUE_INSTANT, issueInstant());
            values.put(TemplateEngine.TAG_STATUS_CODE, StatusCode.SUCCESS_URI);
            if (inResponseTo != null && !inResponseTo.isEmpty()) {
                values.put(TemplateEngine.TAG_IN_RESPONSE_TO, inResponseTo);
            }
            rawSamlResponse = TemplateEngine.replaceTagsByValue(TemplateEngine.getDefaultTemplate(MessageType.LOGOUT_RESPONSE), values);
        }

        if (LOG.isDebugEnabled()) {
            LOG.debug(String.format("LogoutResponse %s to %s in response to %s", id, base, inResponseTo));
        }
        return encode(id, new EncodingRequest(base, MessageType.LOGOUT_RESPONSE, targetSettings.isWantLogoutResponseSigned(),
                rawSamlResponse, relayState, initSettings.getSigningSettings()));
    }
}
