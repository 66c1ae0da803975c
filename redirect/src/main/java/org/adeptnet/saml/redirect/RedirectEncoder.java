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

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Turns a message into a URL for the HTTP-Redirect binding: the XML is
 * deflated, base64 and URL encoded, then sent as SAMLRequest or SAMLResponse
 * with an optional RelayState and, when signed, SigAlg and Signature.
 */
public class RedirectEncoder {

    private static final Log LOG = LogFactory.getLog(RedirectEncoder.class);

    private final RedirectSigner signer;

    public RedirectEncoder() throws SAMLException {
        this(new CredentialMessageSigner());
    }

    public RedirectEncoder(final MessageSigner messageSigner) {
        this.signer = new RedirectSigner(messageSigner);
    }

    public String encode(final EncodingRequest request) throws SAMLException {
        if (LOG.isTraceEnabled()) {
            LOG.trace(request.getRawXml());
        }
        final String payload = RedirectCodec.urlEncode(RedirectCodec.deflateAndBase64Encode(request.getRawXml()));
        final QueryStringBuilder query = new QueryStringBuilder(request.getBaseUrl())
                .append(request.getMessageType().getQueryParameter(), payload);

        final String relayState = request.getRelayState();
        final String encodedRelayState = relayState == null || relayState.isEmpty() ? null : RedirectCodec.urlEncode(relayState);

        if (request.isSigned()) {
            signer.sign(query, encodedRelayState, request.getSigningSettings());
        } else if (encodedRelayState != null) {
            query.append(SAMLParameters.SAML_RELAYSTATE, encodedRelayState);
        }

        final String url = query.toUrl();
        if (LOG.isDebugEnabled()) {
            LOG.debug(String.format("%s %s: %s", request.getMessageType(), request.isSigned() ? "signed" : "unsigned", url));
        }
        return url;
    }
}
