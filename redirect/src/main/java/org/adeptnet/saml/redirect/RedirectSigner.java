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

import java.util.Base64;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Adds SigAlg, RelayState and Signature to a redirect query. The signature
 * covers the query as it stands after RelayState:
 * {@code param=payload&SigAlg=alg[&RelayState=rs]}.
 */
public class RedirectSigner {

    private static final Log LOG = LogFactory.getLog(RedirectSigner.class);

    private final MessageSigner messageSigner;

    public RedirectSigner(final MessageSigner messageSigner) {
        if (messageSigner == null) {
            throw new NullPointerException("messageSigner should never be null");
        }
        this.messageSigner = messageSigner;
    }

    /**
     * @param query holds only the encoded message parameter
     * @param encodedRelayState URL encoded RelayState, or null when absent
     * @param settings key material and algorithm
     * @throws SAMLException if signing fails, the query is then unusable
     */
    public void sign(final QueryStringBuilder query, final String encodedRelayState, final SigningSettings settings) throws SAMLException {
        if (settings == null) {
            throw new SAMLSigningException("No signing settings declared");
        }
        query.append(SAMLParameters.SAML_SIGALG, RedirectCodec.urlEncode(settings.getSignatureAlgorithm()));
        if (encodedRelayState != null) {
            query.append(SAMLParameters.SAML_RELAYSTATE, encodedRelayState);
        }

        final String octetString = query.getQueryString();
        if (LOG.isDebugEnabled()) {
            LOG.debug(String.format("%s: %s", "octetString", octetString));
        }
        final byte[] signature = messageSigner.sign(octetString, settings);
        if (signature == null) {
            throw new SAMLSigningException("Signer returned no signature");
        }
        query.append(SAMLParameters.SAML_SIGNATURE, RedirectCodec.urlEncode(Base64.getEncoder().encodeToString(signature)));
    }
}
