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
 * Input of {@link RedirectEncoder#encode(EncodingRequest)}.
 */
public class EncodingRequest {

    private final String baseUrl;
    private final MessageType messageType;
    private final boolean signed;
    private final String rawXml;
    private final String relayState;
    private final SigningSettings signingSettings;

    /**
     * @param baseUrl destination endpoint
     * @param messageType kind of message, selects SAMLRequest or SAMLResponse
     * @param signed whether SigAlg and Signature are added
     * @param rawXml the message
     * @param relayState may be null or empty, then it is not sent
     * @param signingSettings key and algorithm, required when signed
     */
    public EncodingRequest(final String baseUrl, final MessageType messageType, final boolean signed,
            final String rawXml, final String relayState, final SigningSettings signingSettings) {
        if (baseUrl == null) {
            throw new NullPointerException("baseUrl should never be null");
        }
        if (messageType == null) {
            throw new NullPointerException("messageType should never be null");
        }
        if (rawXml == null) {
            throw new NullPointerException("rawXml should never be null");
        }
        this.baseUrl = baseUrl;
        this.messageType = messageType;
        this.signed = signed;
        this.rawXml = rawXml;
        this.relayState = relayState;
        this.signingSettings = signingSettings;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public MessageType getMessageType() {
        return messageType;
    }

    public boolean isSigned() {
        return signed;
    }

    public String getRawXml() {
        return rawXml;
    }

    public String getRelayState() {
        return relayState;
    }

    public SigningSettings getSigningSettings() {
        return signingSettings;
    }
}
