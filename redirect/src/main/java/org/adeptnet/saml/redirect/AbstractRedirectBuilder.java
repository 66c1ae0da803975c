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

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

/**
 * Common steps of the message builders: metadata checks, message ID and
 * issue instant, custom templates and the final redirect encoding.
 */
public abstract class AbstractRedirectBuilder {

    public static final String MISSING_METADATA = "Missing declaration of metadata";

    private final RedirectEncoder encoder;

    protected AbstractRedirectBuilder(final RedirectEncoder encoder) {
        if (encoder == null) {
            throw new NullPointerException("encoder should never be null");
        }
        this.encoder = encoder;
    }

    protected static EntityMetadata requireMetadata(final Entity entity) throws SAMLConfigurationException {
        if (entity == null || entity.getMetadata() == null) {
            throw new SAMLConfigurationException(MISSING_METADATA);
        }
        return entity.getMetadata();
    }

    protected static EntitySettings requireSettings(final Entity entity, final String role) throws SAMLConfigurationException {
        if (entity.getSettings() == null) {
            throw new SAMLConfigurationException(String.format("Missing declaration of %s settings", role));
        }
        return entity.getSettings();
    }

    /**
     * @return now, UTC, ISO-8601
     */
    protected static String issueInstant() {
        return new DateTime(DateTimeZone.UTC).toString();
    }

    protected static BindingContext transform(final TemplateTransformer transformer, final String template,
            final MessageType messageType) throws SAMLException {
        if (transformer == null) {
            throw new SAMLException(String.format("A custom %s template requires a template transformer", messageType));
        }
        final BindingContext info = transformer.apply(template);
        if (info == null) {
            throw new SAMLException(String.format("Template transformer returned no %s", messageType));
        }
        return info;
    }

    protected BindingContext encode(final String id, final EncodingRequest request) throws SAMLException {
        return new BindingContext(id, encoder.encode(request));
    }
}
