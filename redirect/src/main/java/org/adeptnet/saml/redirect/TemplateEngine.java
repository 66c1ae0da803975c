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

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang.StringEscapeUtils;

/**
 * Fills {@code {Tag}} placeholders of a message template.
 *
 * An attribute whose value is a placeholder without a value is left out of
 * the message. Any other placeholder without a value stays as written.
 */
public final class TemplateEngine {

    public static final String TAG_ID = "ID";
    public static final String TAG_DESTINATION = "Destination";
    public static final String TAG_ISSUER = "Issuer";
    public static final String TAG_ISSUE_INSTANT = "IssueInstant";
    public static final String TAG_ENTITY_ID = "EntityID";
    public static final String TAG_NAME_ID_FORMAT = "NameIDFormat";
    public static final String TAG_ASSERTION_CONSUMER_SERVICE_URL = "AssertionConsumerServiceURL";
    public static final String TAG_ALLOW_CREATE = "AllowCreate";
    public static final String TAG_NAME_ID = "NameID";
    public static final String TAG_SESSION_INDEX = "SessionIndex";
    public static final String TAG_IN_RESPONSE_TO = "InResponseTo";
    public static final String TAG_STATUS_CODE = "StatusCode";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)\\}");
    private static final Pattern PLACEHOLDER_ATTRIBUTE = Pattern.compile("\\s+[\\w:.-]+=\"\\{(\\w+)\\}\"");

    private static final Map<MessageType, String> DEFAULT_TEMPLATES;

    static {
        final Map<MessageType, String> templates = new EnumMap<>(MessageType.class);
        templates.put(MessageType.AUTHN_REQUEST, load("templates/AuthnRequest.xml"));
        templates.put(MessageType.LOGOUT_REQUEST, load("templates/LogoutRequest.xml"));
        templates.put(MessageType.LOGOUT_RESPONSE, load("templates/LogoutResponse.xml"));
        DEFAULT_TEMPLATES = Collections.unmodifiableMap(templates);
    }

    private TemplateEngine() {
    }

    private static String load(final String resource) {
        try (final InputStream is = TemplateEngine.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(String.format("cannot read %s", resource));
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException ex) {
            throw new IllegalStateException(String.format("cannot read %s", resource), ex);
        }
    }

    public static String getDefaultTemplate(final MessageType messageType) {
        return DEFAULT_TEMPLATES.get(messageType);
    }

    /**
     * @param template message template
     * @param values placeholder name to value, values are XML escaped
     * @return the message
     */
    public static String replaceTagsByValue(final String template, final Map<String, String> values) {
        final Matcher attributes = PLACEHOLDER_ATTRIBUTE.matcher(template);
        final StringBuffer resolved = new StringBuffer();
        while (attributes.find()) {
            final String attribute = values.get(attributes.group(1)) == null ? "" : attributes.group();
            attributes.appendReplacement(resolved, Matcher.quoteReplacement(attribute));
        }
        attributes.appendTail(resolved);

        final Matcher tags = PLACEHOLDER.matcher(resolved);
        final StringBuffer result = new StringBuffer();
        while (tags.find()) {
            final String value = values.get(tags.group(1));
            tags.appendReplacement(result, Matcher.quoteReplacement(value == null ? tags.group() : StringEscapeUtils.escapeXml(value)));
        }
        tags.appendTail(result);
        return result.toString();
    }
}
