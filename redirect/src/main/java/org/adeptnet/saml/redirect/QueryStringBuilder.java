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

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Appends already encoded parameters to a destination URL, in the order they
 * are added. The first parameter is prefixed with {@code ?} unless the
 * destination already carries a query, in which case {@code &} is used.
 */
public class QueryStringBuilder {

    private static final Log LOG = LogFactory.getLog(QueryStringBuilder.class);

    private final String baseUrl;
    private final String firstSeparator;
    private final List<String> parameters = new ArrayList<>();

    public QueryStringBuilder(final String baseUrl) {
        if (baseUrl == null) {
            throw new NullPointerException("baseUrl should never be null");
        }
        this.baseUrl = baseUrl;
        if (baseUrl.endsWith("?")) {
            firstSeparator = "";
        } else {
            firstSeparator = hasQuery(baseUrl) ? "&" : "?";
        }
    }

    /**
     * A destination that cannot be parsed is treated as having no query.
     *
     * @param baseUrl destination URL
     * @return the URL has at least one query parameter
     */
    public static boolean hasQuery(final String baseUrl) {
        try {
            final String query = new URI(baseUrl).getRawQuery();
            return query != null && !query.isEmpty();
        } catch (URISyntaxException ex) {
            if (LOG.isDebugEnabled()) {
                LOG.debug(String.format("Unparseable destination [%s], assuming no query: %s", baseUrl, ex.getMessage()));
            }
            return false;
        }
    }

    public QueryStringBuilder append(final String name, final String encodedValue) {
        parameters.add(String.format("%s=%s", name, encodedValue));
        return this;
    }

    /**
     * @return the appended parameters joined by {@code &}, without the
     * destination and its leading separator
     */
    public String getQueryString() {
        return String.join("&", parameters);
    }

    public String toUrl() {
        if (parameters.isEmpty()) {
            return baseUrl;
        }
        return baseUrl + firstSeparator + getQueryString();
    }

    @Override
    public String toString() {
        return toUrl();
    }
}
