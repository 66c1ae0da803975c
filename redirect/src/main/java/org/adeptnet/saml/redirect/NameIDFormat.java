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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.opensaml.saml2.core.NameIDType;

/**
 * Short configuration names for the SAML NameID formats.
 */
public enum NameIDFormat {

    EMAIL_ADDRESS("emailAddress", NameIDType.EMAIL),
    PERSISTENT("persistent", NameIDType.PERSISTENT),
    TRANSIENT("transient", NameIDType.TRANSIENT),
    ENTITY("entity", NameIDType.ENTITY),
    UNSPECIFIED("unspecified", NameIDType.UNSPECIFIED),
    KERBEROS("kerberos", NameIDType.KERBEROS),
    WINDOWS_DOMAIN_QUALIFIED_NAME("windowsDomainQualifiedName", NameIDType.WIN_DOMAIN_QUALIFIED),
    X509_SUBJECT_NAME("x509SubjectName", NameIDType.X509_SUBJECT),
    ENCRYPTED("encrypted", NameIDType.ENCRYPTED);

    private static final Map<String, NameIDFormat> BY_NAME;

    static {
        final Map<String, NameIDFormat> byName = new HashMap<>();
        for (NameIDFormat format : values()) {
            byName.put(format.getName(), format);
        }
        BY_NAME = Collections.unmodifiableMap(byName);
    }

    private final String name;
    private final String uri;

    NameIDFormat(final String name, final String uri) {
        this.name = name;
        this.uri = uri;
    }

    public String getName() {
        return name;
    }

    public String getURI() {
        return uri;
    }

    /**
     * Resolve a configured short name to its format URI.
     *
     * @param name short name, e.g. {@code persistent}
     * @return the format URI, the emailAddress format when the name is unknown
     */
    public static String toURI(final String name) {
        final NameIDFormat format = name == null ? null : BY_NAME.get(name);
        return format == null ? EMAIL_ADDRESS.getURI() : format.getURI();
    }
}
