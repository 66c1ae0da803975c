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
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

public class TemplateEngineTest {

    @Test
    public void testDefaultTemplates() {
        for (MessageType type : MessageType.values()) {
            assertNotNull(type.name(), TemplateEngine.getDefaultTemplate(type));
        }
        assertTrue(TemplateEngine.getDefaultTemplate(MessageType.AUTHN_REQUEST).startsWith("<samlp:AuthnRequest"));
        assertTrue(TemplateEngine.getDefaultTemplate(MessageType.LOGOUT_REQUEST).startsWith("<samlp:LogoutRequest"));
        assertTrue(TemplateEngine.getDefaultTemplate(MessageType.LOGOUT_RESPONSE).startsWith("<samlp:LogoutResponse"));
    }

    @Test
    public void testReplaceTagsByValue() {
        final Map<String, String> values = new HashMap<>();
        values.put("ID", "_42");
        values.put("Issuer", "https://sp.example/metadata");
        assertEquals("<a ID=\"_42\"><i>https://sp.example/metadata</i></a>",
                TemplateEngine.replaceTagsByValue("<a ID=\"{ID}\"><i>{Issuer}</i></a>", values));
    }

    @Test
    public void testValuesAreEscaped() {
        final Map<String, String> values = new HashMap<>();
        values.put("NameID", "<tom & \"jerry\">");
        assertEquals("<n>&lt;tom &amp; &quot;jerry&quot;&gt;</n>",
                TemplateEngine.replaceTagsByValue("<n>{NameID}</n>", values));
        values.put("Issuer", "it's");
        assertEquals("<i a=\"it&apos;s\">it&apos;s</i>",
                TemplateEngine.replaceTagsByValue("<i a=\"{Issuer}\">{Issuer}</i>", values));
    }

    @Test
    public void testAttributeWithoutValueIsDropped() {
        final Map<String, String> values = new HashMap<>();
        values.put("ID", "_1");
        assertEquals("<r ID=\"_1\"><s/></r>",
                TemplateEngine.replaceTagsByValue("<r ID=\"{ID}\" InResponseTo=\"{InResponseTo}\"><s/></r>", values));
    }

    @Test
    public void testTextPlaceholderWithoutValueIsKept() {
        assertEquals("<n>{NameID}</n>", TemplateEngine.replaceTagsByValue("<n>{NameID}</n>", new HashMap<>()));
    }

    @Test
    public void testReplacementValueWithDollarSign() {
        final Map<String, String> values = new HashMap<>();
        values.put("NameID", "a$1\\b");
        assertEquals("<n>a$1\\b</n>", TemplateEngine.replaceTagsByValue("<n>{NameID}</n>", values));
    }

    @Test
    public void testLogoutResponseTemplate() {
        final Map<String, String> values = new HashMap<>();
        values.put(TemplateEngine.TAG_ID, "_2");
        values.put(TemplateEngine.TAG_STATUS_CODE, "urn:oasis:names:tc:SAML:2.0:status:Success");
        final String xml = TemplateEngine.replaceTagsByValue(TemplateEngine.getDefaultTemplate(MessageType.LOGOUT_RESPONSE), values);
        assertFalse(xml.contains("InResponseTo"));
        assertTrue(xml.contains("Value=\"urn:oasis:names:tc:SAML:2.0:status:Success\""));
    }
}
