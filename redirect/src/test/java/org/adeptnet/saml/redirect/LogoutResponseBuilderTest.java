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

import java.util.Arrays;
import org.junit.Before;
import org.junit.Test;
import org.opensaml.saml2.core.StatusCode;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class LogoutResponseBuilderTest extends AbstractRedirectTest {

    private LogoutResponseBuilder builder;
    private Entity sp;

    @Before
    public void before() throws Exception {
        final MessageSigner messageSigner = mock(MessageSigner.class);
        when(messageSigner.sign(anyString(), any(SigningSettings.class))).thenReturn(new byte[]{7});
        builder = new LogoutResponseBuilder(new RedirectEncoder(messageSigner));
        sp = new Entity(spMetadata(), new EntitySettings.Builder().withIdentifierGenerator(identifierGenerator("_resp1")).build());
    }

    private Entity idp(final boolean wantLogoutResponseSigned) {
        return new Entity(idpMetadata(), new EntitySettings.Builder().withWantLogoutResponseSigned(wantLogoutResponseSigned).build());
    }

    @Test
    public void testInResponseTo() throws Exception {
        final BindingContext context = builder.build("_abc123", sp, idp(false), null, null);

        assertEquals("_resp1", context.getId());
        assertTrue(context.getContext().startsWith("https://idp.example/slo?SAMLResponse="));

        final String xml = decodeMessage(context.getContext(), "SAMLResponse");
        assertTrue(xml.startsWith("<samlp:LogoutResponse"));
        assertTrue(xml.contains("InResponseTo=\"_abc123\""));
        assertTrue(xml.contains("ID=\"_resp1\""));
        assertTrue(xml.contains("<samlp:StatusCode Value=\"" + StatusCode.SUCCESS_URI + "\"/>"));
        assertTrue(xml.contains("<saml:Issuer>https://sp.example/metadata</saml:Issuer>"));
    }

    @Test
    public void testWithoutInResponseTo() throws Exception {
        final BindingContext context = builder.build(null, sp, idp(false), null, null);
        final String xml = decodeMessage(context.getContext(), "SAMLResponse");
        assertFalse(xml.contains("InResponseTo"));
        assertFalse(xml.contains("{"));
    }

    @Test
    public void testEmptyInResponseTo() throws Exception {
        final BindingContext context = builder.build("", sp, idp(false), null, null);
        final String xml = decodeMessage(context.getContext(), "SAMLResponse");
        assertFalse(xml.contains("InResponseTo"));
        assertTrue(xml.contains("Destination=\"https://idp.example/slo\">"));
    }

    @Test
    public void testSigned() throws Exception {
        final BindingContext context = builder.build("_abc123", sp, idp(true), "rs", null);
        assertEquals(Arrays.asList("SAMLResponse", "SigAlg", "RelayState", "Signature"), parameterNames(context.getContext()));
    }

    @Test(expected = SAMLConfigurationException.class)
    public void testMissingInitiatorMetadata() throws Exception {
        builder.build("_abc123", null, idp(false), null, null);
    }
}
