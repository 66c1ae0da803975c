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
import org.mockito.ArgumentCaptor;
import org.opensaml.saml2.core.NameIDType;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class LogoutRequestBuilderTest extends AbstractRedirectTest {

    private static final LogoutUser USER = new LogoutUser("alice@sp.example", "_session7");

    private MessageSigner messageSigner;
    private LogoutRequestBuilder builder;
    private SigningSettings spSigning;
    private Entity sp;

    @Before
    public void before() throws Exception {
        messageSigner = mock(MessageSigner.class);
        when(messageSigner.sign(anyString(), any(SigningSettings.class))).thenReturn(new byte[]{4, 5, 6});
        builder = new LogoutRequestBuilder(new RedirectEncoder(messageSigner));
        spSigning = new SigningSettings.Builder().build();
        sp = new Entity(spMetadata(), new EntitySettings.Builder()
                .withIdentifierGenerator(identifierGenerator("_logout1"))
                .withLogoutNameIDFormat("persistent")
                .withSigningSettings(spSigning)
                .build());
    }

    private Entity idp(final boolean wantLogoutRequestSigned) {
        return new Entity(idpMetadata(), new EntitySettings.Builder().withWantLogoutRequestSigned(wantLogoutRequestSigned).build());
    }

    @Test
    public void testUnsignedWithRelayState() throws Exception {
        final BindingContext context = builder.build(USER, sp, idp(false), "deeplink123", null);

        assertEquals("_logout1", context.getId());
        assertTrue(context.getContext().startsWith("https://idp.example/slo?SAMLRequest="));
        assertEquals(Arrays.asList("SAMLRequest", "RelayState"), parameterNames(context.getContext()));
        assertTrue(context.getContext().contains("&RelayState=deeplink123"));
        verifyNoInteractions(messageSigner);

        final String xml = decodeMessage(context.getContext(), "SAMLRequest");
        assertTrue(xml.startsWith("<samlp:LogoutRequest"));
        assertTrue(xml.contains("ID=\"_logout1\""));
        assertTrue(xml.contains("Destination=\"https://idp.example/slo\""));
        assertTrue(xml.contains("<saml:Issuer>https://sp.example/metadata</saml:Issuer>"));
        assertTrue(xml.contains("<saml:NameID Format=\"" + NameIDType.PERSISTENT + "\">alice@sp.example</saml:NameID>"));
        assertTrue(xml.contains("<samlp:SessionIndex>_session7</samlp:SessionIndex>"));
    }

    @Test
    public void testSignedWithRelayState() throws Exception {
        final BindingContext context = builder.build(USER, sp, idp(true), "deeplink123", null);

        assertEquals(Arrays.asList("SAMLRequest", "SigAlg", "RelayState", "Signature"), parameterNames(context.getContext()));

        final ArgumentCaptor<String> octetString = ArgumentCaptor.forClass(String.class);
        verify(messageSigner).sign(octetString.capture(), eq(spSigning));
        assertTrue(octetString.getValue().startsWith("SAMLRequest="));
        assertTrue(octetString.getValue().endsWith("&SigAlg=" + RedirectCodec.urlEncode(RSA_SHA256) + "&RelayState=deeplink123"));
    }

    @Test
    public void testMissingTargetMetadata() throws Exception {
        try {
            builder.build(USER, sp, new Entity(null, new EntitySettings.Builder().build()), null, null);
            fail("expected SAMLConfigurationException");
        } catch (SAMLConfigurationException ex) {
            assertEquals(AbstractRedirectBuilder.MISSING_METADATA, ex.getMessage());
        }
        verifyNoInteractions(messageSigner);
    }

    @Test(expected = SAMLConfigurationException.class)
    public void testMissingTargetSettings() throws Exception {
        builder.build(USER, sp, new Entity(idpMetadata(), null), null, null);
    }

    @Test(expected = SAMLException.class)
    public void testMissingUser() throws Exception {
        builder.build(null, sp, idp(false), null, null);
    }

    @Test
    public void testNoRedirectSingleLogoutService() throws Exception {
        final EntityMetadata metadata = new EntityMetadataConfig.Builder().withEntityId("https://idp.example/metadata").build();
        try {
            builder.build(USER, sp, new Entity(metadata, new EntitySettings.Builder().build()), null, null);
            fail("expected SAMLConfigurationException");
        } catch (SAMLConfigurationException ex) {
            assertTrue(ex.getMessage().startsWith("No acceptable Single Logout Service found"));
        }
    }

    @Test
    public void testCustomTemplateWithoutUser() throws Exception {
        final Entity init = new Entity(spMetadata(), new EntitySettings.Builder()
                .withLogoutRequestTemplate("<logout/>")
                .build());
        final BindingContext context = builder.build(null, init, idp(false), null, template -> new BindingContext("_t", template));
        assertEquals("_t", context.getId());
        assertEquals("<logout/>", decodeMessage(context.getContext(), "SAMLRequest"));
    }

    @Test(expected = NullPointerException.class)
    public void testLogoutUserRequiresSessionIndex() {
        new LogoutUser("alice@sp.example", null);
    }
}
