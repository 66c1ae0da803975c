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

import java.io.File;
import java.io.FileOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyStore;
import java.security.Signature;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CredentialMessageSignerTest extends AbstractRedirectTest {

    private static final String OCTET_STRING = "SAMLRequest=abc%2B&SigAlg=" + RedirectCodec.urlEncode(RSA_SHA256) + "&RelayState=xyz";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private CredentialMessageSigner signer;
    private KeyPair keyPair;

    @Before
    public void before() throws Exception {
        signer = new CredentialMessageSigner();
        keyPair = keyPair();
    }

    @Test
    public void testSignWithPrivateKey() throws Exception {
        final SigningSettings settings = new SigningSettings.Builder().withPrivateKey(keyPair.getPrivate()).build();
        final byte[] signature = signer.sign(OCTET_STRING, settings);
        assertNotNull(signature);

        final Signature verifier = Signature.getInstance("SHA256withRSA");
        verifier.initVerify(keyPair.getPublic());
        verifier.update(OCTET_STRING.getBytes(StandardCharsets.UTF_8));
        assertTrue(verifier.verify(signature));

        verifier.initVerify(keyPair.getPublic());
        verifier.update("SAMLRequest=abc%2B".getBytes(StandardCharsets.UTF_8));
        assertFalse(verifier.verify(signature));
    }

    @Test
    public void testNoKeyMaterial() throws Exception {
        try {
            signer.sign(OCTET_STRING, new SigningSettings.Builder().build());
            fail("expected SAMLSigningException");
        } catch (SAMLSigningException ex) {
            assertEquals("No private key configured for signing", ex.getMessage());
        }
    }

    @Test(expected = SAMLSigningException.class)
    public void testUnknownAlgorithm() throws Exception {
        signer.sign(OCTET_STRING, new SigningSettings.Builder()
                .withPrivateKey(keyPair.getPrivate())
                .withSignatureAlgorithm("urn:example:unknown")
                .build());
    }

    @Test
    public void testMissingKeystore() throws Exception {
        final SigningSettings settings = new SigningSettings.Builder()
                .withKeystore(new File(folder.getRoot(), "missing.jks"))
                .withKeystorePassword("changeit")
                .withCertificateAlias("sp")
                .build();
        try {
            signer.sign(OCTET_STRING, settings);
            fail("expected SAMLSigningException");
        } catch (SAMLSigningException ex) {
            assertNotNull(ex.getCause());
        }
    }

    @Test
    public void testAliasWithoutPrivateKey() throws Exception {
        final File file = folder.newFile("empty.p12");
        final KeyStore keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
        keyStore.load(null, null);
        try (FileOutputStream fos = new FileOutputStream(file)) {
            keyStore.store(fos, "changeit".toCharArray());
        }

        final SigningSettings settings = new SigningSettings.Builder()
                .withKeystore(file)
                .withKeystorePassword("changeit")
                .withCertificateAlias("sp")
                .build();
        try {
            signer.sign(OCTET_STRING, settings);
            fail("expected SAMLSigningException");
        } catch (SAMLSigningException ex) {
            assertTrue(ex.getMessage().startsWith("No private key [sp]"));
        }
    }

    @Test(expected = NullPointerException.class)
    public void testKeystoreWithoutAlias() {
        new SigningSettings.Builder()
                .withKeystore(new File("sp.jks"))
                .withKeystorePassword("changeit")
                .build();
    }
}
