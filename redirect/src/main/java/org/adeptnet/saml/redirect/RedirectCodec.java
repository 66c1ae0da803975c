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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;
import org.opensaml.ws.transport.http.HTTPTransportUtils;

/**
 * Encoding steps of the redirect binding: raw DEFLATE (no zlib header),
 * base64 and URL encoding, and their inverses.
 */
public final class RedirectCodec {

    private RedirectCodec() {
    }

    /**
     * @param input message bytes
     * @return raw DEFLATE data, without zlib header or checksum
     * @throws IOException if compression fails
     */
    public static byte[] deflate(final byte[] input) throws IOException {
        final Deflater deflater = new Deflater(Deflater.DEFAULT_COMPRESSION, true);
        final ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try (final DeflaterOutputStream dos = new DeflaterOutputStream(bos, deflater)) {
            dos.write(input);
        } finally {
            deflater.end();
        }
        return bos.toByteArray();
    }

    public static byte[] inflate(final byte[] content) throws IOException {
        final Inflater inflater = new Inflater(true);
        final ByteArrayOutputStream bos = new ByteArrayOutputStream(content.length * 2);
        try (final InflaterInputStream iis = new InflaterInputStream(new ByteArrayInputStream(content), inflater)) {
            iis.transferTo(bos);
        } finally {
            inflater.end();
        }
        return bos.toByteArray();
    }

    /**
     * @param xml the message
     * @return the deflated, base64-encoded message, not yet URL encoded
     * @throws SAMLException if compression fails
     */
    public static String deflateAndBase64Encode(final String xml) throws SAMLException {
        try {
            return Base64.getEncoder().encodeToString(deflate(xml.getBytes(StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new SAMLException("Unable to compress the message", e);
        }
    }

    /**
     * Inverse of {@link #deflateAndBase64Encode(String)}.
     *
     * @param encoded base64 text, already URL decoded
     * @return the message
     * @throws SAMLException if the text is not base64 or not deflated
     */
    public static String base64DecodeAndInflate(final String encoded) throws SAMLException {
        try {
            return new String(inflate(Base64.getMimeDecoder().decode(encoded)), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException | IOException e) {
            throw new SAMLException("Unable to decompress the message", e);
        }
    }

    public static String urlEncode(final String value) {
        return HTTPTransportUtils.urlEncode(value);
    }

    public static String urlDecode(final String value) {
        return HTTPTransportUtils.urlDecode(value);
    }
}
