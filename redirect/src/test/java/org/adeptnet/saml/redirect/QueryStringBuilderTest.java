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

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class QueryStringBuilderTest {

    @Test
    public void testFirstParameterGetsQuestionMark() {
        final QueryStringBuilder query = new QueryStringBuilder("https://idp.example/sso")
                .append("SAMLRequest", "abc")
                .append("RelayState", "xyz");
        assertEquals("SAMLRequest=abc&RelayState=xyz", query.getQueryString());
        assertEquals("https://idp.example/sso?SAMLRequest=abc&RelayState=xyz", query.toUrl());
    }

    @Test
    public void testExistingQueryGetsAmpersand() {
        final QueryStringBuilder query = new QueryStringBuilder("https://idp.example/sso?tenant=a")
                .append("SAMLRequest", "abc");
        assertEquals("SAMLRequest=abc", query.getQueryString());
        assertEquals("https://idp.example/sso?tenant=a&SAMLRequest=abc", query.toUrl());
    }

    @Test
    public void testTrailingQuestionMark() {
        final QueryStringBuilder query = new QueryStringBuilder("https://idp.example/sso?")
                .append("SAMLRequest", "abc");
        assertEquals("https://idp.example/sso?SAMLRequest=abc", query.toUrl());
    }

    @Test
    public void testNoParameters() {
        assertEquals("https://idp.example/sso", new QueryStringBuilder("https://idp.example/sso").toUrl());
        assertEquals("", new QueryStringBuilder("https://idp.example/sso").getQueryString());
    }

    @Test
    public void testHasQuery() {
        assertTrue(QueryStringBuilder.hasQuery("https://idp.example/sso?a=1"));
        assertFalse(QueryStringBuilder.hasQuery("https://idp.example/sso"));
        assertFalse(QueryStringBuilder.hasQuery("https://idp.example/sso#frag"));
    }

    @Test
    public void testUnparseableUrlHasNoQuery() {
        assertFalse(QueryStringBuilder.hasQuery("https://idp example/sso?a=1"));
        assertEquals("https://idp example/sso?a=1?SAMLRequest=abc",
                new QueryStringBuilder("https://idp example/sso?a=1").append("SAMLRequest", "abc").toUrl());
    }

    @Test(expected = NullPointerException.class)
    public void testNullBaseUrl() {
        new QueryStringBuilder(null);
    }
}
