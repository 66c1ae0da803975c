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

/**
 * A built message: its identifier and either the redirect URL or, when
 * returned by a {@link TemplateTransformer}, the raw XML.
 */
public class BindingContext {

    private final String id;
    private final String context;

    public BindingContext(final String id, final String context) {
        if (id == null) {
            throw new NullPointerException("id should never be null");
        }
        if (context == null) {
            throw new NullPointerException("context should never be null");
        }
        this.id = id;
        this.context = context;
    }

    public String getId() {
        return id;
    }

    public String getContext() {
        return context;
    }

    @Override
    public String toString() {
        return "BindingContext{" + "id=" + id + ", context=" + context + '}';
    }
}
