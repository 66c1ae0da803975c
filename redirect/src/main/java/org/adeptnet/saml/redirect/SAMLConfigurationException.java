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
 * Required metadata, settings or endpoints are not declared. The caller has to
 * supply a complete configuration before retrying.
 */
public class SAMLConfigurationException extends SAMLException {

    private static final long serialVersionUID = 20161017001L;

    public SAMLConfigurationException(final String reason) {
        super(reason);
    }

    public SAMLConfigurationException(final String reason, final Throwable cause) {
        super(reason, cause);
    }
}
