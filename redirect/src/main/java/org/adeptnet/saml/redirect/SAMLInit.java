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

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.opensaml.DefaultBootstrap;
import org.opensaml.xml.ConfigurationException;

/**
 * One-time OpenSAML bootstrap. Metadata unmarshalling and the JCE algorithm
 * mapping used for signing both depend on it.
 */
public final class SAMLInit {

    private static final Log LOG = LogFactory.getLog(SAMLInit.class);

    private static boolean initialized;

    private SAMLInit() {
    }

    public static synchronized void initialize() throws SAMLException {
        if (initialized) {
            return;
        }
        try {
            DefaultBootstrap.bootstrap();
            initialized = true;
            if (LOG.isDebugEnabled()) {
                LOG.debug("OpenSAML bootstrapped");
            }
        } catch (ConfigurationException ex) {
            throw new SAMLException("Unable to bootstrap OpenSAML", ex);
        }
    }
}
