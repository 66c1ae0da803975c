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
 * One party of an exchange, its metadata and its own settings. Either may be
 * undeclared; builders reject what they need but cannot find.
 */
public class Entity {

    private final EntityMetadata metadata;
    private final EntitySettings settings;

    public Entity(final EntityMetadata metadata, final EntitySettings settings) {
        this.metadata = metadata;
        this.settings = settings;
    }

    public EntityMetadata getMetadata() {
        return metadata;
    }

    public EntitySettings getSettings() {
        return settings;
    }
}
