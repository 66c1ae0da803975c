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
 * The subject whose session a LogoutRequest ends.
 */
public class LogoutUser {

    private final String nameId;
    private final String sessionIndex;

    public LogoutUser(final String nameId, final String sessionIndex) {
        if (nameId == null) {
            throw new NullPointerException("nameId should never be null");
        }
        if (sessionIndex == null) {
            throw new NullPointerException("sessionIndex should never be null");
        }
        this.nameId = nameId;
        this.sessionIndex = sessionIndex;
    }

    public String getNameId() {
        return nameId;
    }

    public String getSessionIndex() {
        return sessionIndex;
    }

    @Override
    public String toString() {
        return "LogoutUser{" + "nameId=" + nameId + ", sessionIndex=" + sessionIndex + '}';
    }
}
