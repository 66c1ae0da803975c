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
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.opensaml.Configuration;
import org.opensaml.common.xml.SAMLConstants;
import org.opensaml.saml2.metadata.AssertionConsumerService;
import org.opensaml.saml2.metadata.EntitiesDescriptor;
import org.opensaml.saml2.metadata.EntityDescriptor;
import org.opensaml.saml2.metadata.IDPSSODescriptor;
import org.opensaml.saml2.metadata.SPSSODescriptor;
import org.opensaml.saml2.metadata.SingleLogoutService;
import org.opensaml.saml2.metadata.SingleSignOnService;
import org.opensaml.xml.XMLObject;
import org.opensaml.xml.io.Unmarshaller;
import org.opensaml.xml.io.UnmarshallingException;
import org.opensaml.xml.parse.BasicParserPool;
import org.opensaml.xml.parse.XMLParserException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Immutable {@link EntityMetadata}. Generally it is loaded from the metadata
 * file of the entity, but applications may assemble one with a
 * {@link Builder} if the information comes from some outside source.
 */
public class EntityMetadataConfig implements EntityMetadata {

    private static final Log LOG = LogFactory.getLog(EntityMetadataConfig.class);

    private final String entityId;
    private final Map<String, String> singleSignOnServices;
    private final Map<String, String> singleLogoutServices;
    private final Map<String, String> assertionConsumerServices;
    private final boolean authnRequestsSigned;
    private final boolean wantAuthnRequestsSigned;

    private EntityMetadataConfig(final Builder builder) {
        this.entityId = builder.entityId;
        this.singleSignOnServices = Collections.unmodifiableMap(new LinkedHashMap<>(builder.singleSignOnServices));
        this.singleLogoutServices = Collections.unmodifiableMap(new LinkedHashMap<>(builder.singleLogoutServices));
        this.assertionConsumerServices = Collections.unmodifiableMap(new LinkedHashMap<>(builder.assertionConsumerServices));
        this.authnRequestsSigned = builder.authnRequestsSigned;
        this.wantAuthnRequestsSigned = builder.wantAuthnRequestsSigned;
    }

    /**
     * Load the metadata of an entity from a metadata XML file.
     *
     * @param metadataFile File where the metadata lives
     * @return the parsed metadata
     * @throws SAMLException if the file cannot be read or holds no SSO role
     */
    public static EntityMetadataConfig fromFile(final File metadataFile) throws SAMLException {
        if (LOG.isDebugEnabled()) {
            LOG.debug(String.format("Loading metadata from %s", metadataFile));
        }
        try (final InputStream is = new FileInputStream(metadataFile)) {
            return fromStream(is);
        } catch (IOException e) {
            throw new SAMLException(String.format("Unable to read metadata %s", metadataFile), e);
        }
    }

    /**
     * Load the metadata of an entity. The document is either an
     * EntityDescriptor or an EntitiesDescriptor, of which the first entity is
     * used.
     *
     * @param metadata metadata XML
     * @return the parsed metadata
     * @throws SAMLException if the document cannot be parsed or holds no SSO
     * role
     */
    public static EntityMetadataConfig fromStream(final InputStream metadata) throws SAMLException {
        SAMLInit.initialize();

        final BasicParserPool parsers = new BasicParserPool();
        parsers.setNamespaceAware(true);

        final EntityDescriptor edesc;
        try {
            final Document doc = parsers.parse(metadata);
            final Element root = doc.getDocumentElement();

            final Unmarshaller unmarshaller = Configuration.getUnmarshallerFactory().getUnmarshaller(root);
            if (unmarshaller == null) {
                throw new SAMLException(String.format("Unsupported metadata element %s", root.getLocalName()));
            }
            final XMLObject o = unmarshaller.unmarshall(root);

            if (o instanceof EntitiesDescriptor) {
                final EntitiesDescriptor ed = (EntitiesDescriptor) o;
                if (ed.getEntityDescriptors() == null || ed.getEntityDescriptors().isEmpty()) {
                    throw new SAMLException("EntityDescriptors is empty");
                }
                edesc = ed.getEntityDescriptors().get(0);
            } else if (o instanceof EntityDescriptor) {
                edesc = (EntityDescriptor) o;
            } else {
                throw new SAMLException(String.format("Unsupported metadata element %s", root.getLocalName()));
            }
        } catch (XMLParserException | UnmarshallingException e) {
            throw new SAMLException(e);
        }

        final Builder builder = new Builder().withEntityId(edesc.getEntityID());

        final IDPSSODescriptor idpDesc = edesc.getIDPSSODescriptor(SAMLConstants.SAML20P_NS);
        if (idpDesc != null) {
            for (SingleSignOnService svc : idpDesc.getSingleSignOnServices()) {
                builder.withSingleSignOnService(svc.getBinding(), svc.getLocation());
            }
            for (SingleLogoutService svc : idpDesc.getSingleLogoutServices()) {
                builder.withSingleLogoutService(svc.getBinding(), svc.getLocation());
            }
            builder.withWantAuthnRequestsSigned(Boolean.TRUE.equals(idpDesc.getWantAuthnRequestsSigned()));
        }

        final SPSSODescriptor spDesc = edesc.getSPSSODescriptor(SAMLConstants.SAML20P_NS);
        if (spDesc != null) {
            for (AssertionConsumerService svc : spDesc.getAssertionConsumerServices()) {
                builder.withAssertionConsumerService(svc.getBinding(), svc.getLocation());
            }
            for (SingleLogoutService svc : spDesc.getSingleLogoutServices()) {
                builder.withSingleLogoutService(svc.getBinding(), svc.getLocation());
            }
            builder.withAuthnRequestsSigned(Boolean.TRUE.equals(spDesc.isAuthnRequestsSigned()));
        }

        if (idpDesc == null && spDesc == null) {
            throw new SAMLException("No IDP or SP SSO descriptor found");
        }
        return builder.build();
    }

    @Override
    public String getEntityId() {
        return entityId;
    }

    @Override
    public String getSingleSignOnService(final String binding) {
        return singleSignOnServices.get(binding);
    }

    @Override
    public String getSingleLogoutService(final String binding) {
        return singleLogoutServices.get(binding);
    }

    @Override
    public String getAssertionConsumerService(final String binding) {
        return assertionConsumerServices.get(binding);
    }

    @Override
    public boolean isAuthnRequestsSigned() {
        return authnRequestsSigned;
    }

    @Override
    public boolean isWantAuthnRequestsSigned() {
        return wantAuthnRequestsSigned;
    }

    @Override
    public String toString() {
        return "EntityMetadataConfig{" + "entityId=" + entityId + ", singleSignOnServices=" + singleSignOnServices
                + ", singleLogoutServices=" + singleLogoutServices + ", assertionConsumerServices=" + assertionConsumerServices + '}';
    }

    /**
     * The first location declared for a binding wins, as in metadata where the
     * first matching endpoint is the default one.
     */
    public static class Builder {

        private String entityId;
        private final Map<String, String> singleSignOnServices = new LinkedHashMap<>();
        private final Map<String, String> singleLogoutServices = new LinkedHashMap<>();
        private final Map<String, String> assertionConsumerServices = new LinkedHashMap<>();
        private boolean authnRequestsSigned;
        private boolean wantAuthnRequestsSigned;

        public Builder withEntityId(final String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder withSingleSignOnService(final String binding, final String location) {
            singleSignOnServices.putIfAbsent(binding, location);
            return this;
        }

        public Builder withSingleLogoutService(final String binding, final String location) {
            singleLogoutServices.putIfAbsent(binding, location);
            return this;
        }

        public Builder withAssertionConsumerService(final String binding, final String location) {
            assertionConsumerServices.putIfAbsent(binding, location);
            return this;
        }

        public Builder withAuthnRequestsSigned(final boolean authnRequestsSigned) {
            this.authnRequestsSigned = authnRequestsSigned;
            return this;
        }

        public Builder withWantAuthnRequestsSigned(final boolean wantAuthnRequestsSigned) {
            this.wantAuthnRequestsSigned = wantAuthnRequestsSigned;
            return this;
        }

        public EntityMetadataConfig build() {
            if (entityId == null) {
                throw new NullPointerException("entityId should never be null");
            }
            return new EntityMetadataConfig(this);
        }
    }
}
