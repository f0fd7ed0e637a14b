/*
 * Copyright 2026 LY Corporation
 *
 * LY Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package com.linecorp.armeria.athenz.authorizer.policy;

import java.security.PublicKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.yahoo.athenz.zpe.pkey.PublicKeyStore;

import com.linecorp.armeria.common.annotation.Nullable;

final class PublicKeyStoreKeyProvider implements KeyProvider {

    private static final Logger logger = LoggerFactory.getLogger(PublicKeyStoreKeyProvider.class);

    private final PublicKeyStore publicKeyStore;

    PublicKeyStoreKeyProvider(PublicKeyStore publicKeyStore) {
        this.publicKeyStore = publicKeyStore;
    }

    @Nullable
    @Override
    public SignatureVerifier verifier(AthenzEnvironment environment, String keyId) {
        final PublicKey publicKey;
        switch (environment) {
            case ZTS:
                publicKey = publicKeyStore.getZtsKey(keyId);
                break;
            case ZMS:
                publicKey = publicKeyStore.getZmsKey(keyId);
                break;
            default:
                throw new Error("unknown environment: " + environment);
        }
        if (publicKey == null) {
            logger.debug("No {} public key for key-id {}", environment, keyId);
            return null;
        }
        return SignatureVerifier.ofPublicKey(publicKey);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("publicKeyStore", publicKeyStore)
                          .toString();
    }
}
