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

import static java.util.Objects.requireNonNull;

import java.security.PublicKey;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import com.yahoo.athenz.zpe.pkey.PublicKeyStore;

import com.linecorp.armeria.common.annotation.Nullable;
import com.linecorp.armeria.common.annotation.UnstableApi;

/**
 * Resolves the {@link SignatureVerifier} of a key that signed the policy data.
 * An implementation must be safe to use from multiple threads if policy data are verified concurrently.
 */
@UnstableApi
@FunctionalInterface
public interface KeyProvider {

    /**
     * Returns a new {@link KeyProvider} which looks up ZTS keys with {@link PublicKeyStore#getZtsKey(String)}
     * and ZMS keys with {@link PublicKeyStore#getZmsKey(String)}.
     */
    static KeyProvider ofPublicKeyStore(PublicKeyStore publicKeyStore) {
        requireNonNull(publicKeyStore, "publicKeyStore");
        return new PublicKeyStoreKeyProvider(publicKeyStore);
    }

    /**
     * Returns a new {@link KeyProvider} which serves the specified {@link PublicKey}s keyed by key ID.
     */
    static KeyProvider ofPublicKeys(Map<String, PublicKey> ztsKeys, Map<String, PublicKey> zmsKeys) {
        requireNonNull(ztsKeys, "ztsKeys");
        requireNonNull(zmsKeys, "zmsKeys");
        final Map<String, PublicKey> ztsKeysCopy = ImmutableMap.copyOf(ztsKeys);
        final Map<String, PublicKey> zmsKeysCopy = ImmutableMap.copyOf(zmsKeys);
        return ofPublicKeyStore(new PublicKeyStore() {
            @Override
            public PublicKey getZtsKey(String keyId) {
                return ztsKeysCopy.get(keyId);
            }

            @Override
            public PublicKey getZmsKey(String keyId) {
                return zmsKeysCopy.get(keyId);
            }
        });
    }

    /**
     * Returns the {@link SignatureVerifier} of the key with the specified {@code keyId} issued by
     * the specified {@link AthenzEnvironment}, or {@code null} if the key is unknown.
     */
    @Nullable
    SignatureVerifier verifier(AthenzEnvironment environment, String keyId);
}
