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
import java.security.SignatureException;

import com.linecorp.armeria.common.annotation.UnstableApi;

/**
 * Verifies a signature against the data which was signed.
 */
@UnstableApi
@FunctionalInterface
public interface SignatureVerifier {

    /**
     * Returns a new {@link SignatureVerifier} which verifies signatures with the specified {@link PublicKey}.
     * The signature is expected to be the YBase64-encoded form produced by Athenz servers.
     */
    static SignatureVerifier ofPublicKey(PublicKey publicKey) {
        requireNonNull(publicKey, "publicKey");
        return new PublicKeySignatureVerifier(publicKey);
    }

    /**
     * Verifies the {@code signature} of the {@code data}.
     *
     * @throws SignatureException if the {@code signature} is not valid for the {@code data}
     */
    void verify(String data, String signature) throws SignatureException;
}
