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
import java.security.SignatureException;

import com.google.common.base.MoreObjects;
import com.yahoo.athenz.auth.util.Crypto;
import com.yahoo.athenz.auth.util.CryptoException;

final class PublicKeySignatureVerifier implements SignatureVerifier {

    private final PublicKey publicKey;

    PublicKeySignatureVerifier(PublicKey publicKey) {
        this.publicKey = publicKey;
    }

    @Override
    public void verify(String data, String signature) throws SignatureException {
        final boolean verified;
        try {
            verified = Crypto.verify(data, publicKey, signature);
        } catch (CryptoException e) {
            throw new SignatureException(e.getMessage(), e);
        }
        if (!verified) {
            throw new SignatureException("signature mismatch");
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("algorithm", publicKey.getAlgorithm())
                          .toString();
    }
}
