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

import static com.linecorp.armeria.athenz.authorizer.policy.SignedPolicyTest.domainSignedPolicyData;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PublicKey;
import java.security.SignatureException;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableMap;
import com.yahoo.athenz.auth.util.Crypto;
import com.yahoo.athenz.common.utils.SignUtils;
import com.yahoo.athenz.zpe.pkey.PublicKeyStore;
import com.yahoo.athenz.zts.DomainSignedPolicyData;
import com.yahoo.athenz.zts.SignedPolicyData;

class KeyProviderTest {

    private static KeyPair ztsKeyPair;
    private static KeyPair zmsKeyPair;

    @BeforeAll
    static void generateKeys() throws Exception {
        final KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        ztsKeyPair = generator.generateKeyPair();
        zmsKeyPair = generator.generateKeyPair();
    }

    private static DomainSignedPolicyData sign(DomainSignedPolicyData data) {
        final SignedPolicyData signedPolicyData = data.getSignedPolicyData();
        signedPolicyData.setZmsSignature(Crypto.sign(SignUtils.asCanonicalString(
                signedPolicyData.getPolicyData()), zmsKeyPair.getPrivate()));
        return data.setSignature(Crypto.sign(SignUtils.asCanonicalString(signedPolicyData),
                                             ztsKeyPair.getPrivate()));
    }

    private static KeyProvider keyProvider() {
        return KeyProvider.ofPublicKeys(ImmutableMap.of("zts-key", ztsKeyPair.getPublic()),
                                        ImmutableMap.of("zms-key", zmsKeyPair.getPublic()));
    }

    @Test
    void verifiesSignaturesMadeByAthenz() {
        final SignedPolicy signedPolicy = SignedPolicy.of(sign(domainSignedPolicyData()));
        signedPolicy.verify(keyProvider());
        assertThat(signedPolicy.policyData().getDomain()).isEqualTo("sports");
    }

    @Test
    void rejectsTamperedPolicyData() {
        final DomainSignedPolicyData data = sign(domainSignedPolicyData());
        data.getSignedPolicyData().getPolicyData().setDomain("media");
        // The envelope is signed again so that only the ZMS signature is broken.
        data.setSignature(Crypto.sign(SignUtils.asCanonicalString(data.getSignedPolicyData()),
                                      ztsKeyPair.getPrivate()));

        assertThatThrownBy(() -> SignedPolicy.of(data).verify(keyProvider()))
                .isInstanceOf(SignedPolicyException.class)
                .hasMessageStartingWith("error verify zms signature: ");
    }

    @Test
    void rejectsTamperedEnvelope() {
        final DomainSignedPolicyData data = sign(domainSignedPolicyData());
        data.getSignedPolicyData().setZmsKeyId("other-key");

        assertThatThrownBy(() -> SignedPolicy.of(data).verify(keyProvider()))
                .isInstanceOf(SignedPolicyException.class)
                .hasMessageStartingWith("error verify signature: ");
    }

    @Test
    void rejectsSignatureOfOtherKey() {
        final KeyProvider swapped = KeyProvider.ofPublicKeys(
                ImmutableMap.of("zts-key", zmsKeyPair.getPublic()),
                ImmutableMap.of("zms-key", zmsKeyPair.getPublic()));
        assertThatThrownBy(() -> SignedPolicy.of(sign(domainSignedPolicyData())).verify(swapped))
                .isInstanceOf(SignedPolicyException.class)
                .hasMessageStartingWith("error verify signature: ");
    }

    @Test
    void unknownKeyId() {
        final KeyProvider keyProvider = keyProvider();
        assertThat(keyProvider.verifier(AthenzEnvironment.ZTS, "zms-key")).isNull();
        assertThat(keyProvider.verifier(AthenzEnvironment.ZMS, "zts-key")).isNull();
        assertThat(keyProvider.verifier(AthenzEnvironment.ZTS, "")).isNull();
        assertThat(keyProvider.verifier(AthenzEnvironment.ZTS, "zts-key")).isNotNull();
    }

    @Test
    void ofPublicKeyStore() throws Exception {
        final PublicKeyStore publicKeyStore = new PublicKeyStore() {
            @Override
            public PublicKey getZtsKey(String keyId) {
                return "0".equals(keyId) ? ztsKeyPair.getPublic() : null;
            }

            @Override
            public PublicKey getZmsKey(String keyId) {
                return "0".equals(keyId) ? zmsKeyPair.getPublic() : null;
            }
        };
        final KeyProvider keyProvider = KeyProvider.ofPublicKeyStore(publicKeyStore);
        assertThat(keyProvider.verifier(AthenzEnvironment.ZMS, "1")).isNull();

        final SignatureVerifier verifier = keyProvider.verifier(AthenzEnvironment.ZMS, "0");
        assertThat(verifier).isNotNull();
        verifier.verify("data", Crypto.sign("data", zmsKeyPair.getPrivate()));
        assertThatThrownBy(() -> verifier.verify("data", Crypto.sign("other", zmsKeyPair.getPrivate())))
                .isInstanceOf(SignatureException.class);
    }
}
