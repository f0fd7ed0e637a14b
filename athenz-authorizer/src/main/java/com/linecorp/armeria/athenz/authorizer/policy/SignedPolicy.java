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

import static com.google.common.base.Strings.nullToEmpty;
import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.security.SignatureException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.MoreObjects;
import com.yahoo.athenz.common.utils.SignUtils;
import com.yahoo.athenz.zts.DomainSignedPolicyData;
import com.yahoo.athenz.zts.PolicyData;
import com.yahoo.athenz.zts.SignedPolicyData;

import com.linecorp.armeria.common.annotation.Nullable;
import com.linecorp.armeria.common.annotation.UnstableApi;

/**
 * Athenz policy data fetched from ZTS, whose envelope is signed by ZTS and whose policy data is signed by ZMS.
 * The policy data must not be trusted until {@link #verify(KeyProvider)} succeeds.
 */
@UnstableApi
public final class SignedPolicy {

    private static final Logger logger = LoggerFactory.getLogger(SignedPolicy.class);

    private static final ObjectMapper mapper =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Returns a new {@link SignedPolicy} which wraps the specified {@link DomainSignedPolicyData}.
     */
    public static SignedPolicy of(DomainSignedPolicyData domainSignedPolicyData) {
        requireNonNull(domainSignedPolicyData, "domainSignedPolicyData");
        return new SignedPolicy(domainSignedPolicyData);
    }

    /**
     * Decodes the JSON response of the ZTS {@code /domain/{domain}/signed_policy_data} API.
     *
     * @throws SignedPolicyException if the JSON cannot be decoded
     */
    public static SignedPolicy fromJson(String json) {
        requireNonNull(json, "json");
        try {
            return of(mapper.readValue(json, DomainSignedPolicyData.class));
        } catch (IOException e) {
            throw new SignedPolicyException("Unable to parse signed policy data", e);
        }
    }

    /**
     * Decodes the JSON response of the ZTS {@code /domain/{domain}/signed_policy_data} API.
     *
     * @throws SignedPolicyException if the JSON cannot be decoded
     */
    public static SignedPolicy fromJson(byte[] json) {
        requireNonNull(json, "json");
        try {
            return of(mapper.readValue(json, DomainSignedPolicyData.class));
        } catch (IOException e) {
            throw new SignedPolicyException("Unable to parse signed policy data", e);
        }
    }

    private final DomainSignedPolicyData domainSignedPolicyData;

    private SignedPolicy(DomainSignedPolicyData domainSignedPolicyData) {
        this.domainSignedPolicyData = domainSignedPolicyData;
    }

    /**
     * Returns the {@link DomainSignedPolicyData} as it was fetched.
     */
    public DomainSignedPolicyData domainSignedPolicyData() {
        return domainSignedPolicyData;
    }

    /**
     * Returns the {@link PolicyData} signed by ZMS, or {@code null} if absent.
     * Use it only after {@link #verify(KeyProvider)} succeeds.
     */
    @Nullable
    public PolicyData policyData() {
        final SignedPolicyData signedPolicyData = domainSignedPolicyData.getSignedPolicyData();
        return signedPolicyData != null ? signedPolicyData.getPolicyData() : null;
    }

    /**
     * Verifies the ZTS signature of the {@link SignedPolicyData} and then the ZMS signature of
     * the {@link PolicyData}. The ZMS key is not looked up unless the ZTS signature is valid.
     *
     * @throws SignedPolicyException if a key is not found or a signature is not valid
     */
    public void verify(KeyProvider keyProvider) {
        requireNonNull(keyProvider, "keyProvider");

        final SignatureVerifier ztsVerifier =
                keyProvider.verifier(AthenzEnvironment.ZTS, nullToEmpty(domainSignedPolicyData.getKeyId()));
        if (ztsVerifier == null) {
            throw new SignedPolicyException("zts key not found");
        }

        final SignedPolicyData signedPolicyData = domainSignedPolicyData.getSignedPolicyData();
        try {
            ztsVerifier.verify(canonicalString(signedPolicyData),
                               nullToEmpty(domainSignedPolicyData.getSignature()));
        } catch (SignatureException e) {
            throw new SignedPolicyException("error verify signature: " + e.getMessage(), e);
        }

        final String zmsKeyId;
        final String zmsSignature;
        final PolicyData policyData;
        if (signedPolicyData != null) {
            zmsKeyId = nullToEmpty(signedPolicyData.getZmsKeyId());
            zmsSignature = nullToEmpty(signedPolicyData.getZmsSignature());
            policyData = signedPolicyData.getPolicyData();
        } else {
            zmsKeyId = "";
            zmsSignature = "";
            policyData = null;
        }

        final SignatureVerifier zmsVerifier = keyProvider.verifier(AthenzEnvironment.ZMS, zmsKeyId);
        if (zmsVerifier == null) {
            throw new SignedPolicyException("zms key not found");
        }
        try {
            zmsVerifier.verify(canonicalString(policyData), zmsSignature);
        } catch (SignatureException e) {
            throw new SignedPolicyException("error verify zms signature: " + e.getMessage(), e);
        }

        logger.debug("Verified the signed policy data. zts key-id: {}, zms key-id: {}",
                     domainSignedPolicyData.getKeyId(), zmsKeyId);
    }

    // An absent object is signed as an empty string.

    private static String canonicalString(@Nullable SignedPolicyData signedPolicyData) {
        if (signedPolicyData == null) {
            return "";
        }
        if (signedPolicyData.getPolicyData() == null) {
            // SignUtils requires the policy data, which is signed as an empty one if absent.
            return SignUtils.asCanonicalString(new SignedPolicyData()
                                                       .setExpires(signedPolicyData.getExpires())
                                                       .setModified(signedPolicyData.getModified())
                                                       .setZmsKeyId(signedPolicyData.getZmsKeyId())
                                                       .setZmsSignature(signedPolicyData.getZmsSignature())
                                                       .setPolicyData(new PolicyData()));
        }
        return SignUtils.asCanonicalString(signedPolicyData);
    }

    private static String canonicalString(@Nullable PolicyData policyData) {
        return policyData != null ? SignUtils.asCanonicalString(policyData) : "";
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("keyId", domainSignedPolicyData.getKeyId())
                          .add("zmsKeyId", domainSignedPolicyData.getSignedPolicyData() != null ?
                                           domainSignedPolicyData.getSignedPolicyData().getZmsKeyId() : null)
                          .toString();
    }
}
