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

import com.linecorp.armeria.common.annotation.Nullable;
import com.linecorp.armeria.common.annotation.UnstableApi;

/**
 * A {@link RuntimeException} raised when signed policy data cannot be decoded or its signatures
 * cannot be verified. The policy data must not be used if this exception is raised.
 */
@UnstableApi
public final class SignedPolicyException extends RuntimeException {

    private static final long serialVersionUID = 6402207368823715219L;

    /**
     * Creates a new instance with the specified {@code message}.
     */
    public SignedPolicyException(String message) {
        super(message);
    }

    /**
     * Creates a new instance with the specified {@code message} and {@code cause}.
     */
    public SignedPolicyException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
