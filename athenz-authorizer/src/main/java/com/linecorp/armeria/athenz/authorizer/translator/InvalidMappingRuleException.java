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

package com.linecorp.armeria.athenz.authorizer.translator;

import com.linecorp.armeria.common.annotation.UnstableApi;

/**
 * An {@link IllegalArgumentException} raised when a set of {@link MappingRule}s cannot be compiled into
 * {@link MappingRules}. The whole set is rejected and none of its rules should be used.
 */
@UnstableApi
public final class InvalidMappingRuleException extends IllegalArgumentException {

    private static final long serialVersionUID = -3093528416457810162L;

    /**
     * Creates a new instance with the specified {@code message}.
     */
    public InvalidMappingRuleException(String message) {
        super(message);
    }
}
