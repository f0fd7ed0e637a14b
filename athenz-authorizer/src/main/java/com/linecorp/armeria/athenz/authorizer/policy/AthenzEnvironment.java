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

import com.linecorp.armeria.common.annotation.UnstableApi;

/**
 * The Athenz server whose key signed a part of the policy data.
 */
@UnstableApi
public enum AthenzEnvironment {
    /**
     * ZTS, which distributes the policy data and signs the envelope of it.
     */
    ZTS,
    /**
     * ZMS, which manages the policies and signs the policy data itself.
     */
    ZMS
}
