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

import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;

import com.linecorp.armeria.common.annotation.Nullable;
import com.linecorp.armeria.common.annotation.UnstableApi;

/**
 * The Athenz action and resource which a request has been translated into.
 *
 * @see MappingRules#translate(String, String, String, String)
 */
@UnstableApi
public final class TranslatedRequest {

    /**
     * Returns a new {@link TranslatedRequest} with the specified {@code action} and {@code resource}.
     */
    public static TranslatedRequest of(String action, String resource) {
        return new TranslatedRequest(requireNonNull(action, "action"),
                                     requireNonNull(resource, "resource"));
    }

    private final String action;
    private final String resource;

    private TranslatedRequest(String action, String resource) {
        this.action = action;
        this.resource = resource;
    }

    /**
     * Returns the Athenz action. It is the HTTP method of the request if no rule matched.
     */
    public String action() {
        return action;
    }

    /**
     * Returns the Athenz resource. It is the path of the request if no rule matched.
     */
    public String resource() {
        return resource;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TranslatedRequest)) {
            return false;
        }
        final TranslatedRequest that = (TranslatedRequest) o;
        return action.equals(that.action) && resource.equals(that.resource);
    }

    @Override
    public int hashCode() {
        return action.hashCode() * 31 + resource.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("action", action)
                          .add("resource", resource)
                          .toString();
    }
}
