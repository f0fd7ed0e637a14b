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

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;

import com.linecorp.armeria.common.annotation.Nullable;
import com.linecorp.armeria.common.annotation.UnstableApi;

/**
 * An authored mapping from an HTTP method and a path template to an Athenz action and a resource template.
 *
 * <p>The {@code path} may contain a query part after the first {@code '?'}. Path segments and query values
 * written as {@code {name}} are placeholders, and the captured values can be referred from the
 * {@code resource} with the same {@code {name}}. For example:
 * <pre>{@code
 * MappingRule.of("GET", "/users/{id}/posts?sort={order}", "read", "user.{id}.posts.{order}");
 * }</pre>
 *
 * <p>A {@link MappingRule} is not validated until it is compiled into {@link MappingRules}.
 */
@UnstableApi
public final class MappingRule {

    /**
     * Returns a new {@link MappingRule}.
     *
     * @param method the HTTP method which is compared case-sensitively
     * @param path the path template starting with {@code '/'}, optionally followed by a query template
     * @param action the Athenz action
     * @param resource the resource template
     */
    public static MappingRule of(String method, String path, String action, String resource) {
        return new MappingRule(method, path, action, resource);
    }

    private final String method;
    private final String path;
    private final String action;
    private final String resource;

    /**
     * Absent values are bound to an empty string, so that they are reported by the validation of
     * {@link MappingRules}.
     */
    @JsonCreator
    MappingRule(@JsonProperty("method") @Nullable String method,
                @JsonProperty("path") @Nullable String path,
                @JsonProperty("action") @Nullable String action,
                @JsonProperty("resource") @Nullable String resource) {
        this.method = Strings.nullToEmpty(method);
        this.path = Strings.nullToEmpty(path);
        this.action = Strings.nullToEmpty(action);
        this.resource = Strings.nullToEmpty(resource);
    }

    /**
     * Returns the HTTP method.
     */
    @JsonProperty
    public String method() {
        return method;
    }

    /**
     * Returns the path template including the optional query template.
     */
    @JsonProperty
    public String path() {
        return path;
    }

    /**
     * Returns the Athenz action.
     */
    @JsonProperty
    public String action() {
        return action;
    }

    /**
     * Returns the resource template.
     */
    @JsonProperty
    public String resource() {
        return resource;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MappingRule)) {
            return false;
        }
        final MappingRule that = (MappingRule) o;
        return method.equals(that.method) &&
               path.equals(that.path) &&
               action.equals(that.action) &&
               resource.equals(that.resource);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, path, action, resource);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("method", method)
                          .add("path", path)
                          .add("action", action)
                          .add("resource", resource)
                          .toString();
    }
}
