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

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import com.linecorp.armeria.common.QueryParams;
import com.linecorp.armeria.common.annotation.Nullable;

/**
 * The compiled form of a {@link MappingRule}.
 */
final class CompiledRule {

    static final Splitter PATH_SPLITTER = Splitter.on('/');

    private static final Splitter QUERY_SPLITTER = Splitter.on('&').omitEmptyStrings();

    /**
     * Compiles the specified {@link MappingRule}.
     *
     * @throws InvalidMappingRuleException if the {@link MappingRule} is malformed
     */
    static CompiledRule compile(MappingRule rule) {
        final String method = rule.method();
        final String path = rule.path();
        final String action = rule.action();
        final String resource = rule.resource();

        if (method.isEmpty() || path.isEmpty() || action.isEmpty() || resource.isEmpty()) {
            throw new InvalidMappingRuleException(String.format(
                    "rule is empty, method:%s, path:%s, action:%s, resource:%s",
                    method, path, action, resource));
        }
        if (path.charAt(0) != '/') {
            throw new InvalidMappingRuleException("path(" + path + ") doesn't start with slash");
        }
        if ("/".equals(path)) {
            throw new InvalidMappingRuleException("path is slash only");
        }

        // Path and query share one placeholder namespace.
        final Set<String> placeholders = new HashSet<>();

        // Only the first '?' separates the query, so that a query value may contain '?'.
        final int queryStart = path.indexOf('?');
        final String pathPart = queryStart < 0 ? path : path.substring(0, queryStart);

        final ImmutableList.Builder<RuleToken> pathTokens = ImmutableList.builder();
        for (String segment : PATH_SPLITTER.split(pathPart)) {
            pathTokens.add(toToken(segment, placeholders));
        }

        final Map<String, RuleToken> queryTokens = new LinkedHashMap<>();
        if (queryStart >= 0) {
            for (String pair : QUERY_SPLITTER.split(path.substring(queryStart + 1))) {
                final int valueStart = pair.indexOf('=');
                final String key;
                final String value;
                if (valueStart < 0) {
                    key = pair;
                    value = "";
                } else {
                    key = pair.substring(0, valueStart);
                    value = pair.substring(valueStart + 1);
                }
                if (queryTokens.containsKey(key)) {
                    throw new InvalidMappingRuleException("query multiple values is not allowed");
                }
                queryTokens.put(key, toToken(value, placeholders));
            }
        }

        return new CompiledRule(method, pathTokens.build(), ImmutableMap.copyOf(queryTokens),
                                action, resource);
    }

    private static RuleToken toToken(String raw, Set<String> placeholders) {
        if ("{}".equals(raw)) {
            throw new InvalidMappingRuleException("placeholder is empty");
        }
        if (!RuleToken.isPlaceholder(raw)) {
            return RuleToken.literal(raw);
        }
        if (!placeholders.add(raw)) {
            throw new InvalidMappingRuleException("placeholder(" + raw + ") is duplicated");
        }
        return RuleToken.placeholder(raw);
    }

    private final String method;
    private final List<RuleToken> pathTokens;
    private final Map<String, RuleToken> queryTokens;
    private final String action;
    private final String resource;

    CompiledRule(String method, List<RuleToken> pathTokens, Map<String, RuleToken> queryTokens,
                 String action, String resource) {
        this.method = method;
        this.pathTokens = pathTokens;
        this.queryTokens = queryTokens;
        this.action = action;
        this.resource = resource;
    }

    String method() {
        return method;
    }

    List<RuleToken> pathTokens() {
        return pathTokens;
    }

    Map<String, RuleToken> queryTokens() {
        return queryTokens;
    }

    String action() {
        return action;
    }

    String resource() {
        return resource;
    }

    /**
     * Matches the request against this rule.
     *
     * @param pathSegments the request path split by {@code '/'}
     * @return the captured values keyed by placeholder name, or {@code null} if the request does not match
     */
    @Nullable
    Map<String, String> match(String method, List<String> pathSegments, QueryParams queryParams) {
        if (!this.method.equals(method)) {
            return null;
        }
        if (pathTokens.size() != pathSegments.size()) {
            return null;
        }
        if (queryTokens.size() != queryParams.names().size()) {
            return null;
        }

        final Map<String, String> captured = new HashMap<>();
        for (int i = 0; i < pathTokens.size(); i++) {
            final RuleToken token = pathTokens.get(i);
            final String segment = pathSegments.get(i);
            if (token.isPlaceholder()) {
                captured.put(token.text(), segment);
            } else if (!token.text().equals(segment)) {
                return null;
            }
        }

        for (Entry<String, RuleToken> entry : queryTokens.entrySet()) {
            final List<String> values = queryParams.getAll(entry.getKey());
            // A parameter given more than once is ambiguous.
            if (values.size() != 1) {
                return null;
            }
            final RuleToken token = entry.getValue();
            final String value = values.get(0);
            if (token.isPlaceholder()) {
                captured.put(token.text(), value);
            } else if (!token.text().equals(value)) {
                return null;
            }
        }
        return captured;
    }

    /**
     * Substitutes every placeholder in the resource template with its captured value. The template is
     * scanned once, so a captured value is never substituted again.
     */
    String renderResource(Map<String, String> captured) {
        if (captured.isEmpty()) {
            return resource;
        }

        final StringBuilder buf = new StringBuilder(resource.length());
        int i = 0;
        while (i < resource.length()) {
            final char ch = resource.charAt(i);
            if (ch == '{') {
                final int end = resource.indexOf('}', i + 1);
                if (end > 0) {
                    final String value = captured.get(resource.substring(i, end + 1));
                    if (value != null) {
                        buf.append(value);
                        i = end + 1;
                        continue;
                    }
                }
            }
            buf.append(ch);
            i++;
        }
        return buf.toString();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("method", method)
                          .add("pathTokens", pathTokens)
                          .add("queryTokens", queryTokens)
                          .add("action", action)
                          .add("resource", resource)
                          .toString();
    }
}
