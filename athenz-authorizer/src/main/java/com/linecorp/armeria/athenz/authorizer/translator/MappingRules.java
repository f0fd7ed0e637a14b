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

import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import com.linecorp.armeria.common.QueryParams;
import com.linecorp.armeria.common.annotation.Nullable;
import com.linecorp.armeria.common.annotation.UnstableApi;

/**
 * A compiled set of {@link MappingRule}s per Athenz domain, which translates a request into
 * the Athenz action and resource that an access check is performed against.
 *
 * <p>{@link MappingRules} is immutable and can be shared by multiple threads. Build a new instance and
 * replace the old one when the rules are updated.
 */
@UnstableApi
public final class MappingRules {

    private static final Logger logger = LoggerFactory.getLogger(MappingRules.class);

    private static final MappingRules EMPTY = new MappingRules(ImmutableMap.of());

    /**
     * Returns the {@link MappingRules} without any rules. Every request is translated into its HTTP method
     * and path.
     */
    public static MappingRules empty() {
        return EMPTY;
    }

    /**
     * Returns a new {@link MappingRulesBuilder}.
     */
    public static MappingRulesBuilder builder() {
        return new MappingRulesBuilder();
    }

    /**
     * Validates and compiles the specified {@link MappingRule}s keyed by Athenz domain. The order of the
     * rules in a domain is preserved and decides which rule wins when more than one rule matches a request.
     *
     * @throws InvalidMappingRuleException if a domain is empty, the rules of a domain are {@code null}
     *                                     or any of the rules is malformed. The first error is raised and
     *                                     no rule is compiled.
     */
    public static MappingRules of(Map<String, ? extends List<MappingRule>> rules) {
        requireNonNull(rules, "rules");
        final ImmutableMap.Builder<String, List<CompiledRule>> builder =
                ImmutableMap.builderWithExpectedSize(rules.size());
        for (Entry<String, ? extends List<MappingRule>> entry : rules.entrySet()) {
            final String domain = entry.getKey();
            if (Strings.isNullOrEmpty(domain)) {
                throw new InvalidMappingRuleException("domain is empty");
            }
            final List<MappingRule> domainRules = entry.getValue();
            if (domainRules == null) {
                throw new InvalidMappingRuleException("rules is nil");
            }

            final ImmutableList.Builder<CompiledRule> compiled =
                    ImmutableList.builderWithExpectedSize(domainRules.size());
            for (MappingRule rule : domainRules) {
                requireNonNull(rule, "rules contains null");
                compiled.add(CompiledRule.compile(rule));
            }
            builder.put(domain, compiled.build());
            logger.debug("Compiled {} mapping rule(s) for domain({})", domainRules.size(), domain);
        }
        return new MappingRules(builder.build());
    }

    private final Map<String, List<CompiledRule>> rules;

    private MappingRules(Map<String, List<CompiledRule>> rules) {
        this.rules = rules;
    }

    /**
     * Returns the Athenz domains which have rules.
     */
    public Set<String> domains() {
        return rules.keySet();
    }

    /**
     * Returns the compiled rules of the specified domain in their original order.
     */
    List<CompiledRule> rules(String domain) {
        final List<CompiledRule> domainRules = rules.get(domain);
        return domainRules != null ? domainRules : ImmutableList.of();
    }

    /**
     * Translates a request into an Athenz action and resource.
     *
     * <p>The rules of the {@code domain} are tried in their original order and the first rule that matches
     * the {@code method}, the {@code path} and the {@code query} is used. The action of the rule is returned
     * as it is and the placeholders in its resource are replaced with the captured path segments and query
     * values. If no rule matches, the {@code method} and the {@code path} are returned as the action and
     * the resource respectively.
     *
     * @param domain the Athenz domain
     * @param method the HTTP method of the request
     * @param path the path of the request, without the query
     * @param query the query of the request without the leading {@code '?'}, or {@code null}
     */
    public TranslatedRequest translate(String domain, String method, String path, @Nullable String query) {
        requireNonNull(domain, "domain");
        requireNonNull(method, "method");
        requireNonNull(path, "path");

        final List<CompiledRule> domainRules = rules.get(domain);
        if (domainRules == null || domainRules.isEmpty()) {
            logger.trace("No mapping rules for domain({}). method: {}, path: {}", domain, method, path);
            return TranslatedRequest.of(method, path);
        }

        final List<String> pathSegments = CompiledRule.PATH_SPLITTER.splitToList(path);
        final QueryParams queryParams = QueryParams.fromQueryString(query);
        for (CompiledRule rule : domainRules) {
            final Map<String, String> captured = rule.match(method, pathSegments, queryParams);
            if (captured != null) {
                return TranslatedRequest.of(rule.action(), rule.renderResource(captured));
            }
        }

        logger.trace("No mapping rule matched in domain({}). method: {}, path: {}, query: {}",
                     domain, method, path, query);
        return TranslatedRequest.of(method, path);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("rules", rules)
                          .toString();
    }
}
