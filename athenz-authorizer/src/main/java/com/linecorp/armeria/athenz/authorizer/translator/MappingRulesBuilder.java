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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;

import com.linecorp.armeria.common.annotation.UnstableApi;

/**
 * A builder for creating {@link MappingRules}. The rules of a domain are kept in the order they are added.
 */
@UnstableApi
public final class MappingRulesBuilder {

    private final Map<String, List<MappingRule>> rules = new LinkedHashMap<>();

    MappingRulesBuilder() {}

    /**
     * Adds a {@link MappingRule} to the specified {@code domain}.
     *
     * @see MappingRule#of(String, String, String, String)
     */
    public MappingRulesBuilder rule(String domain, String method, String path, String action,
                                    String resource) {
        return rule(domain, MappingRule.of(method, path, action, resource));
    }

    /**
     * Adds the specified {@link MappingRule} to the specified {@code domain}.
     */
    public MappingRulesBuilder rule(String domain, MappingRule rule) {
        requireNonNull(rule, "rule");
        return rules(domain, ImmutableList.of(rule));
    }

    /**
     * Adds the specified {@link MappingRule}s to the specified {@code domain}. A domain added with no rules
     * is kept, and every request to the domain is translated into its HTTP method and path.
     */
    public MappingRulesBuilder rules(String domain, Iterable<MappingRule> rules) {
        requireNonNull(domain, "domain");
        requireNonNull(rules, "rules");
        final List<MappingRule> domainRules = this.rules.computeIfAbsent(domain, unused -> new ArrayList<>());
        for (MappingRule rule : rules) {
            domainRules.add(requireNonNull(rule, "rules contains null"));
        }
        return this;
    }

    /**
     * Returns newly-created {@link MappingRules} based on the rules added so far.
     *
     * @throws InvalidMappingRuleException if any of the rules is invalid
     */
    public MappingRules build() {
        return MappingRules.of(rules);
    }
}
