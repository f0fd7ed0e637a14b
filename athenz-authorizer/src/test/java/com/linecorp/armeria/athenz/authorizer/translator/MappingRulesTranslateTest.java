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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.google.common.collect.ImmutableList;

class MappingRulesTranslateTest {

    private static MappingRules singleRule(String method, String path, String action, String resource) {
        return MappingRules.builder()
                           .rule("domain", method, path, action, resource)
                           .build();
    }

    @Test
    void pathMatches() {
        final MappingRules rules = singleRule("get", "/path1/path2", "read", "resource");
        assertThat(rules.translate("domain", "get", "/path1/path2", ""))
                .isEqualTo(TranslatedRequest.of("read", "resource"));
    }

    @Test
    void domainDidNotMatch() {
        final MappingRules rules = singleRule("get", "/path1/path2", "read", "resource");
        assertThat(rules.translate("domain1", "get", "/path1/path2", ""))
                .isEqualTo(TranslatedRequest.of("get", "/path1/path2"));
    }

    @Test
    void methodDidNotMatch() {
        final MappingRules rules = singleRule("get", "/path1/path2", "read", "resource");
        assertThat(rules.translate("domain", "post", "/path1/path2", ""))
                .isEqualTo(TranslatedRequest.of("post", "/path1/path2"));
        // Methods are compared case-sensitively.
        assertThat(rules.translate("domain", "GET", "/path1/path2", ""))
                .isEqualTo(TranslatedRequest.of("GET", "/path1/path2"));
    }

    @Test
    void noRules() {
        assertThat(MappingRules.empty().translate("domain", "get", "/path1/path2", null))
                .isEqualTo(TranslatedRequest.of("get", "/path1/path2"));
        final MappingRules rules = MappingRules.builder()
                                               .rules("domain", ImmutableList.of())
                                               .build();
        assertThat(rules.translate("domain", "get", "/path1/path2", null))
                .isEqualTo(TranslatedRequest.of("get", "/path1/path2"));
    }

    @Test
    void pathWithPlaceholder() {
        final MappingRules rules = singleRule("get", "/path1/{placeholder1}/path3", "read",
                                              "resource.{placeholder1}");
        final TranslatedRequest translated = rules.translate("domain", "get", "/path1/path2/path3", "");
        assertThat(translated.action()).isEqualTo("read");
        assertThat(translated.resource()).isEqualTo("resource.path2");
    }

    @Test
    void pathWithConsecutivePlaceholders() {
        final MappingRules rules = singleRule("get", "/{placeholder1}/{placeholder2}", "read",
                                              "resource.{placeholder1}.{placeholder2}");
        assertThat(rules.translate("domain", "get", "/path1/path2", ""))
                .isEqualTo(TranslatedRequest.of("read", "resource.path1.path2"));
    }

    @Test
    void placeholderUsedMoreThanOnce() {
        final MappingRules rules = singleRule("get", "/path1/{placeholder1}/path3", "read",
                                              "resource.{placeholder1}.{placeholder1}.{placeholder1}");
        assertThat(rules.translate("domain", "get", "/path1/path2/path3", ""))
                .isEqualTo(TranslatedRequest.of("read", "resource.path2.path2.path2"));
    }

    @Test
    void pathAndQueryWithPlaceholders() {
        final MappingRules rules = singleRule("get", "/path1/{placeholder1}?param1=value1&param2={placeholder2}",
                                              "read", "resource.{placeholder1}.{placeholder2}");
        assertThat(rules.translate("domain", "get", "/path1/path2", "param2=value2&param1=value1"))
                .isEqualTo(TranslatedRequest.of("read", "resource.path2.value2"));
    }

    @Test
    void queryPlaceholdersOnly() {
        final MappingRules rules = singleRule(
                "get", "/path1/{placeholder1}?param1={placeholder2}&param2={placeholder3}",
                "read", "resource.{placeholder1}.{placeholder2}.{placeholder3}");
        assertThat(rules.translate("domain", "get", "/path1/path2", "param2=value2&param1=value1"))
                .isEqualTo(TranslatedRequest.of("read", "resource.path2.value1.value2"));
    }

    @Test
    void roundTrip() {
        final MappingRules rules = singleRule("M", "/a/{x}/b?q={y}", "act", "{x}:{y}:{x}");
        assertThat(rules.translate("domain", "M", "/a/VAL/b", "q=QV"))
                .isEqualTo(TranslatedRequest.of("act", "VAL:QV:VAL"));
    }

    @Test
    void actionIsNotRendered() {
        final MappingRules rules = singleRule("get", "/users/{id}", "read.{id}", "user.{id}");
        assertThat(rules.translate("domain", "get", "/users/alice", null))
                .isEqualTo(TranslatedRequest.of("read.{id}", "user.alice"));
    }

    @Test
    void capturedValueIsNotRenderedAgain() {
        final MappingRules rules = singleRule("get", "/{a}/{b}", "read", "{a}.{b}.{unknown}");
        assertThat(rules.translate("domain", "get", "/{b}/x", null))
                .isEqualTo(TranslatedRequest.of("read", "{b}.x.{unknown}"));
    }

    @Test
    void queryValueIsDecoded() {
        final MappingRules rules = singleRule("get", "/search?q={q}", "read", "search.{q}");
        assertThat(rules.translate("domain", "get", "/search", "q=a%20b"))
                .isEqualTo(TranslatedRequest.of("read", "search.a b"));
    }

    @Test
    void questionMarkInQueryValue() {
        final MappingRules rules = singleRule("get", "/path1?param1=value1?&param2=value2", "read", "resource");
        assertThat(rules.translate("domain", "get", "/path1", "param1=value1?&param2=value2"))
                .isEqualTo(TranslatedRequest.of("read", "resource"));
    }

    @Test
    void emptyQueryKey() {
        final MappingRules rules = singleRule("get", "/path1?=value", "read", "resource");
        assertThat(rules.translate("domain", "get", "/path1", "=value"))
                .isEqualTo(TranslatedRequest.of("read", "resource"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            // the path lengths are not equal
            "/path1/{placeholder1}  | /path1        | ''",
            // path didn't match
            "/{placeholder1}/path3  | /path1/path2  | ''",
            // the query lengths are not equal
            "/path1?param1=value1&param2={placeholder2} | /path1 | param1=value1",
            // a query parameter is given more than once
            "/path1?param1=value1   | /path1        | param1=value1&param1=value2",
            // query key didn't match
            "/path1?param2=value2   | /path1        | param1=value1",
            // query value didn't match
            "/path1?param1=value2   | /path1        | param1=value1",
            // a request with an extra query parameter
            "/path1                 | /path1        | param1=value1",
            // request path is empty
            "/path1?param1=value1   | ''            | param1=value1",
            // request path is a slash
            "/path1?param1=value1   | /             | param1=value1",
    })
    void fallsBackToMethodAndPath(String rulePath, String path, String query) {
        final MappingRules rules = singleRule("get", rulePath, "read", "resource");
        assertThat(rules.translate("domain", "get", path, query))
                .isEqualTo(TranslatedRequest.of("get", path));
    }

    @Test
    void firstMatchingRuleWins() {
        final MappingRules rules = MappingRules.builder()
                                               .rule("domain", "get", "/users/{id}", "read", "user.{id}")
                                               .rule("domain", "get", "/users/me", "read", "me")
                                               .rule("domain", "get", "/users/{name}", "list", "users")
                                               .build();
        assertThat(rules.translate("domain", "get", "/users/me", null))
                .isEqualTo(TranslatedRequest.of("read", "user.me"));
    }

    @Test
    void translatesPerDomain() {
        final MappingRules rules = MappingRules.builder()
                                               .rule("domain1", "get", "/items", "read", "items1")
                                               .rule("domain2", "get", "/items", "read", "items2")
                                               .build();
        assertThat(rules.translate("domain1", "get", "/items", null).resource()).isEqualTo("items1");
        assertThat(rules.translate("domain2", "get", "/items", null).resource()).isEqualTo("items2");
    }

    @Test
    void idempotent() {
        final MappingRules rules = singleRule("get", "/path1/{placeholder1}?param1={placeholder2}", "read",
                                              "resource.{placeholder1}.{placeholder2}");
        final TranslatedRequest first = rules.translate("domain", "get", "/path1/path2", "param1=value1");
        final TranslatedRequest second = rules.translate("domain", "get", "/path1/path2", "param1=value1");
        assertThat(first).isEqualTo(second)
                         .isEqualTo(TranslatedRequest.of("read", "resource.path2.value1"));
    }

    @Test
    void concurrentTranslation() {
        final MappingRules rules = singleRule("get", "/users/{id}", "read", "user.{id}");
        final List<CompletableFuture<TranslatedRequest>> futures =
                IntStream.range(0, 64)
                         .mapToObj(i -> CompletableFuture.supplyAsync(
                                 () -> rules.translate("domain", "get", "/users/" + i, null)))
                         .collect(Collectors.toList());
        final Map<Integer, String> resources = new HashMap<>();
        for (int i = 0; i < futures.size(); i++) {
            resources.put(i, futures.get(i).join().resource());
        }
        for (int i = 0; i < futures.size(); i++) {
            assertThat(resources.get(i)).isEqualTo("user." + i);
        }
    }
}
