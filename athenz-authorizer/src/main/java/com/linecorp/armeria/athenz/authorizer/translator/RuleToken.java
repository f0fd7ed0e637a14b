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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.linecorp.armeria.common.annotation.Nullable;

/**
 * A compiled path segment or query value of a {@link MappingRule}. A token is either a literal, which must be
 * equal to the requested value, or a placeholder, which captures whatever value is requested.
 */
abstract class RuleToken {

    private static final RuleToken EMPTY_LITERAL = new Literal("");

    static RuleToken literal(String value) {
        requireNonNull(value, "value");
        if (value.isEmpty()) {
            return EMPTY_LITERAL;
        }
        return new Literal(value);
    }

    /**
     * Returns a placeholder token. The {@code name} keeps its braces, e.g. {@code "{id}"}, because resource
     * templates refer to it in the same form.
     */
    static RuleToken placeholder(String name) {
        requireNonNull(name, "name");
        checkArgument(isPlaceholder(name), "name: %s (expected: {<name>})", name);
        return new Placeholder(name);
    }

    /**
     * Returns whether the specified raw token is written as {@code {<name>}} with a non-empty name.
     * {@code "{}"} is not a placeholder.
     */
    static boolean isPlaceholder(String token) {
        return token.length() > 2 && token.charAt(0) == '{' && token.charAt(token.length() - 1) == '}';
    }

    private RuleToken() {}

    abstract boolean isPlaceholder();

    /**
     * Returns the literal value or the placeholder name.
     */
    abstract String text();

    @Override
    public final boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RuleToken)) {
            return false;
        }
        final RuleToken that = (RuleToken) o;
        return isPlaceholder() == that.isPlaceholder() && text().equals(that.text());
    }

    @Override
    public final int hashCode() {
        return text().hashCode() * 31 + (isPlaceholder() ? 1 : 0);
    }

    private static final class Literal extends RuleToken {

        private final String value;

        Literal(String value) {
            this.value = value;
        }

        @Override
        boolean isPlaceholder() {
            return false;
        }

        @Override
        String text() {
            return value;
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }

    private static final class Placeholder extends RuleToken {

        private final String name;

        Placeholder(String name) {
            this.name = name;
        }

        @Override
        boolean isPlaceholder() {
            return true;
        }

        @Override
        String text() {
            return name;
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
