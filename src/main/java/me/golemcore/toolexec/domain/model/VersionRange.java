package me.golemcore.toolexec.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * npm-style version range used in capability grants and invoke requests.
 *
 * <p>
 * Supported forms: {@code *}, exact {@code 1.2.3}, wildcards {@code 1.x} and
 * {@code 1.2.x}, caret {@code ^1.2.0}, tilde {@code ~1.2.0}, and
 * space-separated comparator sets such as {@code >=1.0.0 <2.0.0}.
 */
public final class VersionRange {

    private final String expression;
    private final List<Comparator> comparators;

    private VersionRange(String expression, List<Comparator> comparators) {
        this.expression = expression;
        this.comparators = comparators;
    }

    public static VersionRange parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Version range must not be blank");
        }
        String trimmed = expression.trim();
        List<Comparator> comparators = new ArrayList<>();
        for (String token : trimmed.split("\\s+")) {
            comparators.addAll(parseToken(token));
        }
        return new VersionRange(trimmed, List.copyOf(comparators));
    }

    /**
     * True when {@code expression} names exactly one version rather than a
     * range.
     */
    public static boolean isExact(String expression) {
        return expression != null && SemanticVersion.isValid(expression)
                && !expression.toLowerCase(Locale.ROOT).contains("x");
    }

    public boolean matches(String version) {
        return matches(SemanticVersion.parse(version));
    }

    public boolean matches(SemanticVersion version) {
        for (Comparator comparator : comparators) {
            if (!comparator.test(version)) {
                return false;
            }
        }
        return true;
    }

    public String expression() {
        return expression;
    }

    @Override
    public String toString() {
        return expression;
    }

    private static List<Comparator> parseToken(String token) {
        String lower = token.toLowerCase(Locale.ROOT);
        if ("*".equals(lower) || "x".equals(lower)) {
            return List.of();
        }
        if (lower.startsWith("^")) {
            SemanticVersion base = SemanticVersion.parse(lower.substring(1));
            SemanticVersion upper;
            if (base.major() > 0) {
                upper = new SemanticVersion(base.major() + 1, 0, 0, null);
            } else if (base.minor() > 0) {
                upper = new SemanticVersion(0, base.minor() + 1, 0, null);
            } else {
                upper = new SemanticVersion(0, 0, base.patch() + 1, null);
            }
            return List.of(new Comparator(Op.GTE, base), new Comparator(Op.LT, upper));
        }
        if (lower.startsWith("~")) {
            SemanticVersion base = SemanticVersion.parse(lower.substring(1));
            SemanticVersion upper = new SemanticVersion(base.major(), base.minor() + 1, 0, null);
            return List.of(new Comparator(Op.GTE, base), new Comparator(Op.LT, upper));
        }
        if (lower.contains("x") || lower.contains("*")) {
            return parseWildcard(lower);
        }
        for (Op op : Op.values()) {
            if (op != Op.EQ && lower.startsWith(op.symbol)) {
                return List.of(new Comparator(op, SemanticVersion.parse(lower.substring(op.symbol.length()))));
            }
        }
        String exact = lower.startsWith("=") ? lower.substring(1) : lower;
        return List.of(new Comparator(Op.EQ, SemanticVersion.parse(exact)));
    }

    private static List<Comparator> parseWildcard(String token) {
        String[] parts = token.split("\\.");
        int major = Integer.parseInt(parts[0]);
        if (parts.length < 2 || isWildcard(parts[1])) {
            return List.of(
                    new Comparator(Op.GTE, new SemanticVersion(major, 0, 0, null)),
                    new Comparator(Op.LT, new SemanticVersion(major + 1, 0, 0, null)));
        }
        int minor = Integer.parseInt(parts[1]);
        return List.of(
                new Comparator(Op.GTE, new SemanticVersion(major, minor, 0, null)),
                new Comparator(Op.LT, new SemanticVersion(major, minor + 1, 0, null)));
    }

    private static boolean isWildcard(String part) {
        return "x".equals(part) || "*".equals(part);
    }

    private enum Op {
        // longest symbols first so ">=" is not read as ">"
        GTE(">="), LTE("<="), GT(">"), LT("<"), EQ("=");

        private final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }
    }

    private record Comparator(Op op, SemanticVersion bound) {
        boolean test(SemanticVersion version) {
            int cmp = version.compareTo(bound);
            return switch (op) {
            case GTE -> cmp >= 0;
            case LTE -> cmp <= 0;
            case GT -> cmp > 0;
            case LT -> cmp < 0;
            case EQ -> cmp == 0;
            };
        }
    }
}
