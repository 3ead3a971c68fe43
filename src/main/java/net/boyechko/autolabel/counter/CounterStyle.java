/*
 * AutoLabel - Counter-based labelling for document trees
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.autolabel.counter;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * An immutable rule mapping integers to display strings, modelled on a CSS counter style.
 *
 * <p>Values outside the style's range, or that its system cannot represent, are formatted by the
 * fallback style; without a fallback they degrade to plain signed decimal text. Formatted values
 * are memoised per instance.
 */
public final class CounterStyle {
    private final String cssId;
    private final CounterSystem system;
    private final CounterStyle fallback;
    private final String negativePrefix;
    private final String negativeSuffix;
    private final String prefix;
    private final String suffix;
    private final CounterRange range;
    private final int padWidth;
    private final String padSymbol;

    private final Map<Integer, String> cache = new ConcurrentHashMap<>();

    private CounterStyle(Builder builder) {
        this.cssId = builder.cssId;
        this.system = builder.system;
        this.fallback = builder.fallback;
        this.negativePrefix = builder.negativePrefix;
        this.negativeSuffix = builder.negativeSuffix;
        this.prefix = builder.prefix;
        this.suffix = builder.suffix;
        this.range = builder.range;
        this.padWidth = builder.padWidth;
        this.padSymbol = builder.padSymbol;
    }

    public static Builder builder(String cssId, CounterSystem system) {
        return new Builder(cssId, system);
    }

    public static class Builder {
        private final String cssId;
        private final CounterSystem system;
        private CounterStyle fallback;
        private String negativePrefix = "-";
        private String negativeSuffix = "";
        private String prefix = "";
        private String suffix = "";
        private CounterRange range;
        private int padWidth = 0;
        private String padSymbol = "";

        private Builder(String cssId, CounterSystem system) {
            this.cssId = Objects.requireNonNull(cssId, "cssId");
            this.system = Objects.requireNonNull(system, "system");
        }

        /** Starts from all of {@code base}'s settings except its id. */
        public Builder from(CounterStyle base) {
            this.fallback = base.fallback;
            this.negativePrefix = base.negativePrefix;
            this.negativeSuffix = base.negativeSuffix;
            this.prefix = base.prefix;
            this.suffix = base.suffix;
            this.range = base.range;
            this.padWidth = base.padWidth;
            this.padSymbol = base.padSymbol;
            return this;
        }

        public Builder fallback(CounterStyle fallback) {
            this.fallback = fallback;
            return this;
        }

        public Builder negative(String negativePrefix, String negativeSuffix) {
            this.negativePrefix = Objects.requireNonNull(negativePrefix);
            this.negativeSuffix = Objects.requireNonNull(negativeSuffix);
            return this;
        }

        public Builder prefix(String prefix) {
            this.prefix = Objects.requireNonNull(prefix);
            return this;
        }

        public Builder suffix(String suffix) {
            this.suffix = Objects.requireNonNull(suffix);
            return this;
        }

        /** Sets an inclusive range; either bound may be null. */
        public Builder range(Integer min, Integer max) {
            this.range = new CounterRange(min, max);
            return this;
        }

        public Builder pad(int width, String symbol) {
            if (width < 0) {
                throw new IllegalArgumentException("Pad width must be non-negative");
            }
            this.padWidth = width;
            this.padSymbol = Objects.requireNonNull(symbol);
            return this;
        }

        public CounterStyle build() {
            return new CounterStyle(this);
        }
    }

    public String cssId() {
        return cssId;
    }

    public CounterSystem system() {
        return system;
    }

    public CounterStyle fallback() {
        return fallback;
    }

    public String prefix() {
        return prefix;
    }

    public String suffix() {
        return suffix;
    }

    /** Returns the declared range, or the system's default range if none was declared. */
    public CounterRange range() {
        return range != null ? range : system.defaultRange();
    }

    /** Formats a counter value. Never returns null. */
    public String format(int count) {
        String formatted = cache.get(count);
        if (formatted == null) {
            formatted = formatUncached(count);
            cache.put(count, formatted);
        }
        return formatted;
    }

    private String formatUncached(int count) {
        String core = null;
        if (range().contains(count)) {
            if (count < 0 && system.usesNegative()) {
                // MIN_VALUE has no positive counterpart.
                String digits = count != Integer.MIN_VALUE ? system.formatCore(-count) : null;
                if (digits != null) {
                    int affixLength = length(negativePrefix) + length(negativeSuffix);
                    core = negativePrefix + pad(digits, padWidth - affixLength) + negativeSuffix;
                }
            } else {
                String digits = system.formatCore(count);
                if (digits != null) {
                    core = pad(digits, padWidth);
                }
            }
        }

        if (core == null) {
            return fallback != null ? fallback.format(count) : Integer.toString(count);
        }
        return prefix + core + suffix;
    }

    private String pad(String digits, int width) {
        int missing = width - length(digits);
        return missing > 0 ? padSymbol.repeat(missing) + digits : digits;
    }

    private static int length(String s) {
        return s.codePointCount(0, s.length());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CounterStyle other)) return false;
        return padWidth == other.padWidth
                && cssId.equals(other.cssId)
                && system.equals(other.system)
                && Objects.equals(fallback, other.fallback)
                && negativePrefix.equals(other.negativePrefix)
                && negativeSuffix.equals(other.negativeSuffix)
                && prefix.equals(other.prefix)
                && suffix.equals(other.suffix)
                && Objects.equals(range, other.range)
                && padSymbol.equals(other.padSymbol);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                cssId,
                system,
                fallback,
                negativePrefix,
                negativeSuffix,
                prefix,
                suffix,
                range,
                padWidth,
                padSymbol);
    }

    @Override
    public String toString() {
        return "CounterStyle[" + cssId + "]";
    }
}
