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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A numbering algorithm. Each variant maps a value to its core representation, without padding,
 * negative affixes, prefix or suffix, and returns null when it cannot represent the value.
 */
public sealed interface CounterSystem
        permits CounterSystem.Numeric,
                CounterSystem.Alphabetic,
                CounterSystem.Additive,
                CounterSystem.Symbolic,
                CounterSystem.Cyclic,
                CounterSystem.Fixed,
                CounterSystem.Chinese,
                CounterSystem.Ethiopic {

    /** Returns the core representation of {@code count}, or null if it is unrepresentable. */
    String formatCore(int count);

    /** The range applied when a style declares none. */
    CounterRange defaultRange();

    /** Whether negative values are formatted as their absolute value inside negative affixes. */
    default boolean usesNegative() {
        return true;
    }

    /** Positional notation in base {@code symbols.size()}. */
    record Numeric(List<String> symbols) implements CounterSystem {
        public Numeric {
            symbols = requireSymbols(symbols, 2, "numeric");
        }

        @Override
        public String formatCore(int count) {
            if (count < 0) return null;
            if (count == 0) return symbols.get(0);
            int base = symbols.size();
            List<String> digits = new ArrayList<>();
            while (count > 0) {
                digits.add(symbols.get(count % base));
                count /= base;
            }
            return reversed(digits);
        }

        @Override
        public CounterRange defaultRange() {
            return CounterRange.UNBOUNDED;
        }
    }

    /** Bijective base-N notation, with no symbol for zero. */
    record Alphabetic(List<String> symbols) implements CounterSystem {
        public Alphabetic {
            symbols = requireSymbols(symbols, 2, "alphabetic");
        }

        @Override
        public String formatCore(int count) {
            if (count < 1) return null;
            int base = symbols.size();
            List<String> digits = new ArrayList<>();
            while (count > 0) {
                digits.add(symbols.get((count - 1) % base));
                count = (count - 1) / base;
            }
            return reversed(digits);
        }

        @Override
        public CounterRange defaultRange() {
            return CounterRange.POSITIVE;
        }
    }

    /** Sign-value notation: symbols with weights, taken greedily from the heaviest. */
    record Additive(List<Weighted> symbols) implements CounterSystem {
        public record Weighted(int weight, String symbol) {
            public Weighted {
                if (weight < 0) {
                    throw new IllegalArgumentException("Additive weight must be non-negative");
                }
            }
        }

        public Additive {
            if (symbols == null || symbols.isEmpty()) {
                throw new IllegalArgumentException("additive system needs at least one symbol");
            }
            List<Weighted> sorted = new ArrayList<>(symbols);
            sorted.sort(Comparator.comparingInt(Weighted::weight).reversed());
            symbols = List.copyOf(sorted);
        }

        @Override
        public String formatCore(int count) {
            if (count < 0) return null;
            if (count == 0) {
                Weighted last = symbols.get(symbols.size() - 1);
                return last.weight() == 0 ? last.symbol() : null;
            }
            StringBuilder sb = new StringBuilder();
            int remaining = count;
            for (Weighted w : symbols) {
                if (w.weight() == 0 || w.weight() > remaining) continue;
                int reps = remaining / w.weight();
                sb.append(w.symbol().repeat(reps));
                remaining -= reps * w.weight();
                if (remaining == 0) break;
            }
            return remaining == 0 && sb.length() > 0 ? sb.toString() : null;
        }

        @Override
        public CounterRange defaultRange() {
            return CounterRange.NON_NEGATIVE;
        }
    }

    /** Cycles through the symbols, repeating each one more time on every pass. */
    record Symbolic(List<String> symbols) implements CounterSystem {
        public Symbolic {
            symbols = requireSymbols(symbols, 1, "symbolic");
        }

        @Override
        public String formatCore(int count) {
            if (count < 1) return null;
            int n = symbols.size();
            return symbols.get((count - 1) % n).repeat((count - 1) / n + 1);
        }

        @Override
        public CounterRange defaultRange() {
            return CounterRange.POSITIVE;
        }
    }

    /** Cycles through the symbols without repetition. */
    record Cyclic(List<String> symbols) implements CounterSystem {
        public Cyclic {
            symbols = requireSymbols(symbols, 1, "cyclic");
        }

        @Override
        public String formatCore(int count) {
            if (count < 1) return null;
            return symbols.get((count - 1) % symbols.size());
        }

        @Override
        public CounterRange defaultRange() {
            return CounterRange.POSITIVE;
        }

        @Override
        public boolean usesNegative() {
            return false;
        }
    }

    /** A finite list of symbols, the first standing for {@code firstValue}; no wraparound. */
    record Fixed(List<String> symbols, int firstValue) implements CounterSystem {
        public Fixed {
            symbols = requireSymbols(symbols, 1, "fixed");
        }

        @Override
        public String formatCore(int count) {
            long index = (long) count - firstValue;
            return index >= 0 && index < symbols.size() ? symbols.get((int) index) : null;
        }

        @Override
        public CounterRange defaultRange() {
            return CounterRange.UNBOUNDED;
        }

        @Override
        public boolean usesNegative() {
            return false;
        }
    }

    /**
     * Chinese longhand numbering for values up to 9999: each non-zero digit is followed by its
     * power marker, runs of zero digits collapse into one zero, trailing zeros are dropped, and
     * the leading "one" is omitted for 10 to 19.
     */
    record Chinese(List<String> digits, List<String> powers) implements CounterSystem {
        public Chinese {
            if (digits == null || digits.size() != 10) {
                throw new IllegalArgumentException("chinese system needs 10 digit symbols");
            }
            if (powers == null || powers.size() != 4) {
                throw new IllegalArgumentException("chinese system needs 4 power symbols");
            }
            digits = List.copyOf(digits);
            powers = List.copyOf(powers);
        }

        @Override
        public String formatCore(int count) {
            if (count < 0 || count > 9999) return null;
            if (count == 0) return digits.get(0);

            String decimal = Integer.toString(count);
            int len = decimal.length();
            List<String> parts = new ArrayList<>();
            boolean lastWasZero = false;
            for (int i = 0; i < len; i++) {
                int digit = decimal.charAt(i) - '0';
                int power = len - 1 - i;
                if (digit == 0) {
                    if (!lastWasZero) parts.add(digits.get(0));
                    lastWasZero = true;
                } else {
                    if (!(count >= 10 && count <= 19 && power == 1)) {
                        parts.add(digits.get(digit));
                    }
                    parts.add(powers.get(power));
                    lastWasZero = false;
                }
            }
            while (!parts.isEmpty() && parts.get(parts.size() - 1).equals(digits.get(0))) {
                parts.remove(parts.size() - 1);
            }
            return String.join("", parts);
        }

        @Override
        public CounterRange defaultRange() {
            return new CounterRange(-9999, 9999);
        }
    }

    /**
     * Ethiopic numbering: the value is split into two-digit groups, joined by the hundred marker
     * after odd-numbered groups and the myriad marker after even-numbered ones.
     */
    record Ethiopic(List<String> units, List<String> tens, String hundred, String myriad)
            implements CounterSystem {
        public Ethiopic {
            if (units == null || units.size() != 9 || tens == null || tens.size() != 9) {
                throw new IllegalArgumentException(
                        "ethiopic system needs 9 unit and 9 ten symbols");
            }
            units = List.copyOf(units);
            tens = List.copyOf(tens);
        }

        @Override
        public String formatCore(int count) {
            if (count < 1) return null;
            if (count == 1) return units.get(0);

            List<Integer> groups = new ArrayList<>();
            for (int n = count; n > 0; n /= 100) {
                groups.add(n % 100);
            }

            StringBuilder sb = new StringBuilder();
            for (int index = groups.size() - 1; index >= 0; index--) {
                int value = groups.get(index);
                boolean odd = index % 2 == 1;
                boolean mostSignificant = index == groups.size() - 1;
                boolean dropDigits = value == 0 || (value == 1 && (mostSignificant || odd));
                if (!dropDigits) {
                    if (value / 10 > 0) sb.append(tens.get(value / 10 - 1));
                    if (value % 10 > 0) sb.append(units.get(value % 10 - 1));
                }
                if (odd && value != 0) {
                    sb.append(hundred);
                } else if (!odd && index > 0) {
                    sb.append(myriad);
                }
            }
            return sb.toString();
        }

        @Override
        public CounterRange defaultRange() {
            return CounterRange.POSITIVE;
        }

        @Override
        public boolean usesNegative() {
            return false;
        }
    }

    private static List<String> requireSymbols(List<String> symbols, int min, String system) {
        if (symbols == null || symbols.size() < min) {
            throw new IllegalArgumentException(
                    system + " system needs at least " + min + " symbol(s)");
        }
        return List.copyOf(symbols);
    }

    private static String reversed(List<String> digits) {
        StringBuilder sb = new StringBuilder();
        for (int i = digits.size() - 1; i >= 0; i--) {
            sb.append(digits.get(i));
        }
        return sb.toString();
    }
}
