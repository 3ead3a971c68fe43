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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** YAML-bound table of counter style definitions, keyed by style name. */
public final class CounterStyleTable {
    public Map<String, Definition> styles;
    public Map<String, String> aliases;

    public CounterStyleTable() {
        this.styles = new LinkedHashMap<>();
        this.aliases = new LinkedHashMap<>();
    }

    public static final class Definition {
        /**
         * One of numeric, alphabetic, additive, symbolic, cyclic, fixed, chinese or ethiopic. May
         * be omitted when {@code base} is given.
         */
        public String system;

        /** Name of a style whose settings this one starts from. */
        public String base;

        public List<String> symbols;
        public Map<Integer, String> additive_symbols;

        /** First value of a fixed system (default 1). */
        public Integer first;

        /** Power markers (units, tens, hundreds, thousands) of a chinese system. */
        public List<String> power_symbols;

        /** Tens digits, hundred marker and myriad marker of an ethiopic system. */
        public List<String> tens_symbols;

        public String hundred_symbol;
        public String myriad_symbol;

        public String fallback;
        public List<String> negative;
        public String prefix;
        public String suffix;
        public Integer range_min;
        public Integer range_max;
        public Integer pad_width;
        public String pad_symbol;
    }
}
