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

/** An inclusive range of counter values; a null bound means unbounded on that side. */
public record CounterRange(Integer min, Integer max) {
    public static final CounterRange UNBOUNDED = new CounterRange(null, null);
    public static final CounterRange POSITIVE = new CounterRange(1, null);
    public static final CounterRange NON_NEGATIVE = new CounterRange(0, null);

    public CounterRange {
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("Range minimum " + min + " exceeds maximum " + max);
        }
    }

    public boolean contains(int value) {
        return (min == null || value >= min) && (max == null || value <= max);
    }
}
