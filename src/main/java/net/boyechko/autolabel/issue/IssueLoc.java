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
package net.boyechko.autolabel.issue;

/** Represents the location of a labelling issue in the document tree. */
public sealed interface IssueLoc {
    record None() implements IssueLoc {}

    record AtNode(String path, String tag, String id) implements IssueLoc {}

    static IssueLoc none() {
        return new None();
    }

    static IssueLoc atNode(String path, String tag, String id) {
        return new AtNode(path, tag, id);
    }

    /** Returns a short human-readable description, or an empty string if there is no location. */
    default String describe() {
        if (this instanceof AtNode at) {
            return at.id() != null ? at.path() + " (#" + at.id() + ")" : at.path();
        }
        return "";
    }
}
