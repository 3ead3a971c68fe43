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
package net.boyechko.autolabel.template;

import java.util.Locale;
import java.util.Objects;

/**
 * Chooses which kind of labeller a template inherits from, or a reference points at.
 *
 * <p>In templates it is written as a parent marker ({@code X}, {@code L}, {@code H}, {@code
 * H1}..{@code H6}); in references as a selector after {@code ##} ({@code x}, {@code l}, {@code h},
 * {@code h1}..{@code h6}, or any other element type such as {@code figure}).
 */
public final class ScopeSelector {
    public enum Kind {
        /** Any numbered labeller. */
        ANY,
        /** A list labeller ({@code ol} or {@code ul}). */
        LIST,
        /** A heading labeller of any level. */
        HEADING,
        /** A heading labeller of one specific level. */
        HEADING_LEVEL,
        /** A labeller for one specific element type. */
        ELEMENT
    }

    public static final ScopeSelector ANY = new ScopeSelector(Kind.ANY, 0, null);
    public static final ScopeSelector LIST = new ScopeSelector(Kind.LIST, 0, null);
    public static final ScopeSelector HEADING = new ScopeSelector(Kind.HEADING, 0, null);

    private final Kind kind;
    private final int level;
    private final String elementType;

    private ScopeSelector(Kind kind, int level, String elementType) {
        this.kind = kind;
        this.level = level;
        this.elementType = elementType;
    }

    public static ScopeSelector headingLevel(int level) {
        if (level < 1 || level > 6) {
            throw new IllegalArgumentException("Heading level must be 1..6, got " + level);
        }
        return new ScopeSelector(Kind.HEADING_LEVEL, level, null);
    }

    public static ScopeSelector element(String elementType) {
        return new ScopeSelector(Kind.ELEMENT, 0, elementType.toLowerCase(Locale.ROOT));
    }

    /**
     * Interprets a parent marker from a template.
     *
     * @return the selector, or null if {@code marker} is not a parent marker
     */
    public static ScopeSelector fromMarker(String marker) {
        String m = marker.toUpperCase(Locale.ROOT);
        return switch (m) {
            case "X" -> ANY;
            case "L" -> LIST;
            case "H" -> HEADING;
            case "H1", "H2", "H3", "H4", "H5", "H6" -> headingLevel(m.charAt(1) - '0');
            default -> null;
        };
    }

    /** Interprets the selector of a {@code ##} reference; null or empty means any. */
    public static ScopeSelector fromReference(String selector) {
        if (selector == null || selector.isEmpty()) {
            return ANY;
        }
        ScopeSelector marker = fromMarker(selector);
        return marker != null ? marker : element(selector);
    }

    public Kind kind() {
        return kind;
    }

    /** The heading level, for {@link Kind#HEADING_LEVEL}; 0 otherwise. */
    public int level() {
        return level;
    }

    /** Returns true if labellers of the given element type fall under this selector. */
    public boolean matchesType(String type) {
        return switch (kind) {
            case ANY -> true;
            case LIST -> type.equals("ol") || type.equals("ul");
            case HEADING -> isHeading(type);
            case HEADING_LEVEL -> type.equals("h" + level);
            case ELEMENT -> type.equals(elementType);
        };
    }

    /** Returns true for the tags {@code h1} to {@code h6}. */
    public static boolean isHeading(String tag) {
        return tag.length() == 2 && tag.charAt(0) == 'h' && tag.charAt(1) >= '1'
                && tag.charAt(1) <= '6';
    }

    /** The canonical parent marker for this selector, as written in templates. */
    public String marker() {
        return switch (kind) {
            case ANY -> "X";
            case LIST -> "L";
            case HEADING -> "H";
            case HEADING_LEVEL -> "H" + level;
            case ELEMENT -> elementType;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScopeSelector other)) return false;
        return kind == other.kind
                && level == other.level
                && Objects.equals(elementType, other.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, level, elementType);
    }

    @Override
    public String toString() {
        return marker();
    }
}
