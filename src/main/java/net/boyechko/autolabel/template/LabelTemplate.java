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

import java.util.Objects;
import net.boyechko.autolabel.counter.CounterStyle;

/**
 * An immutable, parsed label template: literals around an optional counter, an optional parent
 * marker whose label is prefixed in, and the template for the next nesting level.
 *
 * <p>A repeating template is its own child template. A template with neither a counter style nor a
 * child template is pure literal text, such as a bullet glyph.
 */
public final class LabelTemplate {
    private final String prefix;
    private final ScopeSelector parentType;
    private final String separator;
    private final CounterStyle counterStyle;
    private final String suffix;
    private final LabelTemplate child;
    private final boolean repeating;

    public LabelTemplate(
            String prefix,
            ScopeSelector parentType,
            String separator,
            CounterStyle counterStyle,
            String suffix,
            LabelTemplate child) {
        this(prefix, parentType, separator, counterStyle, suffix, child, false);
    }

    private LabelTemplate(
            String prefix,
            ScopeSelector parentType,
            String separator,
            CounterStyle counterStyle,
            String suffix,
            LabelTemplate child,
            boolean repeating) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.parentType = parentType;
        this.separator = Objects.requireNonNull(separator, "separator");
        this.counterStyle = counterStyle;
        this.suffix = Objects.requireNonNull(suffix, "suffix");
        this.child = child;
        this.repeating = repeating;
    }

    /** Creates a template that also applies to every further nesting level. */
    public static LabelTemplate repeating(
            String prefix,
            ScopeSelector parentType,
            String separator,
            CounterStyle counterStyle,
            String suffix) {
        return new LabelTemplate(prefix, parentType, separator, counterStyle, suffix, null, true);
    }

    /** Creates a template holding only literal text. */
    public static LabelTemplate literal(String text) {
        return new LabelTemplate(text, null, "", null, "", null);
    }

    public String prefix() {
        return prefix;
    }

    /** The parent marker, or null if this template does not inherit a parent label. */
    public ScopeSelector parentType() {
        return parentType;
    }

    public String separator() {
        return separator;
    }

    /** The counter style, or null for a literal-only template. */
    public CounterStyle counterStyle() {
        return counterStyle;
    }

    public String suffix() {
        return suffix;
    }

    /** The template for the next nesting level: {@code this} if repeating, or null if none. */
    public LabelTemplate childTemplate() {
        return repeating ? this : child;
    }

    public boolean isRepeating() {
        return repeating;
    }

    public boolean isNumbered() {
        return counterStyle != null;
    }

    /**
     * Returns a canonical template string that parses back to an equal template. Literals are
     * double-quoted, counter styles are written by their full names.
     */
    public String toTemplateString() {
        StringBuilder sb = new StringBuilder();
        LabelTemplate t = this;
        while (true) {
            t.appendSegment(sb);
            if (t.repeating) {
                sb.append(",*");
                break;
            }
            if (t.child == null) {
                break;
            }
            sb.append(',');
            t = t.child;
        }
        return sb.toString();
    }

    private void appendSegment(StringBuilder sb) {
        sb.append(quote(prefix));
        if (counterStyle != null) {
            if (parentType != null) {
                sb.append(parentType.marker());
                sb.append('"').append(separator.replace("\"", "\"\"")).append('"');
            }
            sb.append(counterStyle.cssId());
        }
        sb.append(quote(suffix));
    }

    private static String quote(String literal) {
        return literal.isEmpty() ? "" : "\"" + literal.replace("\"", "\"\"") + "\"";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LabelTemplate other)) return false;
        return repeating == other.repeating
                && prefix.equals(other.prefix)
                && Objects.equals(parentType, other.parentType)
                && separator.equals(other.separator)
                && Objects.equals(counterStyle, other.counterStyle)
                && suffix.equals(other.suffix)
                && Objects.equals(child, other.child);
    }

    @Override
    public int hashCode() {
        return Objects.hash(prefix, parentType, separator, counterStyle, suffix, child, repeating);
    }

    @Override
    public String toString() {
        return "LabelTemplate[" + toTemplateString() + "]";
    }
}
