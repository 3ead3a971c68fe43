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
package net.boyechko.autolabel.labeller;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.boyechko.autolabel.template.LabelTemplate;

/**
 * Tracks the count of one numbering scope and renders its labels.
 *
 * <p>The label of a labeller with a parent is built on the parent's current core label, so a
 * second-level heading under section 2 reads {@code 2.1}. Labellers created with this one as their
 * parent are recorded as its dependents, so they can be retired when this one moves on.
 */
public final class Labeller {
    private final String elementType;
    private final LabelTemplate template;
    private final Labeller parent;
    private final Integer styleId;
    private final List<Labeller> dependents = new ArrayList<>();
    private int count;

    public Labeller(String elementType, LabelTemplate template, Labeller parent, Integer styleId) {
        this.elementType = elementType;
        this.template = template;
        this.parent = parent;
        this.styleId = styleId;
    }

    public String elementType() {
        return elementType;
    }

    public LabelTemplate template() {
        return template;
    }

    public Labeller parent() {
        return parent;
    }

    public int count() {
        return count;
    }

    /** The interned style id, or null when this labeller's labels are embedded as text. */
    public Integer styleId() {
        return styleId;
    }

    public boolean isNumbered() {
        return template.isNumbered();
    }

    public void increment() {
        count++;
    }

    void addDependent(Labeller dependent) {
        if (dependent == this) {
            throw new IllegalArgumentException("A labeller cannot depend on itself");
        }
        dependents.add(dependent);
    }

    List<Labeller> dependents() {
        return Collections.unmodifiableList(dependents);
    }

    void clearDependents() {
        dependents.clear();
    }

    /** The label without its literal prefix and suffix; empty for a literal-only template. */
    public String core() {
        if (!template.isNumbered()) {
            return "";
        }
        String s = template.counterStyle().format(count);
        if (parent == null) {
            return s;
        }
        String parentCore = parent.core();
        return parentCore.isEmpty() ? s : parentCore + template.separator() + s;
    }

    /** The full label text. */
    public String text() {
        return template.prefix() + core() + template.suffix();
    }

    /** Class name shared by the styled container and the counter it resets; null if unstyled. */
    public String cssClass() {
        return styleId == null ? null : "la-label" + styleId;
    }

    /**
     * CSS expression for the core label. Styled labellers read their own counter; unstyled ones
     * contribute their current core label as a string.
     */
    public String coreStyleExpr() {
        if (!template.isNumbered()) {
            return "";
        }
        if (styleId == null) {
            return cssString(core());
        }
        String expr = "counter(" + cssClass() + "," + template.counterStyle().cssId() + ")";
        String parentExpr = parent == null ? "" : parent.coreStyleExpr();
        if (parentExpr.isEmpty()) {
            return expr;
        }
        return joinExpr(parentExpr, cssString(template.separator()), expr);
    }

    /** CSS {@code content} value for the full label. */
    public String styleExpr() {
        String expr =
                joinExpr(
                        cssString(template.prefix()),
                        coreStyleExpr(),
                        cssString(template.suffix()));
        return expr.isEmpty() ? "\"\"" : expr;
    }

    private static String joinExpr(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(part);
        }
        return sb.toString();
    }

    /** Quotes a string for CSS, or returns an empty string for empty input. */
    public static String cssString(String s) {
        if (s.isEmpty()) {
            return "";
        }
        return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    @Override
    public String toString() {
        return "Labeller(" + elementType + ", " + template.toTemplateString() + ", " + count
                + (styleId != null ? ", " + cssClass() : "") + ")";
    }
}
