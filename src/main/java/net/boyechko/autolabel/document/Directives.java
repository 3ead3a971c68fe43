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
package net.boyechko.autolabel.document;

import net.boyechko.autolabel.issue.Issue;
import net.boyechko.autolabel.issue.IssueList;
import net.boyechko.autolabel.issue.IssueLoc;
import net.boyechko.autolabel.issue.IssueSev;
import net.boyechko.autolabel.issue.IssueType;

/**
 * Reads and consumes directive attributes.
 *
 * <p>A directive named {@code label} may be written as {@code -label} or, after attribute-name
 * normalisation, as {@code md-label}. Reading a directive removes both forms from the node.
 */
public final class Directives {
    public static final String LABEL = "label";
    public static final String NO_LABEL = "no-label";

    private final IssueList issues;

    public Directives(IssueList issues) {
        this.issues = issues;
    }

    /** Formats a directive as it would be written in source attributes. */
    public static String format(String name, String value) {
        if (value == null) {
            return "-" + name;
        }
        return "-" + name + "=\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    /** Returns true if the node carries the directive in either form, without consuming it. */
    public static boolean peek(Node node, String name) {
        return node.has("-" + name) || node.has("md-" + name);
    }

    /** Removes the directive from the node and returns its value, or null if it was absent. */
    public String pop(Node node, String name, IssueLoc where) {
        Popped popped = popBoth(node, name, where);
        return popped != null ? popped.value() : null;
    }

    /**
     * Removes a flag directive from the node and returns whether it was present. A flag written
     * with a value still counts as present; the value is ignored with a warning.
     */
    public boolean popFlag(Node node, String name, IssueLoc where) {
        Popped popped = popBoth(node, name, where);
        if (popped == null) {
            return false;
        }
        String value = popped.value();
        if (!value.isEmpty() && !value.equals("-" + name) && !value.equals("md-" + name)) {
            issues.add(
                    new Issue(
                            IssueType.DIRECTIVE_VALUE_IGNORED,
                            IssueSev.WARNING,
                            where,
                            "Do not write "
                                    + popped.attribute()
                                    + "=\""
                                    + value
                                    + "\"; "
                                    + popped.attribute()
                                    + " expects no value"));
        }
        return true;
    }

    private record Popped(String attribute, String value) {}

    private Popped popBoth(Node node, String name, IssueLoc where) {
        String dashAttr = "-" + name;
        String mdAttr = "md-" + name;
        String dashValue = node.remove(dashAttr);
        String mdValue = node.remove(mdAttr);

        if (dashValue != null && mdValue != null) {
            issues.add(
                    new Issue(
                            IssueType.DUPLICATE_DIRECTIVE,
                            IssueSev.WARNING,
                            where,
                            "Avoid writing both \""
                                    + dashAttr
                                    + "\" and \""
                                    + mdAttr
                                    + "\" for the same element"));
        }
        if (dashValue != null) {
            return new Popped(dashAttr, dashValue);
        }
        if (mdValue != null) {
            return new Popped(mdAttr, mdValue);
        }
        return null;
    }
}
