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

/** Represents the type of an issue found while labelling a document. */
public enum IssueType {
    // Fatal issues (labelling cannot continue)
    INVALID_LABEL_TEMPLATE("invalid label templates"),

    // Directive issues
    DUPLICATE_DIRECTIVE("directives given in both '-' and 'md-' form"),
    DIRECTIVE_VALUE_IGNORED("flag directives with an ignored value"),
    MISPLACED_DIRECTIVE("label directives on elements that are not normally labelled"),

    // Reference issues
    UNRESOLVED_REFERENCE("cross-references that could not be resolved");

    private final String groupLabel;

    IssueType(String groupLabel) {
        this.groupLabel = groupLabel;
    }

    public String groupLabel() {
        return groupLabel;
    }
}
