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
package net.boyechko.autolabel.core;

import net.boyechko.autolabel.issue.IssueList;

/**
 * Outcome of labelling one document.
 *
 * @param css the generated style rules, one per line; empty when labels are embedded as text
 * @param issues every non-fatal issue found
 */
public record LabelResult(String css, IssueList issues) {

    public boolean hasCss() {
        return !css.isEmpty();
    }
}
