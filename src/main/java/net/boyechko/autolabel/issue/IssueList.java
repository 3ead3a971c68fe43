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

import java.util.ArrayList;
import java.util.Collection;
import java.util.stream.Collectors;

/** List of issues found while labelling a document. */
public class IssueList extends ArrayList<Issue> {

    public IssueList() {
        super();
    }

    public IssueList(Collection<Issue> issues) {
        super(issues != null ? issues : new ArrayList<>());
    }

    public IssueList(Issue issue) {
        super();
        if (issue != null) {
            add(issue);
        }
    }

    /** Returns true if any issue has FATAL severity, meaning labelling cannot continue. */
    public boolean hasFatalIssues() {
        return stream().anyMatch(issue -> issue.severity() == IssueSev.FATAL);
    }

    /** Returns a subset of this list that contains only issues of the given type. */
    public IssueList ofType(IssueType type) {
        return stream()
                .filter(issue -> issue.type() == type)
                .collect(Collectors.toCollection(IssueList::new));
    }

    /** Returns a subset of this list that contains only issues at or above the given severity. */
    public IssueList atLeast(IssueSev severity) {
        return stream()
                .filter(issue -> issue.severity().compareTo(severity) >= 0)
                .collect(Collectors.toCollection(IssueList::new));
    }
}
