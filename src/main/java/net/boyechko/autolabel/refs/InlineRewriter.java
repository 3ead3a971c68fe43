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
package net.boyechko.autolabel.refs;

import net.boyechko.autolabel.document.Node;

/**
 * Turns resolved label text into document content, for hosts that apply inline formatting to
 * labels (for example, converting markup in a literal prefix).
 */
@FunctionalInterface
public interface InlineRewriter {

    /**
     * Rewrites a label.
     *
     * @param label the resolved label text
     * @return a node whose text and children become the content of the reference placeholder
     */
    Node rewrite(String label);
}
