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
package net.boyechko.autolabel.render;

import net.boyechko.autolabel.document.Node;
import net.boyechko.autolabel.labeller.Labeller;

/** Puts labels into the document, either as embedded text or as generated style rules. */
public interface LabelsRenderer {
    /** Marks a list whose items are labelled by this engine rather than by the list marker. */
    String LABELLED_CLASS = "la-labelled";

    /** Marks an embedded label. */
    String LABEL_CLASS = "la-label";

    /** Marks a list item that is skipped by numbering. */
    String NO_LABEL_CLASS = "la-no-label";

    /**
     * Renders the labeller's current label for {@code element}.
     *
     * @param container the list the element is an item of, or null for standalone elements
     */
    void renderLabelledElement(Labeller labeller, Node element, Node container);

    /** Marks an element that takes part in a numbering scope but gets no label. */
    default void renderNoLabelElement(Node element, Node container) {
        if (container != null) {
            element.addClass(NO_LABEL_CLASS);
        }
    }
}
