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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import net.boyechko.autolabel.document.Node;
import net.boyechko.autolabel.labeller.Labeller;

/** Inserts each label as a {@code <span class="la-label">} at the start of the element. */
public class TextLabelsRenderer implements LabelsRenderer {
    private final Set<Node> containers = Collections.newSetFromMap(new IdentityHashMap<>());

    @Override
    public void renderLabelledElement(Labeller labeller, Node element, Node container) {
        if (container != null && containers.add(container)) {
            container.addClass(LABELLED_CLASS);
        }

        Node label = new Node("span", labeller.text());
        label.addClass(LABEL_CLASS);
        label.setTail(element.text());
        element.setText(null);
        element.insert(0, label);
    }
}
