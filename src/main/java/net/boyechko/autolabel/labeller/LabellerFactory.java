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

import java.util.HashMap;
import java.util.Map;
import net.boyechko.autolabel.template.LabelTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates labellers and, when labels are rendered as style rules, hands out their style ids.
 *
 * <p>Labellers for the same element type, template and parent expression share a style id, so
 * their style rules are generated once. Each call still returns a fresh labeller with its own
 * count.
 */
public class LabellerFactory {
    private static final Logger logger = LoggerFactory.getLogger(LabellerFactory.class);

    private record StyleKey(String elementType, LabelTemplate template, String parentExpr) {}

    private final boolean styled;
    private final Map<StyleKey, Integer> styleIds = new HashMap<>();
    private int nextId = 1;

    public LabellerFactory(boolean styled) {
        this.styled = styled;
    }

    public boolean isStyled() {
        return styled;
    }

    public Labeller create(String elementType, LabelTemplate template, Labeller parent) {
        Integer styleId = null;
        if (styled && isList(elementType)) {
            StyleKey key =
                    new StyleKey(
                            elementType, template, parent == null ? "" : parent.coreStyleExpr());
            styleId = styleIds.computeIfAbsent(key, k -> nextId++);
        }
        Labeller labeller = new Labeller(elementType, template, parent, styleId);
        if (parent != null) {
            parent.addDependent(labeller);
        }
        logger.debug("Created {} under {}", labeller, parent);
        return labeller;
    }

    /** Number of distinct style ids handed out so far. */
    public int styleCount() {
        return styleIds.size();
    }

    private static boolean isList(String elementType) {
        return elementType.equals("ol") || elementType.equals("ul");
    }
}
