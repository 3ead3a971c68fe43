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
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import net.boyechko.autolabel.document.Node;
import net.boyechko.autolabel.labeller.Labeller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Labels list items with CSS counters instead of embedded text.
 *
 * <p>The first labeller seen for a list gets a class on the list plus rules that reset, increment
 * and display a counter of the same name. When an item switches the list to another labeller, the
 * item gets that labeller's class and a {@code counter-reset}, and rules scoped to items of that
 * class; every later item in the list carries the class too. Each rule is emitted at most once.
 *
 * <p>Elements outside lists, and labellers without a style id, are labelled as embedded text.
 */
public class CssLabelsRenderer implements LabelsRenderer {
    private static final Logger logger = LoggerFactory.getLogger(CssLabelsRenderer.class);

    private final Consumer<String> sink;
    private final LabelsRenderer fallback;
    private final Set<String> emitted = new HashSet<>();
    private final Map<Node, Labeller> current = new IdentityHashMap<>();
    private final Set<Node> switched = Collections.newSetFromMap(new IdentityHashMap<>());

    public CssLabelsRenderer(Consumer<String> sink) {
        this(sink, new TextLabelsRenderer());
    }

    public CssLabelsRenderer(Consumer<String> sink, LabelsRenderer fallback) {
        this.sink = sink;
        this.fallback = fallback;
    }

    @Override
    public void renderLabelledElement(Labeller labeller, Node element, Node container) {
        String cls = labeller.cssClass();
        if (container == null || cls == null) {
            fallback.renderLabelledElement(labeller, element, container);
            return;
        }

        emit("." + LABELLED_CLASS + ">li{list-style-type:none;}");

        Labeller previous = current.put(container, labeller);
        String item = element.tag();

        if (previous == null) {
            container.addClass(LABELLED_CLASS);
            container.addClass(cls);
            String items = "." + cls + ">" + item + ":not(." + NO_LABEL_CLASS + ")";
            if (labeller.isNumbered()) {
                emit("." + cls + "{counter-reset:" + cls + ";}");
                emit(items + "{counter-increment:" + cls + ";}");
            }
            emit(items + "::before{content:" + labeller.styleExpr() + ";}");
        } else if (previous != labeller) {
            // Qualified by the container class so these beat the container's own item rules.
            String items =
                    "." + LABELLED_CLASS + ">" + item + "." + cls + ":not(." + NO_LABEL_CLASS + ")";
            if (labeller.isNumbered()) {
                emit(items + "{counter-increment:" + cls + ";}");
            }
            emit(items + "::before{content:" + labeller.styleExpr() + ";}");
            element.appendStyle("counter-reset:" + cls);
            switched.add(container);
        }

        if (switched.contains(container)) {
            element.addClass(cls);
        }
    }

    private void emit(String rule) {
        if (emitted.add(rule)) {
            logger.debug("Style rule: {}", rule);
            sink.accept(rule);
        }
    }
}
