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
package net.boyechko.autolabel.walk;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.autolabel.core.LabelConfig;
import net.boyechko.autolabel.document.Directives;
import net.boyechko.autolabel.document.Node;
import net.boyechko.autolabel.document.NodeTrees;
import net.boyechko.autolabel.issue.Issue;
import net.boyechko.autolabel.issue.IssueList;
import net.boyechko.autolabel.issue.IssueLoc;
import net.boyechko.autolabel.issue.IssueSev;
import net.boyechko.autolabel.issue.IssueType;
import net.boyechko.autolabel.labeller.Labeller;
import net.boyechko.autolabel.labeller.LabellerFactory;
import net.boyechko.autolabel.labeller.LabellerStack;
import net.boyechko.autolabel.refs.RefResolver;
import net.boyechko.autolabel.render.LabelsRenderer;
import net.boyechko.autolabel.template.LabelTemplate;
import net.boyechko.autolabel.template.LabelTemplateException;
import net.boyechko.autolabel.template.LabelTemplateParser;
import net.boyechko.autolabel.template.ScopeSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns labels to headings, list items and standalone series elements as the tree is walked,
 * and resolves the references that point at each element with an id.
 *
 * <p>Templates come, in order of preference, from a {@code -label} directive on the element,
 * from the enclosing labeller of the same kind, and from the configured defaults. A template that
 * fails to parse stops the walk; {@link #failure()} then holds the exception.
 */
public class LabelsVisitor implements DocumentTreeVisitor {
    private static final Logger logger = LoggerFactory.getLogger(LabelsVisitor.class);

    private final LabelTemplateParser parser;
    private final LabellerFactory factory;
    private final LabelsRenderer renderer;
    private final RefResolver refs;
    private final List<String> captionTags;
    private final Map<String, LabelTemplate> defaults = new LinkedHashMap<>();

    private final LabellerStack stack = new LabellerStack();
    private final Deque<ListFrame> lists = new ArrayDeque<>();
    private final IssueList issues = new IssueList();
    private final Directives directives = new Directives(issues);

    private LabelTemplateException failure;

    private static final class ListFrame {
        final Node list;
        Labeller labeller;

        ListFrame(Node list, Labeller labeller) {
            this.list = list;
            this.labeller = labeller;
        }
    }

    /**
     * @throws LabelTemplateException if a configured default template is invalid
     */
    public LabelsVisitor(
            LabelConfig config,
            LabelTemplateParser parser,
            LabellerFactory factory,
            LabelsRenderer renderer,
            RefResolver refs)
            throws LabelTemplateException {
        this.parser = parser;
        this.factory = factory;
        this.renderer = renderer;
        this.refs = refs;
        this.captionTags = config.captionTags();
        for (Map.Entry<String, String> e : config.effectiveLabels().entrySet()) {
            defaults.put(e.getKey(), parser.parse(e.getValue()));
        }
    }

    @Override
    public String name() {
        return "Labels";
    }

    @Override
    public String description() {
        return "Numbers headings, lists and series elements and resolves references to them";
    }

    @Override
    public boolean enterElement(VisitorContext ctx) {
        try {
            Node node = ctx.node();
            String tag = ctx.tag();
            if (ScopeSelector.isHeading(tag)) {
                enterHeading(ctx);
                return false;
            }
            if (ctx.hasAnyTag("ol", "ul")) {
                enterList(ctx);
                return true;
            }
            ListFrame frame = lists.peek();
            if (ctx.hasTag("li") && frame != null && node.parent() == frame.list) {
                enterListItem(ctx, frame);
                return true;
            }
            enterOther(ctx);
            return true;
        } catch (LabelTemplateException e) {
            fail(ctx, e);
            return false;
        }
    }

    @Override
    public void leaveElement(VisitorContext ctx) {
        ListFrame frame = lists.peek();
        if (frame != null && ctx.node() == frame.list) {
            lists.pop();
            if (frame.labeller != null) {
                stack.remove(frame.labeller);
            }
        }
    }

    @Override
    public void afterTraversal() {
        if (failure != null) {
            return;
        }
        for (RefResolver.UnresolvedRef ref : refs.unresolved()) {
            issues.add(
                    new Issue(
                            IssueType.UNRESOLVED_REFERENCE,
                            IssueSev.INFO,
                            "Reference "
                                    + ref.marker()
                                    + " to #"
                                    + ref.targetId()
                                    + " matched no "
                                    + ref.selector()
                                    + " label"));
        }
    }

    @Override
    public boolean stopRequested() {
        return failure != null;
    }

    @Override
    public IssueList getIssues() {
        return issues;
    }

    /** The template error that stopped the walk, or null. */
    public LabelTemplateException failure() {
        return failure;
    }

    private void enterHeading(VisitorContext ctx) throws LabelTemplateException {
        Node node = ctx.node();
        String tag = ctx.tag();
        int level = tag.charAt(1) - '0';
        IssueLoc where = ctx.where();

        stack.closeHeadingsBelow(level);
        String override = directives.pop(node, Directives.LABEL, where);
        boolean noLabel = directives.popFlag(node, Directives.NO_LABEL, where);

        Labeller labeller = stack.heading(level);
        if (labeller != null && override != null) {
            LabelTemplate template = parser.parse(override);
            Labeller replacement = factory.create(tag, template, labeller.parent());
            stack.replace(labeller, replacement);
            labeller = replacement;
        }
        if (labeller == null) {
            LabelTemplate template = override != null ? parser.parse(override) : null;
            if (template == null) {
                Labeller above = stack.heading(level - 1);
                if (above != null) {
                    template = above.template().childTemplate();
                }
            }
            if (template == null) {
                template = defaults.get(tag);
            }
            if (template != null) {
                labeller = factory.create(tag, template, stack.findParent(template.parentType()));
                stack.pushHeading(level, labeller);
            }
        }

        Labeller own = null;
        if (labeller != null) {
            if (noLabel) {
                renderer.renderNoLabelElement(node, null);
            } else {
                stack.advance(labeller);
                renderer.renderLabelledElement(labeller, node, null);
                own = labeller;
            }
        }
        resolve(node, own);
    }

    private void enterList(VisitorContext ctx) throws LabelTemplateException {
        Node node = ctx.node();
        String tag = ctx.tag();
        String override = directives.pop(node, Directives.LABEL, ctx.where());

        LabelTemplate template = override != null ? parser.parse(override) : null;
        if (template == null) {
            Labeller outer = stack.findNearest(tag);
            if (outer != null) {
                template = outer.template().childTemplate();
            } else {
                template = defaults.get(tag);
            }
        }

        Labeller labeller = null;
        if (template != null) {
            labeller = factory.create(tag, template, stack.findParent(template.parentType()));
            stack.push(labeller);
        }
        lists.push(new ListFrame(node, labeller));
        resolve(node, null);
    }

    private void enterListItem(VisitorContext ctx, ListFrame frame)
            throws LabelTemplateException {
        Node node = ctx.node();
        IssueLoc where = ctx.where();
        String override = directives.pop(node, Directives.LABEL, where);
        boolean noLabel = directives.popFlag(node, Directives.NO_LABEL, where);

        if (override != null) {
            LabelTemplate template = parser.parse(override);
            Labeller old = frame.labeller;
            // A replacement keeps the parent of the labeller it replaces.
            Labeller parent = old != null ? old.parent() : stack.findParent(template.parentType());
            Labeller replacement = factory.create(frame.list.tag(), template, parent);
            if (old != null) {
                stack.replace(old, replacement);
            } else {
                stack.push(replacement);
            }
            frame.labeller = replacement;
        }

        Labeller labeller = frame.labeller;
        Labeller own = null;
        if (labeller != null) {
            if (noLabel) {
                renderer.renderNoLabelElement(node, frame.list);
            } else {
                stack.advance(labeller);
                renderer.renderLabelledElement(labeller, node, frame.list);
                own = labeller;
            }
        }
        resolve(node, own);
    }

    private void enterOther(VisitorContext ctx) throws LabelTemplateException {
        Node node = ctx.node();
        String tag = ctx.tag();
        boolean configured = defaults.containsKey(tag) && !ctx.hasAnyTag("ol", "ul", "li");

        if (!configured && !Directives.peek(node, Directives.LABEL)) {
            resolve(node, null);
            return;
        }

        IssueLoc where = ctx.where();
        String override = directives.pop(node, Directives.LABEL, where);
        boolean noLabel = directives.popFlag(node, Directives.NO_LABEL, where);
        if (!configured) {
            issues.add(
                    new Issue(
                            IssueType.MISPLACED_DIRECTIVE,
                            IssueSev.WARNING,
                            where,
                            "No labels are configured for <"
                                    + tag
                                    + ">; applying "
                                    + Directives.format(Directives.LABEL, override)
                                    + " anyway"));
        }

        Labeller series = stack.series(tag);
        if (override != null || series == null) {
            LabelTemplate template = override != null ? parser.parse(override) : defaults.get(tag);
            series = factory.create(tag, template, stack.findParent(template.parentType()));
            stack.putSeries(tag, series);
        }

        Labeller own = null;
        if (noLabel) {
            renderer.renderNoLabelElement(node, null);
        } else {
            stack.advance(series);
            Node caption = NodeTrees.findFirstChild(node, captionTags);
            renderer.renderLabelledElement(series, caption != null ? caption : node, null);
            own = series;
        }
        resolve(node, own);
    }

    private void resolve(Node node, Labeller own) {
        if (node.id() == null) {
            return;
        }
        refs.resolveRefs(
                node,
                selector -> {
                    if (own != null
                            && own.isNumbered()
                            && selector.matchesType(own.elementType())) {
                        return own;
                    }
                    return stack.findForReference(selector);
                });
    }

    private void fail(VisitorContext ctx, LabelTemplateException e) {
        logger.debug("Invalid label template at {}: {}", ctx.path(), e.getMessage());
        issues.add(
                new Issue(
                        IssueType.INVALID_LABEL_TEMPLATE,
                        IssueSev.FATAL,
                        ctx.where(),
                        e.getMessage()));
        failure = e;
    }
}
