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

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import net.boyechko.autolabel.counter.CounterStyleRegistry;
import net.boyechko.autolabel.document.Node;
import net.boyechko.autolabel.document.NodeTrees;
import net.boyechko.autolabel.issue.Issue;
import net.boyechko.autolabel.issue.IssueList;
import net.boyechko.autolabel.issue.IssueType;
import net.boyechko.autolabel.labeller.LabellerFactory;
import net.boyechko.autolabel.refs.InlineRewriter;
import net.boyechko.autolabel.refs.RefResolver;
import net.boyechko.autolabel.render.CssLabelsRenderer;
import net.boyechko.autolabel.render.LabelsRenderer;
import net.boyechko.autolabel.render.TextLabelsRenderer;
import net.boyechko.autolabel.template.LabelTemplateException;
import net.boyechko.autolabel.template.LabelTemplateParser;
import net.boyechko.autolabel.walk.DocumentTreeWalker;
import net.boyechko.autolabel.walk.LabelsVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Labels documents: finds reference markers, walks the tree assigning labels, and resolves the
 * references as their targets are labelled.
 *
 * <p>One service may label many documents, one at a time. Counter styles and parsed templates are
 * shared between documents; numbering state and style ids are not.
 */
public class LabelService {
    private static final Logger logger = LoggerFactory.getLogger(LabelService.class);

    private static final int MIN_GROUP_SIZE_FOR_GROUPING = 3;

    private final LabelConfig config;
    private final LabelTemplateParser parser;
    private final ProcessingListener listener;
    private final Consumer<String> styleSink;
    private final InlineRewriter inlineRewriter;
    private final boolean css;
    private final boolean printTree;

    public static class LabelServiceBuilder {
        private LabelConfig config;
        private CounterStyleRegistry registry;
        private ProcessingListener listener;
        private Consumer<String> styleSink;
        private InlineRewriter inlineRewriter;
        private Boolean css;
        private boolean printTree;

        public LabelServiceBuilder withConfig(LabelConfig config) {
            this.config = config;
            return this;
        }

        public LabelServiceBuilder withRegistry(CounterStyleRegistry registry) {
            this.registry = registry;
            return this;
        }

        public LabelServiceBuilder withListener(ProcessingListener listener) {
            this.listener = listener;
            return this;
        }

        /** Also passes each generated style rule to {@code styleSink} as it is produced. */
        public LabelServiceBuilder withStyleSink(Consumer<String> styleSink) {
            this.styleSink = styleSink;
            return this;
        }

        public LabelServiceBuilder withInlineRewriter(InlineRewriter inlineRewriter) {
            this.inlineRewriter = inlineRewriter;
            return this;
        }

        /** Overrides the configuration's choice between CSS counters and embedded text. */
        public LabelServiceBuilder withCss(boolean css) {
            this.css = css;
            return this;
        }

        public LabelServiceBuilder withPrintTree(boolean printTree) {
            this.printTree = printTree;
            return this;
        }

        public LabelService build() {
            if (config == null) {
                config = LabelConfig.loadDefault();
            }
            if (registry == null) {
                registry = CounterStyleRegistry.loadDefault();
            }
            if (listener == null) {
                listener = new LoggingListener();
            }
            return new LabelService(this);
        }
    }

    public static LabelServiceBuilder builder() {
        return new LabelServiceBuilder();
    }

    private LabelService(LabelServiceBuilder builder) {
        this.config = builder.config;
        this.parser = new LabelTemplateParser(builder.registry);
        this.listener = builder.listener;
        this.styleSink = builder.styleSink;
        this.inlineRewriter = builder.inlineRewriter;
        this.css = builder.css != null ? builder.css : builder.config.css;
        this.printTree = builder.printTree;
    }

    /**
     * Labels the tree under {@code root} in place.
     *
     * @throws LabelTemplateException if a configured or directive template is invalid; the tree
     *     may then be partly labelled
     */
    public LabelResult process(Node root) throws LabelTemplateException {
        listener.onPhaseStart("Labelling");

        StringBuilder rules = new StringBuilder();
        LabelsRenderer renderer =
                css
                        ? new CssLabelsRenderer(
                                rule -> {
                                    rules.append(rule).append('\n');
                                    if (styleSink != null) {
                                        styleSink.accept(rule);
                                    }
                                })
                        : new TextLabelsRenderer();

        RefResolver refs = new RefResolver(inlineRewriter);
        refs.findRefs(root);

        LabelsVisitor visitor;
        try {
            visitor = new LabelsVisitor(config, parser, new LabellerFactory(css), renderer, refs);
        } catch (LabelTemplateException e) {
            listener.onError("Invalid configured label template: " + e.getMessage());
            throw e;
        }

        IssueList issues = new DocumentTreeWalker().addVisitor(visitor).walk(root);
        reportIssuesGrouped(issues);

        if (visitor.failure() != null) {
            listener.onError("Labelling aborted: " + visitor.failure().getMessage());
            throw visitor.failure();
        }

        if (printTree) {
            listener.onVerboseOutput(NodeTrees.toDetailedTreeString(root));
        }
        if (refs.markerCount() > 0) {
            listener.onInfo(
                    "Resolved "
                            + refs.resolvedCount()
                            + " of "
                            + refs.markerCount()
                            + " references");
        }
        logger.debug("Labelled <{}> with {} issues", root.tag(), issues.size());
        listener.onSuccess("Labels assigned");
        listener.onSummary(issues);
        return new LabelResult(rules.toString(), issues);
    }

    private void reportIssuesGrouped(IssueList issues) {
        Map<IssueType, List<Issue>> grouped =
                issues.stream().collect(Collectors.groupingBy(Issue::type));

        for (Map.Entry<IssueType, List<Issue>> entry : grouped.entrySet()) {
            List<Issue> groupIssues = entry.getValue();

            if (groupIssues.size() >= MIN_GROUP_SIZE_FOR_GROUPING) {
                listener.onIssueGroup(entry.getKey().groupLabel(), groupIssues);
            } else {
                for (Issue issue : groupIssues) {
                    listener.onWarning(issue);
                }
            }
        }
    }
}
