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

import java.util.ArrayList;
import java.util.List;
import net.boyechko.autolabel.document.Node;
import net.boyechko.autolabel.issue.IssueList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Walks a document tree once in pre-order, invoking multiple visitors at each node. */
public class DocumentTreeWalker {
    private static final Logger logger = LoggerFactory.getLogger(DocumentTreeWalker.class);

    private final List<DocumentTreeVisitor> visitors = new ArrayList<>();

    private int globalIndex;
    private boolean stopped;

    public DocumentTreeWalker addVisitor(DocumentTreeVisitor visitor) {
        visitors.add(visitor);
        return this;
    }

    /** Walks {@code root} and its descendants, returning the issues every visitor collected. */
    public IssueList walk(Node root) {
        this.globalIndex = 0;
        this.stopped = false;

        for (DocumentTreeVisitor visitor : visitors) {
            visitor.beforeTraversal();
        }

        walkElement(root, "/", 0);

        IssueList allIssues = new IssueList();
        for (DocumentTreeVisitor visitor : visitors) {
            visitor.afterTraversal();
            allIssues.addAll(visitor.getIssues());
        }
        return allIssues;
    }

    /** Returns true if the last walk ended early at a visitor's request. */
    public boolean wasStopped() {
        return stopped;
    }

    private void walkElement(Node node, String parentPath, int depth) {
        globalIndex++;

        VisitorContext ctx = VisitorContext.fromNode(node, parentPath, depth, globalIndex);

        // Call enterElement on all visitors; track if any want to skip children
        boolean continueToChildren = true;
        for (DocumentTreeVisitor visitor : visitors) {
            try {
                if (!visitor.enterElement(ctx)) {
                    continueToChildren = false;
                }
            } catch (RuntimeException e) {
                logger.error(
                        "Error in visitor {} at {}: {}",
                        visitor.name(),
                        ctx.path(),
                        e.getMessage(),
                        e);
            }
            if (visitor.stopRequested()) {
                logger.debug("Visitor {} stopped the walk at {}", visitor.name(), ctx.path());
                stopped = true;
                return;
            }
        }

        if (continueToChildren) {
            for (Node child : ctx.children()) {
                walkElement(child, ctx.path() + ".", depth + 1);
                if (stopped) {
                    return;
                }
            }
        }

        for (DocumentTreeVisitor visitor : visitors) {
            try {
                visitor.leaveElement(ctx);
            } catch (RuntimeException e) {
                logger.error(
                        "Error in visitor {} leaving {}: {}",
                        visitor.name(),
                        ctx.path(),
                        e.getMessage(),
                        e);
            }
        }
    }
}
