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
package net.boyechko.autolabel.document;

import java.util.Collection;
import java.util.Map;

/** Static helpers for searching and dumping {@link Node} trees. */
public final class NodeTrees {

    private NodeTrees() {}

    /** Returns the first direct child of {@code parent} whose tag is in {@code tags}, or null. */
    public static Node findFirstChild(Node parent, Collection<String> tags) {
        for (Node child : parent.children()) {
            if (tags.contains(child.tag())) {
                return child;
            }
        }
        return null;
    }

    /** Returns the first node in {@code root}'s subtree (including root) with the given id. */
    public static Node findById(Node root, String id) {
        for (Node n : root.iter()) {
            if (id.equals(n.id())) {
                return n;
            }
        }
        return null;
    }

    public static boolean isDescendantOf(Node candidate, Node ancestor) {
        for (Node n = candidate.parent(); n != null; n = n.parent()) {
            if (n == ancestor) return true;
        }
        return false;
    }

    /** Returns the tag names of the tree, one per line, indented two spaces per level. */
    public static String toIndentedTreeString(Node node) {
        StringBuilder sb = new StringBuilder();
        appendIndentedTree(sb, node, 0);
        return sb.toString();
    }

    private static void appendIndentedTree(StringBuilder sb, Node node, int depth) {
        sb.append("  ".repeat(depth));
        sb.append(node.tag());
        sb.append('\n');
        for (Node kid : node.children()) {
            appendIndentedTree(sb, kid, depth + 1);
        }
    }

    /**
     * Like {@link #toIndentedTreeString}, but also shows attributes, text and tail text.
     *
     * <p>Each element line reads {@code tag attr="value" "text"}. A child's tail text is shown on
     * its own line after the child's subtree, as {@code ~ "tail"} at the child's indentation.
     */
    public static String toDetailedTreeString(Node node) {
        StringBuilder sb = new StringBuilder();
        appendDetailedTree(sb, node, 0);
        return sb.toString();
    }

    private static void appendDetailedTree(StringBuilder sb, Node node, int depth) {
        String indent = "  ".repeat(depth);
        sb.append(indent).append(node.tag());
        for (Map.Entry<String, String> attr : node.attributes().entrySet()) {
            sb.append(' ').append(attr.getKey()).append("=\"").append(attr.getValue()).append('"');
        }
        if (node.text() != null && !node.text().isEmpty()) {
            sb.append(" \"").append(node.text()).append('"');
        }
        sb.append('\n');

        for (Node kid : node.children()) {
            appendDetailedTree(sb, kid, depth + 1);
            if (kid.tail() != null && !kid.tail().isEmpty()) {
                sb.append("  ".repeat(depth + 1)).append("~ \"").append(kid.tail()).append("\"\n");
            }
        }
    }
}
