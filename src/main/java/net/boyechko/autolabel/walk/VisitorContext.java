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

import java.util.List;
import net.boyechko.autolabel.document.Node;
import net.boyechko.autolabel.issue.IssueLoc;

/**
 * Context passed to visitors during document tree traversal. The child list is a snapshot taken
 * before any visitor sees the node, so nodes that visitors insert are not themselves visited.
 */
public record VisitorContext(
        Node node,
        String path,
        String tag,
        String parentTag,
        List<Node> children,
        List<String> childTags,
        /** Depth in the tree (0 = the root passed to the walker). */
        int depth,
        /** Index in traversal order (1-based). */
        int globalIndex) {

    public static VisitorContext fromNode(
            Node node, String parentPath, int depth, int globalIndex) {
        String tag = node.tag();
        String path = parentPath + tag + "[" + globalIndex + "]";
        String parentTag = node.parent() != null ? node.parent().tag() : null;

        List<Node> children = List.copyOf(node.children());
        List<String> childTags = children.stream().map(Node::tag).toList();

        return new VisitorContext(
                node, path, tag, parentTag, children, childTags, depth, globalIndex);
    }

    /** The location of this node, for issue reports. */
    public IssueLoc where() {
        return IssueLoc.atNode(path, tag, node.id());
    }

    public boolean hasTag(String tagName) {
        return tagName.equals(tag);
    }

    public boolean hasAnyTag(String... tagNames) {
        for (String t : tagNames) {
            if (t.equals(tag)) return true;
        }
        return false;
    }
}
