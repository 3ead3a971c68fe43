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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A mutable element of a document tree.
 *
 * <p>Text is stored the way XML element trees store it: {@code text} is the character data before
 * the first child, and each child's {@code tail} is the character data that follows it inside this
 * node. Either may be null.
 */
public final class Node {
    private final String tag;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<Node> children = new ArrayList<>();
    private String text;
    private String tail;
    private Node parent;

    public Node(String tag) {
        this.tag = Objects.requireNonNull(tag, "tag");
    }

    public Node(String tag, String text) {
        this(tag);
        this.text = text;
    }

    public String tag() {
        return tag;
    }

    public boolean hasTag(String... tags) {
        for (String t : tags) {
            if (t.equals(tag)) return true;
        }
        return false;
    }

    // ── Attributes ──────────────────────────────────────────────────

    public String get(String name) {
        return attributes.get(name);
    }

    public boolean has(String name) {
        return attributes.containsKey(name);
    }

    public Node set(String name, String value) {
        attributes.put(name, value);
        return this;
    }

    /** Removes an attribute, returning its previous value (or null if it was not set). */
    public String remove(String name) {
        return attributes.remove(name);
    }

    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public String id() {
        return attributes.get("id");
    }

    /** Adds a class to the space-separated {@code class} attribute, unless already present. */
    public Node addClass(String cls) {
        String existing = attributes.get("class");
        if (existing == null || existing.isBlank()) {
            attributes.put("class", cls);
        } else if (!hasClass(cls)) {
            attributes.put("class", existing + " " + cls);
        }
        return this;
    }

    public boolean hasClass(String cls) {
        String existing = attributes.get("class");
        return existing != null && Arrays.asList(existing.trim().split("\\s+")).contains(cls);
    }

    /** Appends a declaration to the {@code style} attribute. */
    public Node appendStyle(String declaration) {
        String existing = attributes.get("style");
        if (existing == null || existing.isBlank()) {
            attributes.put("style", declaration);
        } else {
            String sep = existing.strip().endsWith(";") ? "" : ";";
            attributes.put("style", existing + sep + declaration);
        }
        return this;
    }

    // ── Text ────────────────────────────────────────────────────────

    public String text() {
        return text;
    }

    public Node setText(String text) {
        this.text = text;
        return this;
    }

    public String tail() {
        return tail;
    }

    public Node setTail(String tail) {
        this.tail = tail;
        return this;
    }

    /** Returns the concatenated character data of this node and its descendants. */
    public String textContent() {
        StringBuilder sb = new StringBuilder();
        appendTextContent(sb);
        return sb.toString();
    }

    private void appendTextContent(StringBuilder sb) {
        if (text != null) sb.append(text);
        for (Node child : children) {
            child.appendTextContent(sb);
            if (child.tail != null) sb.append(child.tail);
        }
    }

    // ── Children ────────────────────────────────────────────────────

    public Node parent() {
        return parent;
    }

    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    public int childCount() {
        return children.size();
    }

    public Node child(int index) {
        return children.get(index);
    }

    public int indexOf(Node child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) return i;
        }
        return -1;
    }

    /** Appends a child and returns it. */
    public Node append(Node child) {
        return insert(children.size(), child);
    }

    /** Inserts a child at the given position and returns it. */
    public Node insert(int index, Node child) {
        if (child.parent != null) {
            child.parent.removeChild(child);
        }
        children.add(index, child);
        child.parent = this;
        return child;
    }

    /** Appends children and returns this node, for building trees fluently. */
    public Node with(Node... kids) {
        for (Node kid : kids) {
            append(kid);
        }
        return this;
    }

    public boolean removeChild(Node child) {
        int index = indexOf(child);
        if (index < 0) return false;
        children.remove(index);
        child.parent = null;
        return true;
    }

    /** Returns this node and all of its descendants in document (pre-)order. */
    public List<Node> iter() {
        List<Node> out = new ArrayList<>();
        collect(this, out);
        return out;
    }

    private static void collect(Node node, List<Node> out) {
        out.add(node);
        for (Node child : node.children) {
            collect(child, out);
        }
    }

    @Override
    public String toString() {
        return "<" + tag + (attributes.isEmpty() ? "" : " " + attributes) + ">";
    }
}
