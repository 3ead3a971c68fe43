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
package net.boyechko.autolabel.refs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.boyechko.autolabel.document.Node;
import net.boyechko.autolabel.labeller.Labeller;
import net.boyechko.autolabel.template.ScopeSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds {@code ##} reference markers inside links and fills them in with labels.
 *
 * <p>Resolution takes two passes. {@link #findRefs} runs once over the whole document, before any
 * labelling, and splits each marker out into a placeholder {@code <span class="la-ref">}. Then, as
 * labelling reaches each element with an {@code id}, {@link #resolveRefs} replaces the text of
 * the placeholders that point at it. Placeholders that never resolve keep their marker text.
 *
 * <p>A marker is {@code ##}, optionally followed by a selector, either bare ({@code ##h2}) or in
 * braces ({@code ##{h2}}). A marker preceded by a backslash is left alone.
 */
public class RefResolver {
    public static final String REF_CLASS = "la-ref";

    static final Pattern REF_PATTERN =
            Pattern.compile("(?<!\\\\)##(?:\\{([A-Za-z0-9_-]+)\\}|([A-Za-z0-9_-]+))?");

    private static final Logger logger = LoggerFactory.getLogger(RefResolver.class);

    /** A placeholder that was never filled in. */
    public record UnresolvedRef(String targetId, ScopeSelector selector, String marker) {}

    private record Ref(String targetId, ScopeSelector selector, Node placeholder) {}

    private final InlineRewriter rewriter;
    private final Map<String, Map<ScopeSelector, List<Node>>> refs = new LinkedHashMap<>();
    private final List<Ref> all = new ArrayList<>();
    private final Set<Node> resolved = Collections.newSetFromMap(new IdentityHashMap<>());

    public RefResolver() {
        this(null);
    }

    /** @param rewriter turns label text into placeholder content; null to insert plain text */
    public RefResolver(InlineRewriter rewriter) {
        this.rewriter = rewriter;
    }

    /** Splits every marker inside same-document links into placeholder nodes. */
    public void findRefs(Node root) {
        for (Node anchor : root.iter()) {
            if (!anchor.hasTag("a")) {
                continue;
            }
            String href = anchor.get("href");
            if (href == null || !href.startsWith("#") || href.length() < 2) {
                continue;
            }
            find(href.substring(1), anchor);
        }
        logger.debug("Found {} reference markers for {} targets", all.size(), refs.size());
    }

    private void find(String id, Node element) {
        String text = element.text();
        if (text != null) {
            Matcher m = REF_PATTERN.matcher(text);
            if (m.find()) {
                element.setText(text.substring(0, m.start()));
                element.insert(0, placeholder(id, m, text));
            }
        }

        // Placeholders are inserted as we go; each one's tail is scanned on the next iteration.
        for (int i = 0; i < element.childCount(); i++) {
            Node child = element.child(i);
            if (!child.hasClass(REF_CLASS)) {
                find(id, child);
            }
            String tail = child.tail();
            if (tail != null) {
                Matcher m = REF_PATTERN.matcher(tail);
                if (m.find()) {
                    child.setTail(tail.substring(0, m.start()));
                    element.insert(i + 1, placeholder(id, m, tail));
                }
            }
        }
    }

    private Node placeholder(String id, Matcher m, String text) {
        String sel = m.group(1) != null ? m.group(1) : m.group(2);
        ScopeSelector selector = ScopeSelector.fromReference(sel);

        Node span = new Node("span", m.group());
        span.addClass(REF_CLASS);
        span.setTail(text.substring(m.end()));

        refs.computeIfAbsent(id, k -> new LinkedHashMap<>())
                .computeIfAbsent(selector, k -> new ArrayList<>())
                .add(span);
        all.add(new Ref(id, selector, span));
        return span;
    }

    /** Returns true if markers point at the given id and no element has claimed it yet. */
    public boolean hasRefsTo(String id) {
        return refs.containsKey(id);
    }

    /**
     * Fills in the placeholders that point at {@code target}. Only the first element carrying a
     * given id is used; later elements with the same id leave the placeholders alone.
     *
     * @param lookup finds the labeller a selector refers to, from the target's point of view; it
     *     may return null, leaving those placeholders as they are
     */
    public void resolveRefs(Node target, Function<ScopeSelector, Labeller> lookup) {
        String id = target.id();
        if (id == null) {
            return;
        }
        Map<ScopeSelector, List<Node>> pending = refs.remove(id);
        if (pending == null) {
            return;
        }
        for (Map.Entry<ScopeSelector, List<Node>> entry : pending.entrySet()) {
            Labeller labeller = lookup.apply(entry.getKey());
            if (labeller == null) {
                continue;
            }
            String label = labeller.core();
            for (Node placeholder : entry.getValue()) {
                fill(placeholder, label);
                resolved.add(placeholder);
            }
            logger.debug(
                    "Resolved {} references to #{} as '{}'", entry.getValue().size(), id, label);
        }
    }

    private void fill(Node placeholder, String label) {
        for (Node old : new ArrayList<>(placeholder.children())) {
            placeholder.removeChild(old);
        }
        if (rewriter == null) {
            placeholder.setText(label);
            return;
        }
        Node content = rewriter.rewrite(label);
        placeholder.setText(content.text());
        for (Node kid : new ArrayList<>(content.children())) {
            placeholder.append(kid);
        }
    }

    /** Number of markers found by {@link #findRefs}. */
    public int markerCount() {
        return all.size();
    }

    /** Number of placeholders filled in so far. */
    public int resolvedCount() {
        return resolved.size();
    }

    /** Returns the markers, in document order, whose placeholders were never filled in. */
    public List<UnresolvedRef> unresolved() {
        List<UnresolvedRef> out = new ArrayList<>();
        for (Ref ref : all) {
            if (!resolved.contains(ref.placeholder())) {
                out.add(
                        new UnresolvedRef(
                                ref.targetId(), ref.selector(), ref.placeholder().text()));
            }
        }
        return out;
    }
}
