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

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import net.boyechko.autolabel.LabelTestBase;
import net.boyechko.autolabel.document.Node;
import net.boyechko.autolabel.labeller.Labeller;
import net.boyechko.autolabel.template.LabelTemplateException;
import net.boyechko.autolabel.template.ScopeSelector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RefResolverTest extends LabelTestBase {
    private Labeller third;

    @BeforeEach
    void setUp() throws LabelTemplateException {
        third = new Labeller("h1", parse("1."), null, null);
        for (int i = 0; i < 3; i++) {
            third.increment();
        }
    }

    private static List<Node> placeholders(Node root) {
        List<Node> out = new ArrayList<>();
        for (Node n : root.iter()) {
            if (n.hasClass(RefResolver.REF_CLASS)) {
                out.add(n);
            }
        }
        return out;
    }

    @Test
    void markerIsSplitOutAndFilledIn() {
        Node a = link("s1", "see ## now");
        Node root = el("body", el("p", a), el("h1", "Intro").set("id", "s1"));

        RefResolver resolver = new RefResolver();
        resolver.findRefs(root);

        assertEquals("see ", a.text());
        Node span = a.child(0);
        assertTrue(span.hasClass(RefResolver.REF_CLASS));
        assertEquals("##", span.text());
        assertEquals(" now", span.tail());
        assertTrue(resolver.hasRefsTo("s1"));

        resolver.resolveRefs(root.child(1), sel -> third);

        assertEquals("3", span.text());
        assertEquals("see 3 now", a.textContent());
        assertTrue(resolver.unresolved().isEmpty());
    }

    @ParameterizedTest
    @CsvSource({
        "##, X",
        "##x, X",
        "##{x}, X",
        "##l, L",
        "##{l}, L",
        "##h, H",
        "##{h}, H",
        "##h2, H2",
        "##{h2}, H2",
        "##figure, figure",
        "##{Table}, table"
    })
    void markerSelectsLabellerKind(String marker, String expectedSelector) {
        Node root = el("body", link("t", marker), el("figure").set("id", "t"));
        List<ScopeSelector> asked = new ArrayList<>();

        RefResolver resolver = new RefResolver();
        resolver.findRefs(root);
        resolver.resolveRefs(
                root.child(1),
                sel -> {
                    asked.add(sel);
                    return third;
                });

        assertEquals(1, asked.size());
        assertEquals(expectedSelector, asked.get(0).marker());
        assertEquals("3", root.child(0).textContent());
    }

    @Test
    void bracesSeparateSelectorFromFollowingText() {
        Node a = link("t", "##{h2}nd");
        Node root = el("body", a, el("h2").set("id", "t"));

        RefResolver resolver = new RefResolver();
        resolver.findRefs(root);

        assertEquals("nd", a.child(0).tail());
        assertEquals(ScopeSelector.headingLevel(2), resolver.unresolved().get(0).selector());
    }

    @Test
    void markersInNestedTextAndTailsAreAllFound() {
        Node em = el("em", "##h");
        em.setTail(" and ##l");
        Node a = link("t", "##h").with(em);
        Node root = el("body", a);

        RefResolver resolver = new RefResolver();
        resolver.findRefs(root);

        List<Node> found = placeholders(root);
        assertEquals(3, found.size());
        assertEquals(List.of("##h", "##h", "##l"), found.stream().map(Node::text).toList());
        assertSame(a, found.get(0).parent());
        assertSame(em, found.get(1).parent());
        assertSame(a, found.get(2).parent());
        assertEquals(" and ", em.tail());
        assertEquals("##h##h and ##l", a.textContent());
    }

    @Test
    void severalMarkersInOneString() {
        Node a = link("t", "## and ##");
        RefResolver resolver = new RefResolver();
        resolver.findRefs(el("body", a));

        assertEquals(2, a.childCount());
        assertEquals(" and ", a.child(0).tail());
        assertEquals("", a.child(1).tail());
    }

    @Test
    void escapedMarkerIsLeftAlone() {
        Node a = link("t", "\\## is literal");
        RefResolver resolver = new RefResolver();
        resolver.findRefs(el("body", a));

        assertEquals(0, a.childCount());
        assertEquals("\\## is literal", a.text());
        assertFalse(resolver.hasRefsTo("t"));
    }

    @Test
    void onlySameDocumentLinksAreScanned() {
        Node external = new Node("a", "##").set("href", "https://example.com/#t");
        Node bare = new Node("a", "##").set("href", "#");
        Node span = el("span", "##");
        Node root = el("body", external, bare, span);

        RefResolver resolver = new RefResolver();
        resolver.findRefs(root);

        assertTrue(placeholders(root).isEmpty());
        assertTrue(resolver.unresolved().isEmpty());
    }

    @Test
    void unresolvedMarkersKeepTheirText() {
        Node root = el("body", link("t", "##h"), link("t", "##l"), el("h1").set("id", "t"));
        RefResolver resolver = new RefResolver();
        resolver.findRefs(root);

        Function<ScopeSelector, Labeller> headingsOnly =
                sel -> sel.equals(ScopeSelector.HEADING) ? third : null;
        resolver.resolveRefs(root.child(2), headingsOnly);

        assertEquals("3", root.child(0).textContent());
        assertEquals("##l", root.child(1).textContent());
        List<RefResolver.UnresolvedRef> unresolved = resolver.unresolved();
        assertEquals(1, unresolved.size());
        assertEquals("t", unresolved.get(0).targetId());
        assertEquals(ScopeSelector.LIST, unresolved.get(0).selector());
        assertEquals("##l", unresolved.get(0).marker());
    }

    @Test
    void targetWithoutMatchingIdIsIgnored() {
        Node root = el("body", link("t", "##"), el("h1").set("id", "other"), el("h1"));
        RefResolver resolver = new RefResolver();
        resolver.findRefs(root);

        resolver.resolveRefs(root.child(1), sel -> third);
        resolver.resolveRefs(root.child(2), sel -> third);

        assertEquals("##", root.child(0).textContent());
        assertEquals(1, resolver.unresolved().size());
    }

    @Test
    void onlyTheFirstElementWithAnIdResolvesIt() throws LabelTemplateException {
        Labeller other = new Labeller("h1", parse("A"), null, null);
        other.increment();
        Node root =
                el(
                        "body",
                        link("t", "##"),
                        el("h1").set("id", "t"),
                        el("h1").set("id", "t"));
        RefResolver resolver = new RefResolver();
        resolver.findRefs(root);

        resolver.resolveRefs(root.child(1), sel -> third);
        resolver.resolveRefs(root.child(2), sel -> other);

        assertEquals("3", root.child(0).textContent());
        assertFalse(resolver.hasRefsTo("t"));
        assertEquals(1, resolver.markerCount());
        assertEquals(1, resolver.resolvedCount());
    }

    @Test
    void rewriterSuppliesPlaceholderContent() {
        InlineRewriter bold = label -> new Node("span").with(new Node("b", label));
        Node root = el("body", link("t", "##"), el("h1").set("id", "t"));
        RefResolver resolver = new RefResolver(bold);
        resolver.findRefs(root);

        resolver.resolveRefs(root.child(1), sel -> third);
        third.increment();
        resolver.resolveRefs(root.child(1), sel -> third);

        Node placeholder = root.child(0).child(0);
        assertNull(placeholder.text());
        assertEquals(1, placeholder.childCount());
        assertEquals("b", placeholder.child(0).tag());
        assertEquals("4", placeholder.textContent());
    }
}
