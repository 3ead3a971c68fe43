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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.autolabel.LabelTestBase;
import net.boyechko.autolabel.core.LabelConfig;
import net.boyechko.autolabel.core.LabelResult;
import net.boyechko.autolabel.document.Node;
import net.boyechko.autolabel.issue.Issue;
import net.boyechko.autolabel.issue.IssueList;
import net.boyechko.autolabel.issue.IssueSev;
import net.boyechko.autolabel.issue.IssueType;
import net.boyechko.autolabel.render.LabelsRenderer;
import org.junit.jupiter.api.Test;

class LabelsVisitorTest extends LabelTestBase {

    private static LabelConfig config(String... typeAndTemplate) {
        LabelConfig config = LabelConfig.empty();
        for (int i = 0; i < typeAndTemplate.length; i += 2) {
            config.withLabel(typeAndTemplate[i], typeAndTemplate[i + 1]);
        }
        return config;
    }

    // ── Headings ────────────────────────────────────────────────────

    @Test
    void headingsNestUnderTheirParents() throws Exception {
        Node root =
                el(
                        "body",
                        el("h1", "Intro"),
                        el("h2", "Scope"),
                        el("h2", "Terms"),
                        el("h1", "Design"),
                        el("h2", "Layout"));

        process(root, config("h1", "1 ,H.1 ,*"));

        assertEquals(List.of("1 ", "1.1 ", "1.2 ", "2 ", "2.1 "), labels(root));
        assertEquals("1.1 Scope", root.child(1).textContent());
    }

    @Test
    void headingWithoutParentLabelOmitsSeparator() throws Exception {
        Node root = el("body", el("h2", "Only"), el("h2", "Second"));

        process(root, config("h2", "H.1 ,*"));

        assertEquals(List.of("1 ", "2 "), labels(root));
    }

    @Test
    void deeperLevelsRestartAfterShallowerHeading() throws Exception {
        Node root =
                el(
                        "body",
                        el("h1"),
                        el("h2"),
                        el("h3"),
                        el("h3"),
                        el("h2"),
                        el("h3"));

        process(root, config("h1", "1.,H.1.,*"));

        assertEquals(List.of("1.", "1.1.", "1.1.1.", "1.1.2.", "1.2.", "1.2.1."), labels(root));
    }

    @Test
    void noLabelHeadingIsSkippedByTheCount() throws Exception {
        Node root = el("body", el("h1", "A"), withNoLabel(el("h1", "B")), el("h1", "C"));

        process(root, config("h1", "1 "));

        assertEquals(List.of("1 ", "2 "), labels(root));
        assertNull(labelOf(root.child(1)));
        assertFalse(root.child(1).has("-no-label"));
    }

    @Test
    void headingOverrideRestartsTheSeries() throws Exception {
        Node root = el("body", el("h1"), withLabel(el("h1"), "A "), el("h1"));

        process(root, config("h1", "1 "));

        assertEquals(List.of("1 ", "A ", "B "), labels(root));
        assertFalse(root.child(1).has("-label"));
    }

    @Test
    void directiveAloneStartsHeadingNumbering() throws Exception {
        Node root = el("body", withLabel(el("h3"), "(i) "), el("h3"), el("h4"));

        process(root, LabelConfig.empty());

        assertEquals(List.of("(i) ", "(ii) "), labels(root));
    }

    // ── Lists ───────────────────────────────────────────────────────

    @Test
    void listItemsAreNumberedInOrder() throws Exception {
        Node list = el("ol", li("one"), li("two"), li("three"));

        process(el("body", list), config("ol", "1."));

        assertEquals(List.of("1.", "2.", "3."), labels(list));
        assertTrue(list.hasClass(LabelsRenderer.LABELLED_CLASS));
    }

    @Test
    void nestedListsUseTheChildTemplate() throws Exception {
        Node inner = el("ol", li("x"), el("li", "y", el("ol", li("deep"))));
        Node list = el("ol", li("a"), el("li", "b", inner), li("c"));

        process(el("body", list), config("ol", "1.,(a),(I)"));

        assertEquals(List.of("1.", "2.", "(a)", "(b)", "(I)", "3."), labels(list));
    }

    @Test
    void listMarkerBuildsOnOuterItem() throws Exception {
        Node list = el("ol", li("a"), el("li", "b", el("ol", li("x"), li("y"))), li("c"));

        process(el("body", list), config("ol", "1.,L.a"));

        assertEquals(List.of("1.", "2.", "2.a", "2.b", "3."), labels(list));
    }

    @Test
    void bulletsRepeatAtEveryLevel() throws Exception {
        Node list = el("ul", el("li", "a", el("ul", el("li", "b", el("ul", li("c"))))));

        process(el("body", list), config("ul", "◼ ,▸ ,*"));

        assertEquals(List.of("◼ ", "▸ ", "▸ "), labels(list));
    }

    @Test
    void itemOverrideAppliesToLaterItems() throws Exception {
        Node list = el("ol", li("a"), withLabel(li("b"), "-1-"), li("c"));

        process(el("body", list), config("ol", "(a)"));

        assertEquals(List.of("(a)", "-1-", "-2-"), labels(list));
    }

    @Test
    void headingOverrideKeepsTheReplacedParent() throws Exception {
        Node root =
                el("body", el("h1"), el("h2"), withLabel(el("h2"), "(a)"), el("h2"));

        process(root, config("h1", "1,H.1"));

        assertEquals(List.of("1", "1.1", "(1a)", "(1b)"), labels(root));
    }

    @Test
    void itemOverrideKeepsTheListParent() throws Exception {
        Node list = el("ol", li("x"), withLabel(li("y"), "(a)"), li("z"));
        Node root = el("body", el("h1"), list);

        process(root, config("h1", "1", "ol", "H.1"));

        assertEquals(List.of("1", "1.1", "(1a)", "(1b)"), labels(root));
    }

    @Test
    void noLabelItemIsMarkedAndSkipped() throws Exception {
        Node list = el("ol", li("a"), withNoLabel(li("b")), li("c"));

        process(el("body", list), config("ol", "1."));

        assertEquals(List.of("1.", "2."), labels(list));
        assertTrue(list.child(1).hasClass(LabelsRenderer.NO_LABEL_CLASS));
    }

    @Test
    void listWithoutTemplateStaysUnlabelled() throws Exception {
        Node list = el("ol", li("a"), li("b"));

        process(el("body", list), LabelConfig.empty());

        assertTrue(labels(list).isEmpty());
        assertNull(list.get("class"));
    }

    @Test
    void listDirectiveOverridesDefault() throws Exception {
        Node list = withLabel(el("ol", li("a"), li("b")), "i)");

        process(el("body", list), config("ol", "1."));

        assertEquals(List.of("i)", "ii)"), labels(list));
    }

    @Test
    void mdPrefixedDirectiveIsAccepted() throws Exception {
        Node list = el("ol", li("a"));
        list.set("md-label", "A.");

        process(el("body", list), LabelConfig.empty());

        assertEquals(List.of("A."), labels(list));
        assertFalse(list.has("md-label"));
    }

    // ── Series ──────────────────────────────────────────────────────

    @Test
    void seriesRestartsUnderEachParentHeading() throws Exception {
        Node root =
                el(
                        "body",
                        el("h1", "One"),
                        el("figure", el("img"), el("figcaption", "Cat")),
                        el("figure", el("figcaption", "Dog")),
                        el("h1", "Two"),
                        el("figure", el("figcaption", "Owl")));

        process(root, config("h1", "1 ", "figure", "\"Figure \"h1.1. "));

        assertEquals(
                List.of("1 ", "Figure 1.1. ", "Figure 1.2. ", "2 ", "Figure 2.1. "),
                labels(root));
        assertEquals("Figure 1.1. Cat", root.child(1).child(1).textContent());
    }

    @Test
    void seriesWithoutCaptionIsLabelledAtTheStart() throws Exception {
        Node table = el("table", el("tr"));
        Node root = el("body", el("aside", "Note"), table);

        process(root, config("aside", "\"Note \"1: ", "table", "\"Table \"1"));

        assertEquals("Note 1: ", labelOf(root.child(0)));
        assertEquals("Table 1", labelOf(table));
    }

    @Test
    void seriesOverrideStartsANewCount() throws Exception {
        Node root =
                el(
                        "body",
                        el("figure"),
                        withLabel(el("figure"), "\"Plate \"A"),
                        el("figure"),
                        withNoLabel(el("figure")),
                        el("figure"));

        process(root, config("figure", "\"Fig. \"1"));

        assertEquals(List.of("Fig. 1", "Plate A", "Plate B", "Plate C"), labels(root));
    }

    // ── References ──────────────────────────────────────────────────

    @Test
    void referencesResolveToTheTargetLabel() throws Exception {
        Node ref = link("design", "see section ##");
        Node root =
                el(
                        "body",
                        el("p", ref),
                        el("h1", "Intro"),
                        el("h1", "Design").set("id", "design"));

        process(root, config("h1", "1. "));

        assertEquals("see section 2", ref.textContent());
    }

    @Test
    void referenceSelectorsPickTheEnclosingScope() throws Exception {
        Node item = li("step").set("id", "step");
        Node refs =
                el(
                        "p",
                        link("step", "##"),
                        link("step", "##l"),
                        link("step", "##h"),
                        link("step", "##{h1}"));
        Node root =
                el(
                        "body",
                        refs,
                        el("h1", "Intro"),
                        el("h1", "Method"),
                        el("ol", li("first"), item));

        process(root, config("h1", "1 ", "ol", "a)"));

        assertEquals("bb22", refs.textContent());
    }

    @Test
    void unresolvedReferenceIsReported() throws Exception {
        Node ref = link("intro", "##l");
        Node root = el("body", el("h1", "Intro").set("id", "intro"), el("p", ref));

        LabelResult result = process(root, config("h1", "1 "));

        assertEquals("##l", ref.textContent());
        IssueList unresolved = result.issues().ofType(IssueType.UNRESOLVED_REFERENCE);
        assertEquals(1, unresolved.size());
        assertEquals(IssueSev.INFO, unresolved.get(0).severity());
        assertEquals(
                "Reference ##l to #intro matched no L label", unresolved.get(0).message());
    }

    @Test
    void referenceToSeriesElement() throws Exception {
        Node ref = link("owl", "Figure ##figure");
        Node root =
                el(
                        "body",
                        el("p", ref),
                        el("figure"),
                        el("figure", el("figcaption", "Owl")).set("id", "owl"));

        process(root, config("figure", "\"Figure \"1. "));

        assertEquals("Figure 2", ref.textContent());
    }

    // ── Directives and issues ───────────────────────────────────────

    @Test
    void directiveOnUnconfiguredElementIsAppliedWithWarning() throws Exception {
        Node para = withLabel(el("p", "Claim"), "\"Claim \"1: ");
        Node root = el("body", para);

        LabelResult result = process(root, LabelConfig.empty());

        assertEquals("Claim 1: ", labelOf(para));
        IssueList misplaced = result.issues().ofType(IssueType.MISPLACED_DIRECTIVE);
        assertEquals(1, misplaced.size());
        Issue issue = misplaced.get(0);
        assertEquals(IssueSev.WARNING, issue.severity());
        assertTrue(issue.message().contains("<p>"), issue.message());
        assertTrue(issue.message().contains("-label=\"\\\"Claim \\\"1: \""), issue.message());
    }

    @Test
    void unconfiguredElementWithoutDirectiveIsUntouched() throws Exception {
        Node para = el("p", "Plain");
        para.set("-no-label", "");

        LabelResult result = process(el("body", para), LabelConfig.empty());

        assertNull(labelOf(para));
        assertTrue(para.has("-no-label"));
        assertTrue(result.issues().isEmpty());
    }

    @Test
    void bothDirectiveFormsAreReported() throws Exception {
        Node heading = withLabel(el("h1"), "A ");
        heading.set("md-label", "1 ");

        LabelResult result = process(el("body", heading), LabelConfig.empty());

        assertEquals("A ", labelOf(heading));
        assertEquals(1, result.issues().ofType(IssueType.DUPLICATE_DIRECTIVE).size());
        assertFalse(heading.has("md-label"));
    }

    @Test
    void flagWithValueIsReported() throws Exception {
        Node item = li("b").set("-no-label", "yes");
        Node list = el("ol", li("a"), item);

        LabelResult result = process(el("body", list), config("ol", "1."));

        assertEquals(List.of("1."), labels(list));
        IssueList ignored = result.issues().ofType(IssueType.DIRECTIVE_VALUE_IGNORED);
        assertEquals(1, ignored.size());
        assertTrue(ignored.get(0).where().describe().contains("li["));
    }
}
