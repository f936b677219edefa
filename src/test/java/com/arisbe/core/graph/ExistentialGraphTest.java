/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.graph;

import com.arisbe.core.common.exception.ArisbeException;
import com.arisbe.core.common.exception.ErrorMessage;
import org.junit.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.arisbe.core.common.collection.Collections.list;
import static com.arisbe.core.common.collection.Collections.set;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ExistentialGraphTest {

    /**
     * sheet: x, Human(x), c1[ Mortal(x), c2[ y ] ]
     */
    private static ExistentialGraph nested() {
        return ExistentialGraph.empty("sheet")
                .withVertex(Vertex.generic("x"))
                .withEdge(Edge.of("human"), list("x"), "Human")
                .withCut(Cut.of("c1"))
                .withEdge(Edge.of("mortal"), list("x"), "Mortal", "c1")
                .withCut(Cut.of("c2"), "c1")
                .withVertex(Vertex.constant("y", "Socrates"), "c2");
    }

    private static void assertPartitioned(ExistentialGraph graph) {
        Set<String> seen = new HashSet<>();
        int placements = 0;
        for (Set<String> area : graph.area().values()) {
            seen.addAll(area);
            placements += area.size();
        }
        assertEquals(graph.size(), placements);
        assertEquals(graph.size(), seen.size());
        graph.vertices().forEach(v -> assertTrue(seen.contains(v.id())));
        graph.edges().forEach(e -> assertTrue(seen.contains(e.id())));
        graph.cuts().forEach(c -> assertTrue(seen.contains(c.id())));
    }

    @Test
    public void empty_graph_has_only_the_sheet() {
        ExistentialGraph graph = ExistentialGraph.empty("sheet");
        assertTrue(graph.isEmpty());
        assertEquals(set("sheet"), graph.area().keySet());
        assertTrue(graph.area("sheet").isEmpty());
        assertTrue(graph.isPositive("sheet"));
        assertEquals(0, graph.depth("sheet"));
    }

    @Test
    public void construction_keeps_the_area_partitioned() {
        ExistentialGraph graph = nested();
        assertPartitioned(graph);
        assertPartitioned(graph.without("c1"));
        assertPartitioned(graph.withVertexMovedTo("y", "sheet"));
        assertPartitioned(graph.withoutAll(set("c2", "y")));
        assertEquals(6, graph.size());
    }

    @Test
    public void construction_leaves_the_original_untouched() {
        ExistentialGraph graph = nested();
        ExistentialGraph bigger = graph.withVertex(Vertex.generic("z"), "c2");
        assertFalse(graph.contains("z"));
        assertTrue(bigger.contains("z"));
        assertEquals(set("y"), graph.area("c2"));
        assertSame(graph.area("c1"), bigger.area("c1"));
    }

    @Test
    public void area_and_full_context_differ_on_nested_cuts() {
        ExistentialGraph graph = nested();
        assertThat(graph.area("sheet"), containsInAnyOrder("x", "human", "c1"));
        assertThat(graph.area("c1"), containsInAnyOrder("mortal", "c2"));
        assertThat(graph.fullContext("c1"), containsInAnyOrder("mortal", "c2", "y"));
        assertEquals(graph.size(), graph.fullContext("sheet").size());
    }

    @Test
    public void context_is_the_inverse_of_area() {
        ExistentialGraph graph = nested();
        for (String context : graph.area().keySet()) {
            for (String element : graph.area(context)) assertEquals(context, graph.context(element));
        }
        assertEquals("sheet", graph.context("c1"));
        assertEquals("c1", graph.context("c2"));
    }

    @Test
    public void polarity_alternates_with_depth() {
        ExistentialGraph graph = nested().withCut(Cut.of("c3"), "c2");
        assertTrue(graph.isPositive("sheet"));
        assertTrue(graph.isNegative("c1"));
        assertTrue(graph.isPositive("c2"));
        assertTrue(graph.isNegative("c3"));
        for (Cut cut : graph.cuts()) {
            assertNotEquals(graph.isPositive(cut.id()), graph.isPositive(graph.context(cut.id())));
        }
        assertEquals(3, graph.depth("c3"));
        assertEquals(2, graph.nestingDepth("y"));
        assertTrue(graph.isEvenlyEnclosed("y"));
        assertTrue(graph.isOddlyEnclosed("mortal"));
    }

    @Test
    public void dominance_follows_nesting() {
        ExistentialGraph graph = nested().withCut(Cut.of("c3"));
        assertTrue(graph.dominates("sheet", "c2"));
        assertTrue(graph.dominates("c1", "c2"));
        assertTrue(graph.dominates("c2", "c2"));
        assertFalse(graph.dominates("c2", "c1"));
        assertFalse(graph.dominates("c3", "c2"));
        assertFalse(graph.encloses("c2", "c2"));
        assertTrue(graph.encloses("c1", "c2"));
        assertThat(graph.ancestors("c2"), contains("c1", "sheet"));
        assertTrue(graph.ancestors("sheet").isEmpty());
    }

    @Test
    public void incidence_is_tracked() {
        ExistentialGraph graph = nested();
        assertEquals(List.of("x"), graph.incidentVertices("mortal"));
        assertEquals("Mortal", graph.relation("mortal"));
        assertEquals(set("human", "mortal"), graph.incidentEdges("x"));
        assertFalse(graph.isIsolated("x"));
        assertTrue(graph.isIsolated("y"));
        assertEquals(set("y"), graph.isolatedVertices());

        ExistentialGraph withoutEdges = graph.without("human").without("mortal");
        assertTrue(withoutEdges.isIsolated("x"));
        assertEquals(set("x", "y"), withoutEdges.isolatedVertices());
    }

    @Test
    public void edges_may_repeat_an_argument() {
        ExistentialGraph graph = nested().withEdge(Edge.of("loves"), list("x", "x"), "Loves");
        assertEquals(List.of("x", "x"), graph.incidentVertices("loves"));
        assertEquals(set("human", "mortal", "loves"), graph.incidentEdges("x"));
        assertEquals(set("human", "mortal"), graph.without("loves").incidentEdges("x"));
    }

    @Test
    public void removing_a_cut_hands_its_contents_to_its_context() {
        ExistentialGraph graph = nested().without("c1");
        assertFalse(graph.contains("c1"));
        assertThat(graph.area("sheet"), containsInAnyOrder("x", "human", "mortal", "c2"));
        assertEquals("sheet", graph.context("c2"));
        assertTrue(graph.isNegative("c2"));
    }

    @Test
    public void removing_a_referenced_vertex_fails() {
        try {
            nested().without("x");
            fail();
        } catch (ArisbeException e) {
            assertEquals(ErrorMessage.Graph.VERTEX_IN_USE.code(), e.errorMessage().code());
        }
    }

    @Test
    public void removing_a_cut_without_its_contents_fails() {
        try {
            nested().withoutAll(set("c2"));
            fail();
        } catch (ArisbeException e) {
            assertEquals(ErrorMessage.Graph.PARTIAL_CUT_REMOVAL.code(), e.errorMessage().code());
        }
    }

    @Test
    public void removing_the_sheet_fails() {
        try {
            nested().without("sheet");
            fail();
        } catch (ArisbeException e) {
            assertEquals(ErrorMessage.Graph.SHEET_NOT_REMOVABLE.code(), e.errorMessage().code());
        }
    }

    @Test
    public void moving_a_cut_into_itself_fails() {
        try {
            nested().withMoved(set("c1"), "c2");
            fail();
        } catch (ArisbeException e) {
            assertEquals(ErrorMessage.Graph.MOVE_INTO_ITSELF.code(), e.errorMessage().code());
        }
    }

    @Test
    public void moving_a_cut_takes_its_contents_along() {
        ExistentialGraph graph = nested().withCut(Cut.of("c3")).withMoved(set("c2"), "c3");
        assertEquals("c3", graph.context("c2"));
        assertEquals(set("y"), graph.area("c2"));
        assertEquals(2, graph.nestingDepth("y"));
    }

    @Test
    public void unknown_identifiers_are_rejected() {
        ExistentialGraph graph = nested();
        try {
            graph.context("nothing");
            fail();
        } catch (ArisbeException e) {
            assertEquals(ErrorMessage.Graph.ELEMENT_NOT_FOUND.code(), e.errorMessage().code());
        }
        try {
            graph.area("x");
            fail();
        } catch (ArisbeException e) {
            assertEquals(ErrorMessage.Graph.CONTEXT_NOT_FOUND.code(), e.errorMessage().code());
        }
        try {
            graph.withVertex(Vertex.generic("z"), "nowhere");
            fail();
        } catch (ArisbeException e) {
            assertEquals(ErrorMessage.Graph.CONTEXT_NOT_FOUND.code(), e.errorMessage().code());
        }
        try {
            graph.withEdge(Edge.of("e"), list("x", "ghost"), "R");
            fail();
        } catch (ArisbeException e) {
            assertEquals(ErrorMessage.Graph.ELEMENT_NOT_FOUND.code(), e.errorMessage().code());
        }
        try {
            graph.incidentEdges("human");
            fail();
        } catch (ArisbeException e) {
            assertEquals(ErrorMessage.Graph.NOT_A_VERTEX.code(), e.errorMessage().code());
        }
    }

    @Test
    public void reused_identifiers_and_blank_relations_are_rejected() {
        ExistentialGraph graph = nested();
        try {
            graph.withCut(Cut.of("x"));
            fail();
        } catch (ArisbeException e) {
            assertEquals(ErrorMessage.Graph.DUPLICATE_ELEMENT.code(), e.errorMessage().code());
        }
        try {
            graph.withVertex(Vertex.generic("sheet"));
            fail();
        } catch (ArisbeException e) {
            assertEquals(ErrorMessage.Graph.DUPLICATE_ELEMENT.code(), e.errorMessage().code());
        }
        try {
            graph.withEdge(Edge.of("e"), list("x"), " ");
            fail();
        } catch (ArisbeException e) {
            assertEquals(ErrorMessage.Graph.INVALID_RELATION_NAME.code(), e.errorMessage().code());
        }
    }

    @Test
    public void dominating_nodes_are_detected() {
        assertTrue(nested().hasDominatingNodes());
        ExistentialGraph crossing = nested().withEdge(Edge.of("knows"), list("y"), "Knows", "c1");
        assertFalse(crossing.hasDominatingNodes());
    }

    @Test
    public void graphs_are_equal_by_content() {
        assertEquals(nested(), nested());
        assertEquals(nested().hashCode(), nested().hashCode());
        assertNotEquals(nested(), nested().withCut(Cut.of("c3")));
        assertEquals(nested(), nested().withCut(Cut.of("c3")).without("c3"));
    }

    @Test
    public void isomorphism_ignores_identifiers() {
        ExistentialGraph renamed = ExistentialGraph.empty("other")
                .withCut(Cut.of("k1"))
                .withVertex(Vertex.generic("a"))
                .withCut(Cut.of("k2"), "k1")
                .withVertex(Vertex.constant("b", "Socrates"), "k2")
                .withEdge(Edge.of("f1"), list("a"), "Mortal", "k1")
                .withEdge(Edge.of("f2"), list("a"), "Human");
        assertTrue(nested().isomorphic(renamed));
        assertFalse(nested().isomorphic(renamed.withVertexMovedTo("b", "k1")));
        assertFalse(nested().isomorphic(renamed.without("f2").withEdge(Edge.of("f2"), list("a"), "Greek")));
    }

    @Test
    public void edits_of_a_large_graph_share_untouched_state() {
        ExistentialGraph large = nested();
        for (int i = 0; i < 5000; i++) {
            large = large.withVertex(Vertex.generic("v" + i), "c1")
                    .withEdge(Edge.of("p" + i), list("v" + i), "P", "c1");
        }
        ExistentialGraph edited = large.without("p42").without("v42").withCut(Cut.of("c3"));

        assertEquals(large.size() - 1, edited.size());
        assertTrue(large.contains("p42"));
        assertTrue(large.incidentEdges("v42").contains("p42"));
        assertFalse(edited.contains("v42"));
        assertSame(large.area("c2"), edited.area("c2"));
        assertSame(large.incidentEdges("v7"), edited.incidentEdges("v7"));
        assertPartitioned(edited);
    }

    @Test
    public void rendering_shows_nesting() {
        assertEquals("*x (Human x) ~[(Mortal x) ~[\"Socrates\"@y]]", nested().toString());
    }
}
