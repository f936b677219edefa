/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.logic;

import com.arisbe.core.common.exception.ErrorMessage;
import com.arisbe.core.common.util.Result;
import com.arisbe.core.graph.Cut;
import com.arisbe.core.graph.Edge;
import com.arisbe.core.graph.ExistentialGraph;
import com.arisbe.core.graph.Identifiers;
import com.arisbe.core.graph.Vertex;
import com.arisbe.core.pattern.Subgraph;
import org.junit.Test;

import java.util.List;
import java.util.Set;

import static com.arisbe.core.common.collection.Collections.list;
import static com.arisbe.core.common.collection.Collections.minusAll;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class InsertionTest {

    private final Identifiers identifiers = Identifiers.sequential();

    /**
     * sheet: x, c1[ c2[ y ] ]
     */
    private final ExistentialGraph graph = ExistentialGraph.empty("sheet")
            .withVertex(Vertex.generic("x"))
            .withCut(Cut.of("c1"))
            .withCut(Cut.of("c2"), "c1")
            .withVertex(Vertex.generic("y"), "c2");

    private static String added(ExistentialGraph before, ExistentialGraph after, String context) {
        Set<String> added = minusAll(after.area(context), before.area(context));
        assertEquals(1, added.size());
        return added.iterator().next();
    }

    @Test
    public void vertex_is_inserted_into_a_negative_context() {
        Result<ExistentialGraph, TransformationError> result = Insertion.vertex("c1", "Socrates").apply(graph, identifiers);
        assertTrue(result.isOk());
        String vertex = added(graph, result.get(), "c1");
        assertEquals("Socrates", result.get().vertex(vertex).label().get());
        assertTrue(result.get().isIsolated(vertex));
    }

    @Test
    public void insertion_in_a_positive_context_fails() {
        assertEquals(ErrorMessage.Transformation.INSERTION_IN_POSITIVE_CONTEXT,
                     Insertion.vertex("sheet", null).apply(graph, identifiers).error().error());
        assertEquals(ErrorMessage.Transformation.INSERTION_IN_POSITIVE_CONTEXT,
                     Insertion.cut("c2").apply(graph, identifiers).error().error());
    }

    @Test
    public void edge_is_attached_to_dominating_vertices() {
        Result<ExistentialGraph, TransformationError> result =
                Insertion.edge("c1", "Loves", list("x", "x")).apply(graph, identifiers);
        assertTrue(result.isOk());
        String edge = added(graph, result.get(), "c1");
        assertEquals("Loves", result.get().relation(edge));
        assertEquals(List.of("x", "x"), result.get().incidentVertices(edge));
    }

    @Test
    public void edge_arguments_are_checked() {
        assertEquals(ErrorMessage.Transformation.INSERTED_ARGUMENT_NOT_DOMINATING,
                     Insertion.edge("c1", "P", list("y")).apply(graph, identifiers).error().error());
        assertEquals(ErrorMessage.Transformation.ELEMENT_NOT_FOUND,
                     Insertion.edge("c1", "P", list("ghost")).apply(graph, identifiers).error().error());
        assertEquals(ErrorMessage.Transformation.NOT_A_VERTEX,
                     Insertion.edge("c1", "P", list("c2")).apply(graph, identifiers).error().error());
        assertEquals(ErrorMessage.Transformation.INVALID_ELEMENT_SHAPE,
                     Insertion.edge("c1", "", list("x")).apply(graph, identifiers).error().error());
    }

    @Test
    public void empty_cut_is_inserted() {
        Result<ExistentialGraph, TransformationError> result = Insertion.cut("c1").apply(graph, identifiers);
        String cut = added(graph, result.get(), "c1");
        assertTrue(result.get().isCut(cut));
        assertTrue(result.get().area(cut).isEmpty());
        assertTrue(result.get().isPositive(cut));
    }

    @Test
    public void template_from_another_graph_is_copied() {
        ExistentialGraph template = ExistentialGraph.empty("other")
                .withVertex(Vertex.generic("a"))
                .withCut(Cut.of("k"))
                .withVertex(Vertex.constant("b", "Plato"), "k")
                .withEdge(Edge.of("r"), list("a", "b"), "Teaches", "k");
        Result<ExistentialGraph, TransformationError> result =
                Insertion.of(Subgraph.ofArea(template, "other"), "c1").apply(graph, identifiers);
        assertTrue(result.isOk());
        ExistentialGraph inserted = result.get();
        assertEquals(graph.size() + template.size(), inserted.size());
        assertEquals(3, inserted.area("c1").size());

        Edge teaches = inserted.edges().iterator().next();
        assertEquals("Teaches", inserted.relation(teaches.id()));
        List<String> arguments = inserted.incidentVertices(teaches.id());
        assertEquals("c1", inserted.context(arguments.get(0)));
        assertEquals(inserted.context(teaches.id()), inserted.context(arguments.get(1)));
        assertEquals("Plato", inserted.vertex(arguments.get(1)).label().get());
    }

    @Test
    public void unknown_context_and_blank_label_are_rejected() {
        assertEquals(ErrorMessage.Transformation.CONTEXT_NOT_FOUND,
                     Insertion.cut("nowhere").apply(graph, identifiers).error().error());
        assertEquals(ErrorMessage.Transformation.INVALID_ELEMENT_SHAPE,
                     Insertion.vertex("c1", " ").apply(graph, identifiers).error().error());
    }
}
