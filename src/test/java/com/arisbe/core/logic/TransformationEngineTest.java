/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.logic;

import com.arisbe.core.common.exception.ErrorMessage;
import com.arisbe.core.common.parameters.Options;
import com.arisbe.core.common.util.Result;
import com.arisbe.core.graph.Cut;
import com.arisbe.core.graph.Edge;
import com.arisbe.core.graph.ExistentialGraph;
import com.arisbe.core.graph.Identifiers;
import com.arisbe.core.graph.Vertex;
import com.arisbe.core.pattern.Subgraph;
import org.junit.Test;

import java.util.Optional;
import java.util.Set;

import static com.arisbe.core.common.collection.Collections.list;
import static com.arisbe.core.common.collection.Collections.minusAll;
import static com.arisbe.core.common.collection.Collections.set;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TransformationEngineTest {

    private final TransformationEngine engine =
            new TransformationEngine(new Options.Engine().traceTransformations(true), Identifiers.sequential());

    /**
     * Every human is mortal, and something is human: *x (Human x) ~[(Mortal x)]
     */
    private final ExistentialGraph graph = ExistentialGraph.empty("sheet")
            .withVertex(Vertex.generic("x"))
            .withEdge(Edge.of("human"), list("x"), "Human")
            .withCut(Cut.of("c1"))
            .withEdge(Edge.of("mortal"), list("x"), "Mortal", "c1");

    @Test
    public void human_mortal_scenario() {
        assertTrue(graph.isPositive("sheet"));
        assertFalse(graph.isPositive("c1"));

        Result<ExistentialGraph, TransformationError> mortal = engine.erase(graph, "mortal");
        assertTrue(mortal.isError());
        assertEquals(ErrorMessage.Transformation.ERASURE_IN_NEGATIVE_CONTEXT, mortal.error().error());

        Result<ExistentialGraph, TransformationError> human = engine.erase(graph, "human");
        assertTrue(human.isOk());
        assertEquals(1, human.get().edges().size());
        assertEquals(set("mortal"), human.get().incidentEdges("x"));

        ExistentialGraph wrapped = engine.addDoubleCut(graph, Subgraph.minimal(graph, list("c1"))).get();
        Set<String> added = minusAll(wrapped.area("sheet"), graph.area("sheet"));
        assertEquals(1, added.size());
        ExistentialGraph unwrapped = engine.removeDoubleCut(wrapped, added.iterator().next()).get();
        assertEquals(graph, unwrapped);
        assertEquals(2, unwrapped.edges().size());
    }

    @Test
    public void validate_reports_without_transforming() {
        Optional<TransformationError> refused = engine.validate(graph, Erasure.of("mortal"));
        assertTrue(refused.isPresent());
        assertEquals(ErrorMessage.Transformation.ERASURE_IN_NEGATIVE_CONTEXT.code(), refused.get().code());
        assertFalse(engine.validate(graph, Erasure.of("human")).isPresent());
        assertTrue(graph.contains("human"));
    }

    @Test
    public void application_options_inherit_from_the_engine() {
        Options.Application options = new Options.Application().checkInvariants(false);
        Result<ExistentialGraph, TransformationError> result = engine.apply(graph, Erasure.of("human"), options);
        assertTrue(result.isOk());
        assertFalse(options.checkInvariants());
        assertTrue(options.traceTransformations());
        assertEquals(Options.DEFAULT_HISTORY_LIMIT, options.historyLimit());
    }

    @Test
    public void convenience_methods_chain_a_proof() {
        ExistentialGraph inserted = engine.insertVertex(graph, "c1", "Socrates").get();
        String socrates = minusAll(inserted.area("c1"), graph.area("c1")).iterator().next();
        inserted = engine.insertEdge(inserted, "c1", "Greek", list(socrates)).get();
        inserted = engine.insertCut(inserted, "c1").get();
        assertEquals(graph.area("c1").size() + 3, inserted.area("c1").size());

        ExistentialGraph iterated = engine.iterate(graph, Subgraph.minimal(graph, list("human")), "sheet", set("x")).get();
        assertEquals(3, iterated.edges().size());
        String copy = minusAll(iterated.area("sheet"), graph.area("sheet")).iterator().next();
        Subgraph candidate = Subgraph.of(iterated, set("x"), set(copy), set(), "sheet", false);
        ExistentialGraph deiterated = engine.deiterate(iterated, candidate, set("x")).get();
        assertEquals(graph, deiterated);

        ExistentialGraph withVertex = engine.addIsolatedVertex(graph, "sheet", null).get();
        String vertex = minusAll(withVertex.area("sheet"), graph.area("sheet")).iterator().next();
        assertEquals(graph, engine.removeIsolatedVertex(withVertex, vertex).get());

        ExistentialGraph emptyDouble = engine.addDoubleCut(graph, "c1").get();
        assertEquals(graph.cuts().size() + 2, emptyDouble.cuts().size());
    }

    @Test
    public void subgraph_insertion_and_erasure_through_the_engine() {
        ExistentialGraph template = ExistentialGraph.empty("t").withVertex(Vertex.constant("p", "Plato"));
        ExistentialGraph inserted = engine.insert(graph, Subgraph.ofArea(template, "t"), "c1").get();
        assertEquals(graph.vertices().size() + 1, inserted.vertices().size());

        ExistentialGraph erased = engine.erase(inserted, "c1").get();
        assertEquals(set("x", "human"), erased.area("sheet"));
        assertEquals(graph.vertices().size(), erased.vertices().size());

        Subgraph everything = Subgraph.minimal(inserted, list("human", "c1"));
        assertTrue(engine.erase(inserted, everything).get().isEmpty());
    }

    @Test
    public void default_engine_reads_system_properties() {
        TransformationEngine defaults = new TransformationEngine();
        assertEquals(Options.DEFAULT_CHECK_INVARIANTS, defaults.options().checkInvariants());
        assertTrue(defaults.erase(graph, "human").isOk());
    }
}
