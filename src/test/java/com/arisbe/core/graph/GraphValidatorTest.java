/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.graph;

import com.arisbe.core.common.exception.ErrorMessage;
import org.junit.Test;

import static com.arisbe.core.common.collection.Collections.list;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class GraphValidatorTest {

    private final GraphValidator validator = new GraphValidator();

    @Test
    public void constructed_graphs_are_valid() {
        ExistentialGraph graph = ExistentialGraph.empty("sheet")
                .withVertex(Vertex.generic("x"))
                .withCut(Cut.of("c1"))
                .withCut(Cut.of("c2"), "c1")
                .withEdge(Edge.of("p"), list("x"), "P", "c2")
                .without("c1");
        GraphValidator.Report report = validator.validate(graph);
        assertTrue(report.isValid());
        assertTrue(report.errors().isEmpty());
        assertTrue(report.warnings().isEmpty());
    }

    @Test
    public void non_dominating_arguments_are_warnings() {
        ExistentialGraph graph = ExistentialGraph.empty("sheet")
                .withCut(Cut.of("c1"))
                .withVertex(Vertex.generic("x"), "c1")
                .withEdge(Edge.of("p"), list("x"), "P");
        GraphValidator.Report report = validator.validate(graph);
        assertTrue(report.isValid());
        assertEquals(1, report.warnings().size());
        assertEquals(ErrorMessage.Graph.NON_DOMINATING_VERTEX, report.warnings().get(0).error());
        assertTrue(report.warnings().get(0).message().contains("'p'"));
    }
}
