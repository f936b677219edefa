/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.logic;

import com.arisbe.core.graph.Cut;
import com.arisbe.core.graph.Edge;
import com.arisbe.core.graph.ExistentialGraph;
import com.arisbe.core.graph.Vertex;
import com.google.common.collect.ImmutableList;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Lists the single-element rule applications that are legal in a graph: erasures from positive
 * contexts, removals of double cuts and removals of isolated vertices.
 */
public class RuleAdvisor {

    public List<Rule> suggest(ExistentialGraph graph) {
        ImmutableList.Builder<Rule> suggestions = ImmutableList.builder();
        for (Edge edge : graph.edges()) {
            if (graph.isEvenlyEnclosed(edge.id())) suggestions.add(Erasure.of(edge.id()));
        }
        for (Cut cut : graph.cuts()) {
            if (graph.isEvenlyEnclosed(cut.id()) && isErasable(graph, cut.id())) suggestions.add(Erasure.of(cut.id()));
        }
        for (Vertex vertex : graph.vertices()) {
            if (graph.isIsolated(vertex.id()) && graph.isEvenlyEnclosed(vertex.id())) {
                suggestions.add(Erasure.of(vertex.id()));
            }
        }
        for (Cut cut : graph.cuts()) {
            Set<String> area = graph.area(cut.id());
            if (area.size() == 1 && graph.isCut(area.iterator().next())) suggestions.add(DoubleCutRemoval.of(cut.id()));
        }
        for (String vertex : graph.isolatedVertices()) {
            suggestions.add(IsolatedVertexRemoval.of(vertex));
        }
        return suggestions.build();
    }

    private boolean isErasable(ExistentialGraph graph, String cut) {
        Set<String> enclosed = new HashSet<>(graph.fullContext(cut));
        for (String element : enclosed) {
            if (graph.isVertex(element) && !enclosed.containsAll(graph.incidentEdges(element))) return false;
        }
        return true;
    }
}
