/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.logic;

import com.arisbe.core.graph.Cut;
import com.arisbe.core.graph.Edge;
import com.arisbe.core.graph.ExistentialGraph;
import com.arisbe.core.graph.Identifiers;
import com.arisbe.core.pattern.Subgraph;
import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Places a fresh copy of a subgraph into a context of a target graph. Cuts are copied together
 * with their contents at every depth; every copied element gets a fresh identifier, and edges are
 * re-attached to the copies of their arguments. Shared vertices are not copied: edges keep
 * referring to the originals. Boundary vertices that are not shared get a fresh copy placed
 * directly in the target context.
 */
class SubgraphCopier {

    private final Subgraph source;
    private final Identifiers identifiers;
    private final Map<String, String> copies;
    private ExistentialGraph target;

    private SubgraphCopier(Subgraph source, ExistentialGraph target, Set<String> shared, Identifiers identifiers) {
        this.source = source;
        this.target = target;
        this.identifiers = identifiers;
        this.copies = new HashMap<>();
        shared.forEach(v -> copies.put(v, v));
    }

    static Copy copy(Subgraph source, ExistentialGraph target, String context, Set<String> shared,
                     Identifiers identifiers) {
        SubgraphCopier copier = new SubgraphCopier(source, target, shared, identifiers);
        copier.copies.put(source.rootContext(), context);
        copier.copyBoundary(context);
        copier.copyContexts(source.rootContext(), context);
        copier.copyEdges();
        Map<String, String> mapping = new HashMap<>(copier.copies);
        mapping.remove(source.rootContext());
        return new Copy(copier.target, mapping);
    }

    private void copyBoundary(String targetContext) {
        ExistentialGraph graph = source.parent();
        for (String vertex : source.boundary()) {
            if (copies.containsKey(vertex)) continue;
            String id = identifiers.vertex(target);
            target = target.withVertex(graph.vertex(vertex).withId(id), targetContext);
            copies.put(vertex, id);
        }
    }

    private void copyContexts(String sourceContext, String targetContext) {
        ExistentialGraph graph = source.parent();
        List<String> nested = new ArrayList<>();
        for (String element : source.area().get(sourceContext)) {
            if (copies.containsKey(element) || graph.isEdge(element)) continue;
            if (graph.isVertex(element)) {
                String id = identifiers.vertex(target);
                target = target.withVertex(graph.vertex(element).withId(id), targetContext);
                copies.put(element, id);
            } else {
                String id = identifiers.cut(target);
                target = target.withCut(Cut.of(id), targetContext);
                copies.put(element, id);
                nested.add(element);
            }
        }
        for (String cut : nested) copyContexts(cut, copies.get(cut));
    }

    private void copyEdges() {
        ExistentialGraph graph = source.parent();
        for (String edge : source.edges()) {
            List<String> arguments = new ArrayList<>();
            for (String vertex : source.nu().get(edge)) arguments.add(copies.getOrDefault(vertex, vertex));
            String id = identifiers.edge(target);
            target = target.withEdge(Edge.of(id), arguments, graph.relation(edge), copies.get(graph.context(edge)));
            copies.put(edge, id);
        }
    }

    static class Copy {

        private final ExistentialGraph graph;
        private final Map<String, String> mapping;

        private Copy(ExistentialGraph graph, Map<String, String> mapping) {
            this.graph = graph;
            this.mapping = ImmutableMap.copyOf(mapping);
        }

        ExistentialGraph graph() {
            return graph;
        }

        /**
         * From each element of the source subgraph to its copy; shared vertices map to themselves.
         */
        Map<String, String> mapping() {
            return mapping;
        }
    }
}
