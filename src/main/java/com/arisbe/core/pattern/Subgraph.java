/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.pattern;

import com.arisbe.core.common.exception.ArisbeException;
import com.arisbe.core.common.exception.ErrorMessage;
import com.arisbe.core.graph.ExistentialGraph;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import javax.annotation.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.arisbe.core.common.exception.ErrorMessage.Subgraph.AREA_MAPPING_MISMATCH;
import static com.arisbe.core.common.exception.ErrorMessage.Subgraph.CONTEXT_OUT_OF_SCOPE;
import static com.arisbe.core.common.exception.ErrorMessage.Subgraph.EDGE_INCOMPLETE;
import static com.arisbe.core.common.exception.ErrorMessage.Subgraph.EMPTY_SEED;
import static com.arisbe.core.common.exception.ErrorMessage.Subgraph.NU_RESTRICTION_MISMATCH;
import static com.arisbe.core.common.exception.ErrorMessage.Subgraph.ROOT_CONTEXT_INVALID;
import static com.arisbe.core.common.exception.ErrorMessage.Subgraph.SUBSET_VIOLATION;
import static com.arisbe.core.common.exception.ErrorMessage.Subgraph.VERTEX_INCOMPLETE;

/**
 * A subgraph {@code (V', E', Cut', root, ν', area')} of a parent graph, as used by the
 * transformation rules to select what to erase, copy or enclose.
 *
 * <p>A subgraph is only ever constructed in a valid state: every factory checks the seven
 * {@link Constraint}s in order and throws {@link SubgraphValidationException} on the first one
 * that fails. A cut belongs to a subgraph only together with everything placed in it.
 *
 * <p>A vertex of {@code V'} placed in a context that strictly encloses the root is a boundary
 * vertex: an edge of the subgraph refers to it across the root, but the subgraph does not own it.
 * Boundary vertices are exempt from the scope and vertex-completeness constraints, and rules
 * never copy, move or remove them.
 */
public class Subgraph {

    public enum Constraint {
        SUBSET(SUBSET_VIOLATION),
        ROOT_CONTEXT(ROOT_CONTEXT_INVALID),
        NU_RESTRICTION(NU_RESTRICTION_MISMATCH),
        AREA_MAPPING(AREA_MAPPING_MISMATCH),
        CONTEXT_SCOPE(CONTEXT_OUT_OF_SCOPE),
        EDGE_COMPLETENESS(EDGE_INCOMPLETE),
        VERTEX_COMPLETENESS(VERTEX_INCOMPLETE);

        private final ErrorMessage error;

        Constraint(ErrorMessage error) {
            this.error = error;
        }

        public ErrorMessage error() {
            return error;
        }
    }

    private final ExistentialGraph parent;
    private final ImmutableSet<String> vertices;
    private final ImmutableSet<String> edges;
    private final ImmutableSet<String> cuts;
    private final String root;
    private final ImmutableMap<String, ImmutableList<String>> nu;
    private final ImmutableMap<String, ImmutableSet<String>> area;
    private final ImmutableSet<String> boundary;
    private final boolean closed;

    private Subgraph(ExistentialGraph parent, ImmutableSet<String> vertices, ImmutableSet<String> edges,
                     ImmutableSet<String> cuts, String root, ImmutableMap<String, ImmutableList<String>> nu,
                     ImmutableMap<String, ImmutableSet<String>> area, boolean closed) {
        this.parent = parent;
        this.vertices = vertices;
        this.edges = edges;
        this.cuts = cuts;
        this.root = root;
        this.nu = nu;
        this.area = area;
        this.boundary = boundaryOf(parent, vertices, root);
        this.closed = closed;
    }

    private static ImmutableSet<String> boundaryOf(ExistentialGraph parent, Set<String> vertices, String root) {
        if (!parent.isContext(root)) return ImmutableSet.of();
        List<String> enclosing = parent.ancestors(root);
        ImmutableSet.Builder<String> boundary = ImmutableSet.builder();
        for (String vertex : vertices) {
            if (parent.isVertex(vertex) && enclosing.contains(parent.context(vertex))) boundary.add(vertex);
        }
        return boundary.build();
    }

    /**
     * A subgraph whose {@code ν'} and area mapping are derived from the parent graph.
     */
    public static Subgraph of(ExistentialGraph graph, Set<String> vertices, Set<String> edges, Set<String> cuts,
                              String root, boolean closed) {
        ImmutableMap.Builder<String, ImmutableList<String>> nu = ImmutableMap.builder();
        for (String edge : edges) {
            if (graph.isEdge(edge)) nu.put(edge, ImmutableList.copyOf(graph.incidentVertices(edge)));
        }
        Set<String> elements = Sets.union(Sets.union(vertices, edges), cuts);
        ImmutableMap.Builder<String, ImmutableSet<String>> area = ImmutableMap.builder();
        if (graph.isContext(root) && !cuts.contains(root)) {
            area.put(root, ImmutableSet.copyOf(Sets.intersection(graph.area(root), elements)));
        }
        for (String cut : cuts) {
            if (graph.isCut(cut)) area.put(cut, ImmutableSet.copyOf(graph.area(cut)));
        }
        return of(graph, vertices, edges, cuts, root, nu.build(), area.buildKeepingLast(), closed);
    }

    /**
     * A subgraph with caller-supplied {@code ν'} and area mappings, validated as given.
     */
    public static Subgraph of(ExistentialGraph graph, Set<String> vertices, Set<String> edges, Set<String> cuts,
                              String root, Map<String, ? extends List<String>> nu,
                              Map<String, ? extends Set<String>> area, boolean closed) {
        ImmutableMap.Builder<String, ImmutableList<String>> nuCopy = ImmutableMap.builder();
        nu.forEach((edge, arguments) -> nuCopy.put(edge, ImmutableList.copyOf(arguments)));
        ImmutableMap.Builder<String, ImmutableSet<String>> areaCopy = ImmutableMap.builder();
        area.forEach((context, elements) -> areaCopy.put(context, ImmutableSet.copyOf(elements)));
        Subgraph subgraph = new Subgraph(graph, ImmutableSet.copyOf(vertices), ImmutableSet.copyOf(edges),
                                         ImmutableSet.copyOf(cuts), root, nuCopy.build(), areaCopy.build(), closed);
        subgraph.validate();
        return subgraph;
    }

    /**
     * The whole content of a context, at every depth, with the outer vertices its edges refer to
     * as boundary vertices.
     */
    public static Subgraph ofArea(ExistentialGraph graph, String context) {
        Set<String> vertices = new LinkedHashSet<>();
        Set<String> edges = new LinkedHashSet<>();
        Set<String> cuts = new LinkedHashSet<>();
        Set<String> enclosed = graph.fullContext(context);
        for (String element : enclosed) {
            if (graph.isVertex(element)) vertices.add(element);
            else if (graph.isEdge(element)) edges.add(element);
            else cuts.add(element);
        }
        for (String edge : edges) {
            for (String vertex : graph.incidentVertices(edge)) {
                if (!enclosed.contains(vertex)) vertices.add(vertex);
            }
        }
        return of(graph, vertices, edges, cuts, context, false);
    }

    public static Subgraph minimal(ExistentialGraph graph, Collection<String> seeds) {
        return minimal(graph, seeds, null);
    }

    /**
     * The smallest subgraph containing the seeds: the arguments of every edge, the complete
     * contents of every cut, and every cut between an element and the root. Without an explicit
     * root, the deepest context enclosing all of them is used. With one, vertices placed in a
     * context enclosing the root become boundary vertices.
     */
    public static Subgraph minimal(ExistentialGraph graph, Collection<String> seeds, @Nullable String root) {
        if (seeds.isEmpty()) throw ArisbeException.of(EMPTY_SEED);
        Set<String> elements = new LinkedHashSet<>();
        for (String seed : seeds) {
            graph.element(seed);
            elements.add(seed);
        }
        String rootContext;
        while (true) {
            close(graph, elements);
            rootContext = root != null ? root : commonAncestor(graph, elements);
            List<String> outer = graph.isContext(rootContext) ? graph.ancestors(rootContext) : List.of();
            Set<String> enclosing = new LinkedHashSet<>();
            for (String element : elements) {
                String context = graph.context(element);
                if (graph.isVertex(element) && outer.contains(context)) continue;
                while (!context.equals(rootContext) && !context.equals(graph.sheet())) {
                    if (!elements.contains(context)) enclosing.add(context);
                    context = graph.context(context);
                }
            }
            if (enclosing.isEmpty()) break;
            elements.addAll(enclosing);
        }
        Set<String> vertices = new LinkedHashSet<>();
        Set<String> edges = new LinkedHashSet<>();
        Set<String> cuts = new LinkedHashSet<>();
        for (String element : elements) {
            if (graph.isVertex(element)) vertices.add(element);
            else if (graph.isEdge(element)) edges.add(element);
            else cuts.add(element);
        }
        return of(graph, vertices, edges, cuts, rootContext, false);
    }

    private static void close(ExistentialGraph graph, Set<String> elements) {
        Deque<String> pending = new ArrayDeque<>(elements);
        while (!pending.isEmpty()) {
            String element = pending.pop();
            Collection<String> required;
            if (graph.isEdge(element)) required = graph.incidentVertices(element);
            else if (graph.isCut(element)) required = graph.area(element);
            else continue;
            for (String r : required) {
                if (elements.add(r)) pending.add(r);
            }
        }
    }

    private static String commonAncestor(ExistentialGraph graph, Set<String> elements) {
        List<String> candidates = null;
        for (String element : elements) {
            String context = graph.context(element);
            List<String> chain = new ArrayList<>();
            chain.add(context);
            chain.addAll(graph.ancestors(context));
            if (candidates == null) candidates = chain;
            else candidates.retainAll(chain);
        }
        assert candidates != null && !candidates.isEmpty();
        return candidates.get(0);
    }

    private void validate() {
        // SUBSET
        Set<String> outside = new LinkedHashSet<>();
        vertices.forEach(v -> { if (!parent.isVertex(v)) outside.add(v); });
        edges.forEach(e -> { if (!parent.isEdge(e)) outside.add(e); });
        cuts.forEach(c -> { if (!parent.isCut(c)) outside.add(c); });
        if (!outside.isEmpty()) throw new SubgraphValidationException(Constraint.SUBSET, outside);

        // ROOT_CONTEXT
        if (!parent.isContext(root) || cuts.contains(root)) {
            throw new SubgraphValidationException(Constraint.ROOT_CONTEXT, ImmutableSet.of(root));
        }

        // NU_RESTRICTION
        Set<String> mismatched = new LinkedHashSet<>();
        for (String edge : edges) {
            if (!parent.incidentVertices(edge).equals(nu.get(edge))) mismatched.add(edge);
        }
        for (String edge : nu.keySet()) {
            if (!edges.contains(edge)) mismatched.add(edge);
        }
        if (!mismatched.isEmpty()) throw new SubgraphValidationException(Constraint.NU_RESTRICTION, mismatched);

        // AREA_MAPPING
        Set<String> elements = elements();
        Set<String> wrongAreas = new LinkedHashSet<>();
        if (!Sets.intersection(parent.area(root), elements).equals(area.get(root))) wrongAreas.add(root);
        for (String cut : cuts) {
            Set<String> contents = parent.area(cut);
            if (!contents.equals(area.get(cut)) || !elements.containsAll(contents)) wrongAreas.add(cut);
        }
        for (String context : area.keySet()) {
            if (!context.equals(root) && !cuts.contains(context)) wrongAreas.add(context);
        }
        if (!wrongAreas.isEmpty()) throw new SubgraphValidationException(Constraint.AREA_MAPPING, wrongAreas);

        // CONTEXT_SCOPE
        Set<String> misplaced = new LinkedHashSet<>();
        for (String element : elements) {
            String context = parent.context(element);
            if (!context.equals(root) && !cuts.contains(context) && !boundary.contains(element)) {
                misplaced.add(element);
            }
        }
        if (!misplaced.isEmpty()) throw new SubgraphValidationException(Constraint.CONTEXT_SCOPE, misplaced);

        // EDGE_COMPLETENESS
        Set<String> missingVertices = new LinkedHashSet<>();
        for (String edge : edges) {
            for (String vertex : nu.get(edge)) {
                if (!vertices.contains(vertex)) missingVertices.add(vertex);
            }
        }
        if (!missingVertices.isEmpty()) {
            throw new SubgraphValidationException(Constraint.EDGE_COMPLETENESS, missingVertices);
        }

        // VERTEX_COMPLETENESS
        if (closed) {
            Set<String> missingEdges = new LinkedHashSet<>();
            for (String vertex : Sets.difference(vertices, boundary)) {
                for (String edge : parent.incidentEdges(vertex)) {
                    if (!edges.contains(edge)) missingEdges.add(edge);
                }
            }
            if (!missingEdges.isEmpty()) {
                throw new SubgraphValidationException(Constraint.VERTEX_COMPLETENESS, missingEdges);
            }
        }
    }

    public ExistentialGraph parent() {
        return parent;
    }

    public Set<String> vertices() {
        return vertices;
    }

    public Set<String> edges() {
        return edges;
    }

    public Set<String> cuts() {
        return cuts;
    }

    public Set<String> elements() {
        return Sets.union(Sets.union(vertices, edges), cuts);
    }

    /**
     * The vertices of this subgraph placed outside it, in a context enclosing the root.
     */
    public Set<String> boundary() {
        return boundary;
    }

    public boolean isBoundary(String vertex) {
        return boundary.contains(vertex);
    }

    public String rootContext() {
        return root;
    }

    /**
     * The elements placed directly in the root context.
     */
    public Set<String> rootElements() {
        return area.get(root);
    }

    public Map<String, List<String>> nu() {
        return java.util.Collections.unmodifiableMap(nu);
    }

    public Map<String, Set<String>> area() {
        return java.util.Collections.unmodifiableMap(area);
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean contains(String id) {
        return vertices.contains(id) || edges.contains(id) || cuts.contains(id);
    }

    public boolean isPositive() {
        return parent.isPositive(root);
    }

    public int size() {
        return vertices.size() + edges.size() + cuts.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Subgraph that = (Subgraph) o;
        return closed == that.closed && parent.equals(that.parent) && vertices.equals(that.vertices) &&
                edges.equals(that.edges) && cuts.equals(that.cuts) && root.equals(that.root);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vertices, edges, cuts, root, closed);
    }

    @Override
    public String toString() {
        return "Subgraph{root=" + root + ", vertices=" + vertices + ", edges=" + edges + ", cuts=" + cuts + "}";
    }
}
