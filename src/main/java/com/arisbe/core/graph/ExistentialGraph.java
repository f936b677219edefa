/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.graph;

import com.arisbe.core.common.exception.ArisbeException;
import com.arisbe.core.pattern.equivalence.StructuralMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.lacuna.bifurcan.IMap;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.arisbe.core.common.collection.Collections.minus;
import static com.arisbe.core.common.collection.Collections.minusAll;
import static com.arisbe.core.common.collection.Collections.plus;
import static com.arisbe.core.common.collection.Collections.persistentMap;
import static com.arisbe.core.common.collection.Collections.plusAll;
import static com.arisbe.core.common.collection.Collections.putAll;
import static com.arisbe.core.common.collection.Collections.removeAll;
import static com.arisbe.core.common.collection.Collections.snapshot;
import static com.arisbe.core.common.collection.Collections.values;
import static com.arisbe.core.common.exception.ErrorMessage.Graph.CONTEXT_NOT_FOUND;
import static com.arisbe.core.common.exception.ErrorMessage.Graph.DUPLICATE_ELEMENT;
import static com.arisbe.core.common.exception.ErrorMessage.Graph.ELEMENT_NOT_FOUND;
import static com.arisbe.core.common.exception.ErrorMessage.Graph.INVALID_RELATION_NAME;
import static com.arisbe.core.common.exception.ErrorMessage.Graph.MOVE_INTO_ITSELF;
import static com.arisbe.core.common.exception.ErrorMessage.Graph.NOT_AN_EDGE;
import static com.arisbe.core.common.exception.ErrorMessage.Graph.NOT_A_VERTEX;
import static com.arisbe.core.common.exception.ErrorMessage.Graph.PARTIAL_CUT_REMOVAL;
import static com.arisbe.core.common.exception.ErrorMessage.Graph.SHEET_NOT_REMOVABLE;
import static com.arisbe.core.common.exception.ErrorMessage.Graph.VERTEX_IN_USE;

/**
 * An Existential Graph Instance: a relational graph with cuts
 * {@code (V, E, ν, ⊤, Cut, area)} together with the relation names {@code rel}.
 *
 * <p>Instances are immutable. Every {@code with...}/{@code without...} operation returns a new
 * graph and leaves the receiver untouched. The mappings are persistent maps: an update copies
 * only the path to the changed entries and shares the rest with the receiver, and a changed area
 * or incidence set is the only set copied.
 *
 * <p>Two query surfaces must not be confused: {@link #area(String)} is the set of elements
 * placed <em>directly</em> in a context, while {@link #fullContext(String)} is everything
 * enclosed by it at any depth. {@link #context(String)} answers the inverse of the former.
 */
public class ExistentialGraph {

    private final String sheet;
    private final IMap<String, Vertex> vertices;
    private final IMap<String, Edge> edges;
    private final IMap<String, Cut> cuts;
    private final IMap<String, ImmutableList<String>> nu;
    private final IMap<String, String> rel;
    private final IMap<String, ImmutableSet<String>> area;
    private final IMap<String, ImmutableSet<String>> incidence;
    private final ContextIndex contexts;
    private int hash = 0;

    private ExistentialGraph(String sheet, IMap<String, Vertex> vertices, IMap<String, Edge> edges,
                             IMap<String, Cut> cuts, IMap<String, ImmutableList<String>> nu,
                             IMap<String, String> rel, IMap<String, ImmutableSet<String>> area,
                             IMap<String, ImmutableSet<String>> incidence, ContextIndex contexts) {
        this.sheet = sheet;
        this.vertices = vertices;
        this.edges = edges;
        this.cuts = cuts;
        this.nu = nu;
        this.rel = rel;
        this.area = area;
        this.incidence = incidence;
        this.contexts = contexts;
    }

    public static ExistentialGraph empty() {
        return empty(Identifiers.random().sheet());
    }

    public static ExistentialGraph empty(String sheet) {
        Objects.requireNonNull(sheet);
        return new ExistentialGraph(sheet, persistentMap(), persistentMap(), persistentMap(), persistentMap(),
                                    persistentMap(), persistentMap(sheet, ImmutableSet.of()), persistentMap(),
                                    ContextIndex.empty(sheet));
    }

    private ExistentialGraph copy(IMap<String, Vertex> vertices, IMap<String, Edge> edges,
                                  IMap<String, Cut> cuts, IMap<String, ImmutableList<String>> nu,
                                  IMap<String, String> rel, IMap<String, ImmutableSet<String>> area,
                                  IMap<String, ImmutableSet<String>> incidence, ContextIndex contexts) {
        return new ExistentialGraph(sheet, vertices, edges, cuts, nu, rel, area, incidence, contexts);
    }

    // Construction

    public ExistentialGraph withVertex(Vertex vertex) {
        return withVertex(vertex, sheet);
    }

    public ExistentialGraph withVertex(Vertex vertex, String context) {
        requireContext(context);
        requireUnused(vertex.id());
        return copy(vertices.put(vertex.id(), vertex), edges, cuts, nu, rel,
                    area.put(context, plus(areaOf(context), vertex.id())), incidence,
                    contexts.placed(vertex.id(), context));
    }

    public ExistentialGraph withEdge(Edge edge, List<String> arguments, String relation) {
        return withEdge(edge, arguments, relation, sheet);
    }

    public ExistentialGraph withEdge(Edge edge, List<String> arguments, String relation, String context) {
        requireContext(context);
        requireUnused(edge.id());
        if (relation == null || relation.isBlank()) throw ArisbeException.of(INVALID_RELATION_NAME, edge.id());
        arguments.forEach(this::vertex);

        Map<String, ImmutableSet<String>> incident = new HashMap<>();
        for (String argument : new LinkedHashSet<>(arguments)) {
            incident.put(argument, plus(incidence.get(argument, ImmutableSet.of()), edge.id()));
        }
        return copy(vertices, edges.put(edge.id(), edge), cuts, nu.put(edge.id(), ImmutableList.copyOf(arguments)),
                    rel.put(edge.id(), relation), area.put(context, plus(areaOf(context), edge.id())),
                    putAll(incidence, incident), contexts.placed(edge.id(), context));
    }

    public ExistentialGraph withCut(Cut cut) {
        return withCut(cut, sheet);
    }

    public ExistentialGraph withCut(Cut cut, String context) {
        requireContext(context);
        requireUnused(cut.id());
        Map<String, ImmutableSet<String>> areas = new HashMap<>();
        areas.put(context, plus(areaOf(context), cut.id()));
        areas.put(cut.id(), ImmutableSet.of());
        return copy(vertices, edges, cuts.put(cut.id(), cut), nu, rel, putAll(area, areas), incidence,
                    contexts.placed(cut.id(), context));
    }

    /**
     * Relocates a vertex into another context, keeping every edge that refers to it.
     */
    public ExistentialGraph withVertexMovedTo(String vertexId, String context) {
        vertex(vertexId);
        return withMoved(ImmutableSet.of(vertexId), context);
    }

    /**
     * Relocates elements, each with everything it encloses, directly into the given context.
     */
    public ExistentialGraph withMoved(Collection<String> elementIds, String context) {
        requireContext(context);
        Set<String> moved = new LinkedHashSet<>(elementIds);
        Map<String, Set<String>> leaving = new HashMap<>();
        for (String id : moved) {
            String from = context(id);
            if (isCut(id) && (id.equals(context) || contexts.dominates(id, context))) {
                throw ArisbeException.of(MOVE_INTO_ITSELF, id, context);
            }
            leaving.computeIfAbsent(from, f -> new HashSet<>()).add(id);
        }
        Map<String, ImmutableSet<String>> areas = new HashMap<>();
        leaving.forEach((from, ids) -> areas.put(from, minusAll(areaOf(from), ids)));
        areas.put(context, plusAll(areas.getOrDefault(context, areaOf(context)), moved));
        return copy(vertices, edges, cuts, nu, rel, putAll(area, areas), incidence, contexts.placedAll(moved, context));
    }

    /**
     * Removes a single element. Removing a cut hands its contents over to the context the cut was
     * placed in; a vertex can only be removed once no edge refers to it.
     */
    public ExistentialGraph without(String elementId) {
        if (elementId.equals(sheet)) throw ArisbeException.of(SHEET_NOT_REMOVABLE, sheet);
        Element element = element(elementId);
        String context = context(elementId);
        if (element.isVertex()) {
            if (!isIsolated(elementId)) {
                throw ArisbeException.of(VERTEX_IN_USE, elementId, incidentEdges(elementId));
            }
            return copy(vertices.remove(elementId), edges, cuts, nu, rel,
                        area.put(context, minus(areaOf(context), elementId)), incidence.remove(elementId),
                        contexts.removed(elementId));
        } else if (element.isEdge()) {
            return copy(vertices, edges.remove(elementId), cuts, nu.remove(elementId), rel.remove(elementId),
                        area.put(context, minus(areaOf(context), elementId)), withoutIncidences(Set.of(elementId)),
                        contexts.removed(elementId));
        } else {
            ImmutableSet<String> contents = areaOf(elementId);
            Map<String, ImmutableSet<String>> areas = new HashMap<>();
            areas.put(context, plusAll(minus(areaOf(context), elementId), contents));
            return copy(vertices, edges, cuts.remove(elementId), nu, rel, putAll(area, areas).remove(elementId),
                        incidence, contexts.removed(elementId).placedAll(contents, context));
        }
    }

    /**
     * Removes a set of elements outright. A removed cut must be removed together with everything it
     * encloses, and no remaining edge may refer to a removed vertex.
     */
    public ExistentialGraph withoutAll(Set<String> elementIds) {
        if (elementIds.contains(sheet)) throw ArisbeException.of(SHEET_NOT_REMOVABLE, sheet);
        Set<String> removedVertices = new HashSet<>();
        Set<String> removedEdges = new HashSet<>();
        Set<String> removedCuts = new HashSet<>();
        for (String id : elementIds) {
            Element element = element(id);
            if (element.isVertex()) removedVertices.add(id);
            else if (element.isEdge()) removedEdges.add(id);
            else removedCuts.add(id);
        }
        for (String cut : removedCuts) {
            Set<String> kept = minusAll(areaOf(cut), elementIds);
            if (!kept.isEmpty()) throw ArisbeException.of(PARTIAL_CUT_REMOVAL, cut, kept);
        }
        for (String vertex : removedVertices) {
            Set<String> referencing = minusAll(incidentEdges(vertex), removedEdges);
            if (!referencing.isEmpty()) throw ArisbeException.of(VERTEX_IN_USE, vertex, referencing);
        }

        Map<String, Set<String>> leaving = new HashMap<>();
        for (String id : elementIds) {
            String from = context(id);
            if (!removedCuts.contains(from)) leaving.computeIfAbsent(from, f -> new HashSet<>()).add(id);
        }
        Map<String, ImmutableSet<String>> areas = new HashMap<>();
        leaving.forEach((from, ids) -> areas.put(from, minusAll(areaOf(from), ids)));

        IMap<String, ImmutableSet<String>> remainingIncidence = withoutIncidences(removedEdges);
        return copy(removeAll(vertices, removedVertices), removeAll(edges, removedEdges), removeAll(cuts, removedCuts),
                    removeAll(nu, removedEdges), removeAll(rel, removedEdges),
                    removeAll(putAll(area, areas), removedCuts), removeAll(remainingIncidence, removedVertices),
                    contexts.removedAll(elementIds));
    }

    private IMap<String, ImmutableSet<String>> withoutIncidences(Set<String> removedEdges) {
        if (removedEdges.isEmpty()) return incidence;
        Map<String, ImmutableSet<String>> changed = new HashMap<>();
        Set<String> emptied = new HashSet<>();
        for (String edge : removedEdges) {
            for (String vertex : nu.get(edge, ImmutableList.of())) {
                ImmutableSet<String> remaining =
                        minusAll(changed.getOrDefault(vertex, incidence.get(vertex, ImmutableSet.of())), removedEdges);
                if (remaining.isEmpty()) emptied.add(vertex);
                else changed.put(vertex, remaining);
            }
        }
        return removeAll(putAll(incidence, changed), emptied);
    }

    private ImmutableSet<String> areaOf(String context) {
        return area.get(context, ImmutableSet.of());
    }

    private void requireContext(String context) {
        if (!isContext(context)) throw ArisbeException.of(CONTEXT_NOT_FOUND, context);
    }

    private void requireUnused(String id) {
        if (containsId(id)) throw ArisbeException.of(DUPLICATE_ELEMENT, id);
    }

    // Components

    public String sheet() {
        return sheet;
    }

    public Collection<Vertex> vertices() {
        return values(vertices);
    }

    public Collection<Edge> edges() {
        return values(edges);
    }

    public Collection<Cut> cuts() {
        return values(cuts);
    }

    /**
     * The {@code ν} mapping from each edge to its ordered arguments.
     */
    public Map<String, List<String>> nu() {
        return java.util.Collections.unmodifiableMap(snapshot(nu));
    }

    /**
     * The {@code rel} mapping from each edge to its relation name.
     */
    public Map<String, String> rel() {
        return snapshot(rel);
    }

    /**
     * The area mapping, for the sheet and every cut.
     */
    public Map<String, Set<String>> area() {
        return java.util.Collections.unmodifiableMap(snapshot(area));
    }

    public int size() {
        return (int) (vertices.size() + edges.size() + cuts.size());
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public Vertex vertex(String id) {
        Vertex vertex = vertices.get(id, null);
        if (vertex != null) return vertex;
        else if (contains(id)) throw ArisbeException.of(NOT_A_VERTEX, id);
        else throw ArisbeException.of(ELEMENT_NOT_FOUND, id);
    }

    public Edge edge(String id) {
        Edge edge = edges.get(id, null);
        if (edge != null) return edge;
        else if (contains(id)) throw ArisbeException.of(NOT_AN_EDGE, id);
        else throw ArisbeException.of(ELEMENT_NOT_FOUND, id);
    }

    public Cut cut(String id) {
        Cut cut = cuts.get(id, null);
        if (cut != null) return cut;
        else throw ArisbeException.of(CONTEXT_NOT_FOUND, id);
    }

    public Element element(String id) {
        if (vertices.contains(id)) return vertices.get(id, null);
        else if (edges.contains(id)) return edges.get(id, null);
        else if (cuts.contains(id)) return cuts.get(id, null);
        else throw ArisbeException.of(ELEMENT_NOT_FOUND, id);
    }

    public boolean isVertex(String id) {
        return vertices.contains(id);
    }

    public boolean isEdge(String id) {
        return edges.contains(id);
    }

    public boolean isCut(String id) {
        return cuts.contains(id);
    }

    /**
     * @return whether the identifier names a vertex, edge or cut of this graph
     */
    public boolean contains(String id) {
        return vertices.contains(id) || edges.contains(id) || cuts.contains(id);
    }

    /**
     * @return whether the identifier is taken, by an element or by the sheet
     */
    public boolean containsId(String id) {
        return sheet.equals(id) || contains(id);
    }

    /**
     * @return whether the identifier names the sheet or a cut
     */
    public boolean isContext(String id) {
        return sheet.equals(id) || cuts.contains(id);
    }

    // Context and area queries

    public Set<String> area(String context) {
        requireContext(context);
        return areaOf(context);
    }

    public String context(String elementId) {
        return contexts.parent(elementId).orElseThrow(() -> ArisbeException.of(ELEMENT_NOT_FOUND, elementId));
    }

    public Set<String> fullContext(String context) {
        requireContext(context);
        ImmutableSet.Builder<String> enclosed = ImmutableSet.builder();
        Deque<String> pending = new ArrayDeque<>();
        pending.add(context);
        while (!pending.isEmpty()) {
            for (String element : areaOf(pending.pop())) {
                enclosed.add(element);
                if (cuts.contains(element)) pending.add(element);
            }
        }
        return enclosed.build();
    }

    public int depth(String context) {
        requireContext(context);
        return contexts.depth(context);
    }

    public boolean isPositive(String context) {
        return depth(context) % 2 == 0;
    }

    public boolean isNegative(String context) {
        return !isPositive(context);
    }

    /**
     * @return the number of cuts enclosing the element
     */
    public int nestingDepth(String elementId) {
        return contexts.depth(context(elementId));
    }

    public boolean isEvenlyEnclosed(String elementId) {
        return nestingDepth(elementId) % 2 == 0;
    }

    public boolean isOddlyEnclosed(String elementId) {
        return !isEvenlyEnclosed(elementId);
    }

    /**
     * @return the contexts enclosing the given context, nearest first, ending with the sheet
     */
    public List<String> ancestors(String context) {
        requireContext(context);
        return contexts.ancestors(context);
    }

    /**
     * @return whether {@code outer} is {@code inner} or one of its enclosing contexts
     */
    public boolean dominates(String outer, String inner) {
        requireContext(outer);
        requireContext(inner);
        return contexts.dominates(outer, inner);
    }

    /**
     * @return whether {@code outer} strictly encloses {@code inner}
     */
    public boolean encloses(String outer, String inner) {
        return !outer.equals(inner) && dominates(outer, inner);
    }

    public List<String> incidentVertices(String edgeId) {
        edge(edgeId);
        return nu.get(edgeId, null);
    }

    public String relation(String edgeId) {
        edge(edgeId);
        return rel.get(edgeId, null);
    }

    public Set<String> incidentEdges(String vertexId) {
        vertex(vertexId);
        return incidence.get(vertexId, ImmutableSet.of());
    }

    public boolean isIsolated(String vertexId) {
        return incidentEdges(vertexId).isEmpty();
    }

    public Set<String> isolatedVertices() {
        ImmutableSet.Builder<String> isolated = ImmutableSet.builder();
        for (String vertex : vertices.keys()) {
            if (!incidence.contains(vertex)) isolated.add(vertex);
        }
        return isolated.build();
    }

    /**
     * @return whether every edge's arguments are placed in contexts dominating the edge's own
     */
    public boolean hasDominatingNodes() {
        for (String edge : nu.keys()) {
            String edgeContext = context(edge);
            for (String vertex : nu.get(edge, ImmutableList.of())) {
                if (!contexts.dominates(context(vertex), edgeContext)) return false;
            }
        }
        return true;
    }

    /**
     * @return whether the two graphs are equal up to a renaming of identifiers
     */
    public boolean isomorphic(ExistentialGraph other) {
        return StructuralMatcher.isomorphic(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExistentialGraph that = (ExistentialGraph) o;
        return sheet.equals(that.sheet) && vertices.equals(that.vertices) && edges.equals(that.edges) &&
                cuts.equals(that.cuts) && nu.equals(that.nu) && rel.equals(that.rel) && area.equals(that.area);
    }

    @Override
    public int hashCode() {
        if (hash == 0) hash = Objects.hash(sheet, vertices, edges, cuts, nu, rel, area);
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        appendArea(builder, sheet);
        return builder.toString();
    }

    private void appendArea(StringBuilder builder, String context) {
        boolean first = true;
        for (String element : areaOf(context)) {
            if (!first) builder.append(" ");
            first = false;
            if (vertices.contains(element)) {
                builder.append(vertices.get(element, null));
            } else if (edges.contains(element)) {
                builder.append("(").append(rel.get(element, null));
                nu.get(element, ImmutableList.of()).forEach(v -> builder.append(" ").append(v));
                builder.append(")");
            } else {
                builder.append("~[");
                appendArea(builder, element);
                builder.append("]");
            }
        }
    }
}
