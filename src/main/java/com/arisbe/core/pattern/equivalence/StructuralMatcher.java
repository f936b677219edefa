/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.pattern.equivalence;

import com.arisbe.core.graph.ExistentialGraph;
import com.arisbe.core.pattern.Subgraph;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Searches for an {@link AlphaEquivalence} that embeds a subgraph into an area of a host graph:
 * elements map to elements of the same kind, vertices to vertices of the same shape, edges to
 * edges with the same relation name and mapped arguments in the same positions, and cuts to cuts
 * whose contents match exactly.
 *
 * <p>The search backtracks over a stack of frames, one per context being matched. Elements of a
 * frame are tried edges first, then cuts, then vertices, so that most vertices are fixed by the
 * edges that refer to them before they are reached.
 */
public class StructuralMatcher {

    private final Subgraph pattern;
    private final ExistentialGraph host;
    private final Set<String> excluded;
    private final Set<String> shared;

    private StructuralMatcher(Subgraph pattern, ExistentialGraph host, Set<String> excluded, Set<String> shared) {
        this.pattern = pattern;
        this.host = host;
        this.excluded = excluded;
        this.shared = shared;
    }

    public static StructuralMatcher of(Subgraph pattern, ExistentialGraph host) {
        return new StructuralMatcher(pattern, host, ImmutableSet.of(), ImmutableSet.of());
    }

    /**
     * Host elements that may not serve as images. A shared vertex is its own image and nothing else.
     */
    public StructuralMatcher excluding(Set<String> excluded, Set<String> shared) {
        return new StructuralMatcher(pattern, host, ImmutableSet.copyOf(excluded), ImmutableSet.copyOf(shared));
    }

    /**
     * An embedding of the pattern's root area into part of the given host context.
     */
    public Optional<AlphaEquivalence> matchInto(String hostContext) {
        return match(host.area(hostContext), false);
    }

    /**
     * A bijection between the pattern's root area and the given set of host elements.
     */
    public Optional<AlphaEquivalence> matchExactly(Set<String> hostElements) {
        return match(hostElements, true);
    }

    public static boolean isomorphic(ExistentialGraph first, ExistentialGraph second) {
        if (first.vertices().size() != second.vertices().size() || first.edges().size() != second.edges().size() ||
                first.cuts().size() != second.cuts().size()) {
            return false;
        }
        Subgraph whole = Subgraph.ofArea(first, first.sheet());
        return of(whole, second).matchExactly(second.area(second.sheet())).isPresent();
    }

    private Optional<AlphaEquivalence> match(Set<String> hostElements, boolean exact) {
        Frame root = new Frame(ordered(pattern.rootElements()), ImmutableSet.copyOf(hostElements), exact);
        if (!root.isFeasible()) return Optional.empty();
        return search(ImmutableList.of(new Cursor(root, 0)), AlphaEquivalence.empty());
    }

    private Optional<AlphaEquivalence> search(List<Cursor> stack, AlphaEquivalence equivalence) {
        if (stack.isEmpty()) return Optional.of(equivalence);
        Cursor top = stack.get(0);
        List<Cursor> rest = stack.subList(1, stack.size());
        if (top.isDone()) return search(rest, equivalence);

        String element = top.element();
        List<Cursor> advanced = push(top.next(), rest);
        Optional<String> image = equivalence.get(element);
        if (image.isPresent()) {
            if (top.frame.hosts.contains(image.get())) return search(advanced, equivalence);
            else return Optional.empty();
        }

        for (String candidate : top.frame.hosts) {
            if (equivalence.isImage(candidate)) continue;
            Optional<AlphaEquivalence> extended = extend(element, candidate, equivalence);
            if (extended.isEmpty()) continue;
            List<Cursor> next = advanced;
            if (pattern.parent().isCut(element)) {
                Frame contents = new Frame(ordered(pattern.area().get(element)), host.area(candidate), true);
                if (!contents.isFeasible()) continue;
                next = push(new Cursor(contents, 0), advanced);
            }
            Optional<AlphaEquivalence> found = search(next, extended.get());
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }

    private Optional<AlphaEquivalence> extend(String element, String candidate, AlphaEquivalence equivalence) {
        ExistentialGraph graph = pattern.parent();
        if (graph.isVertex(element)) {
            if (!vertexMatches(element, candidate)) return Optional.empty();
            return Optional.of(equivalence.extend(element, candidate));
        } else if (graph.isEdge(element)) {
            if (!host.isEdge(candidate) || excluded.contains(candidate)) return Optional.empty();
            if (!graph.relation(element).equals(host.relation(candidate))) return Optional.empty();
            List<String> arguments = graph.incidentVertices(element);
            List<String> candidateArguments = host.incidentVertices(candidate);
            if (arguments.size() != candidateArguments.size()) return Optional.empty();
            AlphaEquivalence extended = equivalence.extend(element, candidate);
            for (int i = 0; i < arguments.size(); i++) {
                String argument = arguments.get(i);
                String candidateArgument = candidateArguments.get(i);
                if (!pattern.contains(argument) || pattern.isBoundary(argument)) {
                    // arguments the pattern does not own are fixed points
                    if (!argument.equals(candidateArgument)) return Optional.empty();
                } else if (extended.isMapped(argument)) {
                    if (!extended.isCompatible(argument, candidateArgument)) return Optional.empty();
                } else {
                    if (extended.isImage(candidateArgument)) return Optional.empty();
                    if (!vertexMatches(argument, candidateArgument)) return Optional.empty();
                    extended = extended.extend(argument, candidateArgument);
                }
            }
            return Optional.of(extended);
        } else {
            if (!host.isCut(candidate) || excluded.contains(candidate)) return Optional.empty();
            return Optional.of(equivalence.extend(element, candidate));
        }
    }

    private boolean vertexMatches(String vertex, String candidate) {
        if (!host.isVertex(candidate)) return false;
        if (shared.contains(vertex)) return vertex.equals(candidate);
        if (excluded.contains(candidate)) return false;
        return pattern.parent().vertex(vertex).sameShape(host.vertex(candidate));
    }

    private ImmutableList<String> ordered(Set<String> elements) {
        ExistentialGraph graph = pattern.parent();
        List<String> ordered = new ArrayList<>(elements.size());
        elements.forEach(e -> { if (graph.isEdge(e)) ordered.add(e); });
        elements.forEach(e -> { if (graph.isCut(e)) ordered.add(e); });
        elements.forEach(e -> { if (graph.isVertex(e)) ordered.add(e); });
        return ImmutableList.copyOf(ordered);
    }

    private static List<Cursor> push(Cursor cursor, List<Cursor> stack) {
        List<Cursor> pushed = new ArrayList<>(stack.size() + 1);
        pushed.add(cursor);
        pushed.addAll(stack);
        return pushed;
    }

    private static class Frame {

        private final ImmutableList<String> elements;
        private final Set<String> hosts;
        private final boolean exact;

        private Frame(ImmutableList<String> elements, Set<String> hosts, boolean exact) {
            this.elements = elements;
            this.hosts = hosts;
            this.exact = exact;
        }

        private boolean isFeasible() {
            return exact ? elements.size() == hosts.size() : elements.size() <= hosts.size();
        }
    }

    private static class Cursor {

        private final Frame frame;
        private final int position;

        private Cursor(Frame frame, int position) {
            this.frame = frame;
            this.position = position;
        }

        private boolean isDone() {
            return position == frame.elements.size();
        }

        private String element() {
            return frame.elements.get(position);
        }

        private Cursor next() {
            return new Cursor(frame, position + 1);
        }
    }
}
