/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.logic;

import com.arisbe.core.common.util.Result;
import com.arisbe.core.graph.ExistentialGraph;
import com.arisbe.core.graph.Identifiers;
import com.arisbe.core.pattern.Subgraph;
import com.arisbe.core.pattern.equivalence.AlphaEquivalence;
import com.arisbe.core.pattern.equivalence.StructuralMatcher;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.arisbe.core.common.collection.Collections.minusAll;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.INCOMPARABLE_CONTEXTS;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.NOT_STRUCTURALLY_IDENTICAL;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.NO_DOMINATING_COPY;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.OVERLAPPING_SUBGRAPHS;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.REMOVED_VERTEX_STILL_REFERENCED;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.WRONG_NESTING_DIRECTION;

/**
 * Removes a subgraph that is a copy of another subgraph placed in the same or an enclosing
 * context. The copy may be given explicitly; otherwise it is searched for in the candidate's root
 * context and then in each enclosing context, nearest first. Shared and boundary vertices stay in
 * place and must be their own images in the copy.
 */
public class Deiteration extends Rule {

    private final Subgraph candidate;
    private final Set<String> shared;
    @Nullable
    private final Subgraph base;

    private Deiteration(Subgraph candidate, Set<String> shared, @Nullable Subgraph base) {
        this.candidate = candidate;
        this.shared = ImmutableSet.copyOf(shared);
        this.base = base;
    }

    public static Deiteration of(Subgraph candidate) {
        return new Deiteration(candidate, ImmutableSet.of(), null);
    }

    public static Deiteration of(Subgraph candidate, Set<String> shared) {
        return new Deiteration(candidate, shared, null);
    }

    public static Deiteration of(Subgraph candidate, Set<String> shared, Subgraph base) {
        return new Deiteration(candidate, shared, base);
    }

    @Override
    public Kind kind() {
        return Kind.DEITERATION;
    }

    @Override
    public Result<ExistentialGraph, TransformationError> apply(ExistentialGraph graph, Identifiers identifiers) {
        TransformationError invalid = checkSubgraph(candidate, graph);
        if (invalid == null) invalid = checkShared(candidate, shared);
        if (invalid == null && base != null) invalid = checkSubgraph(base, graph);
        if (invalid != null) return Result.error(invalid);

        StructuralMatcher matcher = StructuralMatcher.of(candidate, graph).excluding(candidate.elements(), shared);
        String root = candidate.rootContext();
        if (base != null) {
            Set<String> overlap = minusAll(ImmutableSet.copyOf(Sets.intersection(base.elements(), candidate.elements())),
                                           Sets.union(shared, candidate.boundary()));
            if (!overlap.isEmpty()) return reject(OVERLAPPING_SUBGRAPHS, null, overlap);
            String baseRoot = base.rootContext();
            if (!graph.dominates(baseRoot, root)) {
                if (graph.dominates(root, baseRoot)) return reject(WRONG_NESTING_DIRECTION, root, baseRoot, root);
                else return reject(INCOMPARABLE_CONTEXTS, root, baseRoot, root);
            }
            if (matcher.matchExactly(base.rootElements()).isEmpty()) {
                return reject(NOT_STRUCTURALLY_IDENTICAL, root, baseRoot, root);
            }
        } else {
            List<String> scopes = new ArrayList<>();
            scopes.add(root);
            scopes.addAll(graph.ancestors(root));
            Optional<AlphaEquivalence> copy = Optional.empty();
            for (String scope : scopes) {
                copy = matcher.matchInto(scope);
                if (copy.isPresent()) break;
            }
            if (copy.isEmpty()) return reject(NO_DOMINATING_COPY, root, root);
        }

        Set<String> removed = minusAll(ImmutableSet.copyOf(candidate.elements()),
                                       Sets.union(shared, candidate.boundary()));
        for (String id : removed) {
            if (!graph.isVertex(id)) continue;
            Set<String> referencing = minusAll(graph.incidentEdges(id), removed);
            if (!referencing.isEmpty()) return reject(REMOVED_VERTEX_STILL_REFERENCED, id, id, referencing);
        }
        return Result.ok(graph.withoutAll(removed));
    }

    @Override
    public String toString() {
        return kind() + "{" + candidate + ", shared " + shared + (base != null ? ", base " + base : "") + "}";
    }
}
