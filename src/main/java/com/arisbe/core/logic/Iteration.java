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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.Set;

import static com.arisbe.core.common.exception.ErrorMessage.Transformation.CONTEXT_NOT_FOUND;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.INCOMPARABLE_CONTEXTS;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.TARGET_INSIDE_SUBGRAPH;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.WRONG_NESTING_DIRECTION;

/**
 * Copies a subgraph into its own context or a context nested within it. Shared and boundary
 * vertices are not copied; the copied edges refer to them directly.
 */
public class Iteration extends Rule {

    private final Subgraph source;
    private final String target;
    private final Set<String> shared;

    private Iteration(Subgraph source, String target, Set<String> shared) {
        this.source = source;
        this.target = target;
        this.shared = ImmutableSet.copyOf(shared);
    }

    public static Iteration of(Subgraph source, String target) {
        return new Iteration(source, target, ImmutableSet.of());
    }

    public static Iteration of(Subgraph source, String target, Set<String> shared) {
        return new Iteration(source, target, shared);
    }

    @Override
    public Kind kind() {
        return Kind.ITERATION;
    }

    @Override
    public Result<ExistentialGraph, TransformationError> apply(ExistentialGraph graph, Identifiers identifiers) {
        TransformationError invalid = checkSubgraph(source, graph);
        if (invalid == null) invalid = checkShared(source, shared);
        if (invalid != null) return Result.error(invalid);

        String root = source.rootContext();
        if (!graph.isContext(target)) return reject(CONTEXT_NOT_FOUND, target, target);
        if (source.contains(target)) return reject(TARGET_INSIDE_SUBGRAPH, target, target);
        if (!graph.dominates(root, target)) {
            if (graph.dominates(target, root)) return reject(WRONG_NESTING_DIRECTION, target, root, target);
            else return reject(INCOMPARABLE_CONTEXTS, target, root, target);
        }
        Set<String> kept = Sets.union(shared, source.boundary());
        return Result.ok(SubgraphCopier.copy(source, graph, target, kept, identifiers).graph());
    }

    @Override
    public String toString() {
        return kind() + "{" + source + " into " + target + ", shared " + shared + "}";
    }
}
