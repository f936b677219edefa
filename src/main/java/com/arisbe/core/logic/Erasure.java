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
import com.google.common.collect.Sets;

import javax.annotation.Nullable;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import static com.arisbe.core.common.collection.Collections.minusAll;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.ELEMENT_NOT_FOUND;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.ERASED_VERTEX_STILL_REFERENCED;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.ERASURE_IN_NEGATIVE_CONTEXT;

/**
 * Removes an element, or a whole subgraph, from a positive context. An erased cut takes
 * everything it encloses with it; a vertex cannot be erased while an edge that stays refers to it.
 */
public class Erasure extends Rule {

    @Nullable
    private final String element;
    @Nullable
    private final Subgraph subgraph;

    private Erasure(@Nullable String element, @Nullable Subgraph subgraph) {
        this.element = element;
        this.subgraph = subgraph;
    }

    public static Erasure of(String element) {
        return new Erasure(Objects.requireNonNull(element), null);
    }

    public static Erasure of(Subgraph subgraph) {
        return new Erasure(null, Objects.requireNonNull(subgraph));
    }

    @Override
    public Kind kind() {
        return Kind.ERASURE;
    }

    @Override
    public Result<ExistentialGraph, TransformationError> apply(ExistentialGraph graph, Identifiers identifiers) {
        String context;
        Set<String> erased = new LinkedHashSet<>();
        if (element != null) {
            if (!graph.contains(element)) return reject(ELEMENT_NOT_FOUND, element, element);
            context = graph.context(element);
            erased.add(element);
            if (graph.isCut(element)) erased.addAll(graph.fullContext(element));
        } else {
            assert subgraph != null;
            TransformationError invalid = checkSubgraph(subgraph, graph);
            if (invalid != null) return Result.error(invalid);
            context = subgraph.rootContext();
            erased.addAll(Sets.difference(subgraph.elements(), subgraph.boundary()));
        }

        if (graph.isNegative(context)) {
            return reject(ERASURE_IN_NEGATIVE_CONTEXT, element != null ? element : context,
                          element != null ? element : erased, context);
        }
        for (String id : erased) {
            if (!graph.isVertex(id)) continue;
            Set<String> referencing = minusAll(graph.incidentEdges(id), erased);
            if (!referencing.isEmpty()) return reject(ERASED_VERTEX_STILL_REFERENCED, id, id, referencing);
        }
        return Result.ok(graph.withoutAll(erased));
    }

    @Override
    public String toString() {
        return kind() + "{" + (element != null ? element : subgraph) + "}";
    }
}
