/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.logic;

import com.arisbe.core.common.exception.ErrorMessage;
import com.arisbe.core.common.util.Result;
import com.arisbe.core.graph.ExistentialGraph;
import com.arisbe.core.graph.Identifiers;
import com.arisbe.core.pattern.Subgraph;

import javax.annotation.Nullable;
import java.util.Set;

import static com.arisbe.core.common.exception.ErrorMessage.Transformation.INVALID_SUBGRAPH;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.SHARED_VERTEX_INVALID;

/**
 * One application of a transformation rule of the Beta system, with its parameters fixed.
 *
 * <p>Applying a rule never throws for an illegitimate edit: the graph is either transformed as a
 * whole or left untouched, and the reason for a refusal is returned as a {@link TransformationError}.
 */
public abstract class Rule {

    public enum Kind {
        ERASURE("Erasure"),
        INSERTION("Insertion"),
        ITERATION("Iteration"),
        DEITERATION("De-iteration"),
        DOUBLE_CUT_ADDITION("Double cut addition"),
        DOUBLE_CUT_REMOVAL("Double cut removal"),
        ISOLATED_VERTEX_ADDITION("Isolated vertex addition"),
        ISOLATED_VERTEX_REMOVAL("Isolated vertex removal");

        private final String description;

        Kind(String description) {
            this.description = description;
        }

        @Override
        public String toString() {
            return description;
        }
    }

    public abstract Kind kind();

    public abstract Result<ExistentialGraph, TransformationError> apply(ExistentialGraph graph, Identifiers identifiers);

    Result<ExistentialGraph, TransformationError> reject(ErrorMessage error, @Nullable String element,
                                                         Object... parameters) {
        return Result.error(TransformationError.of(kind(), error, element, parameters));
    }

    @Nullable
    TransformationError checkSubgraph(Subgraph subgraph, ExistentialGraph graph) {
        if (subgraph.parent() != graph && !subgraph.parent().equals(graph)) {
            return TransformationError.of(kind(), INVALID_SUBGRAPH, subgraph.rootContext(),
                                          "it was selected in a different graph.");
        }
        return null;
    }

    @Nullable
    TransformationError checkShared(Subgraph subgraph, Set<String> shared) {
        for (String vertex : shared) {
            if (!subgraph.vertices().contains(vertex) || !subgraph.rootElements().contains(vertex)) {
                return TransformationError.of(kind(), SHARED_VERTEX_INVALID, vertex, vertex, subgraph.rootContext());
            }
        }
        return null;
    }
}
