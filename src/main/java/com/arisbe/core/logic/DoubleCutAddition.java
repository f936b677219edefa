/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.logic;

import com.arisbe.core.common.util.Result;
import com.arisbe.core.graph.Cut;
import com.arisbe.core.graph.ExistentialGraph;
import com.arisbe.core.graph.Identifiers;
import com.arisbe.core.pattern.Subgraph;

import javax.annotation.Nullable;
import java.util.LinkedHashSet;
import java.util.Set;

import static com.arisbe.core.common.exception.ErrorMessage.Transformation.CONTEXT_NOT_FOUND;

/**
 * Encloses a subgraph in two new cuts, one directly inside the other. Vertices of the subgraph
 * that edges outside it still refer to are left where they are.
 */
public class DoubleCutAddition extends Rule {

    @Nullable
    private final Subgraph subgraph;
    private final String context;

    private DoubleCutAddition(@Nullable Subgraph subgraph, String context) {
        this.subgraph = subgraph;
        this.context = context;
    }

    public static DoubleCutAddition around(Subgraph subgraph) {
        return new DoubleCutAddition(subgraph, subgraph.rootContext());
    }

    /**
     * An empty double cut placed in the given context.
     */
    public static DoubleCutAddition in(String context) {
        return new DoubleCutAddition(null, context);
    }

    @Override
    public Kind kind() {
        return Kind.DOUBLE_CUT_ADDITION;
    }

    @Override
    public Result<ExistentialGraph, TransformationError> apply(ExistentialGraph graph, Identifiers identifiers) {
        Set<String> enclosed = new LinkedHashSet<>();
        if (subgraph != null) {
            TransformationError invalid = checkSubgraph(subgraph, graph);
            if (invalid != null) return Result.error(invalid);
            for (String element : subgraph.rootElements()) {
                if (graph.isVertex(element) && !subgraph.edges().containsAll(graph.incidentEdges(element))) continue;
                enclosed.add(element);
            }
        } else if (!graph.isContext(context)) {
            return reject(CONTEXT_NOT_FOUND, context, context);
        }

        String outer = identifiers.cut(graph);
        ExistentialGraph withOuter = graph.withCut(Cut.of(outer), context);
        String inner = identifiers.cut(withOuter);
        return Result.ok(withOuter.withCut(Cut.of(inner), outer).withMoved(enclosed, inner));
    }

    @Override
    public String toString() {
        return kind() + "{" + (subgraph != null ? subgraph : "empty in " + context) + "}";
    }
}
