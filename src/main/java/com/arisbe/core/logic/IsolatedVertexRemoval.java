/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.logic;

import com.arisbe.core.common.util.Result;
import com.arisbe.core.graph.ExistentialGraph;
import com.arisbe.core.graph.Identifiers;

import static com.arisbe.core.common.exception.ErrorMessage.Transformation.ELEMENT_NOT_FOUND;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.NOT_A_VERTEX;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.VERTEX_NOT_ISOLATED;

public class IsolatedVertexRemoval extends Rule {

    private final String vertex;

    private IsolatedVertexRemoval(String vertex) {
        this.vertex = vertex;
    }

    public static IsolatedVertexRemoval of(String vertex) {
        return new IsolatedVertexRemoval(vertex);
    }

    @Override
    public Kind kind() {
        return Kind.ISOLATED_VERTEX_REMOVAL;
    }

    @Override
    public Result<ExistentialGraph, TransformationError> apply(ExistentialGraph graph, Identifiers identifiers) {
        if (!graph.contains(vertex)) return reject(ELEMENT_NOT_FOUND, vertex, vertex);
        if (!graph.isVertex(vertex)) return reject(NOT_A_VERTEX, vertex, vertex);
        if (!graph.isIsolated(vertex)) return reject(VERTEX_NOT_ISOLATED, vertex, vertex, graph.incidentEdges(vertex));
        return Result.ok(graph.without(vertex));
    }

    @Override
    public String toString() {
        return kind() + "{" + vertex + "}";
    }
}
