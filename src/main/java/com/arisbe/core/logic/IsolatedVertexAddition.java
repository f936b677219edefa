/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.logic;

import com.arisbe.core.common.util.Result;
import com.arisbe.core.graph.ExistentialGraph;
import com.arisbe.core.graph.Identifiers;
import com.arisbe.core.graph.Vertex;

import javax.annotation.Nullable;

import static com.arisbe.core.common.exception.ErrorMessage.Transformation.CONTEXT_NOT_FOUND;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.INVALID_ELEMENT_SHAPE;

public class IsolatedVertexAddition extends Rule {

    private final String context;
    @Nullable
    private final String label;

    private IsolatedVertexAddition(String context, @Nullable String label) {
        this.context = context;
        this.label = label;
    }

    public static IsolatedVertexAddition of(String context) {
        return new IsolatedVertexAddition(context, null);
    }

    public static IsolatedVertexAddition of(String context, @Nullable String label) {
        return new IsolatedVertexAddition(context, label);
    }

    @Override
    public Kind kind() {
        return Kind.ISOLATED_VERTEX_ADDITION;
    }

    @Override
    public Result<ExistentialGraph, TransformationError> apply(ExistentialGraph graph, Identifiers identifiers) {
        if (!graph.isContext(context)) return reject(CONTEXT_NOT_FOUND, context, context);
        if (label != null && label.isBlank()) {
            return reject(INVALID_ELEMENT_SHAPE, null, "a constant vertex needs a non-blank label.");
        }
        return Result.ok(graph.withVertex(Vertex.of(identifiers.vertex(graph), label), context));
    }

    @Override
    public String toString() {
        return kind() + "{" + (label == null ? "*" : label) + " into " + context + "}";
    }
}
