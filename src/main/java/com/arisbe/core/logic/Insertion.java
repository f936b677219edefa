/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.logic;

import com.arisbe.core.common.util.Result;
import com.arisbe.core.graph.Cut;
import com.arisbe.core.graph.Edge;
import com.arisbe.core.graph.ExistentialGraph;
import com.arisbe.core.graph.Identifiers;
import com.arisbe.core.graph.Vertex;
import com.arisbe.core.pattern.Subgraph;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nullable;
import java.util.List;

import static com.arisbe.core.common.exception.ErrorMessage.Transformation.CONTEXT_NOT_FOUND;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.ELEMENT_NOT_FOUND;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.INSERTED_ARGUMENT_NOT_DOMINATING;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.INSERTION_IN_POSITIVE_CONTEXT;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.INVALID_ELEMENT_SHAPE;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.NOT_A_VERTEX;

/**
 * Adds a new element, or a copy of an arbitrary subgraph, to a negative context.
 */
public abstract class Insertion extends Rule {

    final String context;

    private Insertion(String context) {
        this.context = context;
    }

    public static Insertion vertex(String context, @Nullable String label) {
        return new OfVertex(context, label);
    }

    public static Insertion edge(String context, String relation, List<String> arguments) {
        return new OfEdge(context, relation, arguments);
    }

    public static Insertion cut(String context) {
        return new OfCut(context);
    }

    /**
     * Inserts a fresh copy of the template, which may have been selected in any graph.
     */
    public static Insertion of(Subgraph template, String context) {
        return new OfSubgraph(context, template);
    }

    @Override
    public Kind kind() {
        return Kind.INSERTION;
    }

    @Override
    public Result<ExistentialGraph, TransformationError> apply(ExistentialGraph graph, Identifiers identifiers) {
        if (!graph.isContext(context)) return reject(CONTEXT_NOT_FOUND, context, context);
        if (graph.isPositive(context)) return reject(INSERTION_IN_POSITIVE_CONTEXT, context, context);
        return insert(graph, identifiers);
    }

    abstract Result<ExistentialGraph, TransformationError> insert(ExistentialGraph graph, Identifiers identifiers);

    private static class OfVertex extends Insertion {

        @Nullable
        private final String label;

        private OfVertex(String context, @Nullable String label) {
            super(context);
            this.label = label;
        }

        @Override
        Result<ExistentialGraph, TransformationError> insert(ExistentialGraph graph, Identifiers identifiers) {
            if (label != null && label.isBlank()) {
                return reject(INVALID_ELEMENT_SHAPE, null, "a constant vertex needs a non-blank label.");
            }
            return Result.ok(graph.withVertex(Vertex.of(identifiers.vertex(graph), label), context));
        }

        @Override
        public String toString() {
            return kind() + "{vertex " + (label == null ? "*" : label) + " into " + context + "}";
        }
    }

    private static class OfEdge extends Insertion {

        private final String relation;
        private final List<String> arguments;

        private OfEdge(String context, String relation, List<String> arguments) {
            super(context);
            this.relation = relation;
            this.arguments = ImmutableList.copyOf(arguments);
        }

        @Override
        Result<ExistentialGraph, TransformationError> insert(ExistentialGraph graph, Identifiers identifiers) {
            if (relation == null || relation.isBlank()) {
                return reject(INVALID_ELEMENT_SHAPE, null, "an edge needs a non-blank relation name.");
            }
            for (String vertex : arguments) {
                if (!graph.contains(vertex)) return reject(ELEMENT_NOT_FOUND, vertex, vertex);
                if (!graph.isVertex(vertex)) return reject(NOT_A_VERTEX, vertex, vertex);
                if (!graph.dominates(graph.context(vertex), context)) {
                    return reject(INSERTED_ARGUMENT_NOT_DOMINATING, vertex, vertex, context);
                }
            }
            return Result.ok(graph.withEdge(Edge.of(identifiers.edge(graph)), arguments, relation, context));
        }

        @Override
        public String toString() {
            return kind() + "{" + relation + arguments + " into " + context + "}";
        }
    }

    private static class OfCut extends Insertion {

        private OfCut(String context) {
            super(context);
        }

        @Override
        Result<ExistentialGraph, TransformationError> insert(ExistentialGraph graph, Identifiers identifiers) {
            return Result.ok(graph.withCut(Cut.of(identifiers.cut(graph)), context));
        }

        @Override
        public String toString() {
            return kind() + "{cut into " + context + "}";
        }
    }

    private static class OfSubgraph extends Insertion {

        private final Subgraph template;

        private OfSubgraph(String context, Subgraph template) {
            super(context);
            this.template = template;
        }

        @Override
        Result<ExistentialGraph, TransformationError> insert(ExistentialGraph graph, Identifiers identifiers) {
            return Result.ok(SubgraphCopier.copy(template, graph, context, ImmutableSet.of(), identifiers).graph());
        }

        @Override
        public String toString() {
            return kind() + "{" + template + " into " + context + "}";
        }
    }
}
