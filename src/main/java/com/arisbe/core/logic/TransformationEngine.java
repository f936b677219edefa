/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.logic;

import com.arisbe.core.common.exception.ArisbeException;
import com.arisbe.core.common.parameters.Options;
import com.arisbe.core.common.util.Result;
import com.arisbe.core.graph.ExistentialGraph;
import com.arisbe.core.graph.GraphValidator;
import com.arisbe.core.graph.Identifiers;
import com.arisbe.core.pattern.Subgraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.arisbe.core.common.exception.ErrorMessage.Internal.ILL_FORMED_RESULT;

/**
 * Applies rules to graphs under a common set of options and a common source of identifiers.
 */
public class TransformationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TransformationEngine.class);

    private final Options.Engine options;
    private final Identifiers identifiers;
    private final GraphValidator validator;

    public TransformationEngine() {
        this(Options.Engine.fromSystemProperties(), Identifiers.random());
    }

    public TransformationEngine(Options.Engine options, Identifiers identifiers) {
        this.options = options;
        this.identifiers = identifiers;
        this.validator = new GraphValidator();
    }

    public Options.Engine options() {
        return options;
    }

    public Identifiers identifiers() {
        return identifiers;
    }

    public Result<ExistentialGraph, TransformationError> apply(ExistentialGraph graph, Rule rule) {
        return applyWith(graph, rule, options);
    }

    public Result<ExistentialGraph, TransformationError> apply(ExistentialGraph graph, Rule rule,
                                                               Options.Application applicationOptions) {
        return applyWith(graph, rule, applicationOptions.parent(options));
    }

    private Result<ExistentialGraph, TransformationError> applyWith(ExistentialGraph graph, Rule rule,
                                                                    Options<?, ?> options) {
        boolean trace = options.traceTransformations() && LOG.isTraceEnabled();
        LOG.debug("Applying {}", rule);
        if (trace) LOG.trace("Graph before {}: {}", rule.kind(), graph);

        Result<ExistentialGraph, TransformationError> result = rule.apply(graph, identifiers);
        if (result.isError()) {
            LOG.debug("Rejected {}: [{}] {}", rule.kind(), result.error().code(), result.error().message());
            return result;
        }
        if (trace) LOG.trace("Graph after {}: {}", rule.kind(), result.get());
        if (options.checkInvariants()) {
            GraphValidator.Report report = validator.validate(result.get());
            if (!report.isValid()) {
                LOG.error("{} produced an ill-formed graph: {}", rule, report.errors());
                throw ArisbeException.of(ILL_FORMED_RESULT, rule.kind(), report.errors());
            }
        }
        return result;
    }

    /**
     * Checks whether the rule would apply to the graph, without keeping the outcome.
     */
    public Optional<TransformationError> validate(ExistentialGraph graph, Rule rule) {
        return rule.apply(graph, identifiers).failure();
    }

    public Result<ExistentialGraph, TransformationError> erase(ExistentialGraph graph, String element) {
        return apply(graph, Erasure.of(element));
    }

    public Result<ExistentialGraph, TransformationError> erase(ExistentialGraph graph, Subgraph subgraph) {
        return apply(graph, Erasure.of(subgraph));
    }

    public Result<ExistentialGraph, TransformationError> insertVertex(ExistentialGraph graph, String context,
                                                                      @Nullable String label) {
        return apply(graph, Insertion.vertex(context, label));
    }

    public Result<ExistentialGraph, TransformationError> insertEdge(ExistentialGraph graph, String context,
                                                                    String relation, List<String> arguments) {
        return apply(graph, Insertion.edge(context, relation, arguments));
    }

    public Result<ExistentialGraph, TransformationError> insertCut(ExistentialGraph graph, String context) {
        return apply(graph, Insertion.cut(context));
    }

    public Result<ExistentialGraph, TransformationError> insert(ExistentialGraph graph, Subgraph template,
                                                                String context) {
        return apply(graph, Insertion.of(template, context));
    }

    public Result<ExistentialGraph, TransformationError> iterate(ExistentialGraph graph, Subgraph source,
                                                                 String target, Set<String> shared) {
        return apply(graph, Iteration.of(source, target, shared));
    }

    public Result<ExistentialGraph, TransformationError> deiterate(ExistentialGraph graph, Subgraph candidate,
                                                                   Set<String> shared) {
        return apply(graph, Deiteration.of(candidate, shared));
    }

    public Result<ExistentialGraph, TransformationError> deiterate(ExistentialGraph graph, Subgraph candidate,
                                                                   Set<String> shared, Subgraph base) {
        return apply(graph, Deiteration.of(candidate, shared, base));
    }

    public Result<ExistentialGraph, TransformationError> addDoubleCut(ExistentialGraph graph, Subgraph subgraph) {
        return apply(graph, DoubleCutAddition.around(subgraph));
    }

    public Result<ExistentialGraph, TransformationError> addDoubleCut(ExistentialGraph graph, String context) {
        return apply(graph, DoubleCutAddition.in(context));
    }

    public Result<ExistentialGraph, TransformationError> removeDoubleCut(ExistentialGraph graph, String outer) {
        return apply(graph, DoubleCutRemoval.of(outer));
    }

    public Result<ExistentialGraph, TransformationError> addIsolatedVertex(ExistentialGraph graph, String context,
                                                                           @Nullable String label) {
        return apply(graph, IsolatedVertexAddition.of(context, label));
    }

    public Result<ExistentialGraph, TransformationError> removeIsolatedVertex(ExistentialGraph graph, String vertex) {
        return apply(graph, IsolatedVertexRemoval.of(vertex));
    }
}
