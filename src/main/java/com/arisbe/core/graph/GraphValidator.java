/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.graph;

import com.arisbe.core.common.exception.ErrorMessage;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.arisbe.core.common.exception.ErrorMessage.Graph.AREA_NOT_PARTITIONED;
import static com.arisbe.core.common.exception.ErrorMessage.Graph.CONTEXT_NOT_FOUND;
import static com.arisbe.core.common.exception.ErrorMessage.Graph.CYCLIC_NESTING;
import static com.arisbe.core.common.exception.ErrorMessage.Graph.DANGLING_AREA_ENTRY;
import static com.arisbe.core.common.exception.ErrorMessage.Graph.DANGLING_INCIDENCE;
import static com.arisbe.core.common.exception.ErrorMessage.Graph.MISSING_RELATION;
import static com.arisbe.core.common.exception.ErrorMessage.Graph.NON_DOMINATING_VERTEX;
import static com.arisbe.core.common.exception.ErrorMessage.Graph.OVERLAPPING_IDENTIFIERS;

/**
 * Re-checks the structural invariants of a graph from its raw components, without trusting the
 * indices the graph maintains. Violations of the invariants are errors; edges whose arguments sit
 * in non-dominating contexts are reported as warnings.
 */
public class GraphValidator {

    public Report validate(ExistentialGraph graph) {
        List<Finding> errors = new ArrayList<>();
        List<Finding> warnings = new ArrayList<>();
        checkDisjointness(graph, errors);
        checkAreaPartition(graph, errors);
        checkEdges(graph, errors);
        checkNesting(graph, errors);
        if (errors.isEmpty()) checkDominatingNodes(graph, warnings);
        return new Report(errors, warnings);
    }

    private void checkDisjointness(ExistentialGraph graph, List<Finding> errors) {
        Map<String, Integer> uses = new HashMap<>();
        uses.put(graph.sheet(), 1);
        graph.vertices().forEach(v -> uses.merge(v.id(), 1, Integer::sum));
        graph.edges().forEach(e -> uses.merge(e.id(), 1, Integer::sum));
        graph.cuts().forEach(c -> uses.merge(c.id(), 1, Integer::sum));
        uses.forEach((id, count) -> {
            if (count > 1) errors.add(new Finding(OVERLAPPING_IDENTIFIERS, id));
        });
    }

    private void checkAreaPartition(ExistentialGraph graph, List<Finding> errors) {
        Map<String, Set<String>> area = graph.area();
        Map<String, Integer> placements = new HashMap<>();
        area.forEach((context, elements) -> {
            if (!graph.isContext(context)) errors.add(new Finding(CONTEXT_NOT_FOUND, context));
            for (String element : elements) {
                if (!graph.contains(element)) errors.add(new Finding(DANGLING_AREA_ENTRY, context, element));
                else placements.merge(element, 1, Integer::sum);
            }
        });
        graph.cuts().forEach(c -> {
            if (!area.containsKey(c.id())) errors.add(new Finding(CONTEXT_NOT_FOUND, c.id()));
        });
        List<String> ids = new ArrayList<>();
        graph.vertices().forEach(v -> ids.add(v.id()));
        graph.edges().forEach(e -> ids.add(e.id()));
        graph.cuts().forEach(c -> ids.add(c.id()));
        for (String id : ids) {
            int count = placements.getOrDefault(id, 0);
            if (count != 1) errors.add(new Finding(AREA_NOT_PARTITIONED, id, count));
        }
    }

    private void checkEdges(ExistentialGraph graph, List<Finding> errors) {
        Map<String, List<String>> nu = graph.nu();
        Map<String, String> rel = graph.rel();
        for (Edge edge : graph.edges()) {
            List<String> arguments = nu.get(edge.id());
            String relation = rel.get(edge.id());
            if (arguments == null || relation == null || relation.isBlank()) {
                errors.add(new Finding(MISSING_RELATION, edge.id()));
                continue;
            }
            for (String vertex : arguments) {
                if (!graph.isVertex(vertex)) errors.add(new Finding(DANGLING_INCIDENCE, edge.id(), vertex));
            }
        }
    }

    private void checkNesting(ExistentialGraph graph, List<Finding> errors) {
        Map<String, String> parents = new HashMap<>();
        graph.area().forEach((context, elements) -> elements.forEach(e -> parents.put(e, context)));
        for (Cut cut : graph.cuts()) {
            Set<String> visited = new HashSet<>();
            String current = cut.id();
            while (current != null && !current.equals(graph.sheet())) {
                if (!visited.add(current)) {
                    errors.add(new Finding(CYCLIC_NESTING, cut.id()));
                    break;
                }
                current = parents.get(current);
            }
        }
    }

    private void checkDominatingNodes(ExistentialGraph graph, List<Finding> warnings) {
        graph.nu().forEach((edge, arguments) -> {
            String edgeContext = graph.context(edge);
            for (String vertex : arguments) {
                String vertexContext = graph.context(vertex);
                if (!graph.dominates(vertexContext, edgeContext)) {
                    warnings.add(new Finding(NON_DOMINATING_VERTEX, edge, edgeContext, vertex, vertexContext));
                }
            }
        });
    }

    public static class Report {

        private final List<Finding> errors;
        private final List<Finding> warnings;

        Report(List<Finding> errors, List<Finding> warnings) {
            this.errors = ImmutableList.copyOf(errors);
            this.warnings = ImmutableList.copyOf(warnings);
        }

        public boolean isValid() {
            return errors.isEmpty();
        }

        public List<Finding> errors() {
            return errors;
        }

        public List<Finding> warnings() {
            return warnings;
        }

        @Override
        public String toString() {
            return "Report{errors=" + errors + ", warnings=" + warnings + "}";
        }
    }

    public static class Finding {

        private final ErrorMessage error;
        private final String message;

        Finding(ErrorMessage error, Object... parameters) {
            this.error = error;
            this.message = error.message(parameters);
        }

        public ErrorMessage error() {
            return error;
        }

        public String message() {
            return message;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Finding that = (Finding) o;
            return error.equals(that.error) && message.equals(that.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(error, message);
        }

        @Override
        public String toString() {
            return message;
        }
    }
}
