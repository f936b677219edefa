/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.logic;

import com.arisbe.core.common.util.Result;
import com.arisbe.core.graph.ExistentialGraph;
import com.arisbe.core.graph.Identifiers;

import java.util.LinkedHashSet;
import java.util.Set;

import static com.arisbe.core.common.exception.ErrorMessage.Transformation.ELEMENTS_BETWEEN_CUTS;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.ELEMENT_NOT_FOUND;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.NOT_A_CUT;
import static com.arisbe.core.common.exception.ErrorMessage.Transformation.NOT_A_DOUBLE_CUT;

/**
 * Removes a cut whose area holds nothing but another cut, together with that inner cut. The
 * contents of the inner cut end up in the context of the outer one.
 */
public class DoubleCutRemoval extends Rule {

    private final String outer;

    private DoubleCutRemoval(String outer) {
        this.outer = outer;
    }

    public static DoubleCutRemoval of(String outer) {
        return new DoubleCutRemoval(outer);
    }

    @Override
    public Kind kind() {
        return Kind.DOUBLE_CUT_REMOVAL;
    }

    @Override
    public Result<ExistentialGraph, TransformationError> apply(ExistentialGraph graph, Identifiers identifiers) {
        if (!graph.contains(outer)) return reject(ELEMENT_NOT_FOUND, outer, outer);
        if (!graph.isCut(outer)) return reject(NOT_A_CUT, outer, outer);

        Set<String> innerCuts = new LinkedHashSet<>();
        Set<String> between = new LinkedHashSet<>();
        for (String element : graph.area(outer)) {
            if (graph.isCut(element)) innerCuts.add(element);
            else between.add(element);
        }
        if (innerCuts.isEmpty()) return reject(NOT_A_DOUBLE_CUT, outer, outer);
        if (!between.isEmpty()) return reject(ELEMENTS_BETWEEN_CUTS, outer, between, outer);
        if (innerCuts.size() > 1) return reject(NOT_A_DOUBLE_CUT, outer, outer);

        String inner = innerCuts.iterator().next();
        return Result.ok(graph.without(outer).without(inner));
    }

    @Override
    public String toString() {
        return kind() + "{" + outer + "}";
    }
}
