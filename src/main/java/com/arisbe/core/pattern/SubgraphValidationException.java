/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.pattern;

import com.arisbe.core.common.exception.ArisbeException;
import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.Set;

public class SubgraphValidationException extends ArisbeException {

    private final Subgraph.Constraint constraint;
    private final ImmutableSet<String> offending;

    SubgraphValidationException(Subgraph.Constraint constraint, Collection<String> offending) {
        super(constraint.error(), offending.size() == 1 ? offending.iterator().next() : offending);
        this.constraint = constraint;
        this.offending = ImmutableSet.copyOf(offending);
    }

    public Subgraph.Constraint constraint() {
        return constraint;
    }

    /**
     * The identifiers of the elements or contexts that broke the constraint.
     */
    public Set<String> offending() {
        return offending;
    }
}
