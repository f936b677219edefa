/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.graph;

import com.arisbe.core.common.exception.ArisbeException;

import java.util.Objects;

import static com.arisbe.core.common.exception.ErrorMessage.Internal.ILLEGAL_CAST;

/**
 * A vertex, edge or cut of an {@link ExistentialGraph}. Elements are identity tokens: everything
 * that relates them (placement, arguments, relation names) is held by the graph and addressed by
 * {@link #id()}.
 */
public abstract class Element {

    private final String id;
    private final int hash;

    Element(String id) {
        this.id = Objects.requireNonNull(id);
        this.hash = Objects.hash(getClass(), id);
    }

    public String id() {
        return id;
    }

    public abstract Kind kind();

    public boolean isVertex() {
        return false;
    }

    public boolean isEdge() {
        return false;
    }

    public boolean isCut() {
        return false;
    }

    public Vertex asVertex() {
        throw ArisbeException.of(ILLEGAL_CAST, getClass().getSimpleName(), Vertex.class.getSimpleName());
    }

    public Edge asEdge() {
        throw ArisbeException.of(ILLEGAL_CAST, getClass().getSimpleName(), Edge.class.getSimpleName());
    }

    public Cut asCut() {
        throw ArisbeException.of(ILLEGAL_CAST, getClass().getSimpleName(), Cut.class.getSimpleName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((Element) o).id);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    public enum Kind {
        VERTEX, EDGE, CUT
    }
}
