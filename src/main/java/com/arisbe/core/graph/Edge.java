/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.graph;

/**
 * An occurrence of a relation. Its arguments and its relation name live in the graph's
 * {@code ν} and {@code rel} mappings.
 */
public class Edge extends Element {

    private Edge(String id) {
        super(id);
    }

    public static Edge of(String id) {
        return new Edge(id);
    }

    @Override
    public Kind kind() {
        return Kind.EDGE;
    }

    @Override
    public boolean isEdge() {
        return true;
    }

    @Override
    public Edge asEdge() {
        return this;
    }

    @Override
    public String toString() {
        return "edge@" + id();
    }
}
