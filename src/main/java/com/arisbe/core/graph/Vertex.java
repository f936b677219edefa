/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.graph;

import com.arisbe.core.common.exception.ArisbeException;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;

import static com.arisbe.core.common.exception.ErrorMessage.Graph.CONSTANT_VERTEX_WITHOUT_LABEL;

/**
 * A vertex is either generic (an existentially quantified individual, written {@code *x}) or a
 * constant naming a specific individual (written {@code "Socrates"}). The two are exclusive: only
 * constants carry a label.
 */
public class Vertex extends Element {

    @Nullable
    private final String label;

    private Vertex(String id, @Nullable String label) {
        super(id);
        this.label = label;
    }

    public static Vertex generic(String id) {
        return new Vertex(id, null);
    }

    public static Vertex constant(String id, String label) {
        if (label == null || label.isBlank()) throw ArisbeException.of(CONSTANT_VERTEX_WITHOUT_LABEL, id);
        return new Vertex(id, label);
    }

    public static Vertex of(String id, @Nullable String label) {
        return label == null ? generic(id) : constant(id, label);
    }

    public Optional<String> label() {
        return Optional.ofNullable(label);
    }

    public boolean isGeneric() {
        return label == null;
    }

    public boolean isConstant() {
        return label != null;
    }

    /**
     * Vertices of different graphs, or with different identities, describe the same individual
     * shape when both are generic or both name the same constant.
     */
    public boolean sameShape(Vertex other) {
        return Objects.equals(label, other.label);
    }

    /**
     * A vertex of the same shape under another identity.
     */
    public Vertex withId(String id) {
        return new Vertex(id, label);
    }

    @Override
    public Kind kind() {
        return Kind.VERTEX;
    }

    @Override
    public boolean isVertex() {
        return true;
    }

    @Override
    public Vertex asVertex() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        return Objects.equals(label, ((Vertex) o).label);
    }

    @Override
    public int hashCode() {
        return super.hashCode();
    }

    @Override
    public String toString() {
        return label == null ? "*" + id() : "\"" + label + "\"@" + id();
    }
}
