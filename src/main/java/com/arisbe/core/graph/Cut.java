/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.graph;

/**
 * A negation boundary. Whatever is placed in its area is negated relative to the context the
 * cut itself is placed in.
 */
public class Cut extends Element {

    private Cut(String id) {
        super(id);
    }

    public static Cut of(String id) {
        return new Cut(id);
    }

    @Override
    public Kind kind() {
        return Kind.CUT;
    }

    @Override
    public boolean isCut() {
        return true;
    }

    @Override
    public Cut asCut() {
        return this;
    }

    @Override
    public String toString() {
        return "cut@" + id();
    }
}
