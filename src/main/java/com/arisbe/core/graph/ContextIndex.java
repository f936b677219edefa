/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.graph;

import com.google.common.collect.ImmutableList;
import io.lacuna.bifurcan.IMap;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.arisbe.core.common.collection.Collections.persistentMap;
import static com.arisbe.core.common.collection.Collections.putAll;
import static com.arisbe.core.common.collection.Collections.removeAll;

/**
 * Parent pointers from every element to the context whose area directly contains it. Maintained
 * next to the area mapping so that context, depth and dominance queries walk the nesting chain
 * instead of scanning every area.
 */
class ContextIndex {

    private final String sheet;
    private final IMap<String, String> parents;

    private ContextIndex(String sheet, IMap<String, String> parents) {
        this.sheet = sheet;
        this.parents = parents;
    }

    static ContextIndex empty(String sheet) {
        return new ContextIndex(sheet, persistentMap());
    }

    ContextIndex placed(String element, String context) {
        return new ContextIndex(sheet, parents.put(element, context));
    }

    ContextIndex placedAll(Collection<String> elements, String context) {
        Map<String, String> moved = new HashMap<>();
        elements.forEach(element -> moved.put(element, context));
        return new ContextIndex(sheet, putAll(parents, moved));
    }

    ContextIndex removed(String element) {
        return new ContextIndex(sheet, parents.remove(element));
    }

    ContextIndex removedAll(Set<String> elements) {
        return new ContextIndex(sheet, removeAll(parents, elements));
    }

    Optional<String> parent(String element) {
        return Optional.ofNullable(parents.get(element, null));
    }

    /**
     * The number of cuts between the sheet and the given context; the sheet itself has depth 0.
     */
    int depth(String context) {
        int depth = 0;
        String current = context;
        while (!current.equals(sheet)) {
            current = parents.get(current, null);
            assert current != null;
            depth++;
        }
        return depth;
    }

    /**
     * The chain of contexts enclosing the given context, nearest first, ending with the sheet.
     */
    ImmutableList<String> ancestors(String context) {
        ImmutableList.Builder<String> ancestors = ImmutableList.builder();
        String current = context;
        while (!current.equals(sheet)) {
            current = parents.get(current, null);
            assert current != null;
            ancestors.add(current);
        }
        return ancestors.build();
    }

    boolean dominates(String outer, String inner) {
        String current = inner;
        while (true) {
            if (current.equals(outer)) return true;
            if (current.equals(sheet)) return false;
            current = parents.get(current, null);
            assert current != null;
        }
    }
}
