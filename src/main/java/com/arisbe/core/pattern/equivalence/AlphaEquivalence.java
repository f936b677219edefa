/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.pattern.equivalence;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.arisbe.core.common.collection.Collections.put;
import static com.arisbe.core.common.collection.Collections.set;

/**
 * A bijective renaming of element identifiers, from a pattern graph to a host graph.
 */
public class AlphaEquivalence {

    private final ImmutableMap<String, String> map;
    private final ImmutableMap<String, String> reverseMap;

    private AlphaEquivalence(ImmutableMap<String, String> map, ImmutableMap<String, String> reverseMap) {
        assert map.size() == reverseMap.size();
        assert map.keySet().equals(set(reverseMap.values()));
        this.map = map;
        this.reverseMap = reverseMap;
    }

    public static AlphaEquivalence empty() {
        return new AlphaEquivalence(ImmutableMap.of(), ImmutableMap.of());
    }

    public AlphaEquivalence extend(String from, String to) {
        assert !map.containsKey(from) && !reverseMap.containsKey(to);
        return new AlphaEquivalence(put(map, from, to), put(reverseMap, to, from));
    }

    /**
     * @return whether {@code from -> to} agrees with the mapping, or can be added without breaking it
     */
    public boolean isCompatible(String from, String to) {
        String mapped = map.get(from);
        if (mapped != null) return mapped.equals(to);
        else return !reverseMap.containsKey(to);
    }

    public boolean isMapped(String from) {
        return map.containsKey(from);
    }

    public boolean isImage(String to) {
        return reverseMap.containsKey(to);
    }

    public Optional<String> get(String from) {
        return Optional.ofNullable(map.get(from));
    }

    public Optional<String> inverse(String to) {
        return Optional.ofNullable(reverseMap.get(to));
    }

    public Map<String, String> elementMapping() {
        return map;
    }

    public Map<String, String> reverseElementMapping() {
        return reverseMap;
    }

    public int size() {
        return map.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AlphaEquivalence that = (AlphaEquivalence) o;
        return map.equals(that.map) && reverseMap.equals(that.reverseMap);
    }

    @Override
    public int hashCode() {
        return Objects.hash(map, reverseMap);
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
