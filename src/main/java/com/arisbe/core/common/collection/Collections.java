/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.common.collection;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import io.lacuna.bifurcan.IMap;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Helpers over Guava's immutable collections, which are copied on write, and over bifurcan's
 * persistent maps, which share every branch an update does not touch.
 */
public class Collections {

    @SafeVarargs
    public static <T> ImmutableSet<T> set(T... elements) {
        return ImmutableSet.copyOf(elements);
    }

    public static <T> ImmutableSet<T> set(Collection<? extends T> elements) {
        return ImmutableSet.copyOf(elements);
    }

    @SafeVarargs
    public static <T> ImmutableList<T> list(T... elements) {
        return ImmutableList.copyOf(elements);
    }

    public static <T> ImmutableList<T> list(Collection<? extends T> elements) {
        return ImmutableList.copyOf(elements);
    }

    public static <T> ImmutableSet<T> plus(Set<T> set, T element) {
        if (set.contains(element)) return ImmutableSet.copyOf(set);
        return ImmutableSet.<T>builderWithExpectedSize(set.size() + 1).addAll(set).add(element).build();
    }

    public static <T> ImmutableSet<T> plusAll(Set<T> set, Collection<? extends T> elements) {
        return ImmutableSet.<T>builderWithExpectedSize(set.size() + elements.size()).addAll(set).addAll(elements).build();
    }

    public static <T> ImmutableSet<T> minus(Set<T> set, T element) {
        if (!set.contains(element)) return ImmutableSet.copyOf(set);
        ImmutableSet.Builder<T> builder = ImmutableSet.builderWithExpectedSize(set.size() - 1);
        for (T e : set) {
            if (!e.equals(element)) builder.add(e);
        }
        return builder.build();
    }

    public static <T> ImmutableSet<T> minusAll(Set<T> set, Set<?> elements) {
        return ImmutableSet.copyOf(Sets.filter(set, e -> !elements.contains(e)));
    }

    public static <K, V> ImmutableMap<K, V> put(Map<K, V> map, K key, V value) {
        ImmutableMap.Builder<K, V> builder = ImmutableMap.builderWithExpectedSize(map.size() + 1);
        boolean replaced = false;
        for (Map.Entry<K, V> entry : map.entrySet()) {
            if (entry.getKey().equals(key)) {
                builder.put(key, value);
                replaced = true;
            } else {
                builder.put(entry);
            }
        }
        if (!replaced) builder.put(key, value);
        return builder.build();
    }

    public static <K, V> IMap<K, V> persistentMap() {
        return new io.lacuna.bifurcan.Map<>();
    }

    public static <K, V> IMap<K, V> persistentMap(K key, V value) {
        return Collections.<K, V>persistentMap().put(key, value);
    }

    /**
     * Adds or replaces the entries in one linear pass; untouched branches stay shared with {@code map}.
     */
    public static <K, V> IMap<K, V> putAll(IMap<K, V> map, Map<K, ? extends V> entries) {
        if (entries.isEmpty()) return map;
        IMap<K, V> updated = map.linear();
        for (Map.Entry<K, ? extends V> entry : entries.entrySet()) {
            updated = updated.put(entry.getKey(), entry.getValue());
        }
        return updated.forked();
    }

    public static <K, V> IMap<K, V> removeAll(IMap<K, V> map, Collection<? extends K> keys) {
        if (keys.isEmpty()) return map;
        IMap<K, V> updated = map.linear();
        for (K key : keys) updated = updated.remove(key);
        return updated.forked();
    }

    public static <K, V> ImmutableList<V> values(IMap<K, V> map) {
        ImmutableList.Builder<V> values = ImmutableList.builderWithExpectedSize((int) map.size());
        for (K key : map.keys()) values.add(map.get(key, null));
        return values.build();
    }

    public static <K, V> ImmutableMap<K, V> snapshot(IMap<K, V> map) {
        ImmutableMap.Builder<K, V> snapshot = ImmutableMap.builderWithExpectedSize((int) map.size());
        for (K key : map.keys()) snapshot.put(key, map.get(key, null));
        return snapshot.build();
    }
}
