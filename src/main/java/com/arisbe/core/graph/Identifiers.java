/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.graph;

import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of fresh element identifiers. An identifier handed out for a graph is never one the
 * graph already uses.
 */
public abstract class Identifiers {

    public enum Prefix {
        SHEET("sheet"), VERTEX("v"), EDGE("e"), CUT("c");

        private final String prefix;

        Prefix(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }

    abstract String next(Prefix prefix);

    public static Identifiers random() {
        return new Random();
    }

    public static Identifiers sequential() {
        return new Sequential();
    }

    public String sheet() {
        return next(Prefix.SHEET);
    }

    public String vertex(ExistentialGraph graph) {
        return fresh(graph, Prefix.VERTEX);
    }

    public String edge(ExistentialGraph graph) {
        return fresh(graph, Prefix.EDGE);
    }

    public String cut(ExistentialGraph graph) {
        return fresh(graph, Prefix.CUT);
    }

    private String fresh(ExistentialGraph graph, Prefix prefix) {
        String id;
        do {
            id = next(prefix);
        } while (graph.containsId(id));
        return id;
    }

    private static class Random extends Identifiers {

        @Override
        String next(Prefix prefix) {
            return prefix.prefix() + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        }
    }

    private static class Sequential extends Identifiers {

        private final Map<Prefix, AtomicLong> counters;

        private Sequential() {
            counters = new EnumMap<>(Prefix.class);
            for (Prefix prefix : Prefix.values()) counters.put(prefix, new AtomicLong());
        }

        @Override
        String next(Prefix prefix) {
            return prefix.prefix() + "_" + counters.get(prefix).incrementAndGet();
        }
    }
}
