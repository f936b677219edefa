/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.history;

import com.arisbe.core.common.exception.ArisbeException;
import com.arisbe.core.common.parameters.Options;
import com.arisbe.core.common.util.Result;
import com.arisbe.core.graph.ExistentialGraph;
import com.arisbe.core.logic.Rule;
import com.arisbe.core.logic.TransformationEngine;
import com.arisbe.core.logic.TransformationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

import static com.arisbe.core.common.exception.ErrorMessage.History.INVALID_HISTORY_LIMIT;
import static com.arisbe.core.common.exception.ErrorMessage.History.NOTHING_TO_REDO;
import static com.arisbe.core.common.exception.ErrorMessage.History.NOTHING_TO_UNDO;

/**
 * A caller-held sequence of graph snapshots with undo and redo. Since graphs are immutable, a
 * snapshot is the graph itself. At most {@code limit} earlier snapshots are kept; the oldest are
 * dropped first.
 *
 * Not thread-safe.
 */
public class GraphHistory {

    private static final Logger LOG = LoggerFactory.getLogger(GraphHistory.class);

    private final Deque<ExistentialGraph> past;
    private final Deque<ExistentialGraph> future;
    private final int limit;
    private ExistentialGraph current;

    public GraphHistory(ExistentialGraph initial) {
        this(initial, Options.DEFAULT_HISTORY_LIMIT);
    }

    public GraphHistory(ExistentialGraph initial, Options<?, ?> options) {
        this(initial, options.historyLimit());
    }

    public GraphHistory(ExistentialGraph initial, int limit) {
        if (limit <= 0) throw ArisbeException.of(INVALID_HISTORY_LIMIT, limit);
        this.past = new ArrayDeque<>();
        this.future = new ArrayDeque<>();
        this.limit = limit;
        this.current = initial;
    }

    public ExistentialGraph current() {
        return current;
    }

    public void record(ExistentialGraph graph) {
        past.push(current);
        if (past.size() > limit) {
            past.removeLast();
            LOG.debug("History limit of {} reached, dropped the oldest snapshot", limit);
        }
        future.clear();
        current = graph;
    }

    /**
     * Applies the rule to the current graph and records the outcome when it succeeds.
     */
    public Result<ExistentialGraph, TransformationError> apply(Rule rule, TransformationEngine engine) {
        return engine.apply(current, rule).ifOk(this::record);
    }

    public ExistentialGraph undo() {
        if (past.isEmpty()) throw ArisbeException.of(NOTHING_TO_UNDO);
        future.push(current);
        current = past.pop();
        return current;
    }

    public ExistentialGraph redo() {
        if (future.isEmpty()) throw ArisbeException.of(NOTHING_TO_REDO);
        past.push(current);
        current = future.pop();
        return current;
    }

    public boolean canUndo() {
        return !past.isEmpty();
    }

    public boolean canRedo() {
        return !future.isEmpty();
    }

    public int undoDepth() {
        return past.size();
    }

    public int limit() {
        return limit;
    }
}
