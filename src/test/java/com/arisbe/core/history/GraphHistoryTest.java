/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.history;

import com.arisbe.core.common.exception.ArisbeException;
import com.arisbe.core.common.exception.ErrorMessage;
import com.arisbe.core.common.parameters.Options;
import com.arisbe.core.common.util.Result;
import com.arisbe.core.graph.ExistentialGraph;
import com.arisbe.core.graph.Identifiers;
import com.arisbe.core.graph.Vertex;
import com.arisbe.core.logic.Erasure;
import com.arisbe.core.logic.TransformationEngine;
import com.arisbe.core.logic.TransformationError;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class GraphHistoryTest {

    private final ExistentialGraph empty = ExistentialGraph.empty("sheet");
    private final ExistentialGraph one = empty.withVertex(Vertex.generic("a"));
    private final ExistentialGraph two = one.withVertex(Vertex.generic("b"));

    @Test
    public void undo_and_redo_walk_the_snapshots() {
        GraphHistory history = new GraphHistory(empty);
        assertFalse(history.canUndo());
        history.record(one);
        history.record(two);
        assertEquals(2, history.undoDepth());

        assertSame(one, history.undo());
        assertSame(empty, history.undo());
        assertFalse(history.canUndo());
        assertTrue(history.canRedo());
        assertSame(one, history.redo());
        assertSame(two, history.redo());
        assertFalse(history.canRedo());
        assertSame(two, history.current());
    }

    @Test
    public void recording_discards_the_redo_branch() {
        GraphHistory history = new GraphHistory(empty);
        history.record(one);
        history.undo();
        history.record(two);
        assertFalse(history.canRedo());
        assertSame(empty, history.undo());
    }

    @Test
    public void oldest_snapshots_are_dropped_beyond_the_limit() {
        GraphHistory history = new GraphHistory(empty, 1);
        history.record(one);
        history.record(two);
        assertEquals(1, history.undoDepth());
        assertSame(one, history.undo());
        assertFalse(history.canUndo());
    }

    @Test
    public void limit_comes_from_the_options() {
        GraphHistory history = new GraphHistory(empty, new Options.Engine().historyLimit(7));
        assertEquals(7, history.limit());
        assertEquals(Options.DEFAULT_HISTORY_LIMIT, new GraphHistory(empty).limit());
    }

    @Test
    public void successful_rules_are_recorded() {
        TransformationEngine engine = new TransformationEngine(new Options.Engine(), Identifiers.sequential());
        GraphHistory history = new GraphHistory(one);
        Result<ExistentialGraph, TransformationError> erased = history.apply(Erasure.of("a"), engine);
        assertTrue(erased.isOk());
        assertTrue(history.current().isEmpty());

        Result<ExistentialGraph, TransformationError> refused = history.apply(Erasure.of("ghost"), engine);
        assertTrue(refused.isError());
        assertEquals(1, history.undoDepth());
        assertSame(one, history.undo());
    }

    @Test
    public void empty_history_cannot_undo_or_redo() {
        GraphHistory history = new GraphHistory(empty);
        try {
            history.undo();
            fail();
        } catch (ArisbeException e) {
            assertEquals(ErrorMessage.History.NOTHING_TO_UNDO.code(), e.errorMessage().code());
        }
        try {
            history.redo();
            fail();
        } catch (ArisbeException e) {
            assertEquals(ErrorMessage.History.NOTHING_TO_REDO.code(), e.errorMessage().code());
        }
    }

    @Test
    public void limit_must_be_positive() {
        try {
            new GraphHistory(empty, 0);
            fail();
        } catch (ArisbeException e) {
            assertEquals(ErrorMessage.History.INVALID_HISTORY_LIMIT.code(), e.errorMessage().code());
        }
    }
}
