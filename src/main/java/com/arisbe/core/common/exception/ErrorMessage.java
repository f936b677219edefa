/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.common.exception;

import java.util.HashMap;
import java.util.Map;

import static com.arisbe.core.common.exception.ErrorMessage.Internal.JAVA_ERROR;

public abstract class ErrorMessage {

    private static final Map<String, Map<Integer, ErrorMessage>> errors = new HashMap<>();
    private static int maxCodeNumber = 0;
    private static int maxCodeDigits = 0;
    private static volatile boolean loaded = false;

    private final String codePrefix;
    private final int codeNumber;
    private final String messagePrefix;
    private final String messageBody;
    private String code = null;

    private ErrorMessage(String codePrefix, int codeNumber, String messagePrefix, String messageBody) {
        this.codePrefix = codePrefix;
        this.codeNumber = codeNumber;
        this.messagePrefix = messagePrefix;
        this.messageBody = messageBody;

        synchronized (errors) {
            Map<Integer, ErrorMessage> prefixed = errors.computeIfAbsent(codePrefix, p -> new HashMap<>());
            assert !prefixed.containsKey(codeNumber);
            prefixed.put(codeNumber, this);
            maxCodeNumber = Math.max(codeNumber, maxCodeNumber);
            maxCodeDigits = String.valueOf(maxCodeNumber).length();
        }
    }

    public static void loadConstants() {
        for (Class<?> innerClass : ErrorMessage.class.getDeclaredClasses()) {
            try {
                Class.forName(innerClass.getName(), true, innerClass.getClassLoader());
            } catch (ClassNotFoundException e) {
                throw ArisbeException.of(JAVA_ERROR, e);
            }
        }
        loaded = true;
    }

    public String code() {
        if (code != null) return code;
        // padding depends on the largest code number of every family
        if (!loaded) loadConstants();
        StringBuilder zeros = new StringBuilder();
        for (int digits = String.valueOf(codeNumber).length(); digits < maxCodeDigits; digits++) {
            zeros.append("0");
        }
        code = codePrefix + zeros + codeNumber;
        return code;
    }

    public String message(Object... parameters) {
        return String.format(toString(), parameters);
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", code(), messagePrefix, messageBody);
    }

    public static class Internal extends ErrorMessage {
        public static final Internal ILLEGAL_STATE =
                new Internal(1, "Illegal internal state!");
        public static final Internal ILLEGAL_CAST =
                new Internal(2, "Illegal casting operation from '%s' to '%s'.");
        public static final Internal ILLEGAL_ARGUMENT =
                new Internal(3, "Illegal argument provided.");
        public static final Internal JAVA_ERROR =
                new Internal(4, "Encountered an error in the Java runtime: '%s'.");
        public static final Internal ILL_FORMED_RESULT =
                new Internal(5, "Rule '%s' produced an ill-formed graph: %s");

        private static final String codePrefix = "INT";
        private static final String messagePrefix = "Invalid Internal State";

        Internal(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Graph extends ErrorMessage {
        public static final Graph ELEMENT_NOT_FOUND =
                new Graph(1, "The element '%s' does not exist in the graph.");
        public static final Graph CONTEXT_NOT_FOUND =
                new Graph(2, "The context '%s' is neither the sheet of assertion nor a cut of the graph.");
        public static final Graph DUPLICATE_ELEMENT =
                new Graph(3, "The identifier '%s' is already used in the graph.");
        public static final Graph INVALID_RELATION_NAME =
                new Graph(4, "The edge '%s' must be given a non-blank relation name.");
        public static final Graph NOT_A_VERTEX =
                new Graph(5, "The element '%s' is not a vertex.");
        public static final Graph NOT_AN_EDGE =
                new Graph(6, "The element '%s' is not an edge.");
        public static final Graph CONSTANT_VERTEX_WITHOUT_LABEL =
                new Graph(7, "The constant vertex '%s' must carry a label.");
        public static final Graph SHEET_NOT_REMOVABLE =
                new Graph(8, "The sheet of assertion '%s' cannot be removed or relocated.");
        public static final Graph AREA_NOT_PARTITIONED =
                new Graph(9, "The element '%s' is placed in %s areas, but must be placed in exactly one.");
        public static final Graph DANGLING_AREA_ENTRY =
                new Graph(10, "The area of '%s' contains the unknown element '%s'.");
        public static final Graph DANGLING_INCIDENCE =
                new Graph(11, "The edge '%s' refers to the unknown vertex '%s'.");
        public static final Graph MISSING_RELATION =
                new Graph(12, "The edge '%s' lacks a relation name or an argument sequence.");
        public static final Graph CYCLIC_NESTING =
                new Graph(13, "The cut '%s' is enclosed by itself.");
        public static final Graph OVERLAPPING_IDENTIFIERS =
                new Graph(14, "The identifier '%s' is used by more than one kind of element.");
        public static final Graph NON_DOMINATING_VERTEX =
                new Graph(15, "The edge '%s' in context '%s' refers to the vertex '%s' placed in the non-dominating context '%s'.");
        public static final Graph VERTEX_IN_USE =
                new Graph(16, "The vertex '%s' cannot be removed while the edges '%s' refer to it.");
        public static final Graph PARTIAL_CUT_REMOVAL =
                new Graph(17, "The cut '%s' cannot be removed without the elements '%s' it encloses.");
        public static final Graph MOVE_INTO_ITSELF =
                new Graph(18, "The cut '%s' cannot be moved into the context '%s' it encloses.");

        private static final String codePrefix = "GRA";
        private static final String messagePrefix = "Invalid Graph Operation";

        Graph(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Subgraph extends ErrorMessage {
        public static final Subgraph SUBSET_VIOLATION =
                new Subgraph(1, "The subgraph claims elements that do not belong to the parent graph: '%s'.");
        public static final Subgraph ROOT_CONTEXT_INVALID =
                new Subgraph(2, "The root context '%s' of the subgraph is not a context of the parent graph outside the subgraph.");
        public static final Subgraph NU_RESTRICTION_MISMATCH =
                new Subgraph(3, "The argument sequences of the subgraph differ from those of the parent graph for edges '%s'.");
        public static final Subgraph AREA_MAPPING_MISMATCH =
                new Subgraph(4, "The area mapping of the subgraph differs from the parent graph for contexts '%s'.");
        public static final Subgraph CONTEXT_OUT_OF_SCOPE =
                new Subgraph(5, "The elements '%s' are placed outside the subgraph's root context and cuts.");
        public static final Subgraph EDGE_INCOMPLETE =
                new Subgraph(6, "The edges of the subgraph refer to vertices '%s' that are not part of it.");
        public static final Subgraph VERTEX_INCOMPLETE =
                new Subgraph(7, "The closed subgraph misses the edges '%s' incident to its vertices.");
        public static final Subgraph EMPTY_SEED =
                new Subgraph(8, "A minimal subgraph requires at least one seed element.");

        private static final String codePrefix = "SUB";
        private static final String messagePrefix = "Invalid Subgraph Definition";

        Subgraph(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Transformation extends ErrorMessage {
        public static final Transformation ELEMENT_NOT_FOUND =
                new Transformation(1, "The element '%s' does not exist in the graph.");
        public static final Transformation CONTEXT_NOT_FOUND =
                new Transformation(2, "The context '%s' does not exist in the graph.");
        public static final Transformation ERASURE_IN_NEGATIVE_CONTEXT =
                new Transformation(3, "Cannot erase '%s' from the negative context '%s'.");
        public static final Transformation ERASED_VERTEX_STILL_REFERENCED =
                new Transformation(4, "Cannot erase the vertex '%s' while the edges '%s' still refer to it.");
        public static final Transformation INSERTION_IN_POSITIVE_CONTEXT =
                new Transformation(5, "Cannot insert into the positive context '%s'.");
        public static final Transformation INSERTED_ARGUMENT_NOT_DOMINATING =
                new Transformation(6, "The vertex '%s' is not placed in a context that dominates the target context '%s'.");
        public static final Transformation WRONG_NESTING_DIRECTION =
                new Transformation(7, "Cannot iterate from context '%s' into the shallower context '%s'.");
        public static final Transformation INCOMPARABLE_CONTEXTS =
                new Transformation(8, "The contexts '%s' and '%s' are not nested within one another.");
        public static final Transformation TARGET_INSIDE_SUBGRAPH =
                new Transformation(9, "The target context '%s' is part of the subgraph being copied.");
        public static final Transformation SHARED_VERTEX_INVALID =
                new Transformation(10, "The vertex '%s' cannot be shared: it must belong to the subgraph and lie directly in its root context '%s'.");
        public static final Transformation NO_DOMINATING_COPY =
                new Transformation(11, "No copy of the subgraph rooted at '%s' exists in a context that dominates it.");
        public static final Transformation NOT_STRUCTURALLY_IDENTICAL =
                new Transformation(12, "The subgraphs rooted at '%s' and '%s' are not structurally identical.");
        public static final Transformation OVERLAPPING_SUBGRAPHS =
                new Transformation(13, "The base and the candidate subgraphs share the elements '%s'.");
        public static final Transformation REMOVED_VERTEX_STILL_REFERENCED =
                new Transformation(14, "Removing the vertex '%s' would leave the edges '%s' without an argument.");
        public static final Transformation NOT_A_CUT =
                new Transformation(15, "The element '%s' is not a cut.");
        public static final Transformation NOT_A_DOUBLE_CUT =
                new Transformation(16, "The cut '%s' does not directly enclose exactly one cut.");
        public static final Transformation ELEMENTS_BETWEEN_CUTS =
                new Transformation(17, "The elements '%s' lie between the cut '%s' and its inner cut.");
        public static final Transformation VERTEX_NOT_ISOLATED =
                new Transformation(18, "The vertex '%s' is not isolated: it is referenced by the edges '%s'.");
        public static final Transformation NOT_A_VERTEX =
                new Transformation(19, "The element '%s' is not a vertex.");
        public static final Transformation INVALID_SUBGRAPH =
                new Transformation(20, "The subgraph is invalid: %s");
        public static final Transformation INVALID_ELEMENT_SHAPE =
                new Transformation(21, "The element to insert is malformed: %s");

        private static final String codePrefix = "TRF";
        private static final String messagePrefix = "Illegitimate Transformation";

        Transformation(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class History extends ErrorMessage {
        public static final History NOTHING_TO_UNDO =
                new History(1, "There is no earlier graph to return to.");
        public static final History NOTHING_TO_REDO =
                new History(2, "There is no undone graph to restore.");
        public static final History INVALID_HISTORY_LIMIT =
                new History(3, "The history limit must be positive, but was '%s'.");

        private static final String codePrefix = "HIS";
        private static final String messagePrefix = "Invalid History Operation";

        History(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }
}
