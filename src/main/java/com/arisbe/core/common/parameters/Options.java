/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.common.parameters;

import com.arisbe.core.common.config.SystemProperty;
import com.arisbe.core.common.exception.ArisbeException;

import static com.arisbe.core.common.config.SystemProperty.CHECK_INVARIANTS;
import static com.arisbe.core.common.config.SystemProperty.HISTORY_LIMIT;
import static com.arisbe.core.common.config.SystemProperty.TRACE_TRANSFORMATIONS;
import static com.arisbe.core.common.exception.ErrorMessage.History.INVALID_HISTORY_LIMIT;
import static com.arisbe.core.common.exception.ErrorMessage.Internal.ILLEGAL_ARGUMENT;

public abstract class Options<PARENT extends Options<?, ?>, SELF extends Options<?, ?>> {

    public static final boolean DEFAULT_CHECK_INVARIANTS = true;
    public static final boolean DEFAULT_TRACE_TRANSFORMATIONS = false;
    public static final int DEFAULT_HISTORY_LIMIT = 100;

    private PARENT parent;
    private Boolean checkInvariants = null;
    private Boolean traceTransformations = null;
    private Integer historyLimit = null;

    abstract SELF getThis();

    public SELF parent(PARENT parent) {
        this.parent = parent;
        return getThis();
    }

    public boolean checkInvariants() {
        if (checkInvariants != null) return checkInvariants;
        else if (parent != null) return parent.checkInvariants();
        else return DEFAULT_CHECK_INVARIANTS;
    }

    public SELF checkInvariants(boolean checkInvariants) {
        this.checkInvariants = checkInvariants;
        return getThis();
    }

    public boolean traceTransformations() {
        if (traceTransformations != null) return traceTransformations;
        else if (parent != null) return parent.traceTransformations();
        else return DEFAULT_TRACE_TRANSFORMATIONS;
    }

    public SELF traceTransformations(boolean traceTransformations) {
        this.traceTransformations = traceTransformations;
        return getThis();
    }

    public int historyLimit() {
        if (historyLimit != null) return historyLimit;
        else if (parent != null) return parent.historyLimit();
        else return DEFAULT_HISTORY_LIMIT;
    }

    public SELF historyLimit(int historyLimit) {
        if (historyLimit <= 0) throw ArisbeException.of(INVALID_HISTORY_LIMIT, historyLimit);
        this.historyLimit = historyLimit;
        return getThis();
    }

    public static class Engine extends Options<Engine, Engine> {

        /**
         * Engine options seeded from the {@link SystemProperty} overrides that are set.
         */
        public static Engine fromSystemProperties() {
            Engine options = new Engine();
            if (CHECK_INVARIANTS.value() != null) {
                options.checkInvariants(Boolean.parseBoolean(CHECK_INVARIANTS.value().trim()));
            }
            if (TRACE_TRANSFORMATIONS.value() != null) {
                options.traceTransformations(Boolean.parseBoolean(TRACE_TRANSFORMATIONS.value().trim()));
            }
            if (HISTORY_LIMIT.value() != null) {
                try {
                    options.historyLimit(Integer.parseInt(HISTORY_LIMIT.value().trim()));
                } catch (NumberFormatException e) {
                    throw ArisbeException.of(INVALID_HISTORY_LIMIT, HISTORY_LIMIT.value());
                }
            }
            return options;
        }

        @Override
        Engine getThis() {
            return this;
        }

        @Override
        public Engine parent(Engine parent) {
            throw ArisbeException.of(ILLEGAL_ARGUMENT);
        }
    }

    public static class Application extends Options<Engine, Application> {

        @Override
        Application getThis() {
            return this;
        }
    }
}
