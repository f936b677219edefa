/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.common.config;

import javax.annotation.Nullable;

/**
 * System properties that override the engine's default options
 */
public enum SystemProperty {

    CHECK_INVARIANTS("arisbe.check.invariants"),
    TRACE_TRANSFORMATIONS("arisbe.trace.transformations"),
    HISTORY_LIMIT("arisbe.history.limit");

    private final String key;

    SystemProperty(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * @return the value of the system property, or null if it is not set
     */
    @Nullable
    public String value() {
        return System.getProperty(key);
    }

    public void set(String value) {
        System.setProperty(key, value);
    }

    public void clear() {
        System.clearProperty(key);
    }
}
