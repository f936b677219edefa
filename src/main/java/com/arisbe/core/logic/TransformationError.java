/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.logic;

import com.arisbe.core.common.exception.ArisbeException;
import com.arisbe.core.common.exception.ErrorMessage;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * The reason a rule refused to transform a graph.
 */
public class TransformationError {

    private final Rule.Kind rule;
    @Nullable
    private final String element;
    private final ErrorMessage error;
    private final Object[] parameters;
    private final String message;

    private TransformationError(Rule.Kind rule, @Nullable String element, ErrorMessage error, Object[] parameters) {
        this.rule = rule;
        this.element = element;
        this.error = error;
        this.parameters = parameters;
        this.message = error.message(parameters);
    }

    public static TransformationError of(Rule.Kind rule, ErrorMessage error, @Nullable String element,
                                         Object... parameters) {
        return new TransformationError(rule, element, error, parameters.clone());
    }

    public Rule.Kind rule() {
        return rule;
    }

    /**
     * The element or context the refusal is about, when there is a single one.
     */
    public Optional<String> element() {
        return Optional.ofNullable(element);
    }

    public ErrorMessage error() {
        return error;
    }

    public String code() {
        return error.code();
    }

    public String message() {
        return message;
    }

    public ArisbeException toException() {
        return ArisbeException.of(error, parameters.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransformationError that = (TransformationError) o;
        return rule == that.rule && Objects.equals(element, that.element) && error.equals(that.error) &&
                Arrays.equals(parameters, that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rule, element, error, Arrays.hashCode(parameters));
    }

    @Override
    public String toString() {
        return rule + ": " + message;
    }
}
