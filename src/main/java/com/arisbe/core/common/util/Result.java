/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.common.util;

import com.arisbe.core.common.exception.ArisbeException;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

import static com.arisbe.core.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;

/**
 * The outcome of an operation that either produced a value or was rejected with an error.
 * Exactly one of the two sides is present.
 */
public abstract class Result<VALUE, ERROR> {

    private Result() {}

    public static <VALUE, ERROR> Result<VALUE, ERROR> ok(VALUE value) {
        return new Ok<>(value);
    }

    public static <VALUE, ERROR> Result<VALUE, ERROR> error(ERROR error) {
        return new Error<>(error);
    }

    public abstract boolean isOk();

    public boolean isError() {
        return !isOk();
    }

    public VALUE get() {
        throw ArisbeException.of(ILLEGAL_STATE);
    }

    public ERROR error() {
        throw ArisbeException.of(ILLEGAL_STATE);
    }

    public abstract Optional<VALUE> value();

    public abstract Optional<ERROR> failure();

    public abstract <U> Result<U, ERROR> map(Function<VALUE, U> function);

    public abstract <U> Result<U, ERROR> flatMap(Function<VALUE, Result<U, ERROR>> function);

    public abstract <X extends RuntimeException> VALUE orElseThrow(Function<ERROR, X> exceptionFn);

    public abstract Result<VALUE, ERROR> ifOk(Consumer<VALUE> consumer);

    public abstract Result<VALUE, ERROR> ifError(Consumer<ERROR> consumer);

    private static class Ok<VALUE, ERROR> extends Result<VALUE, ERROR> {

        private final VALUE value;

        private Ok(VALUE value) {
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public VALUE get() {
            return value;
        }

        @Override
        public Optional<VALUE> value() {
            return Optional.of(value);
        }

        @Override
        public Optional<ERROR> failure() {
            return Optional.empty();
        }

        @Override
        public <U> Result<U, ERROR> map(Function<VALUE, U> function) {
            return new Ok<>(function.apply(value));
        }

        @Override
        public <U> Result<U, ERROR> flatMap(Function<VALUE, Result<U, ERROR>> function) {
            return function.apply(value);
        }

        @Override
        public <X extends RuntimeException> VALUE orElseThrow(Function<ERROR, X> exceptionFn) {
            return value;
        }

        @Override
        public Result<VALUE, ERROR> ifOk(Consumer<VALUE> consumer) {
            consumer.accept(value);
            return this;
        }

        @Override
        public Result<VALUE, ERROR> ifError(Consumer<ERROR> consumer) {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return value.equals(((Ok<?, ?>) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return "Ok[" + value + "]";
        }
    }

    private static class Error<VALUE, ERROR> extends Result<VALUE, ERROR> {

        private final ERROR error;

        private Error(ERROR error) {
            this.error = Objects.requireNonNull(error);
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public ERROR error() {
            return error;
        }

        @Override
        public Optional<VALUE> value() {
            return Optional.empty();
        }

        @Override
        public Optional<ERROR> failure() {
            return Optional.of(error);
        }

        @Override
        public <U> Result<U, ERROR> map(Function<VALUE, U> function) {
            return new Error<>(error);
        }

        @Override
        public <U> Result<U, ERROR> flatMap(Function<VALUE, Result<U, ERROR>> function) {
            return new Error<>(error);
        }

        @Override
        public <X extends RuntimeException> VALUE orElseThrow(Function<ERROR, X> exceptionFn) {
            throw exceptionFn.apply(error);
        }

        @Override
        public Result<VALUE, ERROR> ifOk(Consumer<VALUE> consumer) {
            return this;
        }

        @Override
        public Result<VALUE, ERROR> ifError(Consumer<ERROR> consumer) {
            consumer.accept(error);
            return this;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return error.equals(((Error<?, ?>) o).error);
        }

        @Override
        public int hashCode() {
            return error.hashCode();
        }

        @Override
        public String toString() {
            return "Error[" + error + "]";
        }
    }
}
