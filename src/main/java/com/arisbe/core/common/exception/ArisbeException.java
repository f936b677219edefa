/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.common.exception;

import java.util.Objects;

public class ArisbeException extends RuntimeException {

    private final ErrorMessage error;

    protected ArisbeException(ErrorMessage error, Throwable cause) {
        super(error.message(cause), cause);
        assert !getMessage().contains("%s");
        this.error = error;
    }

    protected ArisbeException(ErrorMessage error, Object... parameters) {
        super(error.message(parameters));
        assert !getMessage().contains("%s");
        this.error = error;
    }

    public static ArisbeException of(ErrorMessage errorMessage, Throwable cause) {
        return new ArisbeException(errorMessage, cause);
    }

    public static ArisbeException of(ErrorMessage errorMessage, Object... parameters) {
        return new ArisbeException(errorMessage, parameters);
    }

    public ErrorMessage errorMessage() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ArisbeException that = (ArisbeException) o;
        return error.equals(that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(error);
    }
}
