/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.arisbe.core.common.util;

import com.arisbe.core.common.exception.ArisbeException;
import com.arisbe.core.common.exception.ErrorMessage;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ResultTest {

    @Test
    public void ok_maps_and_chains() {
        Result<Integer, String> ok = Result.ok(2);
        assertTrue(ok.isOk());
        assertEquals(Integer.valueOf(6), ok.map(i -> i * 3).get());
        assertEquals("odd", ok.flatMap(i -> Result.<Integer, String>error("odd")).error());
        assertFalse(ok.failure().isPresent());
        assertEquals(Integer.valueOf(2), ok.orElseThrow(IllegalStateException::new));
    }

    @Test
    public void error_short_circuits() {
        Result<Integer, String> error = Result.error("bad");
        assertTrue(error.isError());
        assertEquals("bad", error.map(i -> i * 3).error());
        assertFalse(error.value().isPresent());

        List<String> seen = new ArrayList<>();
        error.ifOk(i -> seen.add("ok")).ifError(seen::add);
        assertEquals(List.of("bad"), seen);
        try {
            error.orElseThrow(IllegalStateException::new);
            fail();
        } catch (IllegalStateException e) {
            assertEquals("bad", e.getMessage());
        }
    }

    @Test
    public void wrong_side_access_is_an_illegal_state() {
        try {
            Result.<Integer, String>error("bad").get();
            fail();
        } catch (ArisbeException e) {
            assertEquals(ErrorMessage.Internal.ILLEGAL_STATE.code(), e.errorMessage().code());
        }
        try {
            Result.<Integer, String>ok(1).error();
            fail();
        } catch (ArisbeException e) {
            assertEquals(ErrorMessage.Internal.ILLEGAL_STATE.code(), e.errorMessage().code());
        }
    }

    @Test
    public void equality_follows_the_present_side() {
        assertEquals(Result.ok("a"), Result.ok("a"));
        assertFalse(Result.ok("a").equals(Result.error("a")));
    }
}
