package com.rex.gate;

import org.junit.Test;

import java.net.BindException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class BindRetryTest {

    @Test
    public void testRetryThenSucceed() {
        AtomicInteger calls = new AtomicInteger();
        String result = BindRetry.bind("test", 3, 1, () -> {
            if (calls.incrementAndGet() < 3) {
                throw new BindException("Address already in use");
            }
            return "bound";
        });
        assertEquals("bound", result);
        assertEquals(3, calls.get());
    }

    @Test
    public void testExhausted() {
        AtomicInteger calls = new AtomicInteger();
        try {
            BindRetry.bind("test", 2, 1, () -> {
                calls.incrementAndGet();
                throw new BindException("Address already in use");
            });
            fail("Should give up");
        } catch (GateStartException ex) {
            assertTrue(ex.getCause() instanceof BindException);
        }
        assertEquals(2, calls.get());
    }
}
