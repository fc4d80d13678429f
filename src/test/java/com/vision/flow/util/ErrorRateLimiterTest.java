package com.vision.flow.util;

import org.apache.logging.log4j.LogManager;
import org.junit.Test;

import static org.junit.Assert.*;

public class ErrorRateLimiterTest {

    @Test
    public void testThrottlesWithinInterval() throws Exception {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(ErrorRateLimiterTest.class), 100);

        assertTrue(limiter.warn("first"));
        assertFalse(limiter.warn("second"));
        assertFalse(limiter.log("third", new IllegalStateException("x")));
        assertEquals(2, limiter.suppressed());

        Thread.sleep(150);
        assertTrue(limiter.warn("after interval"));
        assertEquals(0, limiter.suppressed());
    }
}
