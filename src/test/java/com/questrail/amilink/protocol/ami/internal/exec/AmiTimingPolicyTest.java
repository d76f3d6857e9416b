package com.questrail.amilink.protocol.ami.internal.exec;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AmiTimingPolicyTest {

    @Test
    void defaultsKeepAliveEveryMinute() {
        AmiTimingPolicy policy = AmiTimingPolicy.defaults();

        assertEquals(Duration.ofSeconds(10), policy.actionTimeout());
        assertEquals(Duration.ofSeconds(2), policy.reconnectBackoff());
        assertEquals(Duration.ofSeconds(60), policy.pingInterval());
        assertTrue(policy.keepAliveEnabled());
    }

    @Test
    void zeroPingIntervalDisablesKeepAlive() {
        AmiTimingPolicy policy = AmiTimingPolicy.withActionTimeout(Duration.ofSeconds(3));

        assertFalse(policy.keepAliveEnabled());
        assertEquals(Duration.ZERO, policy.reconnectBackoff());
    }

    @Test
    void actionTimeoutMustBePositive() {
        assertThrows(IllegalArgumentException.class,
            () -> new AmiTimingPolicy(Duration.ZERO, Duration.ZERO, Duration.ZERO));
    }

    @Test
    void negativeDurationsAreRejected() {
        Duration one = Duration.ofSeconds(1);
        assertThrows(IllegalArgumentException.class, () -> new AmiTimingPolicy(one, Duration.ofSeconds(-1), one));
        assertThrows(IllegalArgumentException.class, () -> new AmiTimingPolicy(one, one, Duration.ofSeconds(-1)));
        assertThrows(NullPointerException.class, () -> new AmiTimingPolicy(null, one, one));
    }
}
