package com.spirecomm.bridge.client.session;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FailureTrackerTest {

    private ConnectionStatusMachine machine;
    private FailureTracker tracker;

    @BeforeEach
    void setUp() {
        machine = new ConnectionStatusMachine();
        machine.onProbeSucceeded();
        machine.onStateAvailable();
        tracker = new FailureTracker(3, machine);
    }

    @Test
    void testStartsClean() {
        assertEquals(0, tracker.getConsecutiveFailures());
        assertEquals("", tracker.getLastError());
        assertEquals(3, tracker.getMaxConsecutiveFailures());
    }

    @Test
    void testThresholdDisconnects() {
        tracker.recordFailure("one");
        tracker.recordFailure("two");
        assertEquals(ConnectionStatus.READY, machine.getStatus());

        tracker.recordFailure("three");
        assertEquals(ConnectionStatus.DISCONNECTED, machine.getStatus());
        assertEquals(3, tracker.getConsecutiveFailures());
        assertEquals("three", tracker.getLastError());
    }

    @Test
    void testSuccessResetsCountButKeepsLastError() {
        tracker.recordFailure("one");
        tracker.recordFailure("two");
        tracker.recordSuccess();

        assertEquals(0, tracker.getConsecutiveFailures());
        assertEquals("two", tracker.getLastError());

        tracker.recordFailure("three");
        tracker.recordFailure("four");
        assertEquals(ConnectionStatus.READY, machine.getStatus());
    }

    @Test
    void testSuccessDoesNotRaiseStatus() {
        machine.disconnect();
        tracker.recordSuccess();
        assertEquals(ConnectionStatus.DISCONNECTED, machine.getStatus());
    }

    @Test
    void testCountKeepsGrowingPastThreshold() {
        for (int i = 0; i < 5; i++) {
            tracker.recordFailure("failure " + i);
        }
        assertEquals(5, tracker.getConsecutiveFailures());
        assertEquals(ConnectionStatus.DISCONNECTED, machine.getStatus());
    }

    @Test
    void testConditionDoesNotCount() {
        tracker.recordCondition("timed out");
        assertEquals(0, tracker.getConsecutiveFailures());
        assertEquals("timed out", tracker.getLastError());
    }

    @Test
    void testThresholdMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new FailureTracker(0, machine));
    }
}
