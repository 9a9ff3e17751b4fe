package com.spirecomm.bridge.protocol;

import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class HealthReportTest {

    @Test
    void testDecodesBridgeHealth() throws Exception {
        HealthReport report = HealthReport.decode("{\"status\": \"ready\", \"has_state\": true,"
                + " \"last_update\": 1712345678.5, \"ready_sent\": true, \"ready_acknowledged\": false}");

        assertTrue(report.isReady());
        assertTrue(report.hasState());
        assertEquals(OptionalDouble.of(1712345678.5), report.lastUpdate());
        assertTrue(report.readySent());
        assertFalse(report.readyAcknowledged());
        assertFalse(report.inGame());
    }

    @Test
    void testMissingFieldsDefault() throws Exception {
        HealthReport report = HealthReport.decode("{\"last_update\": null}");

        assertFalse(report.isReady());
        assertEquals("", report.status());
        assertTrue(report.lastUpdate().isEmpty());
        assertFalse(report.hasState());
    }

    @Test
    void testOtherStatusIsNotReady() throws Exception {
        assertFalse(HealthReport.decode("{\"status\": \"READY\"}").isReady());
        assertFalse(HealthReport.decode("{\"status\": true}").isReady());
    }

    @Test
    void testRejectsMalformedBody() {
        BridgeProtocolException e = assertThrows(BridgeProtocolException.class,
                () -> HealthReport.decode("{\"status\": "));
        assertTrue(e.getMessage().startsWith("Failed to parse health response"));
        assertThrows(BridgeProtocolException.class, () -> HealthReport.decode("\"ready\""));
    }
}
