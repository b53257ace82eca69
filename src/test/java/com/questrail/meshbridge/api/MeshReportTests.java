package com.questrail.meshbridge.api;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MeshReportTests
{
    @Test
    void capabilitiesFollowThePresentValues() {
        MeshReport report = MeshReport.builder("swift-falcon-a3f2").temperature(21.5f).relayState(false).build();

        assertEquals(EnumSet.of(Capability.TEMPERATURE, Capability.PLUG), report.capabilities());
        assertEquals(Optional.of(21.5f), report.temperature());
        assertEquals(Optional.empty(), report.humidity());
        assertEquals(Optional.of(false), report.relayState());
        assertFalse(report.isEmpty());
    }

    @Test
    void reportWithoutValuesIsEmpty() {
        MeshReport report = MeshReport.builder("swift-falcon-a3f2").build();

        assertTrue(report.isEmpty());
        assertTrue(report.capabilities().isEmpty());
    }

    @Test
    void deviceIdIsKeptVerbatim() {
        assertEquals("not a valid id", MeshReport.builder("not a valid id").build().deviceId());
        assertThrows(NullPointerException.class, () -> MeshReport.builder(null));
    }

    @Test
    void nanSensorValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> MeshReport.builder("swift-falcon-a3f2").temperature(Float.NaN));
        assertThrows(IllegalArgumentException.class,
            () -> MeshReport.builder("swift-falcon-a3f2").humidity(Float.NaN));
    }

    @Test
    void equalReportsAreEqual() {
        MeshReport a = MeshReport.builder("swift-falcon-a3f2").humidity(40f).build();
        MeshReport b = MeshReport.builder("swift-falcon-a3f2").humidity(40f).build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, MeshReport.builder("swift-falcon-a3f2").humidity(41f).build());
    }
}
