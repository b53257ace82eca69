package com.questrail.meshbridge.api;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LastKnownValuesTests
{
    private static MeshReport.Builder report() {
        return MeshReport.builder("swift-falcon-a3f2");
    }

    @Test
    void valuesStartAbsent() {
        LastKnownValues values = LastKnownValues.empty();

        assertEquals(Optional.empty(), values.temperature());
        assertEquals(Optional.empty(), values.humidity());
        assertEquals(Optional.empty(), values.relayState());
    }

    @Test
    void presentValuesOverwriteAndAbsentValuesAreSticky() {
        LastKnownValues values = LastKnownValues.empty()
            .merge(report().temperature(20f).relayState(true).build())
            .merge(report().temperature(19f).humidity(50f).build())
            .merge(report().build());

        assertEquals(Optional.of(19f), values.temperature());
        assertEquals(Optional.of(50f), values.humidity());
        assertEquals(Optional.of(true), values.relayState());
    }

    @Test
    void mergeDoesNotMutateTheOriginal() {
        LastKnownValues before = LastKnownValues.empty();

        LastKnownValues after = before.merge(report().relayState(false).build());

        assertEquals(LastKnownValues.empty(), before);
        assertNotEquals(before, after);
    }

    @Test
    void rebuildFromPersistedProjection() {
        LastKnownValues values = LastKnownValues.of(Optional.of(21.5f), Optional.empty(), Optional.of(false));

        assertEquals(Optional.of(21.5f), values.temperature());
        assertEquals(Optional.empty(), values.humidity());
        assertEquals(Optional.of(false), values.relayState());
        assertEquals(values, LastKnownValues.empty().merge(report().temperature(21.5f).relayState(false).build()));
    }
}
