package com.questrail.meshbridge.api;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DeviceIdTests
{
    @Test
    void suffixIsTheTrailingHexGroupInLowerCase() {
        DeviceId id = DeviceId.of("Swift-Falcon-A3F2");

        assertEquals("Swift-Falcon-A3F2", id.value());
        assertEquals("a3f2", id.suffix());
        assertEquals("Swift-Falcon-A3F2", id.toString());
    }

    @Test
    void equalityIsOnTheFullIdentifier() {
        assertEquals(DeviceId.of("swift-falcon-a3f2"), DeviceId.of("swift-falcon-a3f2"));
        assertEquals(DeviceId.of("swift-falcon-a3f2").hashCode(), DeviceId.of("swift-falcon-a3f2").hashCode());
        assertNotEquals(DeviceId.of("swift-falcon-a3f2"), DeviceId.of("lazy-otter-a3f2"));
    }

    @Test
    void identifiersWithoutAValidSuffixAreRejected() {
        assertEquals(Optional.empty(), DeviceId.tryParse(null, 4));
        assertEquals(Optional.empty(), DeviceId.tryParse("", 4));
        assertEquals(Optional.empty(), DeviceId.tryParse("falcon", 4));
        assertEquals(Optional.empty(), DeviceId.tryParse("swift-falcon-", 4));
        assertEquals(Optional.empty(), DeviceId.tryParse("swift-falcon-a3f", 4));
        assertEquals(Optional.empty(), DeviceId.tryParse("swift-falcon-a3f2c", 4));
        assertEquals(Optional.empty(), DeviceId.tryParse("swift-falcon-g3f2", 4));
        assertThrows(IllegalArgumentException.class, () -> DeviceId.of("swift-falcon"));
    }

    @Test
    void suffixLengthIsConfigurable() {
        assertEquals("a3f2c1", DeviceId.of("swift-falcon-a3f2c1", 6).suffix());
        assertTrue(DeviceId.tryParse("swift-falcon-a3f2", 6).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> DeviceId.tryParse("swift-falcon-a3f2", 0));
    }
}
