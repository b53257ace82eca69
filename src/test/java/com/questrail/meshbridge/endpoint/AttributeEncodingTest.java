package com.questrail.meshbridge.endpoint;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AttributeEncodingTest
{
    @Test
    void temperatureIsHundredthsOfADegree() {
        assertEquals(2150, AttributeEncoding.temperature(21.5f).value());
        assertEquals(-1025, AttributeEncoding.temperature(-10.25f).value());
        assertEquals(0, AttributeEncoding.temperature(0f).value());
    }

    @Test
    void temperatureRoundsToNearest() {
        assertEquals(2234, AttributeEncoding.temperature(22.336f).value());
        assertEquals(2233, AttributeEncoding.temperature(22.334f).value());
    }

    @Test
    void temperatureClampsToSigned16Bit() {
        assertEquals(Short.MAX_VALUE, AttributeEncoding.temperature(400f).value());
        assertEquals(Short.MIN_VALUE, AttributeEncoding.temperature(-400f).value());
    }

    @Test
    void humidityIsHundredthsOfAPercentWithinZeroToOneHundred() {
        assertEquals(4550, AttributeEncoding.humidity(45.5f).value());
        assertEquals(0, AttributeEncoding.humidity(-3f).value());
        assertEquals(10_000, AttributeEncoding.humidity(104f).value());
    }

    @Test
    void relayIsBoolean() {
        assertTrue(AttributeEncoding.relay(true).value());
        assertFalse(AttributeEncoding.relay(false).value());
    }
}
