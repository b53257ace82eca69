package com.questrail.meshbridge.endpoint;

/**
 * Typed attribute value exchanged with the framework.
 */
public sealed interface AttributeValue
        permits AttributeValue.Bool, AttributeValue.Int16, AttributeValue.UInt16 {

    record Bool(boolean value) implements AttributeValue {
    }

    record Int16(short value) implements AttributeValue {
    }

    record UInt16(int value) implements AttributeValue {
        public UInt16 {
            if (value < 0 || value > 0xFFFF) {
                throw new IllegalArgumentException("UInt16 out of range: " + value);
            }
        }
    }
}
