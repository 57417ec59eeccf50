package io.etadata.core.attributes;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class AttributeTest {

    @Test
    void categoricalKeepsStringForm() {
        Attribute attr = Attribute.categorical("color", 42);
        assertEquals(AttributeType.CATEGORICAL, attr.type());
        assertEquals("42", attr.value());
        assertEquals("42", attr.categoricalValue());
        assertFalse(attr.hasConfidence());
    }

    @Test
    void numericParsesNumbersAndStrings() {
        assertEquals(12.5, Attribute.numeric("speed", 12.5).numericValue());
        assertEquals(3.0, Attribute.numeric("speed", 3).numericValue());
        assertEquals(-0.25, Attribute.numeric("speed", " -0.25 ").numericValue());
        assertEquals(1.0, Attribute.numeric("speed", true).numericValue());
        assertInstanceOf(Double.class, Attribute.numeric("speed", 7L).value());
    }

    @Test
    void numericRejectsUnparseableValues() {
        ValueParseException e = assertThrows(ValueParseException.class,
            () -> Attribute.numeric("speed", "fast"));
        assertEquals(AttributeType.NUMERIC, e.getAttributeType());
        assertThrows(ValueParseException.class, () -> Attribute.numeric("speed", null));
    }

    @Test
    void numericRejectsNaN() {
        assertThrows(ValueParseException.class, () -> Attribute.numeric("speed", "NaN"));
        assertThrows(ValueParseException.class, () -> Attribute.numeric("speed", Double.NaN));
        assertThrows(ValueParseException.class, () -> Attribute.numeric("speed", Float.NaN, 0.5));
        assertEquals(Double.POSITIVE_INFINITY, Attribute.numeric("speed", "Infinity").numericValue());
    }

    @Test
    void booleanCoercion() {
        assertTrue(Attribute.bool("flag", true).booleanValue());
        assertTrue(Attribute.bool("flag", "YES").booleanValue());
        assertTrue(Attribute.bool("flag", "1").booleanValue());
        assertTrue(Attribute.bool("flag", 2).booleanValue());
        assertFalse(Attribute.bool("flag", "no").booleanValue());
        assertFalse(Attribute.bool("flag", 0).booleanValue());
        assertFalse(Attribute.bool("flag", "False").booleanValue());
        assertThrows(ValueParseException.class, () -> Attribute.bool("flag", "maybe"));
    }

    @Test
    void typedAccessorsRejectOtherTypes() {
        Attribute attr = Attribute.numeric("speed", 1.0);
        assertThrows(IllegalStateException.class, attr::categoricalValue);
        assertThrows(IllegalStateException.class, attr::booleanValue);
    }

    @Test
    void confidenceIsOptional() {
        Attribute attr = Attribute.categorical("color", "red", 0.75);
        assertTrue(attr.hasConfidence());
        assertEquals(0.75, attr.confidence().orElseThrow());

        Attribute withoutConfidence = attr.withConfidence(null);
        assertFalse(withoutConfidence.hasConfidence());
        assertNotEquals(attr, withoutConfidence);
    }

    @Test
    void withValueReparses() {
        Attribute attr = Attribute.numeric("speed", 1.0, 0.5);
        Attribute changed = attr.withValue("2.5");
        assertEquals(2.5, changed.numericValue());
        assertEquals(0.5, changed.confidence().orElseThrow());
        assertEquals(1.0, attr.numericValue());
    }

    @Test
    void equalityCoversAllParts() {
        assertEquals(Attribute.numeric("speed", 3), Attribute.numeric("speed", "3.0"));
        assertEquals(Attribute.numeric("speed", 3).hashCode(), Attribute.numeric("speed", 3.0).hashCode());
        assertNotEquals(Attribute.numeric("speed", 3), Attribute.numeric("pace", 3));
        assertNotEquals(Attribute.categorical("x", "1"), Attribute.numeric("x", 1));
    }

    @Test
    void discriminatorsAreLowercase() {
        assertEquals("categorical", AttributeType.CATEGORICAL.discriminator());
        assertEquals("numeric", AttributeType.NUMERIC.discriminator());
        assertEquals("boolean", AttributeType.BOOLEAN.discriminator());
    }
}
