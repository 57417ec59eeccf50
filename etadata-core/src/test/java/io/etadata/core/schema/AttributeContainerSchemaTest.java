package io.etadata.core.schema;

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

import io.etadata.core.attributes.Attribute;
import io.etadata.core.attributes.AttributeType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class AttributeContainerSchemaTest {

    private static List<Attribute> sample() {
        return List.of(
            Attribute.categorical("color", "red"),
            Attribute.numeric("speed", 3.0),
            Attribute.categorical("color", "blue"),
            Attribute.numeric("speed", 7.0),
            Attribute.bool("moving", true));
    }

    @Test
    void activeSchemaDescribesAttributes() {
        AttributeContainerSchema schema = AttributeContainerSchema.buildActiveSchema(sample());

        assertThat(schema.names()).containsExactly("color", "speed", "moving");
        assertEquals(AttributeType.NUMERIC, schema.getAttributeType("speed"));
        assertThat(schema.getAttributeSchema("color").getCategories()).containsExactly("red", "blue");
        assertEquals(new NumericRange(3.0, 7.0), schema.getAttributeSchema("speed").getRange().orElseThrow());
        for (Attribute attr : sample()) {
            assertTrue(schema.isValid(attr));
        }
    }

    @Test
    void validateAttributeReportsEachViolation() {
        AttributeContainerSchema schema = AttributeContainerSchema.buildActiveSchema(sample());

        assertThrows(NameNotFoundException.class,
            () -> schema.validateAttribute(Attribute.categorical("shape", "round")));
        assertThrows(TypeMismatchException.class,
            () -> schema.validateAttribute(Attribute.categorical("speed", "fast")));
        assertThrows(ValueNotAllowedException.class,
            () -> schema.validateAttribute(Attribute.categorical("color", "green")));
        assertThrows(ValueNotAllowedException.class,
            () -> schema.validateAttribute(Attribute.numeric("speed", 7.5)));
        assertFalse(schema.isValid(Attribute.numeric("speed", 2.0)));
        assertThrows(NameNotFoundException.class, () -> schema.getAttributeType("shape"));
    }

    @Test
    void schemaErrorsShareOneBase() {
        AttributeContainerSchema schema = new AttributeContainerSchema();
        AttributeSchemaException e = assertThrows(AttributeSchemaException.class,
            () -> schema.validateAttribute(Attribute.bool("x", true)));
        assertInstanceOf(NameNotFoundException.class, e);
    }

    @Test
    void addAttributesIsAllOrNothing() {
        AttributeContainerSchema schema = new AttributeContainerSchema();
        schema.addAttribute(Attribute.numeric("speed", 1.0));

        List<Attribute> conflicting = List.of(
            Attribute.categorical("color", "red"),
            Attribute.categorical("speed", "fast"));
        assertThrows(TypeMismatchException.class, () -> schema.addAttributes(conflicting));
        assertThat(schema.names()).containsExactly("speed");

        List<Attribute> selfConflicting = List.of(
            Attribute.bool("moving", true),
            Attribute.numeric("moving", 1.0));
        assertThrows(TypeMismatchException.class,
            () -> AttributeContainerSchema.buildActiveSchema(selfConflicting));
    }

    @Test
    void mergeCopiesNewEntriesAndMergesShared() {
        AttributeContainerSchema left = AttributeContainerSchema.buildActiveSchema(List.of(
            Attribute.categorical("color", "red"),
            Attribute.numeric("speed", 1.0)));
        AttributeContainerSchema right = AttributeContainerSchema.buildActiveSchema(List.of(
            Attribute.categorical("color", "blue"),
            Attribute.bool("moving", false)));

        left.mergeSchema(right);

        assertThat(left.names()).containsExactly("color", "speed", "moving");
        assertThat(left.getAttributeSchema("color").getCategories()).containsExactly("red", "blue");
        assertNotSame(right.getAttributeSchema("moving"), left.getAttributeSchema("moving"));
        assertThat(right.getAttributeSchema("color").getCategories()).containsExactly("blue");
    }

    @Test
    void mergeWithTypeConflictChangesNothing() {
        AttributeContainerSchema left = AttributeContainerSchema.buildActiveSchema(List.of(
            Attribute.categorical("color", "red")));
        AttributeContainerSchema right = AttributeContainerSchema.buildActiveSchema(List.of(
            Attribute.bool("moving", true),
            Attribute.numeric("color", 1.0)));
        AttributeContainerSchema before = left.copy();

        assertThrows(TypeMismatchException.class, () -> left.mergeSchema(right));
        assertEquals(before, left);
    }

    @Test
    void keysMustMatchNames() {
        assertThrows(IllegalArgumentException.class,
            () -> new AttributeContainerSchema(Map.of("colour", AttributeSchema.categorical("color"))));
    }
}
