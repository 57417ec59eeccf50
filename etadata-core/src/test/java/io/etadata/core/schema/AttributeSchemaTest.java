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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class AttributeSchemaTest {

    @Test
    void categoricalCollectsCategories() {
        AttributeSchema schema = AttributeSchema.categorical("color");
        assertFalse(schema.isValidValue("red"));

        schema.addAttribute(Attribute.categorical("color", "red"));
        schema.addAttribute(Attribute.categorical("color", "blue"));
        schema.addAttribute(Attribute.categorical("color", "red"));

        assertThat(schema.getCategories()).containsExactly("red", "blue");
        assertTrue(schema.isValidValue("blue"));
        assertFalse(schema.isValidValue("green"));
        assertFalse(schema.isValidValue(1.0));
    }

    @Test
    void numericRangeGrowsFromFirstValue() {
        AttributeSchema schema = AttributeSchema.numeric("speed");
        assertTrue(schema.getRange().isEmpty());
        assertFalse(schema.isValidValue(1.0));

        schema.addAttribute(Attribute.numeric("speed", 5.0));
        assertEquals(new NumericRange(5.0, 5.0), schema.getRange().orElseThrow());

        schema.addAttribute(Attribute.numeric("speed", -2.0));
        schema.addAttribute(Attribute.numeric("speed", 9.5));
        assertEquals(new NumericRange(-2.0, 9.5), schema.getRange().orElseThrow());
        assertTrue(schema.isValidValue(0.0));
        assertTrue(schema.isValidValue(9.5));
        assertFalse(schema.isValidValue(9.6));
        assertFalse(schema.isValidValue("3"));
    }

    @Test
    void booleanAcceptsAnyFlag() {
        AttributeSchema schema = AttributeSchema.bool("done");
        assertTrue(schema.isValidValue(true));
        assertTrue(schema.isValidValue(false));
        assertFalse(schema.isValidValue("true"));
        schema.addAttribute(Attribute.bool("done", true));
        assertTrue(schema.getCategories().isEmpty());
    }

    @Test
    void addAttributeChecksType() {
        AttributeSchema schema = AttributeSchema.numeric("speed");
        assertThrows(TypeMismatchException.class,
            () -> schema.addAttribute(Attribute.categorical("speed", "fast")));
        assertTrue(schema.getRange().isEmpty());
    }

    @Test
    void mergeIsCommutativeAndIdempotent() {
        AttributeSchema a = AttributeSchema.categorical("color", "id", List.of("red", "blue"));
        AttributeSchema b = AttributeSchema.categorical("color", "id", List.of("blue", "green"));

        AttributeSchema ab = a.copy();
        ab.mergeSchema(b);
        AttributeSchema ba = b.copy();
        ba.mergeSchema(a);
        assertEquals(ab.getCategories(), ba.getCategories());
        assertThat(ab.getCategories()).containsExactlyInAnyOrder("red", "blue", "green");

        AttributeSchema again = ab.copy();
        again.mergeSchema(ab);
        assertEquals(ab, again);

        AttributeSchema x = AttributeSchema.numeric("speed", "n", new NumericRange(0, 5));
        AttributeSchema y = AttributeSchema.numeric("speed", "n", new NumericRange(3, 8));
        AttributeSchema xy = x.copy();
        xy.mergeSchema(y);
        AttributeSchema yx = y.copy();
        yx.mergeSchema(x);
        assertEquals(new NumericRange(0, 8), xy.getRange().orElseThrow());
        assertEquals(xy, yx);
    }

    @Test
    void mergeIntoUnsetRangeAdoptsOther() {
        AttributeSchema unset = AttributeSchema.numeric("speed");
        unset.mergeSchema(AttributeSchema.numeric("speed", null, new NumericRange(1, 2)));
        assertEquals(new NumericRange(1, 2), unset.getRange().orElseThrow());
    }

    @Test
    void mergeRejectsOtherType() {
        AttributeSchema schema = AttributeSchema.numeric("speed");
        assertThrows(TypeMismatchException.class, () -> schema.mergeSchema(AttributeSchema.bool("speed")));
    }

    @Test
    void payloadMustMatchType() {
        assertThrows(IllegalArgumentException.class,
            () -> AttributeSchema.restore(AttributeType.BOOLEAN, "done", null, List.of("x"), null));
        assertThrows(IllegalArgumentException.class,
            () -> AttributeSchema.restore(AttributeType.CATEGORICAL, "c", null, null, new NumericRange(0, 1)));
        assertThrows(IllegalArgumentException.class, () -> new NumericRange(2, 1));
    }

    @Test
    void copyIsIndependent() {
        AttributeSchema schema = AttributeSchema.categorical("color", null, List.of("red"));
        AttributeSchema copy = schema.copy();
        copy.addAttribute(Attribute.categorical("color", "blue"));
        assertEquals(schema.getUuid(), copy.getUuid());
        assertThat(schema.getCategories()).containsExactly("red");
        assertNotEquals(schema, copy);
    }
}
