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

import io.etadata.core.DataCoreException;

/// Thrown when a raw value cannot be coerced to the value type of an attribute.
public class ValueParseException extends DataCoreException {

    private final AttributeType attributeType;

    public ValueParseException(AttributeType attributeType, Object rawValue) {
        super(message(attributeType, rawValue));
        this.attributeType = attributeType;
    }

    public ValueParseException(AttributeType attributeType, Object rawValue, Throwable cause) {
        super(message(attributeType, rawValue), cause);
        this.attributeType = attributeType;
    }

    /// @return the type the value was being parsed for
    public AttributeType getAttributeType() {
        return attributeType;
    }

    private static String message(AttributeType attributeType, Object rawValue) {
        String described = rawValue == null
            ? "null"
            : "'" + rawValue + "' (" + rawValue.getClass().getSimpleName() + ")";
        return "Cannot parse " + described + " as a " + attributeType.discriminator() + " attribute value";
    }
}
