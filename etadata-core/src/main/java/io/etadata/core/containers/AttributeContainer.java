package io.etadata.core.containers;

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
import io.etadata.core.schema.AttributeContainerSchema;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/// An ordered collection of attributes that can enforce an [AttributeContainerSchema].
///
/// ## Enforcement
///
/// Without a schema every attribute is accepted. With a schema, each added
/// attribute must have a name known to the schema, the declared type, and an
/// allowed value; otherwise the add fails and the container is unchanged.
///
/// The schema is shared, not owned: the same schema object may be enforced by
/// several containers, and changes made to it are seen by all of them.
///
/// ## Freezing
///
/// ```java
/// AttributeContainer attrs = new AttributeContainer();
/// attrs.add(Attribute.categorical("weather", "rain"));
/// attrs.add(Attribute.numeric("temperature", 12.0));
///
/// attrs.freezeSchema();
/// attrs.add(Attribute.categorical("weather", "rain"));  // ok
/// attrs.add(Attribute.categorical("weather", "snow"));  // ValueNotAllowedException
/// ```
public class AttributeContainer extends DataContainer<Attribute> {
    private static final Logger logger = LogManager.getLogger(AttributeContainer.class);

    /// Name of the element list in the serialized form.
    public static final String ELEMENTS_FIELD = "attrs";

    private AttributeContainerSchema schema;

    public AttributeContainer() {
    }

    /// @param schema the schema to enforce, or null for none
    public AttributeContainer(AttributeContainerSchema schema) {
        this.schema = schema;
    }

    /// @param attrs the initial attributes
    /// @param schema the schema to enforce, or null for none
    /// @throws io.etadata.core.schema.AttributeSchemaException if an attribute violates the schema
    public AttributeContainer(Collection<Attribute> attrs, AttributeContainerSchema schema) {
        this.schema = schema;
        addAll(attrs);
    }

    @Override
    protected void checkElement(Attribute attr) {
        super.checkElement(attr);
        if (schema != null) {
            schema.validateAttribute(attr);
        }
    }

    public boolean hasSchema() {
        return schema != null;
    }

    /// @return the enforced schema, if any
    public Optional<AttributeContainerSchema> getSchema() {
        return Optional.ofNullable(schema);
    }

    /// Enforces a schema. The current attributes are validated against it
    /// first; if one fails, the previous schema stays in place.
    ///
    /// @param schema the schema to enforce
    /// @throws io.etadata.core.schema.AttributeSchemaException if a current attribute violates the schema
    public void setSchema(AttributeContainerSchema schema) {
        if (schema != null) {
            for (Attribute attr : this) {
                schema.validateAttribute(attr);
            }
        }
        this.schema = schema;
    }

    /// Builds the schema describing the current attributes. The enforced
    /// schema is not touched.
    ///
    /// @return a fresh schema
    public AttributeContainerSchema getActiveSchema() {
        return AttributeContainerSchema.buildActiveSchema(this);
    }

    /// Enforces the current active schema, restricting later additions to the
    /// names, categories and ranges seen so far.
    public void freezeSchema() {
        AttributeContainerSchema active = getActiveSchema();
        logger.debug("Freezing schema over {} attribute(s): {}", size(), active.names());
        this.schema = active;
    }

    /// Stops enforcing a schema.
    public void removeSchema() {
        this.schema = null;
    }

    /// @param name an attribute name
    /// @return the attributes with that name, in container order
    public List<Attribute> getAttributes(String name) {
        return stream().filter(a -> a.name().equals(name)).collect(Collectors.toList());
    }

    /// @param name an attribute name
    /// @return the values of the attributes with that name, in container order
    public List<Object> getValues(String name) {
        return stream().filter(a -> a.name().equals(name)).map(Attribute::value).collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object obj) {
        if (!super.equals(obj)) return false;
        return Objects.equals(schema, ((AttributeContainer) obj).schema);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Objects.hashCode(schema);
    }
}
