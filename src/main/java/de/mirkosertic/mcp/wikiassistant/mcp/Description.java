package de.mirkosertic.mcp.wikiassistant.mcp;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Describes a tool parameter. {@link SchemaGenerator} copies it into the JSON schema.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface Description {

    String value();

    /**
     * Sample values shown to the client as the schema's {@code examples}.
     */
    String[] examples() default {};
}
