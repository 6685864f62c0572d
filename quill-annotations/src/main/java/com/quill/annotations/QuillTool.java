package com.quill.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a class as a Quill tool and publishes its parameter schema. The tool catalog
 * introspects this annotation once at startup to learn which parameters each tool requires
 * and which it can do without.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface QuillTool {

    /** Tool name as used in plans and oracle decisions (e.g. "outline", "clarify"). */
    String name();

    /** Optional description. */
    String description() default "";

    /** Parameters in declaration order. Required ones have no default and must be resolved before the tool runs. */
    QuillToolParam[] parameters() default {};
}
