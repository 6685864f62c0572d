package com.quill.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;

/**
 * A single tool parameter. Used inside {@link QuillTool#parameters()}.
 */
@Retention(RetentionPolicy.RUNTIME)
public @interface QuillToolParam {

    /** Parameter name (e.g. "essay_prompt", "outline"). */
    String name();

    /** Type identifier (e.g. "STRING", "INTEGER", "OBJECT"). Informational only. */
    String type() default "STRING";

    /** Whether the parameter has no default; the resolver fails when a required parameter cannot be filled. */
    boolean required() default false;
}
