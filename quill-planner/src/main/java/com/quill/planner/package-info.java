/**
 * Planning: the {@link com.quill.planner.Decision} model, the
 * {@link com.quill.planner.PlanTranslator}, and the re-planning oracle contract with its
 * JSON text adapter.
 */
package com.quill.planner;
