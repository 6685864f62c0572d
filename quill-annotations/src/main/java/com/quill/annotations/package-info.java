/**
 * Annotations for declaring Quill tools: {@link com.quill.annotations.QuillTool} on the tool class
 * with its {@link com.quill.annotations.QuillToolParam parameters}.
 */
package com.quill.annotations;
