/**
 * Tool contract for Quill: {@link com.quill.tools.Tool} implementations are published through
 * {@link com.quill.tools.ToolProvider} (ServiceLoader), collected in a
 * {@link com.quill.tools.ToolRegistry}, described by a {@link com.quill.tools.ToolCatalog}
 * and called through a {@link com.quill.tools.ToolInvoker}.
 */
package com.quill.tools;
