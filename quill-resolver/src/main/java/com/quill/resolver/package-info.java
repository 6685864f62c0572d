/**
 * Argument resolution: {@link com.quill.resolver.ArgumentResolver} fills a tool's declared
 * parameters from explicit args, the working context, role heuristics, defaults and aliases,
 * using the data in {@link com.quill.resolver.ResolverTables}.
 */
package com.quill.resolver;
