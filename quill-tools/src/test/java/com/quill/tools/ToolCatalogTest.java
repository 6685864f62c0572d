package com.quill.tools;

import com.quill.annotations.QuillTool;
import com.quill.annotations.QuillToolParam;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolCatalogTest {

    @QuillTool(name = "draft_essay", parameters = {
            @QuillToolParam(name = "outline", required = true),
            @QuillToolParam(name = "word_limit", type = "INTEGER"),
            @QuillToolParam(name = "essay_prompt", required = true),
            @QuillToolParam(name = "tone")
    })
    static final class DraftEssayTool implements Tool {
        @Override
        public Map<String, Object> execute(Map<String, Object> args) {
            return Map.of("draft", "...");
        }
    }

    static final class UndeclaredTool implements Tool {
        @Override
        public Map<String, Object> execute(Map<String, Object> args) {
            return Map.of();
        }
    }

    private static ToolProvider provider(String name, Tool tool) {
        return new ToolProvider() {
            @Override
            public String getToolName() {
                return name;
            }

            @Override
            public String getDescription() {
                return name;
            }

            @Override
            public ToolCategory getCategory() {
                return ToolCategory.OTHER;
            }

            @Override
            public Tool getTool() {
                return tool;
            }
        };
    }

    @Test
    void fromRegistry_splitsRequiredAndOptionalInDeclarationOrder() {
        ToolRegistry registry = ToolRegistry.of(provider("draft_essay", new DraftEssayTool()));

        ToolCatalog catalog = ToolCatalog.fromRegistry(registry);

        assertEquals(List.of("outline", "essay_prompt"), List.copyOf(catalog.requiredArgs("draft_essay")));
        assertEquals(List.of("word_limit", "tone"), List.copyOf(catalog.optionalArgs("draft_essay")));
        assertTrue(catalog.isRegistered("draft_essay"));
    }

    @Test
    void fromRegistry_toolWithoutAnnotationHasNoParameters() {
        ToolCatalog catalog = ToolCatalog.fromRegistry(ToolRegistry.of(provider("bare", new UndeclaredTool())));

        assertTrue(catalog.isRegistered("bare"));
        assertTrue(catalog.requiredArgs("bare").isEmpty());
    }

    @Test
    void unregisteredToolYieldsEmptySets() {
        ToolCatalog catalog = ToolCatalog.builder().tool("x", List.of("a"), List.of()).build();

        assertEquals(Set.of(), catalog.requiredArgs("unknown"));
        assertEquals(Set.of(), catalog.optionalArgs("unknown"));
        assertEquals(Set.of(), catalog.requiredArgs(null));
        assertFalse(catalog.isRegistered("unknown"));
        assertTrue(catalog.spec("unknown").isEmpty());
    }

    @Test
    void builder_introspectsAnnotatedClass() {
        ToolCatalog catalog = ToolCatalog.builder().tool(DraftEssayTool.class).build();

        assertEquals(Set.of("draft_essay"), catalog.toolNames());
        assertEquals(2, catalog.spec("draft_essay").orElseThrow().requiredParams().size());
    }

    @Test
    void builder_rejectsDuplicateTool() {
        ToolCatalog.Builder builder = ToolCatalog.builder().tool("x", List.of(), List.of());
        assertThrows(IllegalArgumentException.class, () -> builder.tool("x", List.of(), List.of()));
    }

    @Test
    void toolSpec_rejectsParameterThatIsBothRequiredAndOptional() {
        assertThrows(IllegalArgumentException.class, () -> ToolSpec.of("x", List.of("a"), List.of("a")));
    }

    @Test
    void introspect_rejectsUnannotatedClass() {
        assertThrows(IllegalArgumentException.class, () -> ToolCatalog.introspect(UndeclaredTool.class));
    }

    static ToolProvider providerFor(String name, Tool tool) {
        return provider(name, tool);
    }
}
