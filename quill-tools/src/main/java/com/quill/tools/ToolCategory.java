package com.quill.tools;

/**
 * Category for tool discovery and grouping.
 */
public enum ToolCategory {

    /** Outlining and brainstorming (e.g. outline_generator, brainstorm_specific). */
    PLANNING,

    /** Draft generation (e.g. draft_essay, story_development). */
    DRAFTING,

    /** Revision and polishing (e.g. revise_for_clarity). */
    REVISION,

    /** Measurement and analysis (e.g. word_count). */
    ANALYSIS,

    /** Generic conversational reply (e.g. chat_response). */
    CONVERSATION,

    /** Asking the user for missing details (e.g. clarify). */
    CLARIFICATION,

    /** Other / custom. */
    OTHER
}
