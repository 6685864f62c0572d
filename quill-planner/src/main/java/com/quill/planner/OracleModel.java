package com.quill.planner;

/**
 * Text-completion model behind {@link ModelReplanningOracle}.
 */
@FunctionalInterface
public interface OracleModel {

    String complete(String prompt) throws Exception;
}
