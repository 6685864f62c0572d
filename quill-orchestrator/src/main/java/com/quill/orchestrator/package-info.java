/**
 * Runs a plan to completion: {@link com.quill.orchestrator.Orchestrator} drives the step queue,
 * {@link com.quill.orchestrator.StepExecutor} bounds and retries each tool call, and
 * {@link com.quill.orchestrator.RunMetrics} reports to Micrometer.
 */
package com.quill.orchestrator;
