package com.anton.core.prompt;

import com.anton.core.model.Task;

import java.util.List;

/**
 * Inputs for one implementation prompt.
 *
 * @param task task being attempted
 * @param children known children with their current completion state
 * @param taskFilePath task document path as shown to the agent
 * @param completedCount tasks complete so far (document checkboxes plus this run)
 * @param totalCount tasks in the document plus decomposition subtasks
 * @param retryContext previous failure reason, null on a first attempt
 * @param planFile vetted preflight plan for this task, null if none
 * @param decompose whether decomposition is enabled for the run
 * @param maxDecomposeDepth deepest depth decomposition is allowed at
 * @param maxContextTokens budget for the retrieved-context section
 */
public record PromptRequest(
    Task task,
    List<ChildStatus> children,
    String taskFilePath,
    int completedCount,
    int totalCount,
    String retryContext,
    String planFile,
    boolean decompose,
    int maxDecomposeDepth,
    int maxContextTokens
) {

    public PromptRequest {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public PromptRequest withRetryContext(String retry) {
        return new PromptRequest(task, children, taskFilePath, completedCount, totalCount, retry, planFile,
                decompose, maxDecomposeDepth, maxContextTokens);
    }

    /** A child task and whether it is complete. */
    public record ChildStatus(String text, boolean done) {
    }
}
