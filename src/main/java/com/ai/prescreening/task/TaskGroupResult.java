package com.ai.prescreening.task;

import java.util.Collections;
import java.util.Map;

/**
 * @param taskResults results keyed by entry id, only for tasks that completed, in completion order
 * @param aborted     true when the group stopped early because a result matched the abort condition
 */
public record TaskGroupResult<R>(Map<String, R> taskResults, boolean aborted) {

    public TaskGroupResult {
        taskResults = Collections.unmodifiableMap(taskResults);
    }

    public R get(String id) {
        return taskResults.get(id);
    }
}
