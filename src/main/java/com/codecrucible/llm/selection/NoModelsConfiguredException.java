package com.codecrucible.llm.selection;

import com.codecrucible.llm.TaskType;

/**
 * A task type was requested but its model pool is empty. Fatal to the run.
 */
public class NoModelsConfiguredException extends RuntimeException {

    private final TaskType taskType;

    public NoModelsConfiguredException(TaskType taskType) {
        super("No models configured for task type '" + taskType.getKey() + "'");
        this.taskType = taskType;
    }

    public TaskType getTaskType() {
        return taskType;
    }
}
