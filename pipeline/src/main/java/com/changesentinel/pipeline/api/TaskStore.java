package com.changesentinel.pipeline.api;

import com.changesentinel.core.model.MonitorTask;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface TaskStore {
    Optional<MonitorTask> find(String taskId);

    List<MonitorTask> list();

    Optional<MonitorTask> update(String taskId, UnaryOperator<MonitorTask> change);
}
