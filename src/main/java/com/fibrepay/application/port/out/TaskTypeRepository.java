package com.fibrepay.application.port.out;

import com.fibrepay.domain.model.TaskType;
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;

import java.util.List;
import java.util.Optional;

/**
 * Output port - task type reference data
 */
public interface TaskTypeRepository {

    Future<Optional<TaskType>> findById(String taskTypeId, SqlConnection connection);

    Future<List<TaskType>> findAll(SqlConnection connection);
}
