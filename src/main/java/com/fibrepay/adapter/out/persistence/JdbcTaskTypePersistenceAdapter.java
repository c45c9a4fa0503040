package com.fibrepay.adapter.out.persistence;

import com.fibrepay.application.port.out.TaskTypeRepository;
import com.fibrepay.domain.model.TaskCategory;
import com.fibrepay.domain.model.TaskType;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of TaskTypeRepository
 */
@Slf4j
public class JdbcTaskTypePersistenceAdapter implements TaskTypeRepository {

    private static final String COLUMNS = "ID, CODE, NAME, UNIT, CATEGORY, DEFAULT_RATE";

    @Override
    public Future<Optional<TaskType>> findById(String taskTypeId, SqlConnection connection) {
        String sql = "SELECT " + COLUMNS + " FROM TASK_TYPE WHERE ID = ?";

        return connection.preparedQuery(sql)
                .execute(Tuple.of(taskTypeId))
                .map(rows -> SqlSupport.first(rows, this::mapRow))
                .onFailure(error -> log.error("Failed to find task type {}: {}", taskTypeId, error.getMessage()));
    }

    @Override
    public Future<List<TaskType>> findAll(SqlConnection connection) {
        String sql = "SELECT " + COLUMNS + " FROM TASK_TYPE ORDER BY NAME";

        return connection.query(sql)
                .execute()
                .map(rows -> SqlSupport.all(rows, this::mapRow))
                .onFailure(error -> log.error("Failed to list task types: {}", error.getMessage()));
    }

    private TaskType mapRow(Row row) {
        return TaskType.builder()
                .id(row.getString("ID"))
                .code(row.getString("CODE"))
                .name(row.getString("NAME"))
                .unit(row.getString("UNIT"))
                .category(TaskCategory.fromValue(row.getString("CATEGORY")))
                .defaultRate(row.getBigDecimal("DEFAULT_RATE"))
                .build();
    }
}
