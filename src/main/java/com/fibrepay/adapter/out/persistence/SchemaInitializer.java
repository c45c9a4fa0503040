package com.fibrepay.adapter.out.persistence;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.sqlclient.Pool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the bundled DDL script statement by statement. Every statement is
 * idempotent, so the script can run on each start.
 */
@Slf4j
@RequiredArgsConstructor
public class SchemaInitializer {

    public static final String DEFAULT_SCRIPT = "db/schema.sql";

    private final Vertx vertx;
    private final Pool pool;

    public Future<Void> initialize() {
        return initialize(DEFAULT_SCRIPT);
    }

    public Future<Void> initialize(String resource) {
        return vertx.fileSystem().readFile(resource)
                .map(buffer -> statementsOf(buffer.toString()))
                .compose(statements -> {
                    log.info("Applying {} schema statements from {}", statements.size(), resource);
                    Future<Void> chain = Future.succeededFuture();
                    for (String statement : statements) {
                        chain = chain.compose(v -> pool.query(statement).execute()
                                .onFailure(error -> log.error("Schema statement failed: {}\n{}", error.getMessage(), statement))
                                .mapEmpty());
                    }
                    return chain;
                })
                .onSuccess(v -> log.info("Schema ready"));
    }

    static List<String> statementsOf(String script) {
        String withoutComments = Arrays.stream(script.split("\n"))
                .filter(line -> !line.trim().startsWith("--"))
                .collect(Collectors.joining("\n"));

        return Arrays.stream(withoutComments.split(";"))
                .map(String::trim)
                .filter(statement -> !statement.isEmpty())
                .collect(Collectors.toList());
    }
}
