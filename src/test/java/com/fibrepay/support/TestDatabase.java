package com.fibrepay.support;

import com.fibrepay.adapter.out.persistence.SchemaInitializer;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.jdbcclient.JDBCPool;

import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Private in-memory H2 database with the bundled schema applied
 */
public class TestDatabase implements AutoCloseable {

    private static final long TIMEOUT_SECONDS = 20;

    private final Vertx vertx;
    private final JDBCPool pool;

    private TestDatabase(Vertx vertx, JDBCPool pool) {
        this.vertx = vertx;
        this.pool = pool;
    }

    public static TestDatabase create() {
        Vertx vertx = Vertx.vertx();
        JDBCPool pool = JDBCPool.pool(vertx, new JsonObject()
                .put("url", jdbcUrl())
                .put("driver_class", "org.h2.Driver")
                .put("user", "sa")
                .put("password", "")
                .put("max_pool_size", 8));

        await(new SchemaInitializer(vertx, pool).initialize());
        return new TestDatabase(vertx, pool);
    }

    public static String jdbcUrl() {
        return "jdbc:h2:mem:piecework-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000";
    }

    public Vertx vertx() {
        return vertx;
    }

    public JDBCPool pool() {
        return pool;
    }

    /**
     * Block until the future completes and return its result, rethrowing its failure
     */
    public static <T> T await(Future<T> future) {
        try {
            return future.toCompletionStage().toCompletableFuture().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        } catch (TimeoutException e) {
            throw new IllegalStateException("Future did not complete in " + TIMEOUT_SECONDS + "s", e);
        }
    }

    /**
     * Block until the future fails and return the failure
     */
    public static Throwable awaitFailure(Future<?> future) {
        try {
            future.toCompletionStage().toCompletableFuture().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            return e.getCause();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        } catch (TimeoutException e) {
            throw new IllegalStateException("Future did not complete in " + TIMEOUT_SECONDS + "s", e);
        }
        throw new AssertionError("Expected the future to fail");
    }

    @Override
    public void close() {
        await(pool.close());
        await(vertx.close());
    }
}
