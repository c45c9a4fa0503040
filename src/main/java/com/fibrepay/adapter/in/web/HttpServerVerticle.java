package com.fibrepay.adapter.in.web;

import com.fibrepay.adapter.in.web.approval.ApprovalHandler;
import com.fibrepay.adapter.in.web.payroll.PayrollHandler;
import com.fibrepay.adapter.in.web.worker.WorkerHandler;
import com.fibrepay.adapter.in.web.worklog.WorkLogHandler;
import com.fibrepay.adapter.out.audit.EventBusAuditRecorder;
import com.fibrepay.adapter.out.persistence.JdbcPayrollRunPersistenceAdapter;
import com.fibrepay.adapter.out.persistence.JdbcTaskTypePersistenceAdapter;
import com.fibrepay.adapter.out.persistence.JdbcWorkDayPersistenceAdapter;
import com.fibrepay.adapter.out.persistence.JdbcWorkTaskPersistenceAdapter;
import com.fibrepay.adapter.out.persistence.JdbcWorkerPersistenceAdapter;
import com.fibrepay.adapter.out.persistence.JdbcWorkerRatePersistenceAdapter;
import com.fibrepay.adapter.out.persistence.SchemaInitializer;
import com.fibrepay.application.port.out.PayrollRunRepository;
import com.fibrepay.application.port.out.TaskTypeRepository;
import com.fibrepay.application.port.out.WorkDayRepository;
import com.fibrepay.application.port.out.WorkTaskRepository;
import com.fibrepay.application.port.out.WorkerRateRepository;
import com.fibrepay.application.port.out.WorkerRepository;
import com.fibrepay.application.service.ApprovalService;
import com.fibrepay.application.service.AuditTrail;
import com.fibrepay.application.service.AuthorizationPolicy;
import com.fibrepay.application.service.PayrollQueryService;
import com.fibrepay.application.service.PayrollRunService;
import com.fibrepay.application.service.PeriodCalculator;
import com.fibrepay.application.service.RateResolver;
import com.fibrepay.application.service.RubricEvaluator;
import com.fibrepay.application.service.WorkLogValidator;
import com.fibrepay.application.service.WorkLoggingService;
import com.fibrepay.application.service.WorkerAdministrationService;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.LoggerHandler;
import io.vertx.jdbcclient.JDBCPool;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * HTTP Server Verticle - handles all HTTP requests
 * Infrastructure component that wires up the hexagonal architecture
 */
@Slf4j
public class HttpServerVerticle extends AbstractVerticle {

    private static final int DEFAULT_PORT = 8080;

    private final Clock clock;

    private JDBCPool jdbcPool;
    private HttpServer httpServer;
    private Router router;
    private WebRouter webRouter;

    public HttpServerVerticle() {
        this(Clock.systemDefaultZone());
    }

    public HttpServerVerticle(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");

        initializeDatabase()
                .compose(v -> {
                    log.info("Database initialized successfully");
                    return initializeServices();
                })
                .compose(v -> {
                    log.info("All services initialized successfully");
                    return startHttpServer();
                })
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", actualPort());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        if (jdbcPool != null) {
            jdbcPool.close();
        }
        log.info("HTTP Server Verticle stopped");
    }

    /**
     * Port the server is bound to; differs from the configured one when that was 0
     */
    public int actualPort() {
        return httpServer != null ? httpServer.actualPort() : getPort();
    }

    private Future<Void> initializeDatabase() {
        try {
            JsonObject dbConfig = config().getJsonObject("database");
            if (dbConfig == null) {
                return Future.failedFuture("Database configuration not found in application.yml");
            }

            log.info("Connecting to database: {}", dbConfig.getString("url"));

            JsonObject poolConfig = new JsonObject()
                    .put("url", dbConfig.getString("url"))
                    .put("user", dbConfig.getString("user"))
                    .put("password", dbConfig.getString("password"))
                    .put("driver_class", dbConfig.getString("driver_class"))
                    .put("max_pool_size", dbConfig.getInteger("max_pool_size", 10));

            jdbcPool = JDBCPool.pool(vertx, poolConfig);

            Future<Void> ready = jdbcPool.getConnection()
                    .compose(connection -> connection.close())
                    .onSuccess(v -> log.info("Database connection test successful"))
                    .onFailure(error -> log.error("Database connection failed", error));

            if (dbConfig.getBoolean("init_schema", false)) {
                ready = ready.compose(v -> new SchemaInitializer(vertx, jdbcPool).initialize());
            }
            return ready;

        } catch (Exception e) {
            log.error("Error initializing database", e);
            return Future.failedFuture(e);
        }
    }

    private Future<Void> initializeServices() {
        // Output ports (adapters)
        WorkerRepository workerRepository = new JdbcWorkerPersistenceAdapter();
        TaskTypeRepository taskTypeRepository = new JdbcTaskTypePersistenceAdapter();
        WorkerRateRepository workerRateRepository = new JdbcWorkerRatePersistenceAdapter();
        WorkDayRepository workDayRepository = new JdbcWorkDayPersistenceAdapter();
        WorkTaskRepository workTaskRepository = new JdbcWorkTaskPersistenceAdapter();
        PayrollRunRepository payrollRunRepository = new JdbcPayrollRunPersistenceAdapter();
        AuditTrail auditTrail = new AuditTrail(new EventBusAuditRecorder(vertx), clock);

        // Application services (use cases)
        JsonObject rubric = config().getJsonObject("rubric", new JsonObject());
        RubricEvaluator rubricEvaluator = new RubricEvaluator(
                decimal(rubric, "daily_target", RubricEvaluator.DEFAULT_DAILY_TARGET_KG),
                decimal(rubric, "metres_per_kg", RubricEvaluator.DEFAULT_METRES_PER_KG)
        );
        PeriodCalculator periodCalculator = new PeriodCalculator();
        AuthorizationPolicy authorizationPolicy = new AuthorizationPolicy();
        WorkLogValidator validator = new WorkLogValidator();
        RateResolver rateResolver = new RateResolver(workerRateRepository, taskTypeRepository);

        ApprovalService approvalService = new ApprovalService(
                jdbcPool, workTaskRepository, workDayRepository, rateResolver, authorizationPolicy, auditTrail, clock);
        PayrollRunService payrollRunService = new PayrollRunService(
                jdbcPool, workerRepository, taskTypeRepository, workTaskRepository, payrollRunRepository,
                periodCalculator, auditTrail, clock);
        PayrollQueryService payrollQueryService = new PayrollQueryService(
                jdbcPool, workerRepository, taskTypeRepository, workTaskRepository, periodCalculator,
                authorizationPolicy, clock);
        WorkLoggingService workLoggingService = new WorkLoggingService(
                jdbcPool, workerRepository, workDayRepository, workTaskRepository, taskTypeRepository, validator,
                rubricEvaluator, authorizationPolicy, auditTrail, clock);
        WorkerAdministrationService workerAdministrationService = new WorkerAdministrationService(
                jdbcPool, workerRepository, taskTypeRepository, workerRateRepository, validator, authorizationPolicy,
                auditTrail, clock);

        // Input adapters (handlers)
        router = Router.router(vertx);
        webRouter = new WebRouter(
                router,
                new WorkerHandler(workerAdministrationService),
                new WorkLogHandler(workLoggingService),
                new ApprovalHandler(approvalService),
                new PayrollHandler(payrollQueryService, payrollRunService, clock)
        );

        log.info("Services wired up (Hexagonal Architecture)");
        return Future.succeededFuture();
    }

    private Future<Void> startHttpServer() {
        // Global handlers
        router.route().handler(LoggerHandler.create());
        router.route().handler(BodyHandler.create());

        // Setup routes
        webRouter.setupRoutes();

        // Default route - 404
        router.route().handler(ctx -> {
            ctx.response()
                    .setStatusCode(404)
                    .putHeader("Content-Type", "application/json")
                    .end(new JsonObject()
                            .put("status", "error")
                            .put("message", "Endpoint not found")
                            .encode()
                    );
        });

        int port = getPort();

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(server -> {
                    httpServer = server;
                    log.info("HTTP server listening on port {}", server.actualPort());
                })
                .mapEmpty();
    }

    private int getPort() {
        return config().getJsonObject("http", new JsonObject()).getInteger("port", DEFAULT_PORT);
    }

    private static BigDecimal decimal(JsonObject config, String key, BigDecimal defaultValue) {
        Object value = config.getValue(key);
        return value != null ? new BigDecimal(value.toString()) : defaultValue;
    }
}
