package com.fibrepay.adapter.in.web;

import com.fibrepay.adapter.out.audit.AuditEventCodec;
import com.fibrepay.domain.event.AuditEvent;
import com.fibrepay.infrastructure.config.JacksonConfig;
import com.fibrepay.support.PieceworkFixture;
import com.fibrepay.support.TestDatabase;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.fibrepay.support.TestDatabase.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the HTTP API on a random port over an in-memory H2 database
 */
class PieceworkApiTest {

    private static final String ADMIN = "admin";
    private static final String SUPERVISOR = "supervisor";

    private Vertx vertx;
    private HttpClient client;
    private int port;

    @BeforeEach
    void setUp() {
        JacksonConfig.configure();
        vertx = Vertx.vertx();
        vertx.eventBus().registerDefaultCodec(AuditEvent.class, new AuditEventCodec());

        JsonObject config = new JsonObject()
                .put("http", new JsonObject().put("port", 0))
                .put("database", new JsonObject()
                        .put("url", TestDatabase.jdbcUrl())
                        .put("driver_class", "org.h2.Driver")
                        .put("user", "sa")
                        .put("password", "")
                        .put("max_pool_size", 4)
                        .put("init_schema", true));

        HttpServerVerticle verticle = new HttpServerVerticle(PieceworkFixture.CLOCK);
        await(vertx.deployVerticle(verticle, new DeploymentOptions().setConfig(config)));
        port = verticle.actualPort();
        client = vertx.createHttpClient();
    }

    @AfterEach
    void tearDown() {
        await(vertx.close());
    }

    @Test
    void health_isUp() {
        Response response = call(HttpMethod.GET, "/health", null, null);

        assertEquals(200, response.status());
        assertEquals("UP", response.body().getString("status"));
    }

    @Test
    void missingIdentityHeaders_are401() {
        Response response = call(HttpMethod.GET, "/api/workers", null, null);

        assertEquals(401, response.status());
        assertEquals("error", response.body().getString("status"));
    }

    @Test
    void unknownRoute_is404() {
        assertEquals(404, call(HttpMethod.GET, "/api/nothing-here", ADMIN, null).status());
    }

    @Test
    void malformedBody_is400() {
        Response response = call(HttpMethod.POST, "/api/workers", ADMIN,
                new JsonObject().put("fullName", "Amina Diallo").put("payoutAnchorDate", "not-a-date"));

        assertEquals(400, response.status());
    }

    @Test
    void logApproveAndSettle() {
        // Register a worker
        Response created = call(HttpMethod.POST, "/api/workers", ADMIN, new JsonObject()
                .put("fullName", "Amina Diallo")
                .put("payout", "weekly")
                .put("payoutAnchorDate", "2024-03-04"));
        assertEquals(201, created.status());
        String workerId = created.data().getString("id");
        assertEquals("2024-03-04", created.data().getString("payoutAnchorDate"));

        // Log a day and two tasks
        Response day = call(HttpMethod.POST, "/api/work-days", SUPERVISOR, new JsonObject()
                .put("workerId", workerId)
                .put("workDate", "2024-03-05"));
        assertEquals(200, day.status());
        String workDayId = day.data().getString("workDayId");

        Response combing = call(HttpMethod.POST, "/api/work-tasks", SUPERVISOR, new JsonObject()
                .put("id", "offline-1")
                .put("workDayId", workDayId)
                .put("taskTypeId", PieceworkFixture.COMBING)
                .put("quantity", 2));
        assertEquals(201, combing.status());
        assertEquals("offline-1", combing.data().getString("taskId"));

        Response weaving = call(HttpMethod.POST, "/api/work-tasks", SUPERVISOR, new JsonObject()
                .put("workDayId", workDayId)
                .put("taskTypeId", PieceworkFixture.WEAVING)
                .put("quantity", 30));
        String weavingId = weaving.data().getString("taskId");

        // Approval queue and decisions
        Response pending = call(HttpMethod.GET, "/api/approvals/pending", SUPERVISOR, null);
        assertEquals(2, pending.body().getJsonArray("data").size());

        Response decided = call(HttpMethod.POST, "/api/work-tasks/offline-1/decide", ADMIN,
                new JsonObject().put("status", "approved"));
        assertEquals(200, decided.status());
        assertEquals(300.0, decided.data().getDouble("approvedPay"), 0.001);

        Response bulk = call(HttpMethod.POST, "/api/work-tasks/bulk-decide", SUPERVISOR, new JsonObject()
                .put("taskIds", new JsonArray().add(weavingId).add("missing"))
                .put("status", "approved"));
        assertEquals(1, bulk.data().getInteger("updated"));

        // Pending is not a decision
        assertEquals(400, call(HttpMethod.POST, "/api/work-tasks/offline-1/decide", ADMIN,
                new JsonObject().put("status", "pending")).status());

        // Payroll preview and run
        Response due = call(HttpMethod.GET, "/api/payroll/due?as_of=2024-03-10", ADMIN, null);
        JsonArray dueWorkers = due.body().getJsonArray("data");
        assertEquals(1, dueWorkers.size());
        assertEquals(450.0, dueWorkers.getJsonObject(0).getJsonObject("totals").getDouble("totalPay"), 0.001);

        Response run = call(HttpMethod.POST, "/api/payroll-runs", ADMIN, new JsonObject().put("asOf", "2024-03-10"));
        assertEquals(201, run.status());
        String runId = run.data().getString("runId");

        Response details = call(HttpMethod.GET, "/api/payroll-runs/" + runId, ADMIN, null);
        JsonArray items = details.data().getJsonArray("items");
        assertEquals(1, items.size());
        assertEquals(2, items.getJsonObject(0).getInteger("taskCount"));

        // Paid work is frozen
        assertEquals(409, call(HttpMethod.POST, "/api/work-tasks/offline-1/decide", ADMIN,
                new JsonObject().put("status", "rejected")).status());
        assertEquals(0, call(HttpMethod.GET, "/api/payroll/due?as_of=2024-03-10", ADMIN, null)
                .body().getJsonArray("data").size());
    }

    @Test
    void supervisorCannotReopenOrEditWorkers() {
        Response created = call(HttpMethod.POST, "/api/workers", ADMIN, new JsonObject().put("fullName", "Kofi Mensah"));
        String workerId = created.data().getString("id");

        Response patch = call(HttpMethod.PATCH, "/api/workers/" + workerId, SUPERVISOR,
                new JsonObject().put("active", false));
        assertEquals(403, patch.status());

        Response day = call(HttpMethod.POST, "/api/work-days", SUPERVISOR, new JsonObject()
                .put("workerId", workerId)
                .put("workDate", "2024-03-05"));
        String workDayId = day.data().getString("workDayId");
        assertEquals(200, call(HttpMethod.POST, "/api/work-days/" + workDayId + "/close", SUPERVISOR, null).status());
        assertEquals(403, call(HttpMethod.POST, "/api/work-days/" + workDayId + "/reopen", SUPERVISOR, null).status());
        assertEquals(200, call(HttpMethod.POST, "/api/work-days/" + workDayId + "/reopen", ADMIN, null).status());
    }

    @Test
    void unknownRun_is404() {
        assertEquals(404, call(HttpMethod.GET, "/api/payroll-runs/no-such-run", ADMIN, null).status());
    }

    private Response call(HttpMethod method, String path, String role, JsonObject body) {
        Future<Response> response = client.request(method, port, "localhost", path)
                .compose(request -> {
                    identify(request, role);
                    if (body == null) {
                        return request.send();
                    }
                    request.putHeader("Content-Type", "application/json");
                    return request.send(body.toBuffer());
                })
                .compose(result -> result.body().map(buffer -> new Response(
                        result.statusCode(),
                        buffer.length() > 0 ? buffer.toJsonObject() : new JsonObject())));
        return await(response);
    }

    private static void identify(HttpClientRequest request, String role) {
        if (role != null) {
            request.putHeader(HttpSupport.HEADER_USER_ID, role + "-1");
            request.putHeader(HttpSupport.HEADER_USER_ROLE, role);
        }
    }

    private record Response(int status, JsonObject body) {
        JsonObject data() {
            return body.getJsonObject("data");
        }
    }
}
