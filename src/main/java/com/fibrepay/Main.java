package com.fibrepay;

import com.fibrepay.adapter.in.web.HttpServerVerticle;
import com.fibrepay.adapter.out.audit.AuditEventCodec;
import com.fibrepay.adapter.out.audit.AuditLogVerticle;
import com.fibrepay.domain.event.AuditEvent;
import com.fibrepay.infrastructure.config.ConfigLoader;
import com.fibrepay.infrastructure.config.JacksonConfig;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;

/**
 * Main application entry point
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        log.info("Starting Piecework Settlement Service...");

        // Write PID to file for easy process management
        writePidToFile();

        VertxOptions options = new VertxOptions()
                .setWorkerPoolSize(10)
                .setEventLoopPoolSize(5);

        Vertx vertx = Vertx.vertx(options);

        JacksonConfig.configure();

        vertx.eventBus().registerDefaultCodec(AuditEvent.class, new AuditEventCodec());
        log.info("Registered AuditEvent message codec");

        ConfigLoader.load(vertx)
                .compose(config -> vertx.deployVerticle(new AuditLogVerticle())
                        .compose(auditId -> vertx.deployVerticle(new HttpServerVerticle(), new DeploymentOptions()
                                .setConfig(config)
                                .setInstances(1))))
                .onSuccess(deploymentId -> {
                    log.info("HTTP Server Verticle deployed successfully: {}", deploymentId);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down Piecework Settlement Service...");
                        vertx.close();
                    }));

                    log.info("Piecework Settlement Service is ready!");
                })
                .onFailure(error -> {
                    log.error("Failed to start Piecework Settlement Service", error);
                    vertx.close();
                });
    }

    /**
     * Write the current process PID to a file for easy management
     */
    private static void writePidToFile() {
        try {
            String pid = String.valueOf(ProcessHandle.current().pid());
            try (FileWriter writer = new FileWriter("app.pid")) {
                writer.write(pid);
            }
            log.info("PID written to app.pid: {}", pid);
        } catch (IOException e) {
            log.warn("Failed to write PID to file: {}", e.getMessage());
        }
    }
}
