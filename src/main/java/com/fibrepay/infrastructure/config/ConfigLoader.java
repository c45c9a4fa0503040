package com.fibrepay.infrastructure.config;

import io.vertx.config.ConfigRetriever;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads application.yml from the classpath and applies environment overrides.
 *
 * <p>Recognised variables: HTTP_PORT, DATABASE_URL, DATABASE_DRIVER_CLASS,
 * DATABASE_USER, DATABASE_PASSWORD, DATABASE_MAX_POOL_SIZE.
 */
@Slf4j
public final class ConfigLoader {

    public static final String DEFAULT_CONFIG = "application.yml";

    private ConfigLoader() {
    }

    public static Future<JsonObject> load(Vertx vertx) {
        return load(vertx, DEFAULT_CONFIG);
    }

    public static Future<JsonObject> load(Vertx vertx, String path) {
        ConfigStoreOptions yamlStore = new ConfigStoreOptions()
                .setType("file")
                .setFormat("yaml")
                .setConfig(new JsonObject().put("path", path));

        ConfigStoreOptions envStore = new ConfigStoreOptions()
                .setType("env")
                .setOptional(true)
                .setConfig(new JsonObject().put("keys", new JsonArray()
                        .add("HTTP_PORT")
                        .add("DATABASE_URL")
                        .add("DATABASE_DRIVER_CLASS")
                        .add("DATABASE_USER")
                        .add("DATABASE_PASSWORD")
                        .add("DATABASE_MAX_POOL_SIZE")));

        ConfigRetriever retriever = ConfigRetriever.create(vertx, new ConfigRetrieverOptions()
                .setScanPeriod(0)
                .addStore(yamlStore)
                .addStore(envStore));

        return retriever.getConfig()
                .map(ConfigLoader::applyEnvironment)
                .onSuccess(config -> log.info("Loaded configuration from {}", path))
                .onFailure(error -> log.error("Failed to load {}: {}", path, error.getMessage()))
                .onComplete(ar -> retriever.close());
    }

    static JsonObject applyEnvironment(JsonObject raw) {
        JsonObject config = raw.copy();
        JsonObject http = config.getJsonObject("http", new JsonObject());
        JsonObject database = config.getJsonObject("database", new JsonObject());

        if (raw.containsKey("HTTP_PORT")) {
            http.put("port", Integer.parseInt(raw.getValue("HTTP_PORT").toString()));
        }
        copy(raw, "DATABASE_URL", database, "url");
        copy(raw, "DATABASE_DRIVER_CLASS", database, "driver_class");
        copy(raw, "DATABASE_USER", database, "user");
        copy(raw, "DATABASE_PASSWORD", database, "password");
        if (raw.containsKey("DATABASE_MAX_POOL_SIZE")) {
            database.put("max_pool_size", Integer.parseInt(raw.getValue("DATABASE_MAX_POOL_SIZE").toString()));
        }

        config.put("http", http);
        config.put("database", database);
        return config;
    }

    private static void copy(JsonObject source, String sourceKey, JsonObject target, String targetKey) {
        if (source.containsKey(sourceKey)) {
            target.put(targetKey, source.getValue(sourceKey).toString());
        }
    }
}
