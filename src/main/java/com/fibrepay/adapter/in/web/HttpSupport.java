package com.fibrepay.adapter.in.web;

import com.fibrepay.domain.exception.PieceworkException;
import com.fibrepay.domain.exception.ValidationException;
import com.fibrepay.domain.model.Actor;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Request parsing and response writing shared by the handlers
 */
@Slf4j
public final class HttpSupport {

    public static final String HEADER_USER_ID = "X-User-Id";
    public static final String HEADER_USER_ROLE = "X-User-Role";
    public static final String HEADER_FACTORY_ID = "X-Factory-Id";

    private HttpSupport() {
    }

    /**
     * The caller as identified by the upstream gateway headers
     * @throws UnauthenticatedException when the headers are missing or name an unknown role
     */
    public static Actor actor(RoutingContext context) {
        String userId = context.request().getHeader(HEADER_USER_ID);
        String role = context.request().getHeader(HEADER_USER_ROLE);
        String factoryId = context.request().getHeader(HEADER_FACTORY_ID);
        try {
            return Actor.of(userId, role, factoryId);
        } catch (IllegalArgumentException e) {
            throw new UnauthenticatedException(e.getMessage());
        }
    }

    /**
     * Map the request body to a DTO
     * @throws ValidationException when the body is missing or malformed
     */
    public static <T> T body(RoutingContext context, Class<T> type) {
        JsonObject json;
        try {
            json = context.body().asJsonObject();
        } catch (DecodeException e) {
            throw new ValidationException("Request body is not valid JSON");
        }
        if (json == null) {
            throw new ValidationException("Request body is required");
        }
        try {
            return json.mapTo(type);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid request format: " + rootMessage(e));
        }
    }

    public static LocalDate queryDate(RoutingContext context, String name) {
        String value = context.queryParams().get(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new ValidationException(name + " must be in ISO format (YYYY-MM-DD)");
        }
    }

    public static String queryString(RoutingContext context, String name) {
        String value = context.queryParams().get(name);
        return value == null || value.isBlank() ? null : value;
    }

    public static int queryInt(RoutingContext context, String name, int defaultValue) {
        String value = context.queryParams().get(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ValidationException(name + " must be an integer");
        }
    }

    public static void sendSuccess(RoutingContext context, int statusCode, Object data) {
        send(context, statusCode, ApiResponse.success(data));
    }

    public static void sendError(RoutingContext context, Throwable error) {
        if (error instanceof ValidationException validation) {
            send(context, 400, ApiResponse.error(validation.getMessage(), validation.getErrors()));
        } else if (error instanceof PieceworkException piecework) {
            send(context, piecework.getErrorCode().getHttpStatus(), ApiResponse.error(piecework.getMessage()));
        } else if (error instanceof UnauthenticatedException) {
            send(context, 401, ApiResponse.error(error.getMessage()));
        } else {
            log.error("Unhandled error on {} {}", context.request().method(), context.request().path(), error);
            send(context, 500, ApiResponse.error("Internal server error"));
        }
    }

    private static void send(RoutingContext context, int statusCode, ApiResponse response) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(Json.encode(response));
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }

    /**
     * Missing or unusable identity headers
     */
    public static class UnauthenticatedException extends RuntimeException {
        public UnauthenticatedException(String message) {
            super(message);
        }
    }
}
