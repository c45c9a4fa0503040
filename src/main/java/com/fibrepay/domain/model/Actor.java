package com.fibrepay.domain.model;

import java.util.Optional;

/**
 * The authenticated caller of an operation. Authentication happens upstream;
 * the core only checks which kind of actor it is talking to.
 */
public sealed interface Actor permits Actor.Admin, Actor.Supervisor {

    String userId();

    /**
     * Role name as it appears in audit records.
     */
    String role();

    record Admin(String userId) implements Actor {
        @Override
        public String role() {
            return "admin";
        }
    }

    /**
     * @param factoryId optional factory the supervisor is limited to, null when unscoped
     */
    record Supervisor(String userId, String factoryId) implements Actor {
        @Override
        public String role() {
            return "supervisor";
        }

        public Optional<String> factoryScope() {
            return Optional.ofNullable(factoryId);
        }
    }

    static Actor of(String userId, String role, String factoryId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if ("admin".equalsIgnoreCase(role)) {
            return new Admin(userId);
        }
        if ("supervisor".equalsIgnoreCase(role)) {
            return new Supervisor(userId, factoryId == null || factoryId.isBlank() ? null : factoryId);
        }
        throw new IllegalArgumentException("Unknown role: " + role);
    }
}
