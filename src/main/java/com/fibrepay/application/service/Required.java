package com.fibrepay.application.service;

import io.vertx.core.Future;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Turns an optional lookup result into a future that fails when the value is absent
 */
final class Required {

    private Required() {
    }

    static <T> Future<T> present(Optional<T> value, Supplier<? extends RuntimeException> whenAbsent) {
        return value.map(Future::succeededFuture).orElseGet(() -> Future.failedFuture(whenAbsent.get()));
    }
}
