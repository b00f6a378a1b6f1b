package com.gbu.courseplatform.modules.enrollment;

import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Runs a transactional service call under the persistence retry policy. The
 * call must open its own transaction so that each attempt starts clean.
 */
@Component
@RequiredArgsConstructor
public class PersistenceRetry {

    private final Retry persistenceRetryPolicy;

    public <T> T execute(Supplier<T> transactionalCall) {
        return Retry.decorateSupplier(persistenceRetryPolicy, transactionalCall).get();
    }
}
