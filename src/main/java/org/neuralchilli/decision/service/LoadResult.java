package org.neuralchilli.decision.service;

import java.util.Optional;

/**
 * Outcome of loading one kind: either the number of task records it produced or
 * the reason it could not be loaded.
 */
public sealed interface LoadResult {

    String kind();

    boolean isSuccess();

    Optional<String> error();

    record Loaded(String kind, int taskCount) implements LoadResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<String> error() {
            return Optional.empty();
        }
    }

    record Failed(String kind, String errorMessage) implements LoadResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<String> error() {
            return Optional.of(errorMessage);
        }
    }

    static LoadResult loaded(String kind, int taskCount) {
        return new Loaded(kind, taskCount);
    }

    static LoadResult failed(String kind, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new Failed(kind, message);
    }
}
