package org.example.simplifier.service.gateway;

public enum FailureKind {
    TIMEOUT,
    RATE_LIMITED,
    BACKEND_ERROR,
    INVALID_OUTPUT
}
