package org.example.simplifier.service.gateway;

import java.util.Objects;

/**
 * Result of one gateway operation after its retry budget: either the produced text or the kind of the
 * last failure. Callers turn failures into content-preserving text through {@link FallbackPolicy}.
 */
public final class GatewayOutcome {

    private final String text;
    private final FailureKind failureKind;
    private final String detail;
    private final int attempts;

    private GatewayOutcome(String text, FailureKind failureKind, String detail, int attempts) {
        this.text = text;
        this.failureKind = failureKind;
        this.detail = detail;
        this.attempts = attempts;
    }

    public static GatewayOutcome success(String text) {
        return success(text, 1);
    }

    public static GatewayOutcome success(String text, int attempts) {
        return new GatewayOutcome(Objects.requireNonNull(text, "text"), null, null, attempts);
    }

    public static GatewayOutcome failure(FailureKind kind, String detail) {
        return failure(kind, detail, 1);
    }

    public static GatewayOutcome failure(FailureKind kind, String detail, int attempts) {
        return new GatewayOutcome(null, Objects.requireNonNull(kind, "kind"), detail, attempts);
    }

    public boolean isSuccess() {
        return failureKind == null;
    }

    public String text() {
        if (!isSuccess()) {
            throw new IllegalStateException("No text on a failed outcome: " + failureKind);
        }
        return text;
    }

    public FailureKind failureKind() {
        return failureKind;
    }

    public String detail() {
        return detail;
    }

    public int attempts() {
        return attempts;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "GatewayOutcome[success, attempts=" + attempts + "]"
                : "GatewayOutcome[" + failureKind + ", attempts=" + attempts + ", detail=" + detail + "]";
    }
}
