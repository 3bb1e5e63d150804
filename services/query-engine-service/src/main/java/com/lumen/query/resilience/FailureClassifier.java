package com.lumen.query.resilience;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import org.springframework.web.client.ResourceAccessException;

public class FailureClassifier {
    private static final int MAX_CAUSE_DEPTH = 16;

    public FailureKind classify(Throwable error) {
        if (Thread.currentThread().isInterrupted()) {
            return FailureKind.CALLER_CANCELLED;
        }
        Throwable cause = error;
        for (int depth = 0; cause != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (isCancellation(cause)) {
                return FailureKind.CALLER_CANCELLED;
            }
            cause = cause.getCause();
        }
        if (error instanceof PermanentFailure) {
            return FailureKind.PERMANENT;
        }
        cause = error;
        for (int depth = 0; cause != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (isTransient(cause)) {
                return FailureKind.TRANSIENT;
            }
            cause = cause.getCause();
        }
        // bad input and programming errors fail the same way on every attempt
        return FailureKind.PERMANENT;
    }

    private boolean isCancellation(Throwable error) {
        if (error instanceof InterruptedException
            || error instanceof CancellationException
            || error instanceof CallerCancelledException) {
            return true;
        }
        // socket timeouts are the dependency being slow, not the caller giving up
        return error instanceof InterruptedIOException && !(error instanceof SocketTimeoutException);
    }

    private boolean isTransient(Throwable error) {
        return error instanceof TransientFailure
            || error instanceof IOException
            || error instanceof ResourceAccessException
            || error instanceof TimeoutException;
    }

    static RuntimeException propagate(Exception error) {
        if (error instanceof RuntimeException) {
            return (RuntimeException) error;
        }
        if (error instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new CallerCancelledException("interrupted", error);
        }
        return new GuardedCallException(error);
    }
}
