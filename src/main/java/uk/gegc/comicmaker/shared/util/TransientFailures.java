package uk.gegc.comicmaker.shared.util;

import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.ResourceAccessException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies provider failures. Only timeout and connection class faults are retryable;
 * HTTP 4xx rejections (bad request, rate limit, auth) are not.
 */
public final class TransientFailures {

    private static final int MAX_CAUSE_DEPTH = 10;

    private TransientFailures() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof SocketTimeoutException
                    || current instanceof ConnectException
                    || current instanceof UnknownHostException
                    || current instanceof HttpTimeoutException
                    || current instanceof TimeoutException
                    || current instanceof ResourceAccessException
                    || current instanceof TransientAiException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
