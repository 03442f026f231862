package io.github.hide212131.langchain4j.atelier.runtime.provider;

import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps arbitrary client failures onto {@link ProviderFault}.
 *
 * <p>HTTP status codes are discovered reflectively on the cause chain so that any client library exposing a
 * {@code statusCode()} accessor is understood. Messages are scanned for the markers backends put into
 * overload and rate-limit errors.</p>
 */
public final class FaultClassifier {

    private static final int MAX_CAUSE_DEPTH = 10;

    private FaultClassifier() {
    }

    public static ProviderFault classify(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof ProviderException providerException) {
                return providerException.fault();
            }
            Integer status = statusCode(current);
            if (status != null) {
                return fromStatus(status);
            }
            ProviderFault byMessage = fromMessage(current);
            if (byMessage != null) {
                return byMessage;
            }
            if (current instanceof SocketTimeoutException
                    || current instanceof HttpTimeoutException
                    || current instanceof TimeoutException) {
                return ProviderFault.SERVER_ERROR;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return ProviderFault.FATAL;
    }

    static ProviderFault fromStatus(int status) {
        if (status == 429) {
            return ProviderFault.RATE_LIMITED;
        }
        if (status == 503 || status == 529) {
            return ProviderFault.OVERLOADED;
        }
        if (status >= 500 && status < 600) {
            return ProviderFault.SERVER_ERROR;
        }
        return ProviderFault.FATAL;
    }

    private static ProviderFault fromMessage(Throwable error) {
        String simpleName = error.getClass().getSimpleName();
        if (simpleName.contains("RateLimit")) {
            return ProviderFault.RATE_LIMITED;
        }
        String message = error.getMessage();
        if (message == null) {
            return null;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("rate_limit") || normalized.contains("rate limit")
                || normalized.contains("too many requests")) {
            return ProviderFault.RATE_LIMITED;
        }
        if (normalized.contains("overloaded")) {
            return ProviderFault.OVERLOADED;
        }
        if (normalized.contains("server_error") || normalized.contains("internal server error")
                || normalized.contains("service unavailable")) {
            return ProviderFault.SERVER_ERROR;
        }
        return null;
    }

    private static Integer statusCode(Throwable error) {
        for (String accessor : new String[] {"statusCode", "status"}) {
            try {
                Method method = error.getClass().getMethod(accessor);
                Object value = method.invoke(error);
                if (value instanceof Number number && number.intValue() >= 100) {
                    return number.intValue();
                }
            } catch (ReflectiveOperationException | RuntimeException ignored) {
                // accessor absent on this exception type
            }
        }
        return null;
    }
}
