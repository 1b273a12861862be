package com.orderflow.common.kafka.delivery;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Result of handling one consumed record.
 *
 * @param success   whether the handler applied the record
 * @param retryable whether another attempt could succeed; deterministic failures such as an
 *                  unreadable payload are not retryable
 * @param message   human readable summary
 * @param detail    stack trace of the failure, if any
 * @param payload   domain object the handler produced, if any
 */
public record ProcessingOutcome(
        boolean success,
        boolean retryable,
        String message,
        String detail,
        Object payload
) {

    public static ProcessingOutcome succeeded(String message) {
        return new ProcessingOutcome(true, false, message, null, null);
    }

    public static ProcessingOutcome succeeded(String message, Object payload) {
        return new ProcessingOutcome(true, false, message, null, payload);
    }

    public static ProcessingOutcome failed(String message) {
        return new ProcessingOutcome(false, true, message, null, null);
    }

    public static ProcessingOutcome failed(String message, Throwable cause) {
        return new ProcessingOutcome(false, true, message, stackTraceOf(cause), null);
    }

    public static ProcessingOutcome rejected(String message) {
        return new ProcessingOutcome(false, false, message, null, null);
    }

    public static ProcessingOutcome rejected(String message, Throwable cause) {
        return new ProcessingOutcome(false, false, message, stackTraceOf(cause), null);
    }

    static String stackTraceOf(Throwable cause) {
        if (cause == null) {
            return null;
        }
        StringWriter out = new StringWriter();
        cause.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}
