package com.rolebind.common.infra;

/**
 * Error formatting utilities.
 */
public final class ErrorUtils {

    private ErrorUtils() {
    }

    /**
     * Format an exception message safely.
     *
     * @return a non-null human-readable error string
     */
    public static String formatErrorMessage(Throwable err) {
        if (err == null)
            return "Error";
        String msg = err.getMessage();
        if (msg != null && !msg.isEmpty()) {
            return msg;
        }
        return err.getClass().getSimpleName();
    }

    /**
     * Walk the cause chain and return the first throwable of the given type.
     */
    public static <T extends Throwable> T findCause(Throwable err, Class<T> type) {
        Throwable current = err;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = current.getCause();
        }
        return null;
    }
}
