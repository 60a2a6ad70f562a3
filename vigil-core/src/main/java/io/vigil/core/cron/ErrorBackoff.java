package io.vigil.core.cron;

public final class ErrorBackoff {
    private static final long[] DELAYS_MS = {30_000L, 60_000L, 300_000L, 900_000L, 3_600_000L};

    private ErrorBackoff() {
    }

    public static long delayMs(int consecutiveErrors) {
        int index = Math.min(Math.max(consecutiveErrors, 1) - 1, DELAYS_MS.length - 1);
        return DELAYS_MS[index];
    }
}
