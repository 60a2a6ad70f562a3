package io.vigil.core.heartbeat;

public final class HeartbeatDedup {
    public static final long DEFAULT_WINDOW_MS = 24L * 60 * 60 * 1000;

    private final long windowMs;
    private String lastText;
    private long lastSentAt;

    public HeartbeatDedup() {
        this(DEFAULT_WINDOW_MS);
    }

    public HeartbeatDedup(long windowMs) {
        this.windowMs = windowMs;
    }

    public synchronized boolean isDuplicate(String text, long nowMs) {
        if (lastText == null || !lastText.equals(text)) {
            return false;
        }
        return nowMs - lastSentAt < windowMs;
    }

    public synchronized void record(String text, long nowMs) {
        lastText = text;
        lastSentAt = nowMs;
    }
}
