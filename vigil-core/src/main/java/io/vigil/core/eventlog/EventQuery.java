package io.vigil.core.eventlog;

public record EventQuery(long afterSeq, int limit, String type) {

    public EventQuery {
        afterSeq = Math.max(0, afterSeq);
        limit = limit <= 0 ? Integer.MAX_VALUE : limit;
        type = type == null || type.isBlank() ? null : type;
    }

    public static EventQuery all() {
        return new EventQuery(0, 0, null);
    }

    public static EventQuery after(long afterSeq) {
        return new EventQuery(afterSeq, 0, null);
    }

    public static EventQuery ofType(String type) {
        return new EventQuery(0, 0, type);
    }

    public EventQuery withLimit(int limit) {
        return new EventQuery(afterSeq, limit, type);
    }

    public boolean matches(EventLogEntry entry) {
        return entry.seq() > afterSeq && (type == null || type.equals(entry.type()));
    }
}
