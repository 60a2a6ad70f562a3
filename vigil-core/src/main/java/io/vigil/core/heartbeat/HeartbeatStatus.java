package io.vigil.core.heartbeat;

public enum HeartbeatStatus {
    HEARTBEAT_OK,
    CHAT_YES,
    CHAT_NO
}
