package uz.greenwhite.federation.proxy;

public enum ConnectionStatus {
    /**
     * Handshake in progress. The HTTP transport has no handshake, so records start ACTIVE.
     */
    CONNECTING,
    ACTIVE,
    IDLE,
    DEGRADED,
    BROKEN,
    CLOSING;

    public boolean isUsable() {
        return this == ACTIVE || this == IDLE || this == DEGRADED;
    }
}
