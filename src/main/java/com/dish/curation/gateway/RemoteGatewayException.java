package com.dish.curation.gateway;

/**
 * Failure reported by a {@link RemoteDataGateway} call. Carries an HTTP-style
 * status (0 when the request never produced a response) and the remote message.
 */
public class RemoteGatewayException extends RuntimeException {

    public static final int STATUS_UNREACHABLE = 0;
    public static final int STATUS_NOT_FOUND = 404;
    public static final int STATUS_CONFLICT = 409;

    private final int status;
    private final String remoteMessage;

    public RemoteGatewayException(int status, String remoteMessage) {
        super("HTTP " + status + ": " + remoteMessage);
        this.status = status;
        this.remoteMessage = remoteMessage;
    }

    public RemoteGatewayException(int status, String remoteMessage, Throwable cause) {
        super("HTTP " + status + ": " + remoteMessage, cause);
        this.status = status;
        this.remoteMessage = remoteMessage;
    }

    public int getStatus() {
        return status;
    }

    public String getRemoteMessage() {
        return remoteMessage;
    }

    public boolean isNotFound() {
        return status == STATUS_NOT_FOUND;
    }

    public boolean isConflict() {
        return status == STATUS_CONFLICT;
    }

    /**
     * Message suitable for showing to a curator.
     */
    public String getUserMessage() {
        if (status == STATUS_UNREACHABLE) {
            return "The server could not be reached: " + remoteMessage;
        }
        return "The server rejected the request (" + status + "): " + remoteMessage;
    }
}
