package com.deck.mirror.remote;

/**
 * Failure talking to the remote card service: an HTTP error status, a transport
 * failure or a timeout. Remote calls are never retried automatically.
 */
public class RemoteException extends RuntimeException {

    /** Status used for failures that never produced an HTTP response. */
    public static final int TRANSPORT_FAILURE = 0;

    private final int status;
    private final String body;

    public RemoteException(int status, String body, String message) {
        super(message);
        this.status = status;
        this.body = body != null ? body : "";
    }

    public RemoteException(String message, Throwable cause) {
        super(message, cause);
        this.status = TRANSPORT_FAILURE;
        this.body = "";
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    public boolean isTransportFailure() {
        return status == TRANSPORT_FAILURE;
    }
}
