package com.troveindexer.ingestion.adapter;

/**
 * A ledger RPC call failed: transport error, unusable response, or a JSON-RPC error object. For the latter
 * {@link #getErrorCode()} and {@link #getErrorData()} carry the node's {@code error.code} and {@code error.data}.
 */
public class RpcException extends RuntimeException {

    private final Integer errorCode;
    private final String errorData;

    public RpcException(String message) {
        this(message, (Throwable) null);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = null;
        this.errorData = null;
    }

    public RpcException(String message, Integer errorCode, String errorData) {
        super(message);
        this.errorCode = errorCode;
        this.errorData = errorData;
    }

    public Integer getErrorCode() {
        return errorCode;
    }

    public String getErrorData() {
        return errorData;
    }

    /** True when the node answered with a JSON-RPC error rather than failing at the transport level. */
    public boolean isNodeError() {
        return errorCode != null;
    }
}
