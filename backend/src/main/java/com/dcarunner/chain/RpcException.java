package com.dcarunner.chain;

/**
 * Thrown when an RPC call fails (HTTP, JSON-RPC error, or unusable result).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
