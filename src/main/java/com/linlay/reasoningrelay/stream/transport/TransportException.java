package com.linlay.reasoningrelay.stream.transport;

/**
 * 从 provider 拉流时的连接、超时或非 2xx 失败。
 */
public class TransportException extends RuntimeException {

    private final Integer statusCode;

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    public TransportException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public Integer statusCode() {
        return statusCode;
    }
}
