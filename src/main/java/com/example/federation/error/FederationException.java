package com.example.federation.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request-level failure. Rendered as {@code {errcode, error}} with the status of
 * its {@link ErrorKind}.
 */
public class FederationException extends RuntimeException {

    private final ErrorKind kind;

    public FederationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FederationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Map<String, Object> toBody() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("errcode", kind.getErrcode());
        body.put("error", getMessage());
        return body;
    }

    public static FederationException badRequest(String message) {
        return new FederationException(ErrorKind.BAD_REQUEST, message);
    }

    public static FederationException missingParam(String name) {
        return new FederationException(ErrorKind.MISSING_PARAM, name + " required");
    }

    public static FederationException notFound(String message) {
        return new FederationException(ErrorKind.NOT_FOUND, message);
    }

    public static FederationException forbidden(String message) {
        return new FederationException(ErrorKind.FORBIDDEN, message);
    }

    public static FederationException internal(String message, Throwable cause) {
        return new FederationException(ErrorKind.INTERNAL, message, cause);
    }
}
