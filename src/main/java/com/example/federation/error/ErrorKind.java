package com.example.federation.error;

import org.springframework.http.HttpStatus;

public enum ErrorKind {
    BAD_REQUEST(HttpStatus.BAD_REQUEST, "M_BAD_JSON"),
    MISSING_PARAM(HttpStatus.BAD_REQUEST, "M_MISSING_PARAM"),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "M_UNAUTHORIZED"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "M_NOT_FOUND"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "M_FORBIDDEN"),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR, "M_UNKNOWN");

    private final HttpStatus status;
    private final String errcode;

    ErrorKind(HttpStatus status, String errcode) {
        this.status = status;
        this.errcode = errcode;
    }

    public HttpStatus getStatus() { return status; }
    public String getErrcode() { return errcode; }
}
