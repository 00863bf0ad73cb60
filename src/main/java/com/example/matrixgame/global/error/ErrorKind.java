package com.example.matrixgame.global.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * The four failure kinds a core operation can raise. Only the transport layer
 * turns them into status codes.
 */
@Getter
public enum ErrorKind {
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INVALID_STATE(HttpStatus.BAD_REQUEST),
    PERMISSION_DENIED(HttpStatus.FORBIDDEN),
    CONFLICT(HttpStatus.CONFLICT);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }
}
