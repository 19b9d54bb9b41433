package dao.tron.claim.exception;

import lombok.Getter;

/**
 * Typed, non-fatal failure of a claim or administrative operation.
 */
@Getter
public class ClaimException extends RuntimeException {

    private final ClaimErrorKind kind;

    public ClaimException(ClaimErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ClaimException(ClaimErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
