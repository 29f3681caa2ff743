package com.baykanat.insider.funnel.domain.exception;

/** Event Store'a gitmeden reddedilen istemci hatası; GlobalExceptionHandler 400 ve alan adını döner. */
public class InvalidQueryParameterException extends RuntimeException {

    private final String field;

    public InvalidQueryParameterException(String field, String message) {
        super(message);
        this.field = field;
    }

    public InvalidQueryParameterException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
