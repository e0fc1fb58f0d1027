package com.example.finstatement.exception;

/** An uploaded workbook or PDF could not be decoded. */
public class DocumentReadException extends RuntimeException {

    public DocumentReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
