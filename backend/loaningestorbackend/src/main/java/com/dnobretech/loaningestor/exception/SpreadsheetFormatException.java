package com.dnobretech.loaningestor.exception;

/** Arquivo enviado não é uma planilha legível: fatal para o lote (HTTP 400). */
public class SpreadsheetFormatException extends IllegalArgumentException {

    public SpreadsheetFormatException(String message) {
        super(message);
    }

    public SpreadsheetFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
