package com.musicbox.domain.exception;

/**
 * Excepción lanzada cuando falla la lectura o escritura del registro CSV de tags.
 */
public class CsvProcessingException extends RuntimeException {

    public CsvProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Excepción cuando no se puede escribir al archivo.
     */
    public static CsvProcessingException cannotWrite(String filePath, Throwable cause) {
        return new CsvProcessingException("No se puede escribir al archivo: " + filePath, cause);
    }

    /**
     * Excepción cuando no se puede crear el archivo.
     */
    public static CsvProcessingException cannotCreate(String filePath, Throwable cause) {
        return new CsvProcessingException("No se puede crear el archivo: " + filePath, cause);
    }
}
