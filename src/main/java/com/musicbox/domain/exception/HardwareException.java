package com.musicbox.domain.exception;

/**
 * Excepción lanzada cuando el lector NFC no se puede arrancar o detener.
 */
public class HardwareException extends RuntimeException {

    public HardwareException(String message) {
        super(message);
    }

    public HardwareException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Excepción cuando el puerto no se puede abrir.
     */
    public static HardwareException cannotOpen(String portName) {
        return new HardwareException("No se puede abrir el puerto: " + portName);
    }

    /**
     * Excepción cuando el puerto no existe.
     */
    public static HardwareException portNotFound(String portName) {
        return new HardwareException("Puerto no encontrado: " + portName);
    }

    /**
     * Excepción cuando no se configuró ningún puerto para el lector.
     */
    public static HardwareException portNotConfigured() {
        return new HardwareException("No hay puerto serial configurado (serial.port-name)");
    }
}
