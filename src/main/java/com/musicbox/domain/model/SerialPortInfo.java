package com.musicbox.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Información de un puerto serial donde puede estar conectado el lector.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SerialPortInfo {

    /** Nombre del sistema del puerto (ej: COM3, /dev/ttyUSB0) */
    private String systemPortName;

    private String descriptivePortName;

    private boolean open;
}
