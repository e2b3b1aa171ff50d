package com.musicbox;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * NFC Music Box - Aplicación Principal
 * 
 * Backend de la caja de música:
 * - Lectura de tags NFC (lector serial o simulado)
 * - Asociación de tags con playlists mediante sesiones con timeout
 * - Registro de tags en CSV y playlists en MySQL
 * - Eventos en tiempo real por WebSocket
 */
@SpringBootApplication
public class MusicBoxApplication {

    public static void main(String[] args) {
        SpringApplication.run(MusicBoxApplication.class, args);
    }
}
