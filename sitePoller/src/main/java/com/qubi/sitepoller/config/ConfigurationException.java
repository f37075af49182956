package com.qubi.sitepoller.config;

/** Configuración inválida detectada al cargar; aborta el arranque. */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
