package com.qubi.sitepoller.core.spi;

import com.qubi.sitepoller.core.model.DeviceKind;
import com.qubi.sitepoller.core.model.RawFields;

/**
 * Un collector por familia de protocolo. Cada llamada es un intento aislado:
 * la sesión/socket se abre y se libera dentro de {@link #collect}.
 */
public interface ProtocolCollector {

    DeviceKind kind();

    /**
     * Hace el poll de un device. Nunca devuelve campos parciales: ante un fallo
     * lanza {@link CollectException} con su clasificación.
     * Debe terminar en tiempo acotado (techo propio del protocolo).
     */
    RawFields collect(String address, String site) throws CollectException;
}
