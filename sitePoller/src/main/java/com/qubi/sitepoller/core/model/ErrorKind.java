package com.qubi.sitepoller.core.model;

public enum ErrorKind {
    CONNECTIVITY_TIMEOUT,   // device inalcanzable o se venció el techo de espera
    PROTOCOL_ERROR,         // respuesta inesperada o mal formada
    STRUCTURE_ERROR,        // respondió, pero falta la región/objeto esperado
    PARSE_ERROR,            // un campo no es numérico; se omite sólo ese campo
    CONFIGURATION_ERROR     // kind desconocido o métrica no registrada
}
