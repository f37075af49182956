package com.qubi.sitepoller.plugins.snmp;

import org.snmp4j.smi.OID;

public record QueryObject(
        String name,          // sufijo de métrica, ej. "battery_voltage"
        OID oid
) {
    public static QueryObject of(String name, String dotted) {
        return new QueryObject(name, new OID(dotted.trim()));
    }
}
