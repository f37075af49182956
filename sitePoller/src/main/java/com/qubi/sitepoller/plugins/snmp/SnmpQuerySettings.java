package com.qubi.sitepoller.plugins.snmp;

import com.qubi.sitepoller.config.AppConfig;
import com.qubi.sitepoller.config.ConfigurationException;
import org.snmp4j.mp.SnmpConstants;

import java.util.ArrayList;
import java.util.List;

public record SnmpQuerySettings(
        String community,
        int version,          // SnmpConstants.version1 | version2c
        int port,
        long timeoutMillis,   // por intento
        int retries,          // reintentos extra, techo = timeout * (retries + 1)
        List<QueryObject> objects
) {
    public SnmpQuerySettings {
        objects = List.copyOf(objects);
        if (timeoutMillis <= 0) throw new ConfigurationException("query.timeoutMillis must be > 0");
        if (retries < 0) throw new ConfigurationException("query.retries must be >= 0");
    }

    public static SnmpQuerySettings from(AppConfig.QueryConfig q) {
        List<QueryObject> objs = new ArrayList<>();
        if (q.objects != null) for (var o : q.objects) objs.add(QueryObject.of(o.name, o.oid));
        return new SnmpQuerySettings(q.community, parseVersion(q.version), q.port, q.timeoutMillis, q.retries, objs);
    }

    static int parseVersion(String v) {
        if (v == null) return SnmpConstants.version2c;
        return switch (v.trim().toLowerCase(java.util.Locale.ROOT)) {
            case "1", "v1" -> SnmpConstants.version1;
            case "2", "2c", "v2c" -> SnmpConstants.version2c;
            default -> throw new ConfigurationException("Unsupported SNMP version '" + v + "' (use 1 or 2c)");
        };
    }

    public long ceilingMillis() {
        return timeoutMillis * (retries + 1L);
    }
}
