package com.qubi.sitepoller.core.runtime;

import com.qubi.sitepoller.core.model.Device;
import com.qubi.sitepoller.core.model.DeviceKind;
import com.qubi.sitepoller.core.spi.ProtocolCollector;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Elige el collector por el kind declarado del device. */
public class CollectorRouter {
    private final Map<DeviceKind, ProtocolCollector> collectors = new EnumMap<>(DeviceKind.class);

    public CollectorRouter(List<ProtocolCollector> cs) {
        for (var c : cs) {
            if (collectors.putIfAbsent(c.kind(), c) != null)
                throw new IllegalArgumentException("Two collectors registered for " + c.kind());
        }
    }

    /** Vacío si el kind es desconocido o no hay collector para él. */
    public Optional<ProtocolCollector> resolve(Device device) {
        return device.deviceKind().map(collectors::get);
    }
}
