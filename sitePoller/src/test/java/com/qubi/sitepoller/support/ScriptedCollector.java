package com.qubi.sitepoller.support;

import com.qubi.sitepoller.core.model.DeviceKind;
import com.qubi.sitepoller.core.model.RawFields;
import com.qubi.sitepoller.core.spi.CollectException;
import com.qubi.sitepoller.core.spi.ProtocolCollector;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Collector de prueba: respuesta programada por address, registra el orden de llamadas. */
public class ScriptedCollector implements ProtocolCollector {

    @FunctionalInterface
    public interface Step {
        RawFields run(String address, String site) throws CollectException;
    }

    private final DeviceKind kind;
    private final Map<String, Step> steps = new HashMap<>();
    public final List<String> calls = new ArrayList<>();

    public ScriptedCollector(DeviceKind kind) { this.kind = kind; }

    public ScriptedCollector on(String address, Step step) { steps.put(address, step); return this; }

    @Override public DeviceKind kind() { return kind; }

    @Override
    public RawFields collect(String address, String site) throws CollectException {
        calls.add(site + "/" + address);
        Step step = steps.get(address);
        if (step == null) return new RawFields(site, address, List.of());
        return step.run(address, site);
    }
}
