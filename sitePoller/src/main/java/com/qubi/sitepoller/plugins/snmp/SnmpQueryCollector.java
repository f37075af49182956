package com.qubi.sitepoller.plugins.snmp;

import com.qubi.sitepoller.core.model.DeviceKind;
import com.qubi.sitepoller.core.model.ErrorKind;
import com.qubi.sitepoller.core.model.RawFields;
import com.qubi.sitepoller.core.spi.CollectException;
import com.qubi.sitepoller.core.spi.ProtocolCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snmp4j.CommunityTarget;
import org.snmp4j.PDU;
import org.snmp4j.Snmp;
import org.snmp4j.event.ResponseEvent;
import org.snmp4j.smi.Address;
import org.snmp4j.smi.Counter64;
import org.snmp4j.smi.GenericAddress;
import org.snmp4j.smi.Integer32;
import org.snmp4j.smi.Null;
import org.snmp4j.smi.OctetString;
import org.snmp4j.smi.UnsignedInteger32;
import org.snmp4j.smi.Variable;
import org.snmp4j.smi.VariableBinding;
import org.snmp4j.transport.DefaultUdpTransportMapping;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * GET de un set fijo de OIDs en un solo PDU (más reintentos sin los objetos
 * que un agente v1 reporta como noSuchName). Cada collect abre su propio
 * transporte UDP y lo cierra antes de volver.
 */
public class SnmpQueryCollector implements ProtocolCollector {

    private static final Logger log = LoggerFactory.getLogger(SnmpQueryCollector.class);

    private final SnmpQuerySettings settings;

    public SnmpQueryCollector(SnmpQuerySettings settings) {
        this.settings = settings;
    }

    @Override
    public DeviceKind kind() {
        return DeviceKind.QUERY;
    }

    @Override
    public RawFields collect(String address, String site) throws CollectException {
        Address target = resolve(address);
        List<QueryObject> pending = new ArrayList<>(settings.objects());

        Snmp snmp = null;
        try {
            snmp = new Snmp(new DefaultUdpTransportMapping());
            snmp.listen();
            CommunityTarget<Address> communityTarget = communityTarget(target);

            // SNMPv1 no tiene noSuchObject: el agente corta con noSuchName y el índice
            // del objeto ausente. Se lo saca y se repite el GET; cada vuelta quita uno.
            while (true) {
                log.debug("[snmp] GET {} oids from {} ({}), ceiling {}ms",
                        pending.size(), address, site, settings.ceilingMillis());
                ResponseEvent<Address> event = snmp.send(buildRequest(pending), communityTarget);
                PDU response = checkResponse(event, address);

                int missing = missingObjectIndex(response, pending.size());
                if (missing < 0) {
                    checkErrorStatus(response, address);
                    return RawFields.named(site, address, toValues(pending, response));
                }
                QueryObject gone = pending.remove(missing);
                log.debug("[snmp] {} ({}) not present on {}, retrying without it", gone.name(), gone.oid(), address);
                if (pending.isEmpty()) return RawFields.named(site, address, Map.of());
            }
        } catch (IOException e) {
            throw new CollectException(ErrorKind.CONNECTIVITY_TIMEOUT,
                    "SNMP transport failure talking to " + address + ": " + e.getMessage(), e);
        } finally {
            close(snmp, address);
        }
    }

    private Address resolve(String address) throws CollectException {
        String host = address;
        int port = settings.port();
        int colon = address.lastIndexOf(':');
        // host:port, sólo si no es IPv6 literal
        if (colon > 0 && address.indexOf(':') == colon) {
            host = address.substring(0, colon);
            try {
                port = Integer.parseInt(address.substring(colon + 1));
            } catch (NumberFormatException e) {
                throw new CollectException(ErrorKind.CONFIGURATION_ERROR, "Invalid port in address '" + address + "'");
            }
        }
        Address parsed = GenericAddress.parse("udp:" + host + "/" + port);
        if (parsed == null || !parsed.isValid())
            throw new CollectException(ErrorKind.CONNECTIVITY_TIMEOUT, "Cannot resolve SNMP address '" + address + "'");
        return parsed;
    }

    private static PDU buildRequest(List<QueryObject> objects) {
        PDU pdu = new PDU();
        pdu.setType(PDU.GET);
        for (QueryObject o : objects) pdu.add(new VariableBinding(o.oid()));
        return pdu;
    }

    private CommunityTarget<Address> communityTarget(Address address) {
        CommunityTarget<Address> target = new CommunityTarget<>();
        target.setCommunity(new OctetString(settings.community()));
        target.setAddress(address);
        target.setVersion(settings.version());
        target.setTimeout(settings.timeoutMillis());
        target.setRetries(settings.retries());
        return target;
    }

    private PDU checkResponse(ResponseEvent<Address> event, String address) throws CollectException {
        if (event == null || event.getResponse() == null) {
            if (event != null && event.getError() != null) {
                throw new CollectException(ErrorKind.CONNECTIVITY_TIMEOUT,
                        "SNMP request to " + address + " failed: " + event.getError().getMessage(), event.getError());
            }
            throw new CollectException(ErrorKind.CONNECTIVITY_TIMEOUT,
                    "No SNMP response from " + address + " after " + (settings.retries() + 1) + " tries");
        }
        PDU response = event.getResponse();
        if (response.getType() == PDU.REPORT)
            throw new CollectException(ErrorKind.PROTOCOL_ERROR, "SNMP report PDU from " + address + ": " + response);
        return response;
    }

    /** Posición (0-based) del objeto que el agente reportó como noSuchName, o -1. */
    static int missingObjectIndex(PDU response, int requested) {
        if (response.getErrorStatus() != PDU.noSuchName) return -1;
        int index = response.getErrorIndex();
        return (index >= 1 && index <= requested) ? index - 1 : -1;
    }

    private static void checkErrorStatus(PDU response, String address) throws CollectException {
        if (response.getErrorStatus() != PDU.noError)
            throw new CollectException(ErrorKind.PROTOCOL_ERROR, "SNMP error from " + address + ": "
                    + response.getErrorStatusText() + " (index " + response.getErrorIndex() + ")");
    }

    /**
     * Aparea cada nombre declarado con su valor en orden de request. Los objetos
     * sin valor (null, noSuchObject, noSuchInstance, endOfMibView) no se emiten.
     */
    static Map<String, String> toValues(List<QueryObject> objects, PDU response) throws CollectException {
        List<? extends VariableBinding> vbs = response.getVariableBindings();
        if (vbs == null || vbs.size() != objects.size())
            throw new CollectException(ErrorKind.PROTOCOL_ERROR, "Expected " + objects.size()
                    + " variable bindings, got " + (vbs == null ? 0 : vbs.size()));

        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i < objects.size(); i++) {
            QueryObject requested = objects.get(i);
            VariableBinding vb = vbs.get(i);
            if (vb == null) continue;
            if (vb.getOid() != null && !requested.oid().equals(vb.getOid()))
                throw new CollectException(ErrorKind.PROTOCOL_ERROR, "Response binding " + i + " is "
                        + vb.getOid() + ", requested " + requested.oid());

            Variable v = vb.getVariable();
            if (v == null || v instanceof Null || v.isException()) {
                log.debug("[snmp] {} ({}) returned no value", requested.name(), requested.oid());
                continue;
            }
            out.put(requested.name(), asText(v));
        }
        return out;
    }

    // TimeTicks/Counter/Gauge como número plano; su toString() no sirve para el extractor
    private static String asText(Variable v) {
        if (v instanceof Counter64) {
            // 64 bits sin signo: toLong() da negativo desde 2^63
            return Long.toUnsignedString(((Counter64) v).getValue());
        }
        if (v instanceof Integer32 || v instanceof UnsignedInteger32) {
            return String.valueOf(v.toLong());
        }
        return v.toString();
    }

    private static void close(Snmp snmp, String address) {
        if (snmp == null) return;
        try {
            snmp.close();
        } catch (IOException e) {
            log.warn("[snmp] error closing session for {}: {}", address, e.toString());
        }
    }
}
