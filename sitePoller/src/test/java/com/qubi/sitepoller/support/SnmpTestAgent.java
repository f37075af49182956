package com.qubi.sitepoller.support;

import org.snmp4j.CommandResponder;
import org.snmp4j.CommandResponderEvent;
import org.snmp4j.MessageException;
import org.snmp4j.PDU;
import org.snmp4j.Snmp;
import org.snmp4j.mp.StatusInformation;
import org.snmp4j.smi.Address;
import org.snmp4j.smi.Null;
import org.snmp4j.smi.OID;
import org.snmp4j.smi.UdpAddress;
import org.snmp4j.smi.Variable;
import org.snmp4j.smi.VariableBinding;
import org.snmp4j.transport.DefaultUdpTransportMapping;

import java.io.IOException;
import java.net.DatagramSocket;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Agente SNMP mínimo en loopback: responde GETs con los valores cargados y
 * noSuchObject para lo que no conoce. En modo v1 corta con errorStatus
 * noSuchName en el primer objeto desconocido, como un agente SNMPv1.
 */
public class SnmpTestAgent implements CommandResponder, AutoCloseable {

    private final Map<OID, Variable> values = new ConcurrentHashMap<>();
    private final AtomicInteger requests = new AtomicInteger();
    private final Snmp snmp;
    private final DefaultUdpTransportMapping transport;

    private final int port;
    private volatile boolean v1Errors;

    public SnmpTestAgent() throws IOException {
        port = findFreeUdpPort();
        transport = new DefaultUdpTransportMapping(new UdpAddress("127.0.0.1/" + port));
        snmp = new Snmp(transport);
        snmp.addCommandResponder(this);
        snmp.listen();
    }

    public SnmpTestAgent put(String oid, Variable value) { values.put(new OID(oid), value); return this; }

    public SnmpTestAgent v1Errors() { v1Errors = true; return this; }

    public int port() { return port; }

    public String address() { return "127.0.0.1:" + port(); }

    public int requests() { return requests.get(); }

    @Override
    public <A extends Address> void processPdu(CommandResponderEvent<A> e) {
        PDU request = e.getPDU();
        if (request == null || request.getType() != PDU.GET) return;
        requests.incrementAndGet();

        PDU response = new PDU();
        response.setType(PDU.RESPONSE);
        response.setRequestID(request.getRequestID());
        int index = 0;
        for (VariableBinding vb : request.getVariableBindings()) {
            index++;
            Variable v = values.get(vb.getOid());
            if (v == null && v1Errors) {
                response = v1NoSuchName(request, index);
                break;
            }
            response.add(new VariableBinding(vb.getOid(), v != null ? v : Null.noSuchObject));
        }
        try {
            e.getMessageDispatcher().returnResponsePdu(
                    e.getMessageProcessingModel(), e.getSecurityModel(), e.getSecurityName(),
                    e.getSecurityLevel(), response, e.getMaxSizeResponsePDU(),
                    e.getStateReference(), new StatusInformation());
            e.setProcessed(true);
        } catch (MessageException ex) {
            throw new IllegalStateException(ex);
        }
    }

    // v1: los bindings del request tal cual, con el índice (1-based) del objeto faltante
    private static PDU v1NoSuchName(PDU request, int index) {
        PDU response = new PDU();
        response.setType(PDU.RESPONSE);
        response.setRequestID(request.getRequestID());
        for (VariableBinding vb : request.getVariableBindings()) response.add(new VariableBinding(vb.getOid()));
        response.setErrorStatus(PDU.noSuchName);
        response.setErrorIndex(index);
        return response;
    }

    public static int findFreeUdpPort() throws IOException {
        try (DatagramSocket socket = new DatagramSocket(0)) {
            return socket.getLocalPort();
        }
    }

    @Override
    public void close() {
        try { snmp.close(); } catch (IOException ignored) {}
    }
}
