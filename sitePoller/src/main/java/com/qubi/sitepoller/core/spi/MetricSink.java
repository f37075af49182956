package com.qubi.sitepoller.core.spi;

public interface MetricSink {
    /**
     * Setea el último valor de una métrica (sin historia). Seguro ante llamadas concurrentes.
     * @return false si el nombre no está en el catálogo; se reporta y se ignora.
     */
    boolean publish(String name, double value);
}
