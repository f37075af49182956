package com.qubi.sitepoller.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    /** Pausa entre el fin de un ciclo y el inicio del siguiente (no es período fijo). */
    public int cadenceSeconds = 60;
    public ExpositionConfig exposition = new ExpositionConfig();
    public ScrapeConfig scrape = new ScrapeConfig();
    public QueryConfig query = new QueryConfig();

    /** site -> device -> {kind, address}; el orden del YAML es el orden de poll. */
    public LinkedHashMap<String, LinkedHashMap<String, DeviceConfig>> sites = new LinkedHashMap<>();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExpositionConfig {
        public int port = 8000;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DeviceConfig {
        public String kind;        // scrape | query
        public String address;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ScrapeConfig {
        /** Clase CSS de las regiones label/valor. */
        public String contentClass = "tile";
        public int blockCount = 2;
        /** Techo de espera por las regiones (y del page load). */
        public int waitSeconds = 45;
        public String chromeDriverPath;            // opcional: webdriver.chrome.driver
        public String browserBinary;               // opcional: chrome/chromium
        public List<String> browserArgs = new ArrayList<>(List.of(
                "--headless=new", "--no-sandbox", "--disable-gpu", "--disable-dev-shm-usage"));
        /** Sufijos en el orden de los valores de la página. */
        public List<String> schema = new ArrayList<>();
        /** Sufijos discretos (estados) que no se publican. */
        public List<String> exclude = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QueryConfig {
        public String community = "public";
        public String version = "2c";              // 1 | 2c
        public int port = 161;
        public long timeoutMillis = 5000;
        public int retries = 2;
        public List<ObjectConfig> objects = new ArrayList<>();
        public List<String> exclude = new ArrayList<>();

        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class ObjectConfig {
            public String name;                    // sufijo de métrica
            public String oid;                     // dotted, ej 1.3.6.1.2.1.33.1.2.5.0
        }
    }
}
