package com.example.laborhours.export.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the template export pipeline.
 *
 * Example application.yml:
 *
 * export:
 *   templates:
 *     storage-dir: ./data/export-templates
 *     keys: [labor_hours]
 *   renderer:
 *     mode: libreoffice          # or "internal" for the in-process PDFBox renderer
 *     libreoffice-path: soffice
 *     pool-size: 2
 *     acquire-timeout: 30s
 *     render-timeout: 60s
 *   custom-fields: [sponsor, advisor]
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Component
@ConfigurationProperties(prefix = "export")
public class ExportProperties {

    private Templates templates = new Templates();

    private Renderer renderer = new Renderer();

    /**
     * Custom form field keys known at startup. More can be registered at runtime.
     */
    private List<String> customFields = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Templates {
        /**
         * Directory holding uploaded template bytes and their metadata sidecars
         */
        private String storageDir = "./data/export-templates";

        /**
         * Template keys the store accepts
         */
        private List<String> keys = new ArrayList<>(List.of("labor_hours"));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Renderer {
        private RendererMode mode = RendererMode.LIBREOFFICE;
        private String libreofficePath = "soffice";
        private String workDir = System.getProperty("java.io.tmpdir") + "/labor-hours-export";
        private int poolSize = 2;
        private Duration acquireTimeout = Duration.ofSeconds(30);
        private Duration renderTimeout = Duration.ofSeconds(60);
    }

    public enum RendererMode {
        LIBREOFFICE,
        INTERNAL
    }
}
