package com.example.laborhours.export.config;

import com.example.laborhours.export.renderer.LibreOfficeRendererFactory;
import com.example.laborhours.export.renderer.PdfBoxRendererFactory;
import com.example.laborhours.export.renderer.pool.RendererFactory;
import com.example.laborhours.export.renderer.pool.RendererPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

/**
 * Wires the renderer pool for the configured renderer mode.
 */
@Slf4j
@Configuration
public class RendererConfiguration {

    @Bean
    public RendererFactory rendererFactory(ExportProperties properties) {
        ExportProperties.Renderer renderer = properties.getRenderer();
        if (renderer.getMode() == ExportProperties.RendererMode.INTERNAL) {
            log.info("Using the in-process PDFBox renderer");
            return new PdfBoxRendererFactory();
        }
        log.info("Using LibreOffice at '{}' with work dir {}", renderer.getLibreofficePath(), renderer.getWorkDir());
        return new LibreOfficeRendererFactory(renderer.getLibreofficePath(), Paths.get(renderer.getWorkDir()));
    }

    @Bean(destroyMethod = "close")
    public RendererPool rendererPool(RendererFactory rendererFactory, ExportProperties properties) {
        ExportProperties.Renderer renderer = properties.getRenderer();
        return new RendererPool(rendererFactory, renderer.getPoolSize(), renderer.getAcquireTimeout());
    }
}
