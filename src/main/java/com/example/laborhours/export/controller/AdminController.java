package com.example.laborhours.export.controller;

import com.example.laborhours.export.renderer.pool.RendererPool;
import com.example.laborhours.export.service.CacheInspectionService;
import com.example.laborhours.export.service.CustomFieldRegistry;
import com.example.laborhours.export.service.TemplateStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Operational endpoints: template cache, renderer pool and custom field set.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {
    private final CacheInspectionService inspectionService;
    private final RendererPool rendererPool;
    private final CustomFieldRegistry customFieldRegistry;

    @GetMapping("/cache")
    public ResponseEntity<?> inspectTemplateCache() {
        return ResponseEntity.ok(inspectionService.inspectCache(TemplateStore.CACHE_NAME));
    }

    @DeleteMapping("/cache")
    public ResponseEntity<?> clearTemplateCache() {
        if (!inspectionService.clearCache(TemplateStore.CACHE_NAME)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok().build();
    }

    @GetMapping("/renderer-pool")
    public ResponseEntity<Map<String, Object>> rendererPool() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("size", rendererPool.getSize());
        out.put("availablePermits", rendererPool.getAvailablePermits());
        out.put("idleHandles", rendererPool.getIdleCount());
        out.put("createdHandles", rendererPool.getCreatedCount());
        out.put("discardedHandles", rendererPool.getDiscardedCount());
        return ResponseEntity.ok(out);
    }

    @GetMapping("/custom-fields")
    public ResponseEntity<Set<String>> customFields() {
        return ResponseEntity.ok(customFieldRegistry.snapshot());
    }

    /**
     * Registers a custom form field. Exports pick it up immediately; stored
     * issue lists refresh on the next revalidation.
     */
    @PostMapping("/custom-fields/{fieldKey}")
    public ResponseEntity<Set<String>> registerCustomField(@PathVariable String fieldKey) {
        customFieldRegistry.register(fieldKey);
        return ResponseEntity.ok(customFieldRegistry.snapshot());
    }
}
