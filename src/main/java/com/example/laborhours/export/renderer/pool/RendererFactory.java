package com.example.laborhours.export.renderer.pool;

/**
 * Creates fresh renderer handles for the pool, both initially and to replace
 * handles that crashed or timed out.
 */
public interface RendererFactory {

    RendererHandle create();

    String getName();
}
