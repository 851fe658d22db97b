package com.example.laborhours.export.renderer.pool;

import com.example.laborhours.export.model.RenderJob;

/**
 * One converter instance. A handle runs at most one job at a time; the pool
 * guarantees this, implementations need not.
 */
public interface RendererHandle extends AutoCloseable {

    String getId();

    /**
     * Converts the job's workbook to PDF bytes.
     *
     * @throws com.example.laborhours.export.exception.RendererCrashedException if the converter failed
     * @throws com.example.laborhours.export.exception.RendererTimeoutException if the job's deadline passed
     * @throws InterruptedException if the calling thread was interrupted while waiting on the converter
     */
    byte[] render(RenderJob job) throws InterruptedException;

    /**
     * Releases the converter's resources. Must not throw.
     */
    @Override
    void close();
}
