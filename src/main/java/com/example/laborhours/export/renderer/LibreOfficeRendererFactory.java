package com.example.laborhours.export.renderer;

import com.example.laborhours.export.exception.RendererCrashedException;
import com.example.laborhours.export.exception.RendererTimeoutException;
import com.example.laborhours.export.model.RenderJob;
import com.example.laborhours.export.renderer.pool.RendererFactory;
import com.example.laborhours.export.renderer.pool.RendererHandle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Converts workbooks with a headless LibreOffice. Every handle owns a private
 * user profile directory, so two handles never contend for the same profile
 * lock.
 */
@Slf4j
public class LibreOfficeRendererFactory implements RendererFactory {
    private final String executable;
    private final Path workDir;
    private final AtomicInteger sequence = new AtomicInteger();

    public LibreOfficeRendererFactory(String executable, Path workDir) {
        this.executable = executable;
        this.workDir = workDir;
    }

    @Override
    public RendererHandle create() {
        String id = "soffice-" + sequence.incrementAndGet();
        try {
            Files.createDirectories(workDir);
            Path profileDir = Files.createTempDirectory(workDir, id + "-profile-");
            return new LibreOfficeHandle(id, profileDir);
        } catch (IOException e) {
            throw new RendererCrashedException("Cannot prepare working directory for renderer " + id, e);
        }
    }

    @Override
    public String getName() {
        return "libreoffice";
    }

    private final class LibreOfficeHandle implements RendererHandle {
        private final String id;
        private final Path profileDir;

        private LibreOfficeHandle(String id, Path profileDir) {
            this.id = id;
            this.profileDir = profileDir;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public byte[] render(RenderJob job) throws InterruptedException {
            Path jobDir = null;
            Process process = null;
            try {
                jobDir = Files.createTempDirectory(workDir, id + "-job-");
                Path input = jobDir.resolve("document.xlsx");
                Files.write(input, job.getWorkbookBytes());

                ProcessBuilder builder = new ProcessBuilder(executable,
                        "-env:UserInstallation=" + profileDir.toUri(),
                        "--headless", "--norestore",
                        "--convert-to", "pdf",
                        "--outdir", jobDir.toString(),
                        input.toString())
                        .redirectErrorStream(true)
                        .redirectOutput(jobDir.resolve("soffice.log").toFile());
                process = builder.start();

                if (!process.waitFor(job.remaining().toMillis(), TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                    throw new RendererTimeoutException("LibreOffice did not finish '" + job.getLabel() + "' in time");
                }
                int exitCode = process.exitValue();
                Path output = jobDir.resolve("document.pdf");
                if (exitCode != 0 || !Files.exists(output)) {
                    throw new RendererCrashedException("LibreOffice exited with code " + exitCode
                            + " converting '" + job.getLabel() + "'" + describeLog(jobDir));
                }
                byte[] pdf = Files.readAllBytes(output);
                log.debug("Renderer {} converted '{}' into {} bytes", id, job.getLabel(), pdf.length);
                return pdf;
            } catch (InterruptedException e) {
                if (process != null) {
                    process.destroyForcibly();
                }
                throw e;
            } catch (IOException e) {
                throw new RendererCrashedException("LibreOffice could not convert '" + job.getLabel() + "': " + e.getMessage(), e);
            } finally {
                if (jobDir != null) {
                    deleteQuietly(jobDir);
                }
            }
        }

        private String describeLog(Path jobDir) {
            try {
                String output = Files.readString(jobDir.resolve("soffice.log")).trim();
                return output.isEmpty() ? "" : ": " + output;
            } catch (IOException e) {
                log.debug("No converter log for renderer {}: {}", id, e.getMessage());
                return "";
            }
        }

        @Override
        public void close() {
            deleteQuietly(profileDir);
        }

        private void deleteQuietly(Path dir) {
            try {
                FileSystemUtils.deleteRecursively(dir);
            } catch (IOException e) {
                log.warn("Could not delete renderer directory {}: {}", dir, e.getMessage());
            }
        }
    }
}
