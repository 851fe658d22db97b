package com.example.laborhours.export.service;

import com.example.laborhours.export.aspect.LogExecutionTime;
import com.example.laborhours.export.config.ExportProperties;
import com.example.laborhours.export.model.ExportTemplate;
import com.example.laborhours.export.model.TemplateMetadata;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * File-backed store of export templates, one {@code <key>.xlsx} plus a
 * {@code <key>.meta.yaml} sidecar per key.
 *
 * Saves replace both files wholesale through atomic moves while holding the
 * key's write lock, and loads read both under the read lock, so a reader
 * always sees one consistent version. Loaded templates are cached in
 * "exportTemplates" until the key is saved again. The cache is filled under
 * the read lock and evicted under the write lock, so a load that overlaps a
 * save can never put the replaced version back.
 */
@Slf4j
@Service
public class TemplateStore {
    public static final String CACHE_NAME = "exportTemplates";

    private final ExportProperties properties;
    private final CacheManager cacheManager;
    private final Path storageDir;
    private final ObjectMapper yamlMapper;
    private final Map<String, ReadWriteLock> locks = new ConcurrentHashMap<>();

    public TemplateStore(ExportProperties properties, CacheManager cacheManager) {
        this.properties = properties;
        this.cacheManager = cacheManager;
        this.storageDir = Paths.get(properties.getTemplates().getStorageDir());
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public boolean isKnownKey(String key) {
        return key != null && properties.getTemplates().getKeys().contains(key);
    }

    public List<String> getKnownKeys() {
        return new ArrayList<>(properties.getTemplates().getKeys());
    }

    @LogExecutionTime("load template")
    public Optional<ExportTemplate> find(String key) {
        if (!isKnownKey(key)) {
            return Optional.empty();
        }
        Cache cache = templateCache();
        ReadWriteLock lock = lockFor(key);
        lock.readLock().lock();
        try {
            ExportTemplate cached = cache.get(key, ExportTemplate.class);
            if (cached != null) {
                return Optional.of(cached);
            }
            Path bytesFile = bytesFile(key);
            if (!Files.exists(bytesFile)) {
                log.debug("No template stored under key '{}'", key);
                return Optional.empty();
            }
            byte[] bytes = Files.readAllBytes(bytesFile);
            TemplateMetadata metadata = readMetadata(key);
            log.info("Loaded template '{}' ({} bytes) from {}", key, bytes.length, bytesFile);
            ExportTemplate template = ExportTemplate.builder()
                    .key(key)
                    .name(metadata.getName())
                    .orientation(metadata.getOrientation())
                    .rawBytes(bytes)
                    .validationIssues(metadata.getIssues())
                    .updatedAt(metadata.getUpdatedAt())
                    .build();
            cache.put(key, template);
            return Optional.of(template);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read template '" + key + "'", e);
        } finally {
            lock.readLock().unlock();
        }
    }

    public ExportTemplate save(ExportTemplate template) {
        String key = template.getKey();
        if (!isKnownKey(key)) {
            throw new IllegalArgumentException("Unknown template key '" + key + "'; allowed: " + getKnownKeys());
        }
        Cache cache = templateCache();
        ReadWriteLock lock = lockFor(key);
        lock.writeLock().lock();
        try {
            Files.createDirectories(storageDir);
            TemplateMetadata metadata = new TemplateMetadata(key, template.getName(), template.getOrientation(),
                    new ArrayList<>(template.getValidationIssues()), template.getUpdatedAt());
            writeAtomically(bytesFile(key), template.getRawBytes());
            writeAtomically(metadataFile(key), yamlMapper.writeValueAsBytes(metadata));
            log.info("Stored template '{}' ({} bytes, {} issue(s))", key, template.size(),
                    template.getValidationIssues().size());
            return template;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store template '" + key + "'", e);
        } finally {
            // evict even after a partial write so the next load rereads disk
            cache.evict(key);
            lock.writeLock().unlock();
        }
    }

    private TemplateMetadata readMetadata(String key) throws IOException {
        Path file = metadataFile(key);
        if (!Files.exists(file)) {
            TemplateMetadata fallback = new TemplateMetadata();
            fallback.setKey(key);
            fallback.setName(key);
            return fallback;
        }
        return yamlMapper.readValue(file.toFile(), TemplateMetadata.class);
    }

    private void writeAtomically(Path target, byte[] content) throws IOException {
        Path tmp = Files.createTempFile(storageDir, target.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, content);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private Cache templateCache() {
        Cache cache = cacheManager.getCache(CACHE_NAME);
        if (cache == null) {
            throw new IllegalStateException("Cache '" + CACHE_NAME + "' is not configured");
        }
        return cache;
    }

    private ReadWriteLock lockFor(String key) {
        return locks.computeIfAbsent(key, k -> new ReentrantReadWriteLock());
    }

    private Path bytesFile(String key) {
        return storageDir.resolve(key + ".xlsx");
    }

    private Path metadataFile(String key) {
        return storageDir.resolve(key + ".meta.yaml");
    }
}
