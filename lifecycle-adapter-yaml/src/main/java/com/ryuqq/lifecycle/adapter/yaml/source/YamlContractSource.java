package com.ryuqq.lifecycle.adapter.yaml.source;

import com.ryuqq.lifecycle.adapter.yaml.cache.ContractDocumentCache;
import com.ryuqq.lifecycle.core.contract.ContractDocument;
import com.ryuqq.lifecycle.core.error.ContractSourceException;
import com.ryuqq.lifecycle.core.spi.ContractSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Filesystem implementation of {@link ContractSource} SPI.
 *
 * <p>Walks a contract directory recursively and reads every {@code *.yaml},
 * {@code *.yml} and {@code *.json} file. Files are returned sorted by path so
 * discovery order is stable across runs.</p>
 *
 * <p>With a {@link ContractDocumentCache}, unchanged files are served from the
 * cache until their entry expires.</p>
 *
 * <p>Files larger than the configured maximum (1 MiB by default) are rejected
 * with a {@link ContractSourceException} before they are read.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class YamlContractSource implements ContractSource {

    private static final Logger log = LoggerFactory.getLogger(YamlContractSource.class);

    /** Default upper bound for a single contract file, in bytes. */
    public static final long DEFAULT_MAX_FILE_BYTES = 1024L * 1024L;

    private final Path directory;
    private final ContractDocumentCache cache;
    private final long maxFileBytes;

    public YamlContractSource(Path directory) {
        this(directory, null);
    }

    public YamlContractSource(Path directory, ContractDocumentCache cache) {
        this(directory, cache, DEFAULT_MAX_FILE_BYTES);
    }

    /**
     * @param directory contract root directory
     * @param cache document cache (null disables caching)
     * @param maxFileBytes largest accepted contract file, in bytes
     */
    public YamlContractSource(Path directory, ContractDocumentCache cache, long maxFileBytes) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (maxFileBytes <= 0) {
            throw new IllegalArgumentException("maxFileBytes must be positive: " + maxFileBytes);
        }
        this.directory = directory;
        this.cache = cache;
        this.maxFileBytes = maxFileBytes;
    }

    @Override
    public List<ContractDocument> discover() {
        if (!Files.isDirectory(directory)) {
            throw new ContractSourceException("Contract directory " + directory + " does not exist");
        }

        List<Path> files;
        try (Stream<Path> paths = Files.walk(directory)) {
            files = paths
                .filter(Files::isRegularFile)
                .filter(path -> ContractDocumentReader.isContractFile(path.getFileName().toString()))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ContractSourceException("Failed to scan contract directory " + directory, e);
        }

        List<ContractDocument> documents = new ArrayList<>(files.size());
        for (Path file : files) {
            checkSize(file);
            documents.add(cache == null ? read(file) : cache.getOrLoad(file, lastModified(file), () -> read(file)));
        }
        log.info("Discovered {} contract documents under {}", documents.size(), directory);
        return documents;
    }

    public Path directory() {
        return directory;
    }

    public long maxFileBytes() {
        return maxFileBytes;
    }

    private void checkSize(Path file) {
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new ContractSourceException("Failed to stat contract document " + file, e);
        }
        if (size > maxFileBytes) {
            throw new ContractSourceException("Contract file " + directory.relativize(file)
                + " too large: " + size + " bytes (max: " + maxFileBytes + ")");
        }
    }

    private ContractDocument read(Path file) {
        String sourceId = directory.relativize(file).toString();
        try (InputStream in = Files.newInputStream(file)) {
            return ContractDocumentReader.read(sourceId, in);
        } catch (IOException e) {
            throw new ContractSourceException("Failed to read contract document " + file, e);
        }
    }

    private static FileTime lastModified(Path file) {
        try {
            return Files.getLastModifiedTime(file);
        } catch (IOException e) {
            throw new ContractSourceException("Failed to stat contract document " + file, e);
        }
    }
}
