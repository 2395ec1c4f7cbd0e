package com.ryuqq.lifecycle.adapter.yaml.source;

import com.ryuqq.lifecycle.core.contract.ContractDocument;
import com.ryuqq.lifecycle.core.error.ContractSourceException;
import com.ryuqq.lifecycle.core.spi.ContractSource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Classpath implementation of {@link ContractSource} SPI.
 *
 * <p>Reads a fixed list of resources, in the given order. A missing resource fails
 * discovery.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ClasspathContractSource implements ContractSource {

    private final List<String> resources;
    private final ClassLoader classLoader;

    public ClasspathContractSource(List<String> resources) {
        this(resources, ClasspathContractSource.class.getClassLoader());
    }

    public ClasspathContractSource(List<String> resources, ClassLoader classLoader) {
        if (resources == null) {
            throw new IllegalArgumentException("resources cannot be null");
        }
        if (classLoader == null) {
            throw new IllegalArgumentException("classLoader cannot be null");
        }
        this.resources = List.copyOf(resources);
        this.classLoader = classLoader;
    }

    @Override
    public List<ContractDocument> discover() {
        List<ContractDocument> documents = new ArrayList<>(resources.size());
        for (String resource : resources) {
            documents.add(read(resource));
        }
        return documents;
    }

    private ContractDocument read(String resource) {
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ContractSourceException("Classpath resource " + resource + " not found");
            }
            return ContractDocumentReader.read(resource, in);
        } catch (IOException e) {
            throw new ContractSourceException("Failed to read classpath resource " + resource, e);
        }
    }
}
