package com.ryuqq.lifecycle.adapter.inmemory.source;

import com.ryuqq.lifecycle.core.contract.ContractDocument;
import com.ryuqq.lifecycle.core.error.ContractSourceException;
import com.ryuqq.lifecycle.core.spi.ContractSource;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link ContractSource} SPI.
 *
 * <p>Documents are returned in insertion order. A discovery failure can be armed to
 * exercise the loader's {@code discovery_failed} path.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryContractSource implements ContractSource {

    private final List<ContractDocument> documents = new CopyOnWriteArrayList<>();
    private final AtomicReference<ContractSourceException> failure = new AtomicReference<>();
    private final AtomicInteger discoveries = new AtomicInteger();

    public InMemoryContractSource() {
    }

    public InMemoryContractSource(List<ContractDocument> documents) {
        documents.forEach(this::add);
    }

    public InMemoryContractSource add(ContractDocument document) {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        documents.add(document);
        return this;
    }

    public InMemoryContractSource add(String sourceId, Map<String, Object> content) {
        return add(new ContractDocument(sourceId, content));
    }

    /**
     * Makes subsequent discoveries fail.
     *
     * @param failure exception to throw, or null to clear
     */
    public void failWith(ContractSourceException failure) {
        this.failure.set(failure);
    }

    @Override
    public List<ContractDocument> discover() {
        discoveries.incrementAndGet();
        ContractSourceException armed = failure.get();
        if (armed != null) {
            throw armed;
        }
        return List.copyOf(documents);
    }

    public int discoveryCount() {
        return discoveries.get();
    }
}
