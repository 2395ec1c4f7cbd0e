package com.ryuqq.lifecycle.core.spi;

import com.ryuqq.lifecycle.core.contract.ContractDocument;
import com.ryuqq.lifecycle.core.error.ContractSourceException;

import java.util.List;

/**
 * Contract discovery SPI.
 *
 * <p>Finds contract documents on durable storage and parses them into raw trees.
 * Schema validation is not part of discovery; documents are validated by
 * {@link com.ryuqq.lifecycle.core.contract.ContractParser}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ContractSource {

    /**
     * Discovers all contract documents.
     *
     * @return discovered documents in a stable order (may be empty)
     * @throws ContractSourceException if storage cannot be read or a document is not well-formed
     */
    List<ContractDocument> discover();
}
