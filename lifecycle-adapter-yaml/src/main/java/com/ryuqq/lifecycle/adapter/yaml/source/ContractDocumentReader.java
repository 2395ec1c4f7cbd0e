package com.ryuqq.lifecycle.adapter.yaml.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.ryuqq.lifecycle.core.contract.ContractDocument;
import com.ryuqq.lifecycle.core.error.ContractSourceException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;

/**
 * Reads one YAML or JSON document into a raw contract tree.
 *
 * <p>The format is chosen by file extension: {@code .json} uses the JSON mapper,
 * everything else the YAML mapper.</p>
 */
final class ContractDocumentReader {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> TREE = new TypeReference<>() {};

    private ContractDocumentReader() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static boolean isContractFile(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yaml") || lower.endsWith(".yml") || lower.endsWith(".json");
    }

    /**
     * Reads a document.
     *
     * @param sourceId identifier used in the resulting document and in error messages
     * @param in document stream (not closed by this method)
     * @return parsed document
     * @throws ContractSourceException if the stream cannot be read, is not well-formed or is not a mapping
     */
    static ContractDocument read(String sourceId, InputStream in) {
        ObjectMapper mapper = sourceId.toLowerCase(Locale.ROOT).endsWith(".json") ? JSON : YAML;
        Map<String, Object> content;
        try {
            content = mapper.readValue(in, TREE);
        } catch (JsonProcessingException e) {
            throw new ContractSourceException(
                "Contract document " + sourceId + " is not well-formed: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ContractSourceException("Failed to read contract document " + sourceId, e);
        }
        if (content == null) {
            throw new ContractSourceException("Contract document " + sourceId + " is empty");
        }
        return new ContractDocument(sourceId, content);
    }
}
