/**
 * Contract sources backed by Jackson YAML/JSON readers.
 *
 * <p>{@link com.ryuqq.lifecycle.adapter.yaml.source.YamlContractSource} discovers documents on
 * the filesystem, {@link com.ryuqq.lifecycle.adapter.yaml.source.ClasspathContractSource}
 * reads a fixed resource list. Both return raw trees; schema validation happens in
 * {@link com.ryuqq.lifecycle.core.contract.ContractParser}.</p>
 */
package com.ryuqq.lifecycle.adapter.yaml.source;
