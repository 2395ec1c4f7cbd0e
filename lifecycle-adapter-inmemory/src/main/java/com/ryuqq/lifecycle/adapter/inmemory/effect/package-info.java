/**
 * In-memory alert and resource-release collaborators.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.adapter.inmemory.effect;
