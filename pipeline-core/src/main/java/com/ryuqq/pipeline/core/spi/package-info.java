/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * to provide persistence and inspection for the pipeline engine.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.spi.StateStore} - Full-state snapshots and phase checkpoints</li>
 *   <li>{@link com.ryuqq.pipeline.core.spi.DeadLetterQueue} - Failed task records</li>
 *   <li>{@link com.ryuqq.pipeline.core.spi.ContractValidator} - Advisory payload validation</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (pipeline-adapter-inmemory, pipeline-adapter-file) provide concrete
 * implementations. Contract tests in pipeline-testkit verify them.</p>
 *
 * @since 1.0.0
 * @author Pipeline Team
 */
package com.ryuqq.pipeline.core.spi;
