/**
 * In-memory StateStore adapter implementation package.
 *
 * <p>This package provides a reference implementation of the
 * {@link com.ryuqq.pipeline.core.spi.StateStore} SPI for tests and dry runs.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 *   <li>Suitable for contract tests and orchestrator tests</li>
 * </ul>
 *
 * @see com.ryuqq.pipeline.core.spi.StateStore
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.adapter.inmemory.store;
