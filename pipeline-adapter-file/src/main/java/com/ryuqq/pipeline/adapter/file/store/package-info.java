/**
 * File-system implementation of the {@link com.ryuqq.pipeline.core.spi.StateStore} SPI.
 *
 * <p>One JSON document per job plus one checkpoint summary per phase, all in a single directory.</p>
 */
package com.ryuqq.pipeline.adapter.file.store;
