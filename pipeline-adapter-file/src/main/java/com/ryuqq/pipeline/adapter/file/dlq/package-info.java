/**
 * Append-only JSON Lines implementation of the {@link com.ryuqq.pipeline.core.spi.DeadLetterQueue} SPI.
 */
package com.ryuqq.pipeline.adapter.file.dlq;
