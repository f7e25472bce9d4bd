/**
 * Reusable contract tests for pipeline SPI implementations.
 *
 * <p>Adapter modules extend these abstract classes from their own test sources
 * so every {@link com.ryuqq.pipeline.core.spi.StateStore} and
 * {@link com.ryuqq.pipeline.core.spi.DeadLetterQueue} passes the same scenarios.</p>
 *
 * @since 1.0.0
 * @author Pipeline Team
 */
package com.ryuqq.pipeline.testkit.contract;
