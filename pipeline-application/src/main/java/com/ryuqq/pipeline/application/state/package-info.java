/**
 * Pipeline state persistence on top of the {@link com.ryuqq.pipeline.core.spi.StateStore} SPI.
 *
 * @since 1.0.0
 * @author Pipeline Team
 */
package com.ryuqq.pipeline.application.state;
