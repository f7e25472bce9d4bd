/**
 * Pipeline run configuration.
 *
 * @since 1.0.0
 * @author Pipeline Team
 */
package com.ryuqq.pipeline.application.config;
