/**
 * Association catalog: the source organizations a pipeline run collects from.
 *
 * <p>Loaded from {@code associations.yml} by the file adapter, or built in code for tests.</p>
 *
 * @since 1.0.0
 * @author Pipeline Team
 */
package com.ryuqq.pipeline.application.catalog;
