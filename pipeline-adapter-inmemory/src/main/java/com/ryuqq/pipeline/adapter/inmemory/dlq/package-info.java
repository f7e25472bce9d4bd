/**
 * In-memory dead-letter queue for tests and dry runs.
 *
 * @since 1.0.0
 * @author Pipeline Team
 */
package com.ryuqq.pipeline.adapter.inmemory.dlq;
