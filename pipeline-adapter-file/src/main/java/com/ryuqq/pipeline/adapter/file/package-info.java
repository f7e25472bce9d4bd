/**
 * File-system adapters: JSON state store, JSON Lines dead-letter queue and YAML association catalog.
 *
 * <p>All JSON and YAML handling goes through
 * {@link com.ryuqq.pipeline.adapter.file.json.PipelineObjectMappers}.</p>
 */
package com.ryuqq.pipeline.adapter.file;
