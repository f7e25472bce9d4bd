/**
 * Entity resolution and deduplication engine.
 *
 * <p>Consumes extracted company records (and, for resolution, previously canonicalized
 * entities) and produces canonical records with alias and provenance tracking.</p>
 *
 * <h2>Modes</h2>
 * <ul>
 *   <li>Intra-batch dedupe: {@link com.ryuqq.pipeline.resolution.EntityResolutionEngine#dedupe(java.util.List)}</li>
 *   <li>Cross-batch resolution: {@link com.ryuqq.pipeline.resolution.EntityResolutionEngine#resolve(java.util.List, java.util.List)}</li>
 * </ul>
 *
 * <h2>Known Limitation</h2>
 * <p>Grouping is a flood fill over direct candidate edges. Records that are not pairwise
 * similar can end up in one group through an intermediate record (A~B~C).</p>
 *
 * @since 1.0.0
 * @author Pipeline Team
 */
package com.ryuqq.pipeline.resolution;
