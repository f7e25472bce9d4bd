/**
 * Candidate generation, pairwise scoring and grouping.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.resolution.match.BlockingIndex} - Inverted indices by domain, name token, phone suffix</li>
 *   <li>{@link com.ryuqq.pipeline.resolution.match.WeightedRecordScorer} - Weighted average over contributing signals</li>
 *   <li>{@link com.ryuqq.pipeline.resolution.match.MergeGrouper} - Flood-fill grouping above an inclusive threshold</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Pipeline Team
 */
package com.ryuqq.pipeline.resolution.match;
