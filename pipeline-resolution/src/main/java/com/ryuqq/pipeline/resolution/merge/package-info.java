/**
 * Canonical record construction for merge groups.
 *
 * @since 1.0.0
 * @author Pipeline Team
 */
package com.ryuqq.pipeline.resolution.merge;
