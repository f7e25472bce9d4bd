/**
 * Record normalization helpers.
 *
 * <p>Company names, domains, phone numbers and addresses are normalized here before they
 * are used as blocking keys or compared by the scorer.</p>
 *
 * @since 1.0.0
 * @author Pipeline Team
 */
package com.ryuqq.pipeline.resolution.normalize;
