/**
 * Loads the association catalog from a YAML configuration file.
 */
package com.ryuqq.pipeline.adapter.file.catalog;
