/**
 * Jackson configuration shared by the file adapters.
 */
package com.ryuqq.pipeline.adapter.file.json;
