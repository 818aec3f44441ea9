/**
 * Micrometer instrumentation for the engine.
 */
package com.indicatorsentinel.core.metrics;
