/**
 * Boundary to the external metric source.
 *
 * @since 1.0.0
 */
package com.indicatorsentinel.core.collector;
