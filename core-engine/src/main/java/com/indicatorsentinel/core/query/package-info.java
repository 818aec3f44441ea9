/**
 * Query surface consumed by outer layers.
 *
 * @since 1.0.0
 */
package com.indicatorsentinel.core.query;
