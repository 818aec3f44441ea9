/**
 * Single-indicator run orchestration.
 */
package com.indicatorsentinel.core.execution;
