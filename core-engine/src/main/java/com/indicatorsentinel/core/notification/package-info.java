/**
 * Outbound alert notifications.
 *
 * @since 1.0.0
 */
package com.indicatorsentinel.core.notification;
