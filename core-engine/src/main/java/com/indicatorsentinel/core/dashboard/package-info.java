/**
 * Live dashboard statistics derived from indicators, the execution ledger,
 * alert states and running leases.
 */
package com.indicatorsentinel.core.dashboard;
