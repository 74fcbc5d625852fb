/**
 * REST API layer: controllers and DTOs.
 *
 * <ul>
 *   <li>{@code POST /api/remediation} - generate a scanner-approved fix</li>
 *   <li>{@code GET /health} - liveness</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.remediation.api;
