/**
 * Immutable wall-clock temporal value types.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.temporal.core.model.LocalDate} - calendar date, zero-based month</li>
 *   <li>{@link com.ryuqq.temporal.core.model.LocalTime} - time of day, millisecond precision</li>
 *   <li>{@link com.ryuqq.temporal.core.model.LocalDateTime} - date and time stored as UTC-anchored epoch milliseconds</li>
 *   <li>{@link com.ryuqq.temporal.core.model.Duration} - months, days and milliseconds, never normalized</li>
 * </ul>
 *
 * <h2>Construction</h2>
 * <ul>
 *   <li><strong>Public:</strong> {@code of(...)} factories validate every field</li>
 *   <li><strong>Trusted:</strong> {@link com.ryuqq.temporal.core.model.TrustedTemporalFactory} skips validation, for protocol decoders only</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> final classes, final fields</li>
 *   <li><strong>Host independence:</strong> no default time zone or locale is ever consulted</li>
 *   <li><strong>Canonical text:</strong> {@code toString()} is the normative rendering; {@code %#s} gives the debug form</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Temporal Types Team
 */
package com.ryuqq.temporal.core.model;
