/**
 * Proleptic Gregorian calendar arithmetic shared by the date-bearing value types.
 *
 * <p>{@link com.ryuqq.temporal.core.calendar.CalendarMath} converts between
 * (year, month, day) and ordinal day numbers without touching any
 * time-zone-aware API, so results never depend on the host configuration.</p>
 *
 * @since 1.0.0
 * @author Temporal Types Team
 */
package com.ryuqq.temporal.core.calendar;
