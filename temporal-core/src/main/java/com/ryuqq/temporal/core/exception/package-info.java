/**
 * Exception types raised by the temporal value types.
 *
 * <ul>
 *   <li>{@link com.ryuqq.temporal.core.exception.TemporalValidationException} - a factory argument is out of range</li>
 *   <li>{@link com.ryuqq.temporal.core.exception.FormatInvariantException} - a canonical format routine detected a broken invariant</li>
 * </ul>
 *
 * <p>Both are unchecked. Neither is ever retried inside the library.</p>
 *
 * @since 1.0.0
 * @author Temporal Types Team
 */
package com.ryuqq.temporal.core.exception;
