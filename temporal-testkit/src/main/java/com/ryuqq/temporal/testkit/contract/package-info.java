/**
 * Contract tests for codecs that carry temporal values over the wire.
 *
 * <p>Implementations extend
 * {@link com.ryuqq.temporal.testkit.contract.AbstractWireRoundTripContractTest}
 * and supply the encode/decode round trip for each value type.</p>
 *
 * @since 1.0.0
 * @author Temporal Types Team
 */
package com.ryuqq.temporal.testkit.contract;
