package com.ryuqq.temporal.testkit.contract;

import com.ryuqq.temporal.core.model.Duration;
import com.ryuqq.temporal.core.model.LocalDate;
import com.ryuqq.temporal.core.model.LocalDateTime;
import com.ryuqq.temporal.core.model.LocalTime;

/**
 * Runs the wire round-trip contract against {@link MicrosecondWireCodec}.
 *
 * @author Temporal Types Team
 * @since 1.0.0
 */
class MicrosecondWireCodecContractTest extends AbstractWireRoundTripContractTest {

    private final MicrosecondWireCodec codec = new MicrosecondWireCodec();

    @Override
    protected LocalDate roundTrip(LocalDate value) {
        return codec.decodeDate(codec.encodeDate(value));
    }

    @Override
    protected LocalTime roundTrip(LocalTime value) {
        return codec.decodeTime(codec.encodeTime(value));
    }

    @Override
    protected LocalDateTime roundTrip(LocalDateTime value) {
        return codec.decodeDateTime(codec.encodeDateTime(value));
    }

    @Override
    protected Duration roundTrip(Duration value) {
        return codec.decodeDuration(codec.encodeDuration(value));
    }
}
