package org.nowstart.tradeguard.service.signal;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.tradeguard.data.dto.Signal;
import org.nowstart.tradeguard.data.type.SignalAction;

class HoldSignalProducerTest {

    @Test
    void produce_alwaysHolds() {
        Signal signal = new HoldSignalProducer().produce("BTC-USD", List.of(), null, null);

        assertThat(signal.action()).isEqualTo(SignalAction.HOLD);
        assertThat(signal.confidence()).isZero();
        assertThat(signal.reason()).isEqualTo("no strategy configured");
    }
}
