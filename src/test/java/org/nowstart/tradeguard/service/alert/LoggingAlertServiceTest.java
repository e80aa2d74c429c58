package org.nowstart.tradeguard.service.alert;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

@ExtendWith(OutputCaptureExtension.class)
class LoggingAlertServiceTest {

    private final LoggingAlertService service = new LoggingAlertService();

    @Test
    void notify_logsTitleMessageAndSortedContext(CapturedOutput output) {
        service.notify("Kill switch triggered", "3 consecutive losses", Map.of(
                "triggeredAt", "2026-03-01T12:00:00Z",
                "consecutiveLosses", 3
        ));

        assertThat(output).containsPattern(
                "event=alert title=\"Kill switch triggered\" message=\"3 consecutive losses\""
                        + " context=\\{consecutiveLosses=3, triggeredAt=2026-03-01T12:00:00Z}"
        );
    }
}
