package org.nowstart.tradeguard.service.killswitch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradeguard.data.dto.KillSwitchSnapshot;
import org.nowstart.tradeguard.data.type.AuditEventType;
import org.nowstart.tradeguard.service.audit.AuditTrailService;
import org.nowstart.tradeguard.service.execution.EquityWatermarkService;
import org.springframework.stereotype.Service;

/**
 * Operator-facing kill switch commands. Automatic triggers go straight to {@link KillSwitch}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KillSwitchService {

    private final KillSwitch killSwitch;
    private final AuditTrailService auditTrailService;
    private final EquityWatermarkService equityWatermarkService;

    public KillSwitchSnapshot status() {
        return killSwitch.getState();
    }

    public KillSwitchSnapshot trigger(String reason) {
        log.warn("event=kill_switch_manual_trigger reason=\"{}\"", reason);
        killSwitch.trigger("Manual: " + reason);
        return killSwitch.getState();
    }

    public KillSwitchSnapshot reset() {
        KillSwitchSnapshot before = killSwitch.getState();
        killSwitch.reset();
        auditTrailService.record(AuditEventType.KILL_SWITCH_RESET, KillSwitch.STATE_ID, "previous_reason=" + before.reason());

        // the old peak would re-trip a drawdown halt on the next cycle
        equityWatermarkService.rebase().ifPresent(peak -> auditTrailService.record(
                AuditEventType.EQUITY_PEAK_REBASED,
                KillSwitch.STATE_ID,
                "peak=" + peak.stripTrailingZeros().toPlainString()
        ));
        return killSwitch.getState();
    }
}
