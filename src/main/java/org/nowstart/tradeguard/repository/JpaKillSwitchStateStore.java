package org.nowstart.tradeguard.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.tradeguard.data.dto.KillSwitchSnapshot;
import org.nowstart.tradeguard.data.entity.KillSwitchRecord;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Single-row kill switch storage. The violation window is kept as a JSON array of
 * epoch millis, so sub-millisecond precision does not survive a reload.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JpaKillSwitchStateStore implements KillSwitchStateStore {

    private static final TypeReference<List<Long>> EPOCH_MILLIS_LIST = new TypeReference<>() {};

    private final KillSwitchRecordRepository killSwitchRecordRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<KillSwitchSnapshot> load(String id) {
        return killSwitchRecordRepository.findById(id).map(this::toSnapshot);
    }

    @Override
    @Transactional
    public void save(String id, KillSwitchSnapshot state) {
        KillSwitchRecord record = killSwitchRecordRepository.findById(id)
                .orElseGet(() -> KillSwitchRecord.builder().id(id).build());

        record.setTriggered(state.triggered());
        record.setReason(state.reason());
        record.setTriggeredAt(state.triggeredAt());
        record.setConsecutiveLosses(state.consecutiveLosses());
        record.setSpreadViolations(writeViolations(state.spreadViolations()));
        killSwitchRecordRepository.saveAndFlush(record);

        log.debug("event=kill_switch_persisted id={} triggered={} consecutive_losses={} spread_violations={}",
                id, state.triggered(), state.consecutiveLosses(), state.spreadViolations().size());
    }

    private KillSwitchSnapshot toSnapshot(KillSwitchRecord record) {
        return new KillSwitchSnapshot(
                record.isTriggered(),
                record.getReason(),
                record.getTriggeredAt(),
                record.getConsecutiveLosses(),
                readViolations(record.getSpreadViolations())
        );
    }

    private String writeViolations(List<Instant> violations) {
        List<Long> epochMillis = violations.stream()
                .map(Instant::toEpochMilli)
                .toList();
        try {
            return objectMapper.writeValueAsString(epochMillis);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize spread violation window", e);
        }
    }

    private List<Instant> readViolations(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }

        try {
            return objectMapper.readValue(json, EPOCH_MILLIS_LIST).stream()
                    .map(Instant::ofEpochMilli)
                    .toList();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored spread violation window is not a JSON array: " + json, e);
        }
    }
}
