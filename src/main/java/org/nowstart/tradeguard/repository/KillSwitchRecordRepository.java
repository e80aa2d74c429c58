package org.nowstart.tradeguard.repository;

import org.nowstart.tradeguard.data.entity.KillSwitchRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface KillSwitchRecordRepository extends JpaRepository<KillSwitchRecord, String> {
}
