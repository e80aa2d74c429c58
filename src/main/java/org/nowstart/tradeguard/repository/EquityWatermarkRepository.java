package org.nowstart.tradeguard.repository;

import org.nowstart.tradeguard.data.entity.EquityWatermark;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EquityWatermarkRepository extends JpaRepository<EquityWatermark, String> {
}
