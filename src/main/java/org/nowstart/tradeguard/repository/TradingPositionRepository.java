package org.nowstart.tradeguard.repository;

import java.util.Optional;
import org.nowstart.tradeguard.data.entity.TradingPosition;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TradingPositionRepository extends JpaRepository<TradingPosition, String> {

    Optional<TradingPosition> findBySymbol(String symbol);
}
