package org.nowstart.tradeguard.repository;

import java.util.Optional;
import org.nowstart.tradeguard.data.dto.KillSwitchSnapshot;

/**
 * Storage seam for the kill switch. Writes are synchronous: when {@link #save} returns
 * the state survives a crash.
 */
public interface KillSwitchStateStore {

    Optional<KillSwitchSnapshot> load(String id);

    void save(String id, KillSwitchSnapshot state);
}
