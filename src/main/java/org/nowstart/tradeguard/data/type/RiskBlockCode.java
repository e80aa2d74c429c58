package org.nowstart.tradeguard.data.type;

/**
 * Identifies the guard that rejected a signal. The code is what gets logged and
 * counted, so it stays stable across releases.
 */
public enum RiskBlockCode {
    KILL_SWITCH("kill_switch"),
    LIVE_DISABLED("live_disabled"),
    PAIR_NOT_WHITELISTED("pair_not_whitelisted"),
    MAX_DAILY_LOSS("max_daily_loss"),
    MAX_OPEN_POSITIONS("max_open_positions"),
    MAX_POSITION_USD("max_position_usd"),
    COOLDOWN("cooldown"),
    MIN_VOLUME("min_volume"),
    SPREAD_GUARD("spread_guard"),
    SLIPPAGE_GUARD("slippage_guard");

    private final String code;

    RiskBlockCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
