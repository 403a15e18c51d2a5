package com.example.carerota.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class RotaSettings {
    private final double defaultDailyHourLimit;
    private final int conflictScanWindowDays;
    private final int swapExpiryDays;

    public RotaSettings(
            @Value("${rota.conflict.daily-hour-limit:12}") double defaultDailyHourLimit,
            @Value("${rota.conflict-scan.window-days:7}") int conflictScanWindowDays,
            @Value("${rota.swap.expiry-days:7}") int swapExpiryDays) {
        if (defaultDailyHourLimit <= 0) {
            throw new IllegalArgumentException("rota.conflict.daily-hour-limit must be positive");
        }
        this.defaultDailyHourLimit = defaultDailyHourLimit;
        this.conflictScanWindowDays = Math.max(1, conflictScanWindowDays);
        this.swapExpiryDays = Math.max(1, swapExpiryDays);
    }

    public double getDefaultDailyHourLimit() { return defaultDailyHourLimit; }
    public int getConflictScanWindowDays() { return conflictScanWindowDays; }
    public int getSwapExpiryDays() { return swapExpiryDays; }
}
