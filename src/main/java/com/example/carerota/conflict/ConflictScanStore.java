package com.example.carerota.conflict;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest background scan result per home.
 */
@Component
public class ConflictScanStore {

    private final Map<Long, Snapshot> latest = new ConcurrentHashMap<>();

    public void put(Snapshot snapshot) {
        latest.put(snapshot.homeId(), snapshot);
    }

    public Optional<Snapshot> get(Long homeId) {
        return Optional.ofNullable(latest.get(homeId));
    }

    public void clear() {
        latest.clear();
    }

    public record Snapshot(Long homeId, LocalDate from, LocalDate to, LocalDateTime scannedAt,
                           List<ConflictReport> conflicts) {}
}
