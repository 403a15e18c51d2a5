package com.example.carerota.conflict;

import com.example.carerota.common.error.ErrorLogBuffer;
import com.example.carerota.config.RotaSettings;
import com.example.carerota.home.Home;
import com.example.carerota.home.HomeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Periodically re-checks upcoming assignments of every active home and keeps the
 * result in {@link ConflictScanStore}. Read-only, so it runs without coordinating
 * with assignment changes.
 */
@Component
@ConditionalOnProperty(name = "rota.conflict-scan.enabled", havingValue = "true", matchIfMissing = true)
public class ConflictScanScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ConflictScanScheduler.class);

    private final HomeRepository homeRepository;
    private final ConflictCheckService conflictCheckService;
    private final ConflictScanStore store;
    private final RotaSettings settings;
    private final ErrorLogBuffer errorLogBuffer;

    public ConflictScanScheduler(HomeRepository homeRepository,
                                 ConflictCheckService conflictCheckService,
                                 ConflictScanStore store,
                                 RotaSettings settings,
                                 ErrorLogBuffer errorLogBuffer) {
        this.homeRepository = homeRepository;
        this.conflictCheckService = conflictCheckService;
        this.store = store;
        this.settings = settings;
        this.errorLogBuffer = errorLogBuffer;
    }

    @Scheduled(fixedDelayString = "${rota.conflict-scan.interval-ms:30000}",
               initialDelayString = "${rota.conflict-scan.interval-ms:30000}")
    public void scanUpcoming() {
        LocalDate from = LocalDate.now();
        LocalDate to = from.plusDays(settings.getConflictScanWindowDays() - 1L);
        for (Home home : homeRepository.findByActiveTrue()) {
            scanHome(home.getId(), from, to);
        }
    }

    void scanHome(Long homeId, LocalDate from, LocalDate to) {
        try {
            List<ConflictReport> conflicts = conflictCheckService.scanConflicts(homeId, from, to);
            store.put(new ConflictScanStore.Snapshot(homeId, from, to, LocalDateTime.now(), conflicts));
            if (!conflicts.isEmpty()) {
                logger.warn("Home {} has {} conflicting assignments between {} and {}",
                        homeId, conflicts.size(), from, to);
            }
        } catch (DataAccessException e) {
            // next run retries; other homes are still scanned
            logger.error("Conflict scan failed for home {}", homeId, e);
            errorLogBuffer.addScanFailure(homeId, from, to, e);
        }
    }
}
