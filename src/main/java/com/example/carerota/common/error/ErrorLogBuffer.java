package com.example.carerota.common.error;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Recent unexpected failures, newest first, for the admin endpoints. Failed
 * background conflict scans carry the home and window they were checking, so an
 * operator can tell which rota has gone unchecked.
 */
@Component
public class ErrorLogBuffer {

    public enum Source { REQUEST, CONFLICT_SCAN }

    private static final int MAX_ENTRIES = 200;

    private final Deque<Entry> entries = new ConcurrentLinkedDeque<>();

    public void addError(String message, Throwable t) {
        add(new Entry(LocalDateTime.now(), Source.REQUEST, null, null, null, message == null ? "" : message, detail(t)));
    }

    public void addScanFailure(Long homeId, LocalDate from, LocalDate to, Throwable t) {
        add(new Entry(LocalDateTime.now(), Source.CONFLICT_SCAN, homeId, from, to,
                "Conflict scan failed for home " + homeId, detail(t)));
    }

    public List<Entry> recent() {
        return new ArrayList<>(entries);
    }

    /**
     * Entries matching both filters; a null filter matches everything.
     */
    public List<Entry> recent(Source source, Long homeId) {
        return entries.stream()
                .filter(e -> source == null || e.source() == source)
                .filter(e -> homeId == null || homeId.equals(e.homeId()))
                .toList();
    }

    public void clear() {
        entries.clear();
    }

    private void add(Entry entry) {
        entries.addFirst(entry);
        while (entries.size() > MAX_ENTRIES) {
            entries.pollLast();
        }
    }

    private static String detail(Throwable t) {
        return t == null ? "" : t.getClass().getName() + ": " + t.getMessage();
    }

    /**
     * @param homeId    home being scanned, null for request failures
     * @param scanFrom  first date of the failed scan window
     * @param scanTo    last date of the failed scan window
     */
    public record Entry(LocalDateTime time,
                        Source source,
                        Long homeId,
                        LocalDate scanFrom,
                        LocalDate scanTo,
                        String message,
                        String detail) {}
}
