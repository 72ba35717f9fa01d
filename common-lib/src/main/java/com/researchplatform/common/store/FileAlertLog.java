package com.researchplatform.common.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchplatform.common.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Alert log persisted as a JSON array, newest first, truncated to {@code capacity} entries.
 *
 * <p>Every append is a read-modify-write of the whole file. The monitor checks symbols in
 * parallel, so appends within this process are serialized by a lock. Writers in other processes
 * are not coordinated.
 */
public class FileAlertLog implements AlertLog {

    private static final Logger log = LoggerFactory.getLogger(FileAlertLog.class);

    private final Path path;
    private final int capacity;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();

    public FileAlertLog(Path path, int capacity, ObjectMapper objectMapper) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.path = path;
        this.capacity = capacity;
        this.objectMapper = objectMapper;
    }

    @Override
    public void append(Alert alert) {
        lock.lock();
        try {
            List<AlertEntry> entries = readEntries();
            entries.add(0, AlertEntry.from(alert));
            List<AlertEntry> kept = entries.size() > capacity
                ? new ArrayList<>(entries.subList(0, capacity))
                : entries;
            write(kept);
            log.debug("[AlertLog] Appended alert. type={} symbol={} size={}", alert.type(), alert.symbol(), kept.size());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Alert> recent(int limit) {
        lock.lock();
        try {
            List<Alert> alerts = new ArrayList<>();
            for (AlertEntry entry : readEntries()) {
                if (alerts.size() >= limit) break;
                try {
                    alerts.add(entry.toAlert());
                } catch (RuntimeException e) {
                    log.warn("[AlertLog] Skipping malformed entry. symbol={} reason={}", entry.getSymbol(), e.getMessage());
                }
            }
            return alerts;
        } finally {
            lock.unlock();
        }
    }

    private List<AlertEntry> readEntries() {
        if (!Files.exists(path)) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(path.toFile(), new TypeReference<List<AlertEntry>>() {}));
        } catch (IOException e) {
            log.warn("[AlertLog] Existing log unreadable, starting fresh. path={} reason={}", path, e.getMessage());
            return new ArrayList<>();
        }
    }

    private void write(List<AlertEntry> entries) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), entries);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write alert log " + path, e);
        }
    }
}
