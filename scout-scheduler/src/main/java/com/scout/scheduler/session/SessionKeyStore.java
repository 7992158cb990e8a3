package com.scout.scheduler.session;

import com.scout.executor.ApprovalMode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;

/**
 * Maps a conversation key to the session that serves it today.
 * <p>
 * Entries are only valid on the UTC day they were written. Any read on a later
 * day evicts the entry, which bounds how much context one conversation can
 * accumulate in a single session.
 */
@Slf4j
public class SessionKeyStore {

    private final SessionKeyRepository repository;
    private final Clock clock;

    public SessionKeyStore(SessionKeyRepository repository) {
        this(repository, Clock.systemUTC());
    }

    public SessionKeyStore(SessionKeyRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Session id stored for today, or null.
     */
    public synchronized String get(String key) {
        SessionKeyEntry entry = getEntry(key);
        return entry != null ? entry.getSessionId() : null;
    }

    /**
     * Today's entry, including mode-only placeholders, or null.
     */
    public synchronized SessionKeyEntry getEntry(String key) {
        Map<String, SessionKeyEntry> entries = repository.load();
        SessionKeyEntry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (!today().equals(entry.getStartedDate())) {
            log.info("Session for {} expired (started {})", key, entry.getStartedDate());
            entries.remove(key);
            repository.save(entries);
            return null;
        }
        return entry;
    }

    /**
     * Approval mode chosen for today, or null for the backend default.
     */
    public synchronized ApprovalMode approvalMode(String key) {
        SessionKeyEntry entry = getEntry(key);
        return entry != null ? entry.getPermissionMode() : null;
    }

    /**
     * Store a session dated today. A null mode keeps the mode already stored.
     */
    public synchronized void set(String key, String sessionId, ApprovalMode mode) {
        Map<String, SessionKeyEntry> entries = repository.load();
        SessionKeyEntry previous = entries.get(key);
        ApprovalMode effective = mode;
        if (effective == null && previous != null && today().equals(previous.getStartedDate())) {
            effective = previous.getPermissionMode();
        }
        entries.put(key, new SessionKeyEntry(sessionId, today(), effective));
        repository.save(entries);
    }

    /**
     * Change the approval mode without touching the session. Creates a
     * placeholder when no entry exists for today.
     */
    public synchronized void setApprovalMode(String key, ApprovalMode mode) {
        Map<String, SessionKeyEntry> entries = repository.load();
        SessionKeyEntry entry = entries.get(key);
        if (entry == null || !today().equals(entry.getStartedDate())) {
            entry = new SessionKeyEntry(null, today(), mode);
        } else {
            entry.setPermissionMode(mode);
        }
        entries.put(key, entry);
        repository.save(entries);
    }

    public synchronized void clear(String key) {
        Map<String, SessionKeyEntry> entries = repository.load();
        if (entries.remove(key) != null) {
            repository.save(entries);
        }
    }

    private String today() {
        return LocalDate.now(clock).toString();
    }
}
