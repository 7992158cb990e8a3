package com.scout.scheduler.session;

import java.util.Map;

/**
 * Storage for the key to session table. The whole table is read and written
 * at once.
 */
public interface SessionKeyRepository {

    /** Current table; empty when nothing is stored. */
    Map<String, SessionKeyEntry> load();

    void save(Map<String, SessionKeyEntry> entries);
}
