package com.echelon.kernel.audit;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link AuditSink} that keeps entries in memory. Used in tests and single-node demos.
 */
public class InMemoryAuditSink implements AuditSink {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void append(AuditEntry entry) {
        entries.add(entry);
    }

    /** Snapshot of the entries appended so far, in order. */
    public List<AuditEntry> entries() {
        return List.copyOf(entries);
    }

    public List<AuditEntry> entriesFor(String tenantId) {
        return entries.stream().filter(e -> tenantId.equals(e.tenantId())).toList();
    }

    public void clear() {
        entries.clear();
    }
}
