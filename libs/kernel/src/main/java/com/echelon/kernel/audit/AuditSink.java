package com.echelon.kernel.audit;

/**
 * Durable destination of audit entries. Called from the audit worker thread only.
 */
public interface AuditSink {

    /**
     * Appends one entry.
     *
     * @throws Exception if the entry could not be stored; the worker logs it to the fallback channel
     */
    void append(AuditEntry entry) throws Exception;
}
