package com.echelon.kernel.audit;

import com.echelon.kernel.json.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each entry as one JSON line on the {@code echelon.audit} logger.
 * Route that logger to its own appender to get an append-only audit file.
 */
public class Slf4jAuditSink implements AuditSink {

    public static final String LOGGER_NAME = "echelon.audit";

    private static final Logger audit = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void append(AuditEntry entry) {
        audit.info(Json.write(entry));
    }
}
