package com.toolgate.enforcer.audit;

import com.toolgate.common.json.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each event as a single JSON line at INFO on the
 * {@value #LOGGER_NAME} logger.
 */
public class Slf4jAuditSink implements AuditSink {

    public static final String LOGGER_NAME = "toolgate.audit";

    private final Logger logger;

    public Slf4jAuditSink() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    public Slf4jAuditSink(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void emit(AuditEvent event) {
        String json = JsonSupport.toJson(event);
        if (json == null) {
            throw new IllegalStateException("Audit event for " + event.getToolName() + " is not serializable");
        }
        logger.info(json);
    }
}
