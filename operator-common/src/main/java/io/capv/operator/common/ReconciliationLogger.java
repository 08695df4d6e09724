/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.spi.AbstractLogger;
import org.apache.logging.log4j.spi.ExtendedLoggerWrapper;

/**
 * Log4j logger with two families of methods. The {@code xxxCr} methods are used inside a reconciliation: they prefix
 * the message with it and attach its marker, so the log4j2 configuration can filter on a single resource. The
 * {@code xxxOp} methods are for messages about the operator itself.
 */
public class ReconciliationLogger {
    private static final String FQCN = ReconciliationLogger.class.getName();

    private final ExtendedLoggerWrapper logger;

    private ReconciliationLogger(Logger logger) {
        this.logger = new ExtendedLoggerWrapper((AbstractLogger) logger, logger.getName(), logger.getMessageFactory());
    }

    public static ReconciliationLogger create(Class<?> clazz) {
        return new ReconciliationLogger(LogManager.getLogger(clazz));
    }

    public static ReconciliationLogger create(String name) {
        return new ReconciliationLogger(LogManager.getLogger(name));
    }

    private void op(Level level, String message, Object... params) {
        logger.logIfEnabled(FQCN, level, null, message, params);
    }

    private void cr(Level level, Reconciliation reconciliation, String message, Object... params) {
        if (logger.isEnabled(level, reconciliation.getMarker())) {
            logger.logIfEnabled(FQCN, level, reconciliation.getMarker(), reconciliation + ": " + message, params);
        }
    }

    public void traceCr(Reconciliation reconciliation, String message, Object... params) {
        cr(Level.TRACE, reconciliation, message, params);
    }

    public void debugOp(String message, Object... params) {
        op(Level.DEBUG, message, params);
    }

    public void debugCr(Reconciliation reconciliation, String message, Object... params) {
        cr(Level.DEBUG, reconciliation, message, params);
    }

    public void infoOp(String message, Object... params) {
        op(Level.INFO, message, params);
    }

    public void infoCr(Reconciliation reconciliation, String message, Object... params) {
        cr(Level.INFO, reconciliation, message, params);
    }

    public void warnOp(String message, Object... params) {
        op(Level.WARN, message, params);
    }

    public void warnCr(Reconciliation reconciliation, String message, Object... params) {
        cr(Level.WARN, reconciliation, message, params);
    }

    public void errorOp(String message, Object... params) {
        op(Level.ERROR, message, params);
    }
}
