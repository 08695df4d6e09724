/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.api.model.common;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Represents a status condition of a custom resource. Conditions are identified by their type and are kept in the
 * status section in a stable order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"type", "status", "severity", "lastTransitionTime", "reason", "message"})
public class Condition {
    /**
     * Condition status True
     */
    public static final String STATUS_TRUE = "True";
    /**
     * Condition status False
     */
    public static final String STATUS_FALSE = "False";
    /**
     * Condition status Unknown
     */
    public static final String STATUS_UNKNOWN = "Unknown";

    /**
     * Severity used for conditions which block the resource and need an intervention
     */
    public static final String SEVERITY_ERROR = "Error";
    /**
     * Severity used for conditions which block the resource but might be temporary
     */
    public static final String SEVERITY_WARNING = "Warning";
    /**
     * Severity used for informative conditions (for example the resource is waiting for something)
     */
    public static final String SEVERITY_INFO = "Info";
    /**
     * No severity. Used for conditions with status True.
     */
    public static final String SEVERITY_NONE = "";

    private String type;
    private String status;
    private String severity;
    private String lastTransitionTime;
    private String reason;
    private String message;

    public Condition() {
    }

    /**
     * Creates a copy of another condition
     *
     * @param other     Condition which should be copied
     */
    public Condition(Condition other) {
        this.type = other.type;
        this.status = other.status;
        this.severity = other.severity;
        this.lastTransitionTime = other.lastTransitionTime;
        this.reason = other.reason;
        this.message = other.message;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    public String getLastTransitionTime() {
        return lastTransitionTime;
    }

    public void setLastTransitionTime(String lastTransitionTime) {
        this.lastTransitionTime = lastTransitionTime;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o == null || getClass() != o.getClass()) {
            return false;
        } else {
            Condition condition = (Condition) o;
            return Objects.equals(type, condition.type)
                    && Objects.equals(status, condition.status)
                    && Objects.equals(severity, condition.severity)
                    && Objects.equals(lastTransitionTime, condition.lastTransitionTime)
                    && Objects.equals(reason, condition.reason)
                    && Objects.equals(message, condition.message);
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, status, severity, lastTransitionTime, reason, message);
    }

    @Override
    public String toString() {
        return "Condition(type=" + type + ", status=" + status + ", severity=" + severity + ", reason=" + reason + ", message=" + message + ")";
    }
}
