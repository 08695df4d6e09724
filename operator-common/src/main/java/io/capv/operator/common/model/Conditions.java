/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.model;

import io.capv.api.model.common.Condition;
import io.capv.api.model.common.ConditionReasons;
import io.capv.api.model.common.ConditionTypes;
import io.capv.api.model.common.Status;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Utility methods for tracking the conditions in the status sections of the custom resources. The transition time of a
 * condition changes only when its status flips.
 */
public class Conditions {
    private Conditions() { }

    /**
     * Returns the current timestamp in ISO 8601 format, for example "2019-07-23T09:08:12.356Z".
     *
     * @return the current timestamp in ISO 8601 format, for example "2019-07-23T09:08:12.356Z".
     */
    public static String iso8601Now() {
        return iso8601(Instant.now());
    }

    /**
     * Returns the timestamp of the provided date in ISO 8601 format, for example "2019-07-23T09:08:12.356Z".
     *
     * @param instant The date instant for which should the ISO 8601 timestamp be provided
     *
     * @return the timestamp in ISO 8601 format
     */
    public static String iso8601(Instant instant) {
        return ZonedDateTime.ofInstant(instant, ZoneOffset.UTC).format(DateTimeFormatter.ISO_INSTANT);
    }

    /**
     * Sets the condition. An existing condition of the same type is replaced in place, keeping its transition time
     * when the status did not change. A new Ready condition goes first.
     *
     * @param status        Status section
     * @param condition     Condition to set
     */
    public static void set(Status status, Condition condition) {
        List<Condition> conditions = status.conditions();

        for (int i = 0; i < conditions.size(); i++) {
            Condition existing = conditions.get(i);

            if (Objects.equals(existing.getType(), condition.getType())) {
                if (Objects.equals(existing.getStatus(), condition.getStatus())) {
                    condition.setLastTransitionTime(existing.getLastTransitionTime());
                } else if (condition.getLastTransitionTime() == null) {
                    condition.setLastTransitionTime(iso8601Now());
                }

                conditions.set(i, condition);
                return;
            }
        }

        if (condition.getLastTransitionTime() == null) {
            condition.setLastTransitionTime(iso8601Now());
        }

        if (ConditionTypes.READY.equals(condition.getType())) {
            conditions.add(0, condition);
        } else {
            conditions.add(condition);
        }
    }

    /**
     * @param status    Status section
     * @param type      Condition type
     */
    public static void markTrue(Status status, String type) {
        Condition condition = new Condition();
        condition.setType(type);
        condition.setStatus(Condition.STATUS_TRUE);
        set(status, condition);
    }

    /**
     * Sets a False condition with reason, severity and a formatted message
     *
     * @param status            Status section
     * @param type              Condition type
     * @param reason            Reason
     * @param severity          Severity
     * @param messageFormat     Message format in {@link String#format(String, Object...)} syntax
     * @param args              Message arguments
     */
    public static void markFalse(Status status, String type, String reason, String severity, String messageFormat, Object... args) {
        Condition condition = new Condition();
        condition.setType(type);
        condition.setStatus(Condition.STATUS_FALSE);
        condition.setReason(reason);
        condition.setSeverity(severity);
        condition.setMessage(messageFormat != null ? String.format(messageFormat, args) : null);
        set(status, condition);
    }

    /**
     * @param status    Status section (can be null)
     * @param type      Condition type
     *
     * @return  The condition or null if not present
     */
    public static Condition get(Status status, String type) {
        if (status == null || status.getConditions() == null) {
            return null;
        }

        return status.getConditions().stream()
                .filter(c -> Objects.equals(c.getType(), type))
                .findFirst()
                .orElse(null);
    }

    /**
     * @param status    Status section (can be null)
     * @param type      Condition type
     *
     * @return  True if the condition exists and is True
     */
    public static boolean isTrue(Status status, String type) {
        Condition condition = get(status, type);
        return condition != null && Condition.STATUS_TRUE.equals(condition.getStatus());
    }

    /**
     * @param status    Status section (can be null)
     * @param type      Condition type
     *
     * @return  True if the condition exists and is False
     */
    public static boolean isFalse(Status status, String type) {
        Condition condition = get(status, type);
        return condition != null && Condition.STATUS_FALSE.equals(condition.getStatus());
    }

    /**
     * @param status    Status section
     * @param type      Condition type to remove
     */
    public static void delete(Status status, String type) {
        if (status.getConditions() == null) {
            return;
        }

        Iterator<Condition> it = status.getConditions().iterator();
        while (it.hasNext()) {
            if (Objects.equals(it.next().getType(), type)) {
                it.remove();
            }
        }
    }

    /**
     * Computes the Ready summary of the conditions. When every condition other than Ready is True, the summary is
     * True. Otherwise the summary mirrors the blocking condition: the one with the worst severity, the earlier one in
     * the list on a tie.
     *
     * @param conditions    Conditions to summarize
     *
     * @return  New Ready condition without a transition time
     */
    public static Condition summary(List<Condition> conditions) {
        Condition blocking = null;

        if (conditions != null) {
            for (Condition condition : conditions) {
                if (ConditionTypes.READY.equals(condition.getType())
                        || Condition.STATUS_TRUE.equals(condition.getStatus())) {
                    continue;
                }

                if (blocking == null || severityRank(condition.getSeverity()) > severityRank(blocking.getSeverity())) {
                    blocking = condition;
                }
            }
        }

        Condition ready = new Condition();
        ready.setType(ConditionTypes.READY);

        if (blocking == null) {
            ready.setStatus(Condition.STATUS_TRUE);
        } else {
            ready.setStatus(blocking.getStatus());
            ready.setReason(blocking.getReason());
            ready.setSeverity(blocking.getSeverity());
            ready.setMessage(blocking.getMessage());
        }

        return ready;
    }

    /**
     * Recomputes the Ready condition of the status from the other conditions. Does nothing when the status has no
     * conditions at all.
     *
     * @param status    Status section
     */
    public static void setSummary(Status status) {
        if (status == null || status.getConditions() == null || status.getConditions().isEmpty()) {
            return;
        }

        set(status, summary(status.getConditions()));
    }

    /**
     * Recomputes the Ready condition. While the resource is being deleted, a Ready condition which the reconciliation
     * marked False with the Deleting reason names what the deletion waits for. It is kept unless another condition
     * reports a warning or an error.
     *
     * @param status      Status section
     * @param deleting    True when the resource has a deletion timestamp
     */
    public static void setSummary(Status status, boolean deleting) {
        if (status == null || status.getConditions() == null || status.getConditions().isEmpty()) {
            return;
        }

        Condition ready = get(status, ConditionTypes.READY);
        Condition summary = summary(status.getConditions());

        if (deleting
                && ready != null
                && Condition.STATUS_FALSE.equals(ready.getStatus())
                && ConditionReasons.DELETING.equals(ready.getReason())
                && (Condition.STATUS_TRUE.equals(summary.getStatus()) || severityRank(summary.getSeverity()) <= severityRank(Condition.SEVERITY_INFO))) {
            return;
        }

        set(status, summary);
    }

    private static int severityRank(String severity) {
        if (Condition.SEVERITY_ERROR.equals(severity)) {
            return 3;
        } else if (Condition.SEVERITY_WARNING.equals(severity)) {
            return 2;
        } else if (Condition.SEVERITY_INFO.equals(severity)) {
            return 1;
        } else {
            return 0;
        }
    }
}
