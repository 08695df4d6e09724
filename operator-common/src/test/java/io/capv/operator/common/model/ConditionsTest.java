/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.model;

import io.capv.api.model.common.Condition;
import io.capv.api.model.common.ConditionReasons;
import io.capv.api.model.common.ConditionTypes;
import io.capv.api.model.vsphere.VSphereMachineStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

public class ConditionsTest {
    private static Condition condition(String type, String status, String severity, String reason) {
        Condition condition = new Condition();
        condition.setType(type);
        condition.setStatus(status);
        condition.setSeverity(severity);
        condition.setReason(reason);
        condition.setMessage(reason != null ? reason + " message" : null);
        return condition;
    }

    @Test
    public void testTransitionTimeChangesOnlyWhenStatusFlips() {
        VSphereMachineStatus status = new VSphereMachineStatus();

        Conditions.markFalse(status, ConditionTypes.VM_PROVISIONED, ConditionReasons.CLONING, Condition.SEVERITY_INFO, "Cloning %s", "vm-1");
        Condition first = Conditions.get(status, ConditionTypes.VM_PROVISIONED);
        first.setLastTransitionTime("2020-01-01T00:00:00Z");

        Conditions.markFalse(status, ConditionTypes.VM_PROVISIONED, ConditionReasons.WAITING_FOR_NETWORK_ADDRESS, Condition.SEVERITY_INFO, "Waiting");
        Condition second = Conditions.get(status, ConditionTypes.VM_PROVISIONED);
        assertThat(second.getReason(), is(ConditionReasons.WAITING_FOR_NETWORK_ADDRESS));
        assertThat(second.getLastTransitionTime(), is("2020-01-01T00:00:00Z"));

        Conditions.markTrue(status, ConditionTypes.VM_PROVISIONED);
        Condition third = Conditions.get(status, ConditionTypes.VM_PROVISIONED);
        assertThat(third.getStatus(), is(Condition.STATUS_TRUE));
        assertThat(third.getLastTransitionTime().equals("2020-01-01T00:00:00Z"), is(false));
        assertThat(status.getConditions().size(), is(1));
    }

    @Test
    public void testMarkFalseFormatsMessage() {
        VSphereMachineStatus status = new VSphereMachineStatus();

        Conditions.markFalse(status, ConditionTypes.VM_PROVISIONED, ConditionReasons.CLONING, Condition.SEVERITY_INFO, "Cloning %s into %s", "template", "folder");

        Condition condition = Conditions.get(status, ConditionTypes.VM_PROVISIONED);
        assertThat(condition.getMessage(), is("Cloning template into folder"));
        assertThat(condition.getSeverity(), is(Condition.SEVERITY_INFO));
        assertThat(condition.getLastTransitionTime(), is(notNullValue()));
        assertThat(Conditions.isFalse(status, ConditionTypes.VM_PROVISIONED), is(true));
        assertThat(Conditions.isTrue(status, ConditionTypes.VM_PROVISIONED), is(false));
    }

    @Test
    public void testGetAndDelete() {
        VSphereMachineStatus status = new VSphereMachineStatus();
        assertThat(Conditions.get(status, ConditionTypes.VM_PROVISIONED), is(nullValue()));
        assertThat(Conditions.get(null, ConditionTypes.VM_PROVISIONED), is(nullValue()));

        Conditions.markTrue(status, ConditionTypes.VM_PROVISIONED);
        Conditions.markTrue(status, ConditionTypes.VCENTER_AVAILABLE);
        Conditions.delete(status, ConditionTypes.VM_PROVISIONED);

        assertThat(Conditions.get(status, ConditionTypes.VM_PROVISIONED), is(nullValue()));
        assertThat(Conditions.isTrue(status, ConditionTypes.VCENTER_AVAILABLE), is(true));
    }

    @Test
    public void testSummaryAllTrue() {
        Condition ready = Conditions.summary(List.of(
                condition(ConditionTypes.READY, Condition.STATUS_FALSE, Condition.SEVERITY_ERROR, "Old"),
                condition(ConditionTypes.VCENTER_AVAILABLE, Condition.STATUS_TRUE, null, null),
                condition(ConditionTypes.VM_PROVISIONED, Condition.STATUS_TRUE, null, null)));

        assertThat(ready.getType(), is(ConditionTypes.READY));
        assertThat(ready.getStatus(), is(Condition.STATUS_TRUE));
        assertThat(ready.getReason(), is(nullValue()));
    }

    @Test
    public void testSummaryWorstSeverityWins() {
        Condition ready = Conditions.summary(List.of(
                condition(ConditionTypes.VM_PROVISIONED, Condition.STATUS_FALSE, Condition.SEVERITY_INFO, ConditionReasons.CLONING),
                condition(ConditionTypes.VCENTER_AVAILABLE, Condition.STATUS_FALSE, Condition.SEVERITY_ERROR, ConditionReasons.VCENTER_UNREACHABLE),
                condition(ConditionTypes.CREDENTIALS_AVAILABLE, Condition.STATUS_FALSE, Condition.SEVERITY_WARNING, ConditionReasons.SECRET_NOT_FOUND)));

        assertThat(ready.getStatus(), is(Condition.STATUS_FALSE));
        assertThat(ready.getReason(), is(ConditionReasons.VCENTER_UNREACHABLE));
        assertThat(ready.getSeverity(), is(Condition.SEVERITY_ERROR));
        assertThat(ready.getMessage(), is(ConditionReasons.VCENTER_UNREACHABLE + " message"));
    }

    @Test
    public void testSummaryTieGoesToFirstCondition() {
        Condition ready = Conditions.summary(List.of(
                condition(ConditionTypes.VCENTER_AVAILABLE, Condition.STATUS_TRUE, null, null),
                condition(ConditionTypes.PLACEMENT_CONSTRAINT_MET, Condition.STATUS_FALSE, Condition.SEVERITY_ERROR, ConditionReasons.FOLDER_NOT_FOUND),
                condition(ConditionTypes.FAILURE_DOMAIN_VALIDATED, Condition.STATUS_FALSE, Condition.SEVERITY_ERROR, ConditionReasons.TOPOLOGY_NOT_FOUND)));

        assertThat(ready.getReason(), is(ConditionReasons.FOLDER_NOT_FOUND));
    }

    @Test
    public void testSetSummaryPutsReadyFirst() {
        VSphereMachineStatus status = new VSphereMachineStatus();
        Conditions.markTrue(status, ConditionTypes.VM_PROVISIONED);

        Conditions.setSummary(status);

        assertThat(status.getConditions().get(0).getType(), is(ConditionTypes.READY));
        assertThat(Conditions.isTrue(status, ConditionTypes.READY), is(true));

        VSphereMachineStatus empty = new VSphereMachineStatus();
        Conditions.setSummary(empty);
        assertThat(empty.getConditions(), is(nullValue()));
    }

    @Test
    public void testDeletingReadyIsKeptWhileDeleting() {
        VSphereMachineStatus status = new VSphereMachineStatus();
        Conditions.markTrue(status, ConditionTypes.VCENTER_AVAILABLE);
        Conditions.markFalse(status, ConditionTypes.CONTROL_PLANE_ENDPOINT_RESOLVED, ConditionReasons.WAITING_FOR_CONTROL_PLANE_MACHINES, Condition.SEVERITY_INFO, null);
        Conditions.markFalse(status, ConditionTypes.READY, ConditionReasons.DELETING, Condition.SEVERITY_INFO, "Waiting for %d dependent resources", 2);

        Conditions.setSummary(status, true);
        assertThat(Conditions.get(status, ConditionTypes.READY).getReason(), is(ConditionReasons.DELETING));
        assertThat(Conditions.get(status, ConditionTypes.READY).getMessage(), is("Waiting for 2 dependent resources"));

        Conditions.setSummary(status, false);
        assertThat(Conditions.get(status, ConditionTypes.READY).getReason(), is(ConditionReasons.WAITING_FOR_CONTROL_PLANE_MACHINES));
    }

    @Test
    public void testDeletingReadyWithoutOtherBlockersStaysFalse() {
        VSphereMachineStatus status = new VSphereMachineStatus();
        Conditions.markTrue(status, ConditionTypes.PLACEMENT_CONSTRAINT_MET);
        Conditions.markFalse(status, ConditionTypes.READY, ConditionReasons.DELETING, Condition.SEVERITY_INFO, "Deployment zone is used by %d Machines", 1);

        Conditions.setSummary(status, true);

        assertThat(Conditions.isFalse(status, ConditionTypes.READY), is(true));
        assertThat(Conditions.get(status, ConditionTypes.READY).getReason(), is(ConditionReasons.DELETING));
    }

    @Test
    public void testDeletionFailureWinsOverDeletingReady() {
        VSphereMachineStatus status = new VSphereMachineStatus();
        Conditions.markFalse(status, ConditionTypes.READY, ConditionReasons.DELETING, Condition.SEVERITY_INFO, null);
        Conditions.markFalse(status, ConditionTypes.VM_PROVISIONED, ConditionReasons.DELETION_FAILED, Condition.SEVERITY_WARNING, "%s", "task failed");

        Conditions.setSummary(status, true);

        assertThat(Conditions.get(status, ConditionTypes.READY).getReason(), is(ConditionReasons.DELETION_FAILED));
        assertThat(Conditions.get(status, ConditionTypes.READY).getMessage(), is("task failed"));
    }
}
