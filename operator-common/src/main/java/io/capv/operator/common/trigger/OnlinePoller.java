/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common.trigger;

import java.util.function.BooleanSupplier;

/**
 * Describes a background poll waiting for an external system to come online.
 *
 * @param precondition  When already true, no polling is needed at all
 * @param awaited       The state being waited for
 * @param onMet         Action run once when the awaited state is reached, typically emitting a reconciliation event
 * @param recorded      True once the reaction to the event was recorded and the poller can end
 */
public record OnlinePoller(BooleanSupplier precondition, BooleanSupplier awaited, Runnable onMet, BooleanSupplier recorded) {
}
