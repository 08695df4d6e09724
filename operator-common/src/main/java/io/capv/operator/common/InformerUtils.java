/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.common;

import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;

import java.net.HttpURLConnection;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Informer lifecycle helpers shared by the controllers
 */
public class InformerUtils {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(InformerUtils.class);

    private InformerUtils() {
    }

    /**
     * Stops the informers and waits until all of them report they are stopped
     *
     * @param timeoutMs     Overall wait limit
     * @param informers     Informers to stop
     */
    public static void stopAll(long timeoutMs, SharedIndexInformer<?>... informers) {
        LOGGER.infoOp("Stopping {} informers", informers.length);

        CompletableFuture<?>[] stopped = Arrays.stream(informers)
                .map(informer -> {
                    informer.stop();
                    return informer.stopped().toCompletableFuture();
                })
                .toArray(CompletableFuture<?>[]::new);

        try {
            CompletableFuture.allOf(stopped).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warnOp("Interrupted while waiting for the informers to stop");
        } catch (ExecutionException | TimeoutException e) {
            LOGGER.warnOp("Informers did not stop cleanly within {} ms", timeoutMs, e);
        }
    }

    /**
     * Informer exception handler. A missing resource type (the CRD is not installed) ends the watch, anything else
     * is retried by the informer.
     *
     * @param type          Watched resource type
     * @param isStarted     Whether the informer had already started
     * @param throwable     The error
     *
     * @return  True when the informer should retry
     */
    public static boolean loggingExceptionHandler(String type, boolean isStarted, Throwable throwable) {
        boolean unknownType = throwable instanceof KubernetesClientException e && e.getCode() == HttpURLConnection.HTTP_NOT_FOUND;

        if (unknownType) {
            LOGGER.errorOp("{} is not served by the API server, is its CRD installed?", type, throwable);
        } else {
            LOGGER.errorOp("{} informer ({}) failed and will retry", type, isStarted ? "started" : "starting", throwable);
        }

        return !unknownType;
    }
}
