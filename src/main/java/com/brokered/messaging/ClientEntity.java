/*
 * Copyright 2010-2019 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *  http://aws.amazon.com/apache2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */
package com.brokered.messaging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Base of every client-side entity: carries the client id used in logs and
 * telemetry, and the close lifecycle.
 */
public abstract class ClientEntity {
    private static final Logger LOG = LoggerFactory.getLogger(ClientEntity.class);

    private final String clientId;

    private volatile boolean closed = false;

    private CompletableFuture<Void> closeFuture;

    protected ClientEntity(String clientId) {
        this.clientId = clientId;
    }

    /**
     * Builds a client id from the entity's kind and a random suffix, e.g.
     * <code>MessageReceiver-1c3f9a2e</code>.
     */
    protected static String generateClientId(String name) {
        return name + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public String getClientId() {
        return clientId;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes the entity. Only the first call does any work; later calls return
     * the same future.
     */
    public synchronized CompletableFuture<Void> close() {
        if (closeFuture != null) {
            return closeFuture;
        }
        closed = true;
        LOG.info("Closing {}", clientId);
        try {
            closeFuture = onClose();
        } catch (RuntimeException e) {
            LOG.error("Failed to close {}", clientId, e);
            closeFuture = CompletableFuture.failedFuture(e);
        }
        return closeFuture;
    }

    /**
     * Releases whatever the entity holds on the transport.
     */
    protected abstract CompletableFuture<Void> onClose();
}
