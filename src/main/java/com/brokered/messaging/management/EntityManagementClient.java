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
package com.brokered.messaging.management;

import com.brokered.messaging.BrokeredMessagingClientConstants;
import com.brokered.messaging.MessageReceiver;
import com.brokered.messaging.message.BrokeredMessage;
import com.brokered.messaging.message.MessageDecoder;
import com.brokered.messaging.util.CompletableFutures;
import jakarta.jms.JMSException;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Browsing and session operations of an entity, sent through the management
 * endpoint of a receiver bound to it.
 */
public class EntityManagementClient {

    private final MessageReceiver receiver;

    private final MessageDecoder messageDecoder;

    public EntityManagementClient(MessageReceiver receiver, MessageDecoder messageDecoder) {
        if (receiver == null || messageDecoder == null) {
            throw new IllegalArgumentException("Receiver and message decoder cannot be null");
        }
        this.receiver = receiver;
        this.messageDecoder = messageDecoder;
    }

    /**
     * Looks at messages without locking or removing them.
     *
     * @param fromSequenceNumber
     *            the sequence number to start browsing at
     * @param messageCount
     *            the most messages to return, at least one
     * @return the messages found, empty if there are none
     */
    public CompletableFuture<List<BrokeredMessage>> peek(long fromSequenceNumber, int messageCount) {
        if (messageCount < BrokeredMessagingClientConstants.MIN_BATCH) {
            return CompletableFuture.failedFuture(new IllegalArgumentException(String.format(
                    "Invalid message count. Provided value '%1$s' cannot be smaller than '%2$s'",
                    messageCount, BrokeredMessagingClientConstants.MIN_BATCH)));
        }
        ManagementRequest request = newRequest(ManagementConstants.Operations.PEEK_MESSAGE)
                .property(ManagementConstants.Properties.FROM_SEQUENCE_NUMBER, fromSequenceNumber)
                .property(ManagementConstants.Properties.MESSAGE_COUNT, messageCount)
                .build();
        return CompletableFutures.map(send(request), response -> response.hasNoContent()
                ? Collections.<BrokeredMessage>emptyList()
                : messageDecoder.decodeAll(response.getMessageEntries()));
    }

    /**
     * Extends the lock this receiver holds on a session.
     *
     * @return the new expiry of the session lock
     */
    public CompletableFuture<Instant> renewSessionLock(String sessionId) {
        if (sessionId == null || sessionId.isEmpty()) {
            return invalidSessionId();
        }
        ManagementRequest request = newRequest(ManagementConstants.Operations.RENEW_SESSION_LOCK)
                .property(ManagementConstants.Properties.SESSION_ID, sessionId)
                .build();
        return CompletableFutures.compose(send(request), response -> {
            Instant lockedUntil = ManagementValues.toInstant(response.getValue(ManagementConstants.Properties.EXPIRATION));
            if (lockedUntil == null) {
                return CompletableFuture.<Instant>failedFuture(
                        new JMSException("Renew session lock response carries no expiration for session " + sessionId));
            }
            return CompletableFuture.completedFuture(lockedUntil);
        });
    }

    /**
     * @return the session state, or null if none was set
     */
    public CompletableFuture<byte[]> getSessionState(String sessionId) {
        if (sessionId == null || sessionId.isEmpty()) {
            return invalidSessionId();
        }
        ManagementRequest request = newRequest(ManagementConstants.Operations.GET_SESSION_STATE)
                .property(ManagementConstants.Properties.SESSION_ID, sessionId)
                .build();
        return CompletableFutures.compose(send(request), response -> {
            Object state = response.getValue(ManagementConstants.Properties.SESSION_STATE);
            if (state != null && !(state instanceof byte[])) {
                return CompletableFuture.<byte[]>failedFuture(new JMSException("Session state of session " + sessionId
                        + " is not binary: " + state.getClass().getName()));
            }
            return CompletableFuture.completedFuture((byte[]) state);
        });
    }

    /**
     * Replaces the session state. A null state clears it.
     */
    public CompletableFuture<Void> setSessionState(String sessionId, byte[] state) {
        if (sessionId == null || sessionId.isEmpty()) {
            return invalidSessionId();
        }
        ManagementRequest request = newRequest(ManagementConstants.Operations.SET_SESSION_STATE)
                .property(ManagementConstants.Properties.SESSION_ID, sessionId)
                .property(ManagementConstants.Properties.SESSION_STATE, state)
                .build();
        return CompletableFutures.map(send(request), response -> null);
    }

    private ManagementRequest.Builder newRequest(String operation) {
        return ManagementRequest.builder(operation, receiver.getOperationTimeout());
    }

    private CompletableFuture<ManagementResponse> send(ManagementRequest request) {
        return CompletableFutures.compose(receiver.executeManagementRequest(request),
                response -> ManagementExceptions.successOrFailure(response, request.getOperation()));
    }

    private static <T> CompletableFuture<T> invalidSessionId() {
        return CompletableFuture.failedFuture(new IllegalArgumentException("Session id cannot be null or empty"));
    }
}
