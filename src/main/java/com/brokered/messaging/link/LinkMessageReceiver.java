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
package com.brokered.messaging.link;

import com.brokered.messaging.BrokeredMessagingClientConstants;
import com.brokered.messaging.MessageReceiver;
import com.brokered.messaging.ReceiverConfiguration;
import com.brokered.messaging.management.ManagementChannel;
import com.brokered.messaging.management.ManagementConstants;
import com.brokered.messaging.management.ManagementExceptions;
import com.brokered.messaging.management.ManagementRequest;
import com.brokered.messaging.management.ManagementResponse;
import com.brokered.messaging.management.ManagementValues;
import com.brokered.messaging.message.BrokeredMessage;
import com.brokered.messaging.message.MessageDecoder;
import com.brokered.messaging.settlement.DispositionStatus;
import com.brokered.messaging.telemetry.LoggingReceiverTelemetry;
import com.brokered.messaging.telemetry.ReceiverTelemetry;
import com.brokered.messaging.util.CompletableFutures;
import jakarta.jms.IllegalStateException;
import jakarta.jms.JMSException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Receiver over a receiving link and a management channel.
 * <P>
 * Messages are pulled through the {@link ReceiveLink}. Settlement, lock
 * renewal and receive-by-sequence-number go to the entity's management
 * endpoint, where broker-reported failures are turned into
 * <code>JMSException</code>s by {@link ManagementExceptions}.
 * <P>
 * Once the receiver is closed, every transport call fails with
 * <code>IllegalStateException</code>.
 */
public class LinkMessageReceiver extends MessageReceiver {
    private static final Logger LOG = LoggerFactory.getLogger(LinkMessageReceiver.class);

    private final ReceiveLink receiveLink;

    private final ManagementChannel managementChannel;

    private final MessageDecoder messageDecoder;

    public LinkMessageReceiver(String path, ReceiverConfiguration configuration, ReceiveLink receiveLink,
                               ManagementChannel managementChannel, MessageDecoder messageDecoder) {
        this(path, configuration, receiveLink, managementChannel, messageDecoder, new LoggingReceiverTelemetry());
    }

    public LinkMessageReceiver(String path, ReceiverConfiguration configuration, ReceiveLink receiveLink,
                               ManagementChannel managementChannel, MessageDecoder messageDecoder,
                               ReceiverTelemetry telemetry) {
        super(path, configuration, telemetry);
        if (receiveLink == null || managementChannel == null || messageDecoder == null) {
            throw new IllegalArgumentException("Receive link, management channel and message decoder cannot be null");
        }
        this.receiveLink = receiveLink;
        this.managementChannel = managementChannel;
        this.messageDecoder = messageDecoder;
    }

    @Override
    protected CompletableFuture<List<BrokeredMessage>> onReceive(int maxMessageCount) {
        if (isClosed()) {
            return closedFailure();
        }
        return receiveLink.receive(maxMessageCount, getPrefetchCount(), getOperationTimeout());
    }

    @Override
    protected CompletableFuture<List<BrokeredMessage>> onReceiveBySequenceNumbers(Collection<Long> sequenceNumbers) {
        long[] numbers = sequenceNumbers.stream().mapToLong(Long::longValue).toArray();
        ManagementRequest request = newRequest(ManagementConstants.Operations.RECEIVE_BY_SEQUENCE_NUMBER)
                .property(ManagementConstants.Properties.SEQUENCE_NUMBERS, numbers)
                .property(ManagementConstants.Properties.RECEIVER_SETTLE_MODE, getReceiveMode().getReceiverSettleMode())
                .build();
        return CompletableFutures.map(requestAndCheck(request), response -> response.hasNoContent()
                ? Collections.<BrokeredMessage>emptyList()
                : messageDecoder.decodeAll(response.getMessageEntries()));
    }

    @Override
    protected CompletableFuture<Void> onComplete(Collection<UUID> lockTokens) {
        return updateDisposition(lockTokens, DispositionStatus.COMPLETED);
    }

    @Override
    protected CompletableFuture<Void> onAbandon(Collection<UUID> lockTokens) {
        return updateDisposition(lockTokens, DispositionStatus.ABANDONED);
    }

    @Override
    protected CompletableFuture<Void> onDefer(Collection<UUID> lockTokens) {
        return updateDisposition(lockTokens, DispositionStatus.DEFERRED);
    }

    @Override
    protected CompletableFuture<Void> onDeadLetter(Collection<UUID> lockTokens) {
        return updateDisposition(lockTokens, DispositionStatus.SUSPENDED);
    }

    @Override
    protected CompletableFuture<Instant> onRenewLock(UUID lockToken) {
        ManagementRequest request = newRequest(ManagementConstants.Operations.RENEW_LOCK)
                .property(ManagementConstants.Properties.LOCK_TOKENS, new UUID[] { lockToken })
                .build();
        return CompletableFutures.compose(requestAndCheck(request), response -> {
            Instant lockedUntil = ManagementValues.toInstant(
                    ManagementValues.first(response.getValue(ManagementConstants.Properties.EXPIRATIONS)));
            if (lockedUntil == null) {
                return CompletableFuture.<Instant>failedFuture(
                        new JMSException("Renew lock response carries no expiration for lock token " + lockToken));
            }
            return CompletableFuture.completedFuture(lockedUntil);
        });
    }

    @Override
    protected CompletableFuture<ManagementResponse> onExecuteManagementRequest(ManagementRequest request) {
        if (isClosed()) {
            return closedFailure();
        }
        return managementChannel.request(request);
    }

    @Override
    protected CompletableFuture<Void> onClose() {
        return CompletableFuture.allOf(receiveLink.close(), managementChannel.close());
    }

    private CompletableFuture<Void> updateDisposition(Collection<UUID> lockTokens, DispositionStatus status) {
        ManagementRequest request = newRequest(ManagementConstants.Operations.UPDATE_DISPOSITION)
                .property(ManagementConstants.Properties.LOCK_TOKENS, lockTokens.toArray(new UUID[0]))
                .property(ManagementConstants.Properties.DISPOSITION_STATUS, status.getWireValue())
                .build();
        return CompletableFutures.map(requestAndCheck(request), response -> null);
    }

    private ManagementRequest.Builder newRequest(String operation) {
        return ManagementRequest.builder(operation, getOperationTimeout())
                .trackingId(UUID.randomUUID().toString());
    }

    private CompletableFuture<ManagementResponse> requestAndCheck(ManagementRequest request) {
        if (isClosed()) {
            return closedFailure();
        }
        LOG.debug("{}: sending {} to {}", getClientId(), request.getOperation(), getPath());
        return CompletableFutures.compose(managementChannel.request(request),
                response -> ManagementExceptions.successOrFailure(response, request.getOperation()));
    }

    private static <T> CompletableFuture<T> closedFailure() {
        return CompletableFuture.failedFuture(new IllegalStateException(BrokeredMessagingClientConstants.RECEIVER_CLOSED));
    }
}
