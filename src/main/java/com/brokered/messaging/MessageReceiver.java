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

import com.brokered.messaging.management.ManagementRequest;
import com.brokered.messaging.management.ManagementResponse;
import com.brokered.messaging.message.BrokeredMessage;
import com.brokered.messaging.settlement.ReceiveModeGuard;
import com.brokered.messaging.settlement.SettlementValidator;
import com.brokered.messaging.telemetry.LoggingReceiverTelemetry;
import com.brokered.messaging.telemetry.ReceiverOperation;
import com.brokered.messaging.telemetry.ReceiverTelemetry;
import com.brokered.messaging.util.CompletableFutures;
import jakarta.jms.JMSException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * A receiver pulls messages from one entity (a queue or a subscription) and
 * settles them.
 * <P>
 * Every operation runs the same way: the arguments and, for operations that
 * need a lock, the receive mode are checked first. A failed check completes
 * the returned future exceptionally without any telemetry and without
 * touching the transport. Otherwise a start event is recorded, the transport
 * hook is invoked and bounded by the operation timeout, and a stop or
 * exception event is recorded before the result is handed back.
 * <P>
 * Failures raised by a hook are handed back as they were raised: no wrapping,
 * no retry. A hook that does not complete within the operation timeout fails
 * the operation with <code>java.util.concurrent.TimeoutException</code>.
 * <P>
 * Operations may be invoked concurrently. Nothing is serialized here; any
 * ordering the transport needs is the transport's business.
 * <P>
 * Settlement state is never cached: completing the same lock token twice
 * sends both requests and reports whatever the broker answers.
 */
public abstract class MessageReceiver extends ClientEntity {
    private static final Logger LOG = LoggerFactory.getLogger(MessageReceiver.class);

    private final String path;

    private final ReceiveMode receiveMode;

    private final Duration operationTimeout;

    private final ReceiverTelemetry telemetry;

    private volatile int prefetchCount;

    protected MessageReceiver(String path, ReceiverConfiguration configuration) {
        this(path, configuration, new LoggingReceiverTelemetry());
    }

    protected MessageReceiver(String path, ReceiverConfiguration configuration, ReceiverTelemetry telemetry) {
        super(generateClientId(MessageReceiver.class.getSimpleName()));
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("Entity path cannot be null or empty");
        }
        if (configuration == null) {
            throw new IllegalArgumentException("Receiver configuration cannot be null");
        }
        this.path = path;
        this.receiveMode = configuration.getReceiveMode();
        this.operationTimeout = configuration.getOperationTimeout();
        this.prefetchCount = configuration.getPrefetchCount();
        this.telemetry = telemetry == null ? new LoggingReceiverTelemetry() : telemetry;
    }

    public String getPath() {
        return path;
    }

    public ReceiveMode getReceiveMode() {
        return receiveMode;
    }

    public Duration getOperationTimeout() {
        return operationTimeout;
    }

    public int getPrefetchCount() {
        return prefetchCount;
    }

    /**
     * Sets how many messages the transport may fetch ahead of receive calls.
     * Applies to receives started after this call.
     *
     * @param prefetchCount
     *            zero disables prefetching
     * @throws IllegalArgumentException
     *             if the value is negative
     */
    public void setPrefetchCount(int prefetchCount) {
        if (prefetchCount < BrokeredMessagingClientConstants.MIN_PREFETCH) {
            throw new IllegalArgumentException(String.format("Invalid prefetch size. Provided value '%1$s' cannot be smaller than '%2$s'", prefetchCount, BrokeredMessagingClientConstants.MIN_PREFETCH));
        }
        this.prefetchCount = prefetchCount;
    }

    /**
     * Receives the next message.
     *
     * @return the next message, or null if none arrived within the operation
     *         timeout
     */
    public CompletableFuture<BrokeredMessage> receive() {
        return CompletableFutures.map(receive(1), messages -> messages.isEmpty() ? null : messages.get(0));
    }

    /**
     * Receives up to <code>maxMessageCount</code> messages.
     *
     * @param maxMessageCount
     *            at least one
     * @return the messages in delivery order, empty if none arrived within the
     *         operation timeout
     */
    public CompletableFuture<List<BrokeredMessage>> receive(int maxMessageCount) {
        try {
            SettlementValidator.validateMaxMessageCount(maxMessageCount);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        return CompletableFutures.map(this.<List<BrokeredMessage>>execute(ReceiverOperation.RECEIVE,
                () -> onReceive(maxMessageCount), maxMessageCount), MessageReceiver::emptyIfNull);
    }

    /**
     * Receives deferred or previously received messages by their sequence
     * numbers. Messages that were settled meanwhile, or whose entries expired,
     * are simply missing from the result.
     *
     * @param sequenceNumbers
     *            non-empty batch of sequence numbers
     */
    public CompletableFuture<List<BrokeredMessage>> receiveBySequenceNumbers(Collection<Long> sequenceNumbers) {
        int count;
        try {
            count = SettlementValidator.validateSequenceNumbers(sequenceNumbers);
            ReceiveModeGuard.requirePeekLock(receiveMode);
        } catch (JMSException | IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        return CompletableFutures.map(this.<List<BrokeredMessage>>execute(ReceiverOperation.RECEIVE_BY_SEQUENCE_NUMBER,
                () -> onReceiveBySequenceNumbers(sequenceNumbers), count, sequenceNumbers),
                MessageReceiver::emptyIfNull);
    }

    /**
     * Completes the delivery attempts; the broker removes the messages.
     */
    public CompletableFuture<Void> complete(Collection<UUID> lockTokens) {
        return settle(ReceiverOperation.COMPLETE, lockTokens, () -> onComplete(lockTokens));
    }

    /**
     * Releases the locks; the messages can be delivered again right away.
     */
    public CompletableFuture<Void> abandon(Collection<UUID> lockTokens) {
        return settle(ReceiverOperation.ABANDON, lockTokens, () -> onAbandon(lockTokens));
    }

    /**
     * Defers the messages; from now on they can only be received through
     * {@link #receiveBySequenceNumbers(Collection)}.
     */
    public CompletableFuture<Void> defer(Collection<UUID> lockTokens) {
        return settle(ReceiverOperation.DEFER, lockTokens, () -> onDefer(lockTokens));
    }

    /**
     * Moves the messages to the entity's dead-letter sub-queue.
     */
    public CompletableFuture<Void> deadLetter(Collection<UUID> lockTokens) {
        return settle(ReceiverOperation.DEAD_LETTER, lockTokens, () -> onDeadLetter(lockTokens));
    }

    /**
     * Extends the lock of one delivery attempt.
     *
     * @param lockToken
     *            the lock token of the delivery
     * @return the new expiry of the lock, as reported by the broker
     */
    public CompletableFuture<Instant> renewLock(UUID lockToken) {
        try {
            SettlementValidator.validateLockToken(lockToken);
            ReceiveModeGuard.requirePeekLock(receiveMode);
        } catch (JMSException | IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        return execute(ReceiverOperation.RENEW_LOCK, () -> onRenewLock(lockToken),
                1, Collections.singletonList(lockToken));
    }

    /**
     * Sends a raw request to the entity's management endpoint. The response is
     * returned as is, whatever its status code.
     */
    public CompletableFuture<ManagementResponse> executeManagementRequest(ManagementRequest request) {
        return execute(ReceiverOperation.MANAGEMENT_REQUEST, () -> onExecuteManagementRequest(request),
                request == null ? null : request.getOperation());
    }

    protected abstract CompletableFuture<List<BrokeredMessage>> onReceive(int maxMessageCount);

    protected abstract CompletableFuture<List<BrokeredMessage>> onReceiveBySequenceNumbers(Collection<Long> sequenceNumbers);

    protected abstract CompletableFuture<Void> onComplete(Collection<UUID> lockTokens);

    protected abstract CompletableFuture<Void> onAbandon(Collection<UUID> lockTokens);

    protected abstract CompletableFuture<Void> onDefer(Collection<UUID> lockTokens);

    protected abstract CompletableFuture<Void> onDeadLetter(Collection<UUID> lockTokens);

    protected abstract CompletableFuture<Instant> onRenewLock(UUID lockToken);

    protected abstract CompletableFuture<ManagementResponse> onExecuteManagementRequest(ManagementRequest request);

    private CompletableFuture<Void> settle(ReceiverOperation operation, Collection<UUID> lockTokens,
                                           Supplier<CompletableFuture<Void>> hook) {
        int count;
        try {
            count = SettlementValidator.validateLockTokens(lockTokens);
            ReceiveModeGuard.requirePeekLock(receiveMode);
        } catch (JMSException | IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        return execute(operation, hook, count, lockTokens);
    }

    private <T> CompletableFuture<T> execute(ReceiverOperation operation, Supplier<CompletableFuture<T>> hook,
                                             Object... startArgs) {
        notifyStart(operation, startArgs);

        CompletableFuture<T> pending;
        try {
            pending = Objects.requireNonNull(hook.get(), "Transport hook returned no future");
        } catch (RuntimeException e) {
            pending = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        // The hook's future belongs to the transport; only a copy is bounded.
        pending.copy().orTimeout(operationTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((value, error) -> {
                    if (error != null) {
                        Throwable cause = CompletableFutures.unwrap(error);
                        notifyException(operation, cause);
                        result.completeExceptionally(cause);
                    } else {
                        notifyStop(operation);
                        result.complete(value);
                    }
                });
        return result;
    }

    private void notifyStart(ReceiverOperation operation, Object... args) {
        try {
            telemetry.start(operation, getClientId(), args);
        } catch (RuntimeException e) {
            LOG.warn("Telemetry start event failed for {} on {}", operation, getClientId(), e);
        }
    }

    private void notifyStop(ReceiverOperation operation) {
        try {
            telemetry.stop(operation, getClientId());
        } catch (RuntimeException e) {
            LOG.warn("Telemetry stop event failed for {} on {}", operation, getClientId(), e);
        }
    }

    private void notifyException(ReceiverOperation operation, Throwable error) {
        try {
            telemetry.exception(operation, getClientId(), error);
        } catch (RuntimeException e) {
            LOG.warn("Telemetry exception event failed for {} on {}", operation, getClientId(), e);
        }
    }

    private static List<BrokeredMessage> emptyIfNull(List<BrokeredMessage> messages) {
        return messages == null ? Collections.emptyList() : messages;
    }
}
