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

import java.time.Duration;

public class ReceiverConfiguration {
    private ReceiveMode receiveMode;
    private int prefetchCount;
    private Duration operationTimeout;

    public ReceiverConfiguration() {
        // Peek-lock without prefetch unless told otherwise.
        this.receiveMode = ReceiveMode.PEEK_LOCK;
        this.prefetchCount = BrokeredMessagingClientConstants.DEFAULT_PREFETCH;
        this.operationTimeout = BrokeredMessagingClientConstants.DEFAULT_OPERATION_TIMEOUT;
    }

    public ReceiveMode getReceiveMode() {
        return receiveMode;
    }

    public void setReceiveMode(ReceiveMode receiveMode) {
        if (receiveMode == null) {
            throw new IllegalArgumentException("Receive mode cannot be null");
        }
        this.receiveMode = receiveMode;
    }

    public ReceiverConfiguration withReceiveMode(ReceiveMode receiveMode) {
        setReceiveMode(receiveMode);
        return this;
    }

    public int getPrefetchCount() {
        return prefetchCount;
    }

    public void setPrefetchCount(int prefetchCount) {
        if (prefetchCount < BrokeredMessagingClientConstants.MIN_PREFETCH) {
            throw new IllegalArgumentException(String.format("Invalid prefetch size. Provided value '%1$s' cannot be smaller than '%2$s'", prefetchCount, BrokeredMessagingClientConstants.MIN_PREFETCH));
        }
        this.prefetchCount = prefetchCount;
    }

    public ReceiverConfiguration withPrefetchCount(int prefetchCount) {
        setPrefetchCount(prefetchCount);
        return this;
    }

    public Duration getOperationTimeout() {
        return operationTimeout;
    }

    public void setOperationTimeout(Duration operationTimeout) {
        if (operationTimeout == null || operationTimeout.isNegative() || operationTimeout.isZero()) {
            throw new IllegalArgumentException(String.format("Invalid operation timeout. Provided value '%1$s' must be a positive duration", operationTimeout));
        }
        this.operationTimeout = operationTimeout;
    }

    public ReceiverConfiguration withOperationTimeout(Duration operationTimeout) {
        setOperationTimeout(operationTimeout);
        return this;
    }

}
