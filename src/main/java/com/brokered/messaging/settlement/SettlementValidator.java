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
package com.brokered.messaging.settlement;

import com.brokered.messaging.BrokeredMessagingClientConstants;

import java.util.Collection;
import java.util.UUID;

/**
 * Shape checks on caller supplied batches. These run before anything is sent
 * to the broker, so a malformed batch never reaches the network.
 */
public final class SettlementValidator {

    private SettlementValidator() {
    }

    /**
     * @param lockTokens
     *            the lock tokens of the delivery attempts to settle
     * @return the number of lock tokens in the batch
     * @throws IllegalArgumentException
     *             if the collection is null or empty
     */
    public static int validateLockTokens(Collection<UUID> lockTokens) {
        if (lockTokens == null || lockTokens.isEmpty()) {
            throw new IllegalArgumentException("lock token collection must be non-null and non-empty");
        }
        return lockTokens.size();
    }

    /**
     * @param sequenceNumbers
     *            the sequence numbers of the messages to receive
     * @return the number of sequence numbers in the batch
     * @throws IllegalArgumentException
     *             if the collection is null or empty
     */
    public static int validateSequenceNumbers(Collection<Long> sequenceNumbers) {
        if (sequenceNumbers == null || sequenceNumbers.isEmpty()) {
            throw new IllegalArgumentException("sequence number collection must be non-null and non-empty");
        }
        return sequenceNumbers.size();
    }

    public static void validateLockToken(UUID lockToken) {
        if (lockToken == null) {
            throw new IllegalArgumentException("lock token must be non-null");
        }
    }

    public static void validateMaxMessageCount(int maxMessageCount) {
        if (maxMessageCount < BrokeredMessagingClientConstants.MIN_BATCH) {
            throw new IllegalArgumentException(String.format("Invalid message count. Provided value '%1$s' cannot be smaller than '%2$s'", maxMessageCount, BrokeredMessagingClientConstants.MIN_BATCH));
        }
    }
}
