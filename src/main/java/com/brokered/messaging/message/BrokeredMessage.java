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
package com.brokered.messaging.message;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A message delivered by the broker.
 * <P>
 * The sequence number is assigned by the broker and grows monotonically per
 * entity. The lock token names the current delivery attempt; it is only set
 * for peek-lock deliveries and is only meaningful until
 * {@link #getLockedUntil()}.
 */
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@Getter
@Builder
public class BrokeredMessage {

    @ToString.Include
    @EqualsAndHashCode.Include
    private final String messageId;

    @ToString.Include
    @EqualsAndHashCode.Include
    private final long sequenceNumber;

    // Null for receive-and-delete deliveries
    @ToString.Include
    @EqualsAndHashCode.Include
    private final UUID lockToken;

    private final Instant lockedUntil;

    private final int deliveryCount;

    private final String sessionId;

    private final byte[] body;

    @Singular
    private final Map<String, Object> properties;

    public boolean isLocked() {
        return lockToken != null;
    }
}
