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

/**
 * Terminal state a consumer assigns to a delivery attempt. The broker owns the
 * resulting message state; nothing is kept locally.
 * <ul>
 * <li>COMPLETED removes the message from the entity.</li>
 * <li>ABANDONED releases the lock, the message is redelivered right away.</li>
 * <li>DEFERRED keeps the message, retrievable only by sequence number.</li>
 * <li>SUSPENDED moves the message to the dead-letter sub-queue.</li>
 * </ul>
 */
public enum DispositionStatus {
    COMPLETED("completed"),
    ABANDONED("abandoned"),
    // Spelled the way the broker expects it.
    DEFERRED("defered"),
    SUSPENDED("suspended");

    private final String wireValue;

    DispositionStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Returns the value sent as <code>disposition-status</code>.
     */
    public String getWireValue() {
        return wireValue;
    }
}
