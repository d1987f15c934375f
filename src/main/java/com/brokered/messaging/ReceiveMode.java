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

/**
 * <p>
 * Specifies how the broker hands messages over to a receiver:
 * <ul>
 * <li>In PEEK_LOCK mode, a delivered message stays on the entity, locked to
 * this receiver, until it is settled (complete, abandon, defer, dead-letter)
 * or its lock expires. Every delivery attempt carries a lock token.</li>
 * <li>In RECEIVE_AND_DELETE mode, the broker removes the message as soon as
 * it is delivered. There is no lock and nothing to settle.</li>
 * </ul>
 */
public enum ReceiveMode {
    PEEK_LOCK(1), RECEIVE_AND_DELETE(0);

    private final int receiverSettleMode;

    ReceiveMode(int receiverSettleMode) {
        this.receiverSettleMode = receiverSettleMode;
    }

    /**
     * Returns the value sent as <code>receiver-settle-mode</code> on
     * management requests that deliver messages.
     */
    public int getReceiverSettleMode() {
        return receiverSettleMode;
    }
}
