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
import com.brokered.messaging.ReceiveMode;
import jakarta.jms.IllegalStateException;

/**
 * Lock tokens only exist in peek-lock mode, so every operation that takes one
 * is rejected on a receive-and-delete receiver.
 */
public final class ReceiveModeGuard {

    private ReceiveModeGuard() {
    }

    /**
     * @param receiveMode
     *            the mode the receiver was created with
     * @throws IllegalStateException
     *             if the mode is not {@link ReceiveMode#PEEK_LOCK}
     */
    public static void requirePeekLock(ReceiveMode receiveMode) throws IllegalStateException {
        if (receiveMode != ReceiveMode.PEEK_LOCK) {
            throw new IllegalStateException(BrokeredMessagingClientConstants.PEEK_LOCK_REQUIRED);
        }
    }
}
