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

import com.brokered.messaging.message.BrokeredMessage;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The transport's receiving link to one entity, delivering messages in the
 * receive mode the link was attached with.
 */
public interface ReceiveLink {

    /**
     * Receives up to <code>maxMessageCount</code> messages.
     *
     * @param maxMessageCount
     *            the most messages to hand back
     * @param prefetchCount
     *            how many messages the link may buffer ahead, zero for none
     * @param timeout
     *            how long to wait for the first message
     * @return the messages in delivery order, empty if none arrived in time
     */
    CompletableFuture<List<BrokeredMessage>> receive(int maxMessageCount, int prefetchCount, Duration timeout);

    /**
     * Detaches the link.
     */
    CompletableFuture<Void> close();
}
