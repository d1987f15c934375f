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

import com.brokered.messaging.management.ManagementConstants;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Decodes the encoded messages found in management responses. The encoding is
 * owned by the transport.
 */
@FunctionalInterface
public interface MessageDecoder {

    /**
     * @param encoded
     *            the message as carried in the response
     * @param lockToken
     *            the lock token of the delivery, or null when not locked
     */
    BrokeredMessage decode(byte[] encoded, UUID lockToken);

    /**
     * Decodes every entry of a <code>messages</code> list, keeping the order
     * the broker returned them in.
     */
    default List<BrokeredMessage> decodeAll(List<Map<String, Object>> entries) {
        List<BrokeredMessage> messages = new ArrayList<>(entries.size());
        for (Map<String, Object> entry : entries) {
            byte[] encoded = (byte[]) entry.get(ManagementConstants.Properties.MESSAGE);
            UUID lockToken = (UUID) entry.get(ManagementConstants.Properties.LOCK_TOKEN);
            messages.add(decode(encoded, lockToken));
        }
        return messages;
    }
}
