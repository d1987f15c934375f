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
package com.brokered.messaging.management;

import java.time.Instant;
import java.util.Date;
import java.util.List;

/**
 * Reads typed values out of management response bodies. Transports decode
 * AMQP timestamps as <code>Date</code>; some hand over <code>Instant</code>
 * or epoch milliseconds instead, and all three are accepted.
 */
public final class ManagementValues {

    private ManagementValues() {
    }

    /**
     * @return the instant, or null if the value is missing or not a timestamp
     */
    public static Instant toInstant(Object value) {
        if (value instanceof Instant) {
            return (Instant) value;
        } else if (value instanceof Date) {
            return ((Date) value).toInstant();
        } else if (value instanceof Number) {
            return Instant.ofEpochMilli(((Number) value).longValue());
        }
        return null;
    }

    /**
     * Returns the first element of an array or list value, or null if there is
     * none.
     */
    public static Object first(Object value) {
        if (value instanceof Object[]) {
            Object[] array = (Object[]) value;
            return array.length > 0 ? array[0] : null;
        } else if (value instanceof List) {
            List<?> list = (List<?>) value;
            return list.isEmpty() ? null : list.get(0);
        }
        return null;
    }
}
