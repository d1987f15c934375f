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

public class BrokeredMessagingClientConstants {

    public static final int MIN_BATCH = 1;

    public static final int MIN_PREFETCH = 0;

    public static final int DEFAULT_PREFETCH = 0;

    public static final Duration DEFAULT_OPERATION_TIMEOUT = Duration.ofSeconds(60);

    public static final String PEEK_LOCK_REQUIRED = "The operation is only supported in 'PEEK_LOCK' receive mode.";

    public static final String RECEIVER_CLOSED = "Receiver is closed";
}
