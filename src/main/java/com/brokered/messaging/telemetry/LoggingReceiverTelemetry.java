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
package com.brokered.messaging.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Default telemetry, writing every event to the log.
 */
public class LoggingReceiverTelemetry implements ReceiverTelemetry {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingReceiverTelemetry.class);

    @Override
    public void start(ReceiverOperation operation, String clientId, Object... args) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("{}: {}Start {}", clientId, operation.getEventName(), Arrays.deepToString(args));
        }
    }

    @Override
    public void stop(ReceiverOperation operation, String clientId) {
        LOG.debug("{}: {}Stop", clientId, operation.getEventName());
    }

    @Override
    public void exception(ReceiverOperation operation, String clientId, Throwable error) {
        LOG.warn("{}: {}Exception {}", clientId, operation.getEventName(), error.toString());
    }
}
