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

/**
 * Receives start, stop and exception events around every receiver operation.
 * The events are observations only: nothing returned or thrown from here is
 * allowed to change the operation's outcome.
 */
public interface ReceiverTelemetry {

    /**
     * Called once the operation's preconditions passed, before the transport
     * is involved.
     *
     * @param operation
     *            the operation being started
     * @param clientId
     *            the receiver's client id
     * @param args
     *            operation details, such as the batch count and the batch
     */
    void start(ReceiverOperation operation, String clientId, Object... args);

    /**
     * Called when the operation completed successfully.
     */
    void stop(ReceiverOperation operation, String clientId);

    /**
     * Called when the transport failed the operation, before the failure is
     * handed back to the caller.
     */
    void exception(ReceiverOperation operation, String clientId, Throwable error);
}
