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

import java.util.concurrent.CompletableFuture;

/**
 * Request-response link to the management endpoint of one entity. Encoding
 * the request and correlating the answer is up to the transport.
 */
public interface ManagementChannel {

    /**
     * Sends a request and completes with the broker's answer, whatever its
     * status code. Completes exceptionally only when the transport fails.
     *
     * @param request
     *            the request to send
     * @return the broker's answer
     */
    CompletableFuture<ManagementResponse> request(ManagementRequest request);

    /**
     * Releases the link.
     */
    CompletableFuture<Void> close();
}
