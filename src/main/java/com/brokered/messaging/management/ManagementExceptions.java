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

import com.brokered.messaging.BrokerException;
import com.brokered.messaging.BrokerTimeoutException;
import com.brokered.messaging.MessageLockLostException;
import com.brokered.messaging.SessionLockLostException;
import jakarta.jms.InvalidDestinationException;
import jakarta.jms.JMSException;
import jakarta.jms.JMSSecurityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Turns a non-success management response into the matching
 * <code>JMSException</code>. Transport failures never come through here; they
 * are surfaced as they were raised.
 */
public final class ManagementExceptions {
    private static final Logger LOG = LoggerFactory.getLogger(ManagementExceptions.class);

    private ManagementExceptions() {
    }

    /**
     * Passes a successful response on, or fails with the translated exception.
     *
     * @param response
     *            the broker's answer
     * @param operation
     *            the management operation, used in the error message
     * @return a future completed with the same response, or failed with a
     *         <code>JMSException</code> built from the status code and error
     *         condition
     */
    public static CompletableFuture<ManagementResponse> successOrFailure(ManagementResponse response, String operation) {
        if (response.isSuccess()) {
            return CompletableFuture.completedFuture(response);
        }
        return CompletableFuture.failedFuture(toException(response, operation));
    }

    public static JMSException toException(ManagementResponse response, String operation) {
        String condition = response.getErrorCondition();
        String errorMessage = logAndGetBrokerError(response, operation);
        if (ManagementConstants.Conditions.MESSAGE_LOCK_LOST.equals(condition)) {
            return new MessageLockLostException(errorMessage, response.getStatusCode(),
                    response.getStatusDescription(), condition);
        } else if (ManagementConstants.Conditions.SESSION_LOCK_LOST.equals(condition)) {
            return new SessionLockLostException(errorMessage, response.getStatusCode(),
                    response.getStatusDescription(), condition);
        } else if (ManagementConstants.Conditions.TIMEOUT.equals(condition)) {
            return new BrokerTimeoutException(errorMessage, response.getStatusCode(),
                    response.getStatusDescription(), condition);
        } else if (ManagementConstants.Conditions.NOT_FOUND.equals(condition)) {
            return new InvalidDestinationException(errorMessage, condition);
        } else if (ManagementConstants.Conditions.UNAUTHORIZED_ACCESS.equals(condition)) {
            return new JMSSecurityException(errorMessage, condition);
        }
        return new BrokerException(errorMessage, response.getStatusCode(), response.getStatusDescription(), condition);
    }

    /**
     * Create generic error message for a broker-reported failure. Message
     * includes Operation, StatusCode, StatusDescription and ErrorCondition.
     */
    private static String logAndGetBrokerError(ManagementResponse response, String operation) {
        String errorMessage = "Management request failed: " + operation + ". StatusCode: " + response.getStatusCode()
                + " StatusDescription: " + response.getStatusDescription()
                + " ErrorCondition: " + response.getErrorCondition();
        LOG.error(errorMessage);
        return errorMessage;
    }
}
