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

import jakarta.jms.JMSException;
import lombok.Getter;

/**
 * Raised when the broker answers a management request with a non-success
 * status. The AMQP error condition, when the broker supplied one, is also
 * available as the JMS error code.
 */
@Getter
public class BrokerException extends JMSException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    private final String statusDescription;

    private final String errorCondition;

    public BrokerException(String reason, int statusCode, String statusDescription, String errorCondition) {
        super(reason, errorCondition);
        this.statusCode = statusCode;
        this.statusDescription = statusDescription;
        this.errorCondition = errorCondition;
    }
}
