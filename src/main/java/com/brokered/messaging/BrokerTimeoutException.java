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

/**
 * The broker gave up on a management request before it finished. The outcome
 * of the request is unknown.
 */
public class BrokerTimeoutException extends BrokerException {

    private static final long serialVersionUID = 1L;

    public BrokerTimeoutException(String reason, int statusCode, String statusDescription, String errorCondition) {
        super(reason, statusCode, statusDescription, errorCondition);
    }
}
