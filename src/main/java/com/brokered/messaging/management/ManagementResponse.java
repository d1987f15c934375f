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

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Answer of the management endpoint. The status code and error condition come
 * from the response's application properties; a non-success status is a
 * broker-reported failure, distinct from a failure of the transport itself.
 */
@ToString
@Getter
public class ManagementResponse {

    private final int statusCode;

    private final String statusDescription;

    private final String errorCondition;

    @ToString.Exclude
    private final Map<String, Object> body;

    public ManagementResponse(int statusCode, String statusDescription, String errorCondition, Map<String, Object> body) {
        this.statusCode = statusCode;
        this.statusDescription = statusDescription;
        this.errorCondition = errorCondition;
        this.body = body == null ? Collections.emptyMap() : Collections.unmodifiableMap(body);
    }

    /**
     * Builds a response from the application properties and body the
     * transport decoded.
     *
     * @throws IllegalArgumentException
     *             if the properties hold no numeric status code
     */
    public static ManagementResponse fromProperties(Map<String, Object> applicationProperties, Map<String, Object> body) {
        Object statusCode = applicationProperties == null ? null
                : applicationProperties.get(ManagementConstants.Response.STATUS_CODE);
        if (!(statusCode instanceof Number)) {
            throw new IllegalArgumentException("Management response carries no status code: " + statusCode);
        }
        Object description = applicationProperties.get(ManagementConstants.Response.STATUS_DESCRIPTION);
        Object condition = applicationProperties.get(ManagementConstants.Response.ERROR_CONDITION);
        return new ManagementResponse(((Number) statusCode).intValue(),
                description == null ? null : description.toString(),
                condition == null ? null : condition.toString(),
                body);
    }

    public boolean isSuccess() {
        return statusCode == ManagementConstants.StatusCodes.OK
                || statusCode == ManagementConstants.StatusCodes.NO_CONTENT;
    }

    public boolean hasNoContent() {
        return statusCode == ManagementConstants.StatusCodes.NO_CONTENT;
    }

    public Object getValue(String key) {
        return body.get(key);
    }

    /**
     * Returns the entries of the <code>messages</code> list, each holding an
     * encoded <code>message</code> and, for locked deliveries, a
     * <code>lock-token</code>.
     */
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> getMessageEntries() {
        Object messages = body.get(ManagementConstants.Properties.MESSAGES);
        if (messages == null) {
            return Collections.emptyList();
        }
        return (List<Map<String, Object>>) messages;
    }
}
