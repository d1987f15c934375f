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

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named operation against the broker's management endpoint.
 * <P>
 * Application properties carry the operation name, the server timeout and an
 * optional tracking id. The body carries the operation's arguments. Both maps
 * keep insertion order and are read only once the request is built.
 */
@ToString
@Getter
public class ManagementRequest {

    private final String operation;

    private final Map<String, Object> applicationProperties;

    private final Map<String, Object> body;

    private ManagementRequest(Map<String, Object> applicationProperties, Map<String, Object> body) {
        this.operation = (String) applicationProperties.get(ManagementConstants.OPERATION);
        this.applicationProperties = Collections.unmodifiableMap(applicationProperties);
        this.body = Collections.unmodifiableMap(body);
    }

    /**
     * Starts a request for the given operation.
     *
     * @param operation
     *            one of {@link ManagementConstants.Operations}
     * @param serverTimeout
     *            how long the broker may spend on the request
     */
    public static Builder builder(String operation, Duration serverTimeout) {
        return new Builder(operation, serverTimeout);
    }

    public Object getProperty(String key) {
        return body.get(key);
    }

    public static final class Builder {

        private final Map<String, Object> applicationProperties = new LinkedHashMap<>();

        private final Map<String, Object> body = new LinkedHashMap<>();

        private Builder(String operation, Duration serverTimeout) {
            if (operation == null || operation.isEmpty()) {
                throw new IllegalArgumentException("Management operation cannot be null or empty");
            }
            applicationProperties.put(ManagementConstants.OPERATION, operation);
            if (serverTimeout != null) {
                applicationProperties.put(ManagementConstants.Properties.SERVER_TIMEOUT, serverTimeout.toMillis());
            }
        }

        public Builder trackingId(String trackingId) {
            if (trackingId != null) {
                applicationProperties.put(ManagementConstants.Properties.TRACKING_ID, trackingId);
            }
            return this;
        }

        public Builder property(String key, Object value) {
            body.put(key, value);
            return this;
        }

        public ManagementRequest build() {
            return new ManagementRequest(new LinkedHashMap<>(applicationProperties), new LinkedHashMap<>(body));
        }
    }
}
