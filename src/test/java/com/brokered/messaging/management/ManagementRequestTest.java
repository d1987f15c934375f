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

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Test the ManagementRequest class
 */
public class ManagementRequestTest {

    /*
     * Test the builder fills application properties and body in order
     */
    @Test
    public void testBuilder() {
        ManagementRequest request = ManagementRequest.builder(ManagementConstants.Operations.PEEK_MESSAGE,
                        Duration.ofSeconds(45))
                .trackingId("tracking-1")
                .property(ManagementConstants.Properties.FROM_SEQUENCE_NUMBER, 12L)
                .property(ManagementConstants.Properties.MESSAGE_COUNT, 3)
                .build();

        assertEquals("com.microsoft:peek-message", request.getOperation());
        assertEquals(List.of(ManagementConstants.OPERATION, ManagementConstants.Properties.SERVER_TIMEOUT,
                        ManagementConstants.Properties.TRACKING_ID),
                new ArrayList<>(request.getApplicationProperties().keySet()));
        assertEquals(45000L, request.getApplicationProperties().get(ManagementConstants.Properties.SERVER_TIMEOUT));
        assertEquals("tracking-1", request.getApplicationProperties().get(ManagementConstants.Properties.TRACKING_ID));
        assertEquals(List.of(ManagementConstants.Properties.FROM_SEQUENCE_NUMBER,
                        ManagementConstants.Properties.MESSAGE_COUNT),
                new ArrayList<>(request.getBody().keySet()));
        assertEquals(12L, request.getProperty(ManagementConstants.Properties.FROM_SEQUENCE_NUMBER));
    }

    /*
     * Test a null tracking id is left out
     */
    @Test
    public void testNullTrackingId() {
        ManagementRequest request = ManagementRequest.builder(ManagementConstants.Operations.RENEW_LOCK,
                Duration.ofSeconds(1)).trackingId(null).build();

        assertFalse(request.getApplicationProperties().containsKey(ManagementConstants.Properties.TRACKING_ID));
        assertNull(request.getProperty(ManagementConstants.Properties.LOCK_TOKENS));
    }

    /*
     * Test built requests cannot be changed
     */
    @Test
    public void testUnmodifiable() {
        ManagementRequest.Builder builder = ManagementRequest.builder(ManagementConstants.Operations.RENEW_LOCK,
                Duration.ofSeconds(1));
        ManagementRequest request = builder.build();
        builder.property(ManagementConstants.Properties.LOCK_TOKENS, "late");

        assertFalse(request.getBody().containsKey(ManagementConstants.Properties.LOCK_TOKENS));
        assertThatThrownBy(() -> request.getBody().put("key", "value"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> request.getApplicationProperties().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    /*
     * Test an empty operation is rejected
     */
    @Test
    public void testEmptyOperation() {
        assertThatThrownBy(() -> ManagementRequest.builder("", Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ManagementRequest.builder(null, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
