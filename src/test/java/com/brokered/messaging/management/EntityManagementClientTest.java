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

import com.brokered.messaging.MessageReceiver;
import com.brokered.messaging.SessionLockLostException;
import com.brokered.messaging.message.BrokeredMessage;
import com.brokered.messaging.message.MessageDecoder;
import jakarta.jms.JMSException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Test the EntityManagementClient class
 */
public class EntityManagementClientTest {

    private static final String SESSION_ID = "session-42";

    private static final Duration OPERATION_TIMEOUT = Duration.ofSeconds(20);

    private MessageReceiver receiver;
    private MessageDecoder messageDecoder;
    private EntityManagementClient managementClient;

    @BeforeEach
    public void setup() {
        receiver = mock(MessageReceiver.class);
        messageDecoder = mock(MessageDecoder.class);
        when(receiver.getOperationTimeout()).thenReturn(OPERATION_TIMEOUT);
        managementClient = new EntityManagementClient(receiver, messageDecoder);
    }

    /*
     * Test peek sends the starting sequence number and count
     */
    @Test
    public void testPeek() {
        byte[] encoded = new byte[] { 9 };
        BrokeredMessage message = BrokeredMessage.builder().sequenceNumber(12).build();
        when(messageDecoder.decodeAll(any())).thenCallRealMethod();
        when(messageDecoder.decode(encoded, null)).thenReturn(message);
        respondWith(new ManagementResponse(200, "OK", null, Map.of(ManagementConstants.Properties.MESSAGES,
                List.of(Map.of(ManagementConstants.Properties.MESSAGE, encoded)))));

        assertEquals(List.of(message), managementClient.peek(12L, 5).join());

        ManagementRequest request = captureRequest();
        assertEquals(ManagementConstants.Operations.PEEK_MESSAGE, request.getOperation());
        assertEquals(12L, request.getProperty(ManagementConstants.Properties.FROM_SEQUENCE_NUMBER));
        assertEquals(5, request.getProperty(ManagementConstants.Properties.MESSAGE_COUNT));
        assertEquals(OPERATION_TIMEOUT.toMillis(),
                request.getApplicationProperties().get(ManagementConstants.Properties.SERVER_TIMEOUT));
    }

    /*
     * Test peek with no content returns no messages
     */
    @Test
    public void testPeekNoContent() {
        respondWith(new ManagementResponse(204, null, null, null));

        assertTrue(managementClient.peek(0L, 10).join().isEmpty());
        verify(messageDecoder, never()).decode(any(), any());
    }

    /*
     * Test peek with an invalid count
     */
    @Test
    public void testPeekInvalidCount() {
        assertThatThrownBy(() -> managementClient.peek(0L, 0).join())
                .hasCauseInstanceOf(IllegalArgumentException.class);
        verify(receiver, never()).executeManagementRequest(any());
    }

    /*
     * Test renew session lock returns the new expiry
     */
    @Test
    public void testRenewSessionLock() {
        Instant lockedUntil = Instant.parse("2026-10-18T09:00:00Z");
        respondWith(new ManagementResponse(200, "OK", null,
                Map.of(ManagementConstants.Properties.EXPIRATION, Date.from(lockedUntil))));

        assertEquals(lockedUntil, managementClient.renewSessionLock(SESSION_ID).join());
        assertEquals(SESSION_ID, captureRequest().getProperty(ManagementConstants.Properties.SESSION_ID));
    }

    /*
     * Test renew session lock without an expiry in the response
     */
    @Test
    public void testRenewSessionLockNoExpiration() {
        respondWith(new ManagementResponse(200, "OK", null, Collections.emptyMap()));

        assertThatThrownBy(() -> managementClient.renewSessionLock(SESSION_ID).join())
                .hasCauseExactlyInstanceOf(JMSException.class);
    }

    /*
     * Test a lost session lock reported by the broker
     */
    @Test
    public void testRenewSessionLockLost() {
        respondWith(new ManagementResponse(410, "session lock expired",
                ManagementConstants.Conditions.SESSION_LOCK_LOST, null));

        assertThatThrownBy(() -> managementClient.renewSessionLock(SESSION_ID).join())
                .hasCauseInstanceOf(SessionLockLostException.class);
        assertTrue(managementClient.renewSessionLock(SESSION_ID).handle((value, error) -> error).join()
                instanceof SessionLockLostException);
    }

    /*
     * Test a failure of the management request reaches callbacks unchanged
     */
    @Test
    public void testRequestFailureUnwrapped() {
        JMSException failure = new JMSException("link detached");
        when(receiver.executeManagementRequest(any(ManagementRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(failure));

        assertSame(failure, managementClient.peek(0L, 1).handle((value, error) -> error).join());
        assertSame(failure, managementClient.setSessionState(SESSION_ID, null).handle((value, error) -> error).join());
    }

    /*
     * Test session state of an unexpected type
     */
    @Test
    public void testSessionStateNotBinary() {
        respondWith(new ManagementResponse(200, "OK", null,
                Map.of(ManagementConstants.Properties.SESSION_STATE, "not bytes")));

        assertThatThrownBy(() -> managementClient.getSessionState(SESSION_ID).join())
                .hasCauseExactlyInstanceOf(JMSException.class)
                .hasRootCauseMessage("Session state of session session-42 is not binary: java.lang.String");
    }

    /*
     * Test a session without state
     */
    @Test
    public void testSessionStateMissing() {
        respondWith(new ManagementResponse(200, "OK", null, null));

        assertNull(managementClient.getSessionState(SESSION_ID).join());
    }

    /*
     * Test reading and writing session state
     */
    @Test
    public void testSessionState() {
        byte[] state = new byte[] { 1, 2 };
        respondWith(new ManagementResponse(200, "OK", null, Map.of(ManagementConstants.Properties.SESSION_STATE, state)));

        assertArrayEquals(state, managementClient.getSessionState(SESSION_ID).join());
        assertEquals(ManagementConstants.Operations.GET_SESSION_STATE, captureRequest().getOperation());
    }

    /*
     * Test writing session state sends it in the body
     */
    @Test
    public void testSetSessionState() {
        byte[] state = new byte[] { 3 };
        respondWith(new ManagementResponse(200, "OK", null, null));

        assertNull(managementClient.setSessionState(SESSION_ID, state).join());

        ManagementRequest request = captureRequest();
        assertEquals(ManagementConstants.Operations.SET_SESSION_STATE, request.getOperation());
        assertEquals(SESSION_ID, request.getProperty(ManagementConstants.Properties.SESSION_ID));
        assertArrayEquals(state, (byte[]) request.getProperty(ManagementConstants.Properties.SESSION_STATE));
    }

    /*
     * Test session operations with an empty session id
     */
    @Test
    public void testEmptySessionId() {
        assertThatThrownBy(() -> managementClient.renewSessionLock("").join())
                .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> managementClient.getSessionState(null).join())
                .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> managementClient.setSessionState("", new byte[0]).join())
                .hasCauseInstanceOf(IllegalArgumentException.class);
        verify(receiver, never()).executeManagementRequest(any());
    }

    private void respondWith(ManagementResponse response) {
        when(receiver.executeManagementRequest(any(ManagementRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(response));
    }

    private ManagementRequest captureRequest() {
        ArgumentCaptor<ManagementRequest> captor = ArgumentCaptor.forClass(ManagementRequest.class);
        verify(receiver).executeManagementRequest(captor.capture());
        return captor.getValue();
    }
}
