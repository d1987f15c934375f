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
package com.brokered.messaging.util;

import jakarta.jms.JMSException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Test the CompletableFutures class
 */
public class CompletableFuturesTest {

    /*
     * Test unwrapping nested completion exceptions
     */
    @Test
    public void testUnwrap() {
        JMSException failure = new JMSException("broker");

        assertSame(failure, CompletableFutures.unwrap(new CompletionException(new CompletionException(failure))));
        assertSame(failure, CompletableFutures.unwrap(failure));
    }

    /*
     * Test map hands back the mapped value
     */
    @Test
    public void testMap() {
        assertEquals(4, CompletableFutures.map(CompletableFuture.completedFuture("four"), String::length).join());
    }

    /*
     * Test map passes the source failure on without wrapping it
     */
    @Test
    public void testMapSourceFailure() {
        JMSException failure = new JMSException("broker");
        CompletableFuture<String> source = CompletableFuture.<String>failedFuture(failure).thenApply(value -> value);

        assertSame(failure, CompletableFutures.map(source, String::length).handle((value, error) -> error).join());
    }

    /*
     * Test a mapper that throws fails the result with its exception
     */
    @Test
    public void testMapMapperThrows() {
        IllegalStateException failure = new IllegalStateException("bad value");

        CompletableFuture<Integer> result = CompletableFutures.map(CompletableFuture.completedFuture("x"), value -> {
            throw failure;
        });

        assertSame(failure, result.handle((value, error) -> error).join());
    }

    /*
     * Test compose passes the inner stage's failure on without wrapping it
     */
    @Test
    public void testComposeInnerFailure() {
        JMSException failure = new JMSException("lock lost");

        CompletableFuture<Integer> result = CompletableFutures.compose(CompletableFuture.completedFuture("x"),
                value -> CompletableFuture.<Integer>failedFuture(failure));

        assertSame(failure, result.handle((value, error) -> error).join());
    }

    /*
     * Test compose with an inner stage returning a value, and with none
     */
    @Test
    public void testCompose() {
        assertEquals(1, CompletableFutures.compose(CompletableFuture.completedFuture("x"),
                value -> CompletableFuture.completedFuture(value.length())).join());

        CompletableFuture<Integer> missing = CompletableFutures.compose(CompletableFuture.completedFuture("x"),
                value -> null);
        assertTrue(missing.handle((value, error) -> error).join() instanceof NullPointerException);
    }
}
