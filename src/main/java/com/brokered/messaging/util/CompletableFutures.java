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

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Chaining helpers for futures handed back to callers. Unlike
 * <code>thenApply</code> and <code>thenCompose</code>, a failure reaches the
 * returned future as the original throwable, never wrapped in a
 * <code>CompletionException</code>.
 */
public final class CompletableFutures {

    private CompletableFutures() {
    }

    /**
     * Strips the <code>CompletionException</code> layers that dependent stages
     * add around a failure.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Completes a new future with the mapped value of <code>source</code>, or
     * with the unwrapped failure of <code>source</code> or of the mapper.
     */
    public static <T, R> CompletableFuture<R> map(CompletableFuture<T> source, Function<? super T, ? extends R> mapper) {
        CompletableFuture<R> result = new CompletableFuture<>();
        source.whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
                return;
            }
            try {
                result.complete(mapper.apply(value));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    /**
     * Like {@link #map(CompletableFuture, Function)}, for a mapper that
     * returns a stage of its own.
     */
    public static <T, R> CompletableFuture<R> compose(CompletableFuture<T> source,
                                                      Function<? super T, ? extends CompletionStage<R>> mapper) {
        CompletableFuture<R> result = new CompletableFuture<>();
        source.whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
                return;
            }
            CompletionStage<R> next;
            try {
                next = Objects.requireNonNull(mapper.apply(value), "Mapper returned no stage");
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
                return;
            }
            next.whenComplete((nextValue, nextError) -> {
                if (nextError != null) {
                    result.completeExceptionally(unwrap(nextError));
                } else {
                    result.complete(nextValue);
                }
            });
        });
        return result;
    }
}
