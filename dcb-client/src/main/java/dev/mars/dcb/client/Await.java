/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.dcb.client;

import dev.mars.dcb.api.error.DcbErrorCodes;
import dev.mars.dcb.api.exception.DcbException;
import dev.mars.dcb.api.exception.TransportException;
import io.vertx.core.Context;
import io.vertx.core.Future;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Blocks the calling thread on a Vert.x future.
 */
final class Await {

    private Await() {
        // Utility class - no instantiation
    }

    /**
     * Waits for the future and returns its result, rethrowing failures as
     * {@link DcbException}s.
     *
     * @throws IllegalStateException if called on a Vert.x event loop thread
     */
    static <T> T result(Future<T> future, Duration timeout) {
        if (Context.isOnEventLoopThread()) {
            throw new IllegalStateException("Blocking DCB client call on a Vert.x event loop thread");
        }
        try {
            return future.toCompletionStage().toCompletableFuture().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof DcbException) {
                throw (DcbException) cause;
            }
            throw new TransportException(DcbErrorCodes.TRANSPORT_CONNECTION_FAILED,
                "Request failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new TransportException("No response within " + timeout.toMillis() + " ms", null, 0, true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(DcbErrorCodes.TRANSPORT_INTERRUPTED,
                "Interrupted while waiting for the store", e);
        }
    }
}
