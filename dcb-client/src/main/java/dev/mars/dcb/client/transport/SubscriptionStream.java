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

package dev.mars.dcb.client.transport;

import io.vertx.core.streams.ReadStream;

/**
 * A live stream of items pushed by the store.
 *
 * <p>The stream does nothing until {@link #start()} is called, so handlers can
 * be registered first. Implementations accept {@link #start()},
 * {@link #pause()}, {@link #resume()} and {@link #close()} from any thread.
 *
 * @param <T> the type of items emitted
 */
public interface SubscriptionStream<T> extends ReadStream<T> {

    /**
     * Opens the underlying connection and starts emitting items.
     */
    void start();

    /**
     * Closes the underlying connection. No handler is invoked afterwards.
     */
    void close();
}
