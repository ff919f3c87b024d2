////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lspdaemon.rpc;

import com.google.gson.JsonElement;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * An outbound request waiting for its response. Confined to the client's
 * event loop.
 */
final class PendingRequest {

    private final int id;
    private final String method;
    private final long deadlineNanos;
    private final CompletableFuture<JsonElement> future;
    private ScheduledFuture<?> timeout;

    PendingRequest(int id, String method, long deadlineNanos, CompletableFuture<JsonElement> future) {
        this.id = id;
        this.method = method;
        this.deadlineNanos = deadlineNanos;
        this.future = future;
    }

    int getId() {
        return id;
    }

    String getMethod() {
        return method;
    }

    long getDeadlineNanos() {
        return deadlineNanos;
    }

    void setTimeout(ScheduledFuture<?> timeout) {
        this.timeout = timeout;
    }

    void resolve(JsonElement result) {
        cancelTimeout();
        future.complete(result);
    }

    void reject(Throwable error) {
        cancelTimeout();
        future.completeExceptionally(error);
    }

    private void cancelTimeout() {
        if (timeout != null) {
            timeout.cancel(false);
        }
    }
}
