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
package com.tomaszrup.lspdaemon;

/**
 * A single request did not receive a response before its deadline.
 * Only that request fails; the connection stays usable.
 */
public class RequestTimeoutException extends DaemonException {

    private static final long serialVersionUID = 1L;

    private final int requestId;
    private final String method;

    public RequestTimeoutException(int requestId, String method, long timeoutMs) {
        super("Request " + requestId + " (" + method + ") timed out after " + timeoutMs + "ms");
        this.requestId = requestId;
        this.method = method;
    }

    public int getRequestId() {
        return requestId;
    }

    public String getMethod() {
        return method;
    }
}
