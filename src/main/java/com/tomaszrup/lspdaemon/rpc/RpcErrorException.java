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
import com.google.gson.JsonObject;
import com.tomaszrup.lspdaemon.DaemonException;

/**
 * The worker answered a request with a JSON-RPC error object.
 */
public class RpcErrorException extends DaemonException {

    private static final long serialVersionUID = 1L;

    private final int code;

    public RpcErrorException(int code, String message) {
        super(message);
        this.code = code;
    }

    static RpcErrorException fromJson(String method, JsonElement error) {
        if (error != null && error.isJsonObject()) {
            JsonObject obj = error.getAsJsonObject();
            int code = obj.has("code") && obj.get("code").isJsonPrimitive() ? obj.get("code").getAsInt() : 0;
            String message = obj.has("message") && obj.get("message").isJsonPrimitive()
                    ? obj.get("message").getAsString() : "unknown error";
            return new RpcErrorException(code, method + " failed: " + message);
        }
        return new RpcErrorException(0, method + " failed: " + error);
    }

    /** JSON-RPC error code, or {@code 0} if the worker sent none. */
    public int getCode() {
        return code;
    }
}
