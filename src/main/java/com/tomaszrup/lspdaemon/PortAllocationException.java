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
 * No free port was found within the probe budget.
 */
public class PortAllocationException extends DaemonException {

    private static final long serialVersionUID = 1L;

    private final int startPort;
    private final int attempts;

    public PortAllocationException(int startPort, int attempts) {
        super("No free port found in " + startPort + ".." + (startPort + attempts - 1));
        this.startPort = startPort;
        this.attempts = attempts;
    }

    public int getStartPort() {
        return startPort;
    }

    public int getAttempts() {
        return attempts;
    }
}
