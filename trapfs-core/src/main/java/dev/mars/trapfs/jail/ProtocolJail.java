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

package dev.mars.trapfs.jail;

import dev.mars.trapfs.capture.UploadCaptureService;

import java.util.UUID;

/**
 * One protocol's home below the jail root. Sessions opened here start in the home
 * directory and can never leave it.
 */
public class ProtocolJail {

    private final String protocolName;
    private final String home;
    private final JailRoot root;

    ProtocolJail(String protocolName, String home, JailRoot root) {
        this.protocolName = protocolName;
        this.home = home;
        this.root = root;
    }

    /**
     * Opens a session without upload capture; {@code beginUpload} is then not implemented.
     */
    public JailSession openSession() {
        return openSession(UUID.randomUUID().toString(), null);
    }

    public JailSession openSession(String sessionId, UploadCaptureService captureService) {
        return new JailSession(this, sessionId, captureService);
    }

    public String getProtocolName() {
        return protocolName;
    }

    /**
     * @return store path of the home directory, e.g. {@code /ftp}
     */
    public String getHome() {
        return home;
    }

    JailRoot getRoot() {
        return root;
    }

    @Override
    public String toString() {
        return "ProtocolJail{protocol='" + protocolName + "', home='" + home + "'}";
    }
}
