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

package dev.mars.trapfs.capture;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Record of one completed capture, stored next to it as {@code <storedName>.json}.
 */
public class UploadReceipt {

    private final String storedName;
    private final String originalName;
    private final String protocol;
    private final String sessionId;
    private final long bytes;
    private final String sha256;
    private final Instant openedAt;
    private final Instant closedAt;

    @JsonCreator
    public UploadReceipt(
            @JsonProperty("storedName") String storedName,
            @JsonProperty("originalName") String originalName,
            @JsonProperty("protocol") String protocol,
            @JsonProperty("sessionId") String sessionId,
            @JsonProperty("bytes") long bytes,
            @JsonProperty("sha256") String sha256,
            @JsonProperty("openedAt") Instant openedAt,
            @JsonProperty("closedAt") Instant closedAt) {
        this.storedName = storedName;
        this.originalName = originalName;
        this.protocol = protocol;
        this.sessionId = sessionId;
        this.bytes = bytes;
        this.sha256 = sha256;
        this.openedAt = openedAt;
        this.closedAt = closedAt;
    }

    public static UploadReceipt of(UploadCaptureWriter writer, String originalName, String protocol,
                                   String sessionId) {
        return new UploadReceipt(writer.getStoredName(), originalName, protocol, sessionId,
                writer.getBytesWritten(), writer.getSha256(), writer.getOpenedAt(), writer.getClosedAt());
    }

    // Getters
    public String getStoredName() { return storedName; }
    public String getOriginalName() { return originalName; }
    public String getProtocol() { return protocol; }
    public String getSessionId() { return sessionId; }
    public long getBytes() { return bytes; }
    public String getSha256() { return sha256; }
    public Instant getOpenedAt() { return openedAt; }
    public Instant getClosedAt() { return closedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UploadReceipt)) return false;
        UploadReceipt that = (UploadReceipt) o;
        return bytes == that.bytes
                && Objects.equals(storedName, that.storedName)
                && Objects.equals(originalName, that.originalName)
                && Objects.equals(protocol, that.protocol)
                && Objects.equals(sessionId, that.sessionId)
                && Objects.equals(sha256, that.sha256)
                && Objects.equals(openedAt, that.openedAt)
                && Objects.equals(closedAt, that.closedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(storedName, originalName, protocol, sessionId, bytes, sha256, openedAt, closedAt);
    }

    @Override
    public String toString() {
        return "UploadReceipt{" +
                "storedName='" + storedName + '\'' +
                ", originalName='" + originalName + '\'' +
                ", protocol='" + protocol + '\'' +
                ", sessionId='" + sessionId + '\'' +
                ", bytes=" + bytes +
                ", sha256='" + sha256 + '\'' +
                '}';
    }
}
