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

package dev.mars.trapfs.storage;

import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Incremental digest over captured upload bytes.
 * Supports SHA-256 by default with options for other algorithms.
 */
public class ChecksumCalculator {
    public static final String DEFAULT_ALGORITHM = "SHA-256";
    private static final int BUFFER_SIZE = 8192;

    private final MessageDigest digest;
    private final String algorithm;

    public ChecksumCalculator() {
        this(DEFAULT_ALGORITHM);
    }

    public ChecksumCalculator(String algorithm) {
        this.algorithm = algorithm;
        try {
            this.digest = MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Unsupported checksum algorithm: " + algorithm, e);
        }
    }

    /**
     * Update the checksum calculation with a portion of data
     */
    public void update(byte[] data, int offset, int length) {
        digest.update(data, offset, length);
    }

    /**
     * Get the final checksum as a hexadecimal string. Resets the calculator.
     */
    public String getChecksum() {
        return bytesToHex(digest.digest());
    }

    public String getAlgorithm() {
        return algorithm;
    }

    /**
     * Calculate the default-algorithm checksum of a stream, reading it to the end
     */
    public static String checksumOf(InputStream inputStream) throws IOException {
        ChecksumCalculator calculator = new ChecksumCalculator();
        byte[] buffer = new byte[BUFFER_SIZE];
        int bytesRead;
        while ((bytesRead = inputStream.read(buffer)) != -1) {
            calculator.update(buffer, 0, bytesRead);
        }
        return calculator.getChecksum();
    }

    public static String checksumOf(byte[] data) {
        ChecksumCalculator calculator = new ChecksumCalculator();
        calculator.update(data, 0, data.length);
        return calculator.getChecksum();
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder result = new StringBuilder();
        for (byte b : bytes) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }

    @Override
    public String toString() {
        return "ChecksumCalculator{algorithm='" + algorithm + "'}";
    }
}
