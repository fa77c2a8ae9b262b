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

package dev.mars.trapfs.listing;

/**
 * Fixed English month abbreviations used in listings, independent of the JVM locale.
 */
public final class MonthNames {

    private static final String[] ABBREVIATIONS = {
            "Jan", "Feb", "Mar", "Apr", "May", "Jun",
            "Jul", "Aug", "Sep", "Oct", "Nov", "Dec"
    };

    private MonthNames() {
    }

    /**
     * @param month month of year, 1 to 12
     */
    public static String abbreviation(int month) {
        if (month < 1 || month > ABBREVIATIONS.length) {
            throw new IllegalArgumentException("Month out of range: " + month);
        }
        return ABBREVIATIONS[month - 1];
    }
}
