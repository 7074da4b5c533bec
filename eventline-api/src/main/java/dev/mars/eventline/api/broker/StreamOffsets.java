package dev.mars.eventline.api.broker;

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

/**
 * Ordering of broker offsets. Offsets are either plain sequence numbers or
 * {@code <millis>-<sequence>} pairs; both compare numerically part by part.
 */
public final class StreamOffsets {

    /**
     * Position before the first entry of any stream.
     */
    public static final String START = "0";

    private StreamOffsets() {
    }

    public static int compare(String left, String right) {
        long[] a = parse(left);
        long[] b = parse(right);
        int result = Long.compare(a[0], b[0]);
        return result != 0 ? result : Long.compare(a[1], b[1]);
    }

    public static boolean isAfter(String candidate, String reference) {
        return compare(candidate, reference) > 0;
    }

    private static long[] parse(String offset) {
        if (offset == null || offset.isBlank()) {
            throw new IllegalArgumentException("Offset cannot be null or blank");
        }
        int dash = offset.indexOf('-');
        try {
            if (dash < 0) {
                return new long[] {Long.parseLong(offset), 0L};
            }
            return new long[] {Long.parseLong(offset.substring(0, dash)), Long.parseLong(offset.substring(dash + 1))};
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed stream offset: " + offset, e);
        }
    }
}
