/*
 * ByteArrays.java
 * Copyright (C) 2026 Chris Burdess
 *
 * This file is part of mint, a minimal file-serving HTTP responder.
 *
 * mint is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * mint is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with mint.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.mint.util;

/**
 * Utility methods for searching received byte arrays.
 *
 * <p>Received data is usually only partly filled, so every method takes
 * the number of valid bytes explicitly rather than using the array
 * length.
 *
 * <p>All methods in this class are stateless and thread-safe.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ByteArrays {

    // Prevent instantiation
    private ByteArrays() {
    }

    /**
     * Returns the index of the first occurrence of a byte.
     *
     * @param buf the array to search
     * @param len the number of valid bytes at the start of buf
     * @param b the byte to find
     * @param from the index to start searching from
     * @return the index of b, or -1 if it does not occur in [from, len)
     */
    public static int indexOf(byte[] buf, int len, byte b, int from) {
        if (len > buf.length) {
            throw new IllegalArgumentException("len exceeds buffer: " + len);
        }
        for (int i = Math.max(from, 0); i < len; i++) {
            if (buf[i] == b) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns the index of the first occurrence of a byte sequence.
     *
     * @param buf the array to search
     * @param len the number of valid bytes at the start of buf
     * @param pattern the sequence to find, which must be non-empty
     * @param from the index to start searching from
     * @return the index where pattern starts, or -1 if it does not occur
     *         entirely within [from, len)
     */
    public static int indexOf(byte[] buf, int len, byte[] pattern, int from) {
        if (len > buf.length) {
            throw new IllegalArgumentException("len exceeds buffer: " + len);
        }
        if (pattern.length == 0) {
            throw new IllegalArgumentException("Empty pattern");
        }
        int last = len - pattern.length;
        for (int i = Math.max(from, 0); i <= last; i++) {
            if (regionMatches(buf, i, pattern)) {
                return i;
            }
        }
        return -1;
    }

    private static boolean regionMatches(byte[] buf, int offset, byte[] pattern) {
        for (int j = 0; j < pattern.length; j++) {
            if (buf[offset + j] != pattern[j]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the value of an ASCII hexadecimal digit.
     *
     * @param b the byte to convert
     * @return 0-15, or -1 if b is not a hexadecimal digit
     */
    public static int hexValue(byte b) {
        return Character.digit((char) (b & 0xff), 16);
    }

}
