/*
 * RequestParser.java
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

package org.bluezoo.mint.http;

import org.bluezoo.mint.util.ByteArrays;

import java.nio.charset.StandardCharsets;

/**
 * Extracts the method and request-target from the bytes of one request.
 *
 * <p>Only the request line is inspected. The header section must be
 * complete (terminated by an empty line) within the bytes received, but
 * the header fields themselves and any body are ignored.
 *
 * <p>The checks run in a fixed order, and the first failure wins:
 * <ol>
 * <li>no CRLFCRLF: {@link RequestException.Reason#MALFORMED_REQUEST}</li>
 * <li>no space after the method: {@code MALFORMED_REQUEST}</li>
 * <li>method other than GET, in any case:
 *     {@link RequestException.Reason#UNSUPPORTED_METHOD}</li>
 * <li>no space after the target: {@code MALFORMED_REQUEST}</li>
 * <li>target longer than {@link #MAX_TARGET_LENGTH} bytes:
 *     {@link RequestException.Reason#TARGET_TOO_LONG}</li>
 * </ol>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class RequestParser {

    /** Longest request-target accepted, in bytes. */
    public static final int MAX_TARGET_LENGTH = 1024;

    private static final byte[] HEADER_END = { '\r', '\n', '\r', '\n' };
    private static final byte SP = ' ';

    private RequestParser() {
    }

    /**
     * Parses the request line.
     *
     * @param buf the received bytes
     * @param len the number of valid bytes at the start of buf
     * @return the parsed request line
     * @throws RequestException if the request cannot be served
     */
    public static RequestLine parse(byte[] buf, int len) throws RequestException {
        if (ByteArrays.indexOf(buf, len, HEADER_END, 0) < 0) {
            throw new RequestException(RequestException.Reason.MALFORMED_REQUEST,
                    "No end of header section");
        }

        int methodEnd = ByteArrays.indexOf(buf, len, SP, 0);
        if (methodEnd < 0) {
            throw new RequestException(RequestException.Reason.MALFORMED_REQUEST,
                    "No space after method");
        }
        String method = new String(buf, 0, methodEnd, StandardCharsets.ISO_8859_1);
        if (!"GET".equalsIgnoreCase(method)) {
            throw new RequestException(RequestException.Reason.UNSUPPORTED_METHOD,
                    "Method not allowed: " + method);
        }

        int targetStart = methodEnd + 1;
        int targetEnd = ByteArrays.indexOf(buf, len, SP, targetStart);
        if (targetEnd < 0) {
            throw new RequestException(RequestException.Reason.MALFORMED_REQUEST,
                    "No space after request-target");
        }
        int targetLength = targetEnd - targetStart;
        if (targetLength > MAX_TARGET_LENGTH) {
            throw new RequestException(RequestException.Reason.TARGET_TOO_LONG,
                    "Request-target too long: " + targetLength);
        }
        String target = new String(buf, targetStart, targetLength, StandardCharsets.ISO_8859_1);
        return new RequestLine(method, target);
    }

    /**
     * Parses a request held entirely in buf.
     */
    public static RequestLine parse(byte[] buf) throws RequestException {
        return parse(buf, buf.length);
    }

}
