/*
 * HTTPStatus.java
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

/**
 * The HTTP status codes mint can send.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum HTTPStatus {

    /** 200 OK */
    OK(200, "OK"),

    /** 404 Not Found */
    NOT_FOUND(404, "Not Found"),

    /** 405 Method Not Allowed */
    METHOD_NOT_ALLOWED(405, "Method Not Allowed"),

    /** 414 URI Too Long */
    URI_TOO_LONG(414, "URI Too Long"),

    /** 500 Internal Server Error */
    INTERNAL_SERVER_ERROR(500, "Internal Server Error");

    /**
     * The numeric HTTP status code.
     */
    public final int code;

    /**
     * The reason phrase sent on the status line.
     */
    public final String reason;

    HTTPStatus(int code, String reason) {
        this.code = code;
        this.reason = reason;
    }

    @Override
    public String toString() {
        return code + " " + reason;
    }

}
