/*
 * RequestException.java
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
 * Exception thrown when a request line cannot be accepted.
 *
 * <p>The {@link Reason} determines which fixed response is sent back to
 * the client.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RequestException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Why the request was refused.
     */
    public enum Reason {

        /** Missing header terminator, or missing space on the request line. */
        MALFORMED_REQUEST(Response.INTERNAL_SERVER_ERROR),

        /** A method other than GET. */
        UNSUPPORTED_METHOD(Response.METHOD_NOT_ALLOWED),

        /** The request target exceeds the length limit. */
        TARGET_TOO_LONG(Response.URI_TOO_LONG);

        private final Response response;

        Reason(Response response) {
            this.response = response;
        }

        /**
         * Returns the fixed response sent for this reason.
         */
        public Response getResponse() {
            return response;
        }
    }

    private final Reason reason;

    /**
     * Creates a new request exception.
     *
     * @param reason why the request was refused
     * @param message the error message
     */
    public RequestException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

}
