/*
 * RequestLine.java
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
 * The method and request-target of an accepted request.
 * The target is kept exactly as sent, still percent-encoded.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class RequestLine {

    private final String method;
    private final String target;

    public RequestLine(String method, String target) {
        this.method = method;
        this.target = target;
    }

    public String getMethod() {
        return method;
    }

    public String getTarget() {
        return target;
    }

    @Override
    public String toString() {
        return method + " " + target;
    }

}
