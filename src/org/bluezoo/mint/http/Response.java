/*
 * Response.java
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

import org.bluezoo.mint.Mint;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A complete HTTP/1.1 response: status line, header fields and body.
 *
 * <p>Responses are immutable. The wire form is rendered once, when the
 * response is constructed, so the error responses below can be shared
 * by every connection.
 *
 * <p>Every response carries {@code Server}, {@code Connection: close},
 * {@code Content-Type} and a {@code Content-Length} equal to the body
 * length.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Response {

    public static final String SERVER = "mint/" + Mint.VERSION;
    public static final String HTML = "text/html; charset=utf-8";

    private static final String CRLF = "\r\n";

    /** Target absent, or unreadable as a file or directory. */
    public static final Response NOT_FOUND = error(HTTPStatus.NOT_FOUND);

    /** Any method other than GET. */
    public static final Response METHOD_NOT_ALLOWED = error(HTTPStatus.METHOD_NOT_ALLOWED);

    /** Request target over the length limit. */
    public static final Response URI_TOO_LONG = error(HTTPStatus.URI_TOO_LONG);

    /** Malformed request, receive failure or internal fault. */
    public static final Response INTERNAL_SERVER_ERROR = error(HTTPStatus.INTERNAL_SERVER_ERROR);

    private final HTTPStatus status;
    private final Map<String,String> headers;
    private final int contentLength;
    private final byte[] bytes;

    /**
     * Creates a response.
     *
     * @param status the status
     * @param contentType the value of the Content-Type header
     * @param body the body, which may be empty
     */
    public Response(HTTPStatus status, String contentType, byte[] body) {
        if (status == null || contentType == null || body == null) {
            throw new NullPointerException();
        }
        this.status = status;
        this.contentLength = body.length;
        Map<String,String> map = new LinkedHashMap<>();
        map.put("Server", SERVER);
        map.put("Connection", "close");
        map.put("Content-Type", contentType);
        map.put("Content-Length", Integer.toString(body.length));
        this.headers = Collections.unmodifiableMap(map);
        this.bytes = render(status, headers, body);
    }

    private static Response error(HTTPStatus status) {
        String html = "<html><body><h1>" + status + "</h1></body></html>";
        return new Response(status, HTML, html.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] render(HTTPStatus status, Map<String,String> headers, byte[] body) {
        StringBuilder head = new StringBuilder();
        head.append("HTTP/1.1 ").append(status.code).append(' ').append(status.reason).append(CRLF);
        for (Map.Entry<String,String> header : headers.entrySet()) {
            head.append(header.getKey()).append(": ").append(header.getValue()).append(CRLF);
        }
        head.append(CRLF);
        byte[] headBytes = head.toString().getBytes(StandardCharsets.ISO_8859_1);
        ByteArrayOutputStream out = new ByteArrayOutputStream(headBytes.length + body.length);
        out.write(headBytes, 0, headBytes.length);
        out.write(body, 0, body.length);
        return out.toByteArray();
    }

    public HTTPStatus getStatus() {
        return status;
    }

    /**
     * Returns the header fields in the order they are sent.
     */
    public Map<String,String> getHeaders() {
        return headers;
    }

    public String getHeader(String name) {
        return headers.get(name);
    }

    public int getContentLength() {
        return contentLength;
    }

    /**
     * Returns the body.
     */
    public byte[] getBody() {
        byte[] body = new byte[contentLength];
        System.arraycopy(bytes, bytes.length - contentLength, body, 0, contentLength);
        return body;
    }

    /**
     * Returns the complete wire form of this response.
     * The returned array must not be modified.
     */
    public byte[] getBytes() {
        return bytes;
    }

    @Override
    public String toString() {
        return "HTTP/1.1 " + status + " (" + contentLength + " bytes)";
    }

}
