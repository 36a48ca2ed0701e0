/*
 * FileConnection.java
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

package org.bluezoo.mint.http.file;

import org.bluezoo.mint.http.RequestException;
import org.bluezoo.mint.http.RequestLine;
import org.bluezoo.mint.http.RequestParser;
import org.bluezoo.mint.http.Response;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketAddress;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.text.MessageFormat;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serves exactly one request on an accepted connection, then closes it.
 *
 * <p>A connection runs once, on a worker thread, through these states:
 * <pre>
 * ACCEPTED -&gt; TIMEOUT_ARMED -&gt; RECEIVED -&gt; PARSED -&gt; RESOLVED -&gt; RESPONDED -&gt; CLOSED
 * </pre>
 * A refused request skips straight to RESPONDED with a fixed error
 * response. If the receive timeout cannot be set, or the peer closes
 * without sending anything, nothing is sent and the connection goes
 * straight to CLOSED. Whatever happens, CLOSED is reached exactly once.
 *
 * <p>The request is read with a single receive into a buffer of
 * {@link #BUFFER_SIZE} bytes. A request header section that does not fit,
 * or that arrives in several segments, is refused as malformed.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FileConnection implements Runnable {

    private static final Logger LOGGER = Logger.getLogger(FileConnection.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.mint.http.file.L10N");

    /** Size of the receive buffer. */
    public static final int BUFFER_SIZE = 8192;

    /** Default receive timeout in milliseconds. */
    public static final int DEFAULT_RECEIVE_TIMEOUT = 5000;

    /**
     * Lifecycle of a connection.
     */
    public enum State {
        ACCEPTED,
        TIMEOUT_ARMED,
        RECEIVED,
        PARSED,
        RESOLVED,
        RESPONDED,
        CLOSED
    }

    private final Socket socket;
    private final PathResolver resolver;
    private final int receiveTimeout;
    private final SocketAddress remoteAddress;
    private volatile State state;

    /**
     * Creates a connection using the default receive timeout.
     *
     * @param socket the accepted socket
     * @param resolver resolves request-targets against the document root
     */
    public FileConnection(Socket socket, PathResolver resolver) {
        this(socket, resolver, DEFAULT_RECEIVE_TIMEOUT);
    }

    /**
     * Creates a connection.
     *
     * @param socket the accepted socket
     * @param resolver resolves request-targets against the document root
     * @param receiveTimeout the receive timeout in milliseconds, or 0 to
     *        wait indefinitely
     * @throws IllegalArgumentException if receiveTimeout is negative
     */
    public FileConnection(Socket socket, PathResolver resolver, int receiveTimeout) {
        if (receiveTimeout < 0) {
            throw new IllegalArgumentException("receiveTimeout cannot be negative: " + receiveTimeout);
        }
        this.socket = socket;
        this.resolver = resolver;
        this.receiveTimeout = receiveTimeout;
        this.remoteAddress = socket.getRemoteSocketAddress();
        this.state = State.ACCEPTED;
    }

    public State getState() {
        return state;
    }

    @Override
    public void run() {
        try {
            serve();
        } finally {
            close();
        }
    }

    private void serve() {
        try {
            socket.setSoTimeout(receiveTimeout);
        } catch (SocketException e) {
            String message = MessageFormat.format(L10N.getString("err.timeout_setup"), remoteAddress);
            LOGGER.log(Level.WARNING, message, e);
            return;
        }
        state = State.TIMEOUT_ARMED;

        byte[] buf = new byte[BUFFER_SIZE];
        int len;
        try {
            InputStream in = socket.getInputStream();
            len = in.read(buf);
        } catch (SocketTimeoutException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                String message = MessageFormat.format(L10N.getString("info.receive_timeout"), remoteAddress);
                LOGGER.fine(message);
            }
            respond(null, Response.INTERNAL_SERVER_ERROR);
            return;
        } catch (IOException e) {
            handleReadError(e);
            respond(null, Response.INTERNAL_SERVER_ERROR);
            return;
        }
        if (len <= 0) {
            if (LOGGER.isLoggable(Level.FINE)) {
                String message = MessageFormat.format(L10N.getString("info.closed_by_peer"), remoteAddress);
                LOGGER.fine(message);
            }
            return;
        }
        state = State.RECEIVED;

        RequestLine request = null;
        Response response;
        try {
            request = RequestParser.parse(buf, len);
            state = State.PARSED;
            ResolvedTarget target = resolver.resolve(request.getTarget());
            state = State.RESOLVED;
            if (LOGGER.isLoggable(Level.FINEST)) {
                LOGGER.finest(target.toString());
            }
            response = ResponseBuilder.build(target);
        } catch (RequestException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                String message = MessageFormat.format(L10N.getString("info.request_refused"),
                        remoteAddress, e.getReason(), e.getMessage());
                LOGGER.fine(message);
            }
            response = e.getReason().getResponse();
        } catch (IOException | RuntimeException e) {
            String message = MessageFormat.format(L10N.getString("err.internal"), remoteAddress);
            LOGGER.log(Level.SEVERE, message, e);
            response = Response.INTERNAL_SERVER_ERROR;
        }
        respond(request, response);
    }

    /**
     * Writes the response. A failed write is logged and otherwise
     * ignored: the connection is closed either way.
     */
    private void respond(RequestLine request, Response response) {
        try {
            OutputStream out = socket.getOutputStream();
            out.write(response.getBytes());
            out.flush();
        } catch (IOException e) {
            handleWriteError(e);
        }
        state = State.RESPONDED;

        if (LOGGER.isLoggable(Level.INFO)) {
            String requestText = (request != null) ? request.toString() : "-";
            String message = MessageFormat.format(L10N.getString("info.access"),
                    remoteAddress, requestText, String.valueOf(response.getStatus().code),
                    String.valueOf(response.getContentLength()));
            LOGGER.info(message);
        }
    }

    /**
     * Half-closes then closes the socket, at most once.
     */
    private void close() {
        if (state == State.CLOSED) {
            return;
        }
        try {
            if (!socket.isClosed() && !socket.isOutputShutdown()) {
                socket.shutdownOutput();
            }
        } catch (IOException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.log(Level.FINE, "Error shutting down output to " + remoteAddress, e);
            }
        }
        try {
            socket.close();
        } catch (IOException e) {
            String message = MessageFormat.format(L10N.getString("err.close"), remoteAddress);
            LOGGER.log(Level.WARNING, message, e);
        }
        state = State.CLOSED;
    }

    private void handleReadError(IOException e) {
        // "Connection reset by peer" is normal when clients disconnect abruptly
        String msg = e.getMessage();
        if (msg != null && (msg.contains("reset") || msg.contains("Broken pipe"))) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Client disconnected: " + remoteAddress);
            }
        } else if (LOGGER.isLoggable(Level.WARNING)) {
            String message = MessageFormat.format(L10N.getString("err.read"), remoteAddress);
            LOGGER.log(Level.WARNING, message, e);
        }
    }

    private void handleWriteError(IOException e) {
        // "Broken pipe" is normal when clients disconnect before we finish writing
        String msg = e.getMessage();
        if (msg != null && (msg.contains("Broken pipe") || msg.contains("reset"))) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Client disconnected: " + remoteAddress);
            }
        } else if (LOGGER.isLoggable(Level.WARNING)) {
            String message = MessageFormat.format(L10N.getString("err.write"), remoteAddress);
            LOGGER.log(Level.WARNING, message, e);
        }
    }

}
