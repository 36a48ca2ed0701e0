/*
 * Dispatcher.java
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

package org.bluezoo.mint;

import org.bluezoo.mint.http.file.FileConnection;
import org.bluezoo.mint.http.file.PathResolver;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.file.Path;
import java.text.MessageFormat;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Accepts connections and hands each one to the worker pool.
 *
 * <p>The accept loop never waits for a connection to be served: each
 * accepted socket becomes a {@link FileConnection} task and the loop goes
 * straight back to accepting. A failure to accept one connection is
 * logged and the loop continues. There is no admission control: when all
 * workers are busy, accepted connections wait in the pool's queue.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Dispatcher {

    private static final Logger LOGGER = Logger.getLogger(Dispatcher.class.getName());

    private final WorkerPool pool;
    private final int receiveTimeout;
    private ServerSocket serverSocket;
    private boolean closed;
    private volatile boolean active;

    /**
     * Creates a dispatcher using the default receive timeout.
     *
     * @param pool the pool that runs accepted connections
     */
    public Dispatcher(WorkerPool pool) {
        this(pool, FileConnection.DEFAULT_RECEIVE_TIMEOUT);
    }

    /**
     * Creates a dispatcher.
     *
     * @param pool the pool that runs accepted connections
     * @param receiveTimeout the receive timeout for each connection, in
     *        milliseconds, or 0 to wait indefinitely
     * @throws IllegalArgumentException if pool is null or receiveTimeout
     *         is negative
     */
    public Dispatcher(WorkerPool pool, int receiveTimeout) {
        if (pool == null) {
            throw new IllegalArgumentException("pool cannot be null");
        }
        if (receiveTimeout < 0) {
            throw new IllegalArgumentException("receiveTimeout cannot be negative: " + receiveTimeout);
        }
        this.pool = pool;
        this.receiveTimeout = receiveTimeout;
    }

    /**
     * Binds to the given endpoint and serves files from the root until
     * {@link #shutdown} is called.
     *
     * @param bindAddress the local address to bind to
     * @param port the port to listen on
     * @param rootPath the document root
     * @throws IOException if the server socket cannot be bound
     */
    public void serve(InetAddress bindAddress, int port, Path rootPath) throws IOException {
        bind(bindAddress, port);
        acceptConnections(rootPath);
    }

    /**
     * Creates the listening socket.
     * The address is made reusable and the system default backlog is used.
     *
     * @param bindAddress the local address to bind to
     * @param port the port to listen on, or 0 for an ephemeral port
     * @throws IOException if the socket cannot be created or bound
     * @throws IllegalStateException if already bound or shut down
     */
    public synchronized void bind(InetAddress bindAddress, int port) throws IOException {
        if (closed) {
            throw new IllegalStateException("Dispatcher is shut down");
        }
        if (serverSocket != null) {
            throw new IllegalStateException("Already bound");
        }
        ServerSocket ss = new ServerSocket();
        try {
            ss.setReuseAddress(true);
            long t1 = System.currentTimeMillis();
            ss.bind(new InetSocketAddress(bindAddress, port));
            long t2 = System.currentTimeMillis();
            if (LOGGER.isLoggable(Level.FINE)) {
                String message = Mint.L10N.getString("info.bound_server");
                message = MessageFormat.format(message, String.valueOf(ss.getLocalPort()), bindAddress, (t2 - t1));
                LOGGER.fine(message);
            }
        } catch (IOException e) {
            try {
                ss.close();
            } catch (IOException closeEx) {
                e.addSuppressed(closeEx);
            }
            throw e;
        }
        serverSocket = ss;
        active = true;
    }

    /**
     * Returns the port the dispatcher is listening on, or -1 if not bound.
     */
    public synchronized int getLocalPort() {
        return (serverSocket != null) ? serverSocket.getLocalPort() : -1;
    }

    /**
     * Runs the accept loop on the calling thread until {@link #shutdown}
     * is called.
     *
     * @param rootPath the document root
     */
    public void acceptConnections(Path rootPath) {
        ServerSocket ss;
        synchronized (this) {
            if (serverSocket == null) {
                throw new IllegalStateException("Not bound");
            }
            ss = serverSocket;
        }
        PathResolver resolver = new PathResolver(rootPath);
        while (active) {
            Socket socket;
            try {
                socket = ss.accept();
            } catch (IOException e) {
                if (!active) {
                    // Server socket closed by shutdown
                    break;
                }
                LOGGER.log(Level.WARNING, Mint.L10N.getString("err.accept"), e);
                continue;
            }
            dispatch(socket, resolver);
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(Mint.L10N.getString("info.accept_loop_end"));
        }
    }

    private void dispatch(Socket socket, PathResolver resolver) {
        if (LOGGER.isLoggable(Level.FINEST)) {
            String message = Mint.L10N.getString("info.accepted");
            message = MessageFormat.format(message, socket.getRemoteSocketAddress());
            LOGGER.finest(message);
        }
        try {
            pool.submit(new FileConnection(socket, resolver, receiveTimeout));
        } catch (IllegalStateException e) {
            // Pool already shut down
            LOGGER.log(Level.WARNING, Mint.L10N.getString("err.dispatch"), e);
            try {
                socket.close();
            } catch (IOException closeEx) {
                LOGGER.log(Level.FINE, "Error closing undispatched connection", closeEx);
            }
        }
    }

    /**
     * Stops accepting connections and closes the listening socket.
     * Connections already handed to the pool are unaffected. A dispatcher
     * that has been shut down cannot be bound again.
     */
    public void shutdown() {
        ServerSocket ss;
        synchronized (this) {
            closed = true;
            active = false;
            ss = serverSocket;
        }
        if (ss != null) {
            try {
                ss.close();
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "Error closing server socket", e);
            }
        }
    }

}
