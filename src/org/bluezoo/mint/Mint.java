/*
 * Mint.java
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
import org.bluezoo.mint.util.PathNames;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.MessageFormat;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Configuration and lifecycle manager for the mint server.
 * Owns the worker pool and the dispatcher that feeds it.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Mint {

    public static final String VERSION = "1.0";

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.mint.L10N");
    static final Logger LOGGER = Logger.getLogger(Mint.class.getName());

    static final int EXIT_USAGE = 1;
    static final int EXIT_BIND = 2;

    private final InetAddress bindAddress;
    private final int port;
    private final Path rootPath;
    private final WorkerPool pool;
    private final Dispatcher dispatcher;

    /**
     * Creates a server. No socket is opened until {@link #start}.
     *
     * @param bindAddress the local address to listen on
     * @param port the port to listen on, or 0 for an ephemeral port
     * @param rootPath the document root
     * @param workerCount the number of worker threads
     * @param receiveTimeout the receive timeout in milliseconds
     * @throws IllegalArgumentException if workerCount is less than 1 or
     *         receiveTimeout is negative
     */
    public Mint(InetAddress bindAddress, int port, Path rootPath, int workerCount, int receiveTimeout) {
        if (receiveTimeout < 0) {
            throw new IllegalArgumentException("receiveTimeout cannot be negative: " + receiveTimeout);
        }
        this.bindAddress = bindAddress;
        this.port = port;
        this.rootPath = rootPath;
        this.pool = new WorkerPool(workerCount);
        this.dispatcher = new Dispatcher(pool, receiveTimeout);
    }

    public WorkerPool getWorkerPool() {
        return pool;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    /**
     * Binds the listening socket.
     *
     * @throws IOException if the socket cannot be bound
     */
    public void start() throws IOException {
        long t1 = System.currentTimeMillis();
        dispatcher.bind(bindAddress, port);
        long t2 = System.currentTimeMillis();
        if (LOGGER.isLoggable(Level.INFO)) {
            String message = L10N.getString("info.started_mint");
            message = MessageFormat.format(message, bindAddress.getHostAddress(),
                    String.valueOf(dispatcher.getLocalPort()), rootPath, (t2 - t1));
            LOGGER.info(message);
        }
    }

    /**
     * Runs the accept loop on the calling thread until {@link #shutdown}.
     */
    public void run() {
        dispatcher.acceptConnections(rootPath);
    }

    /**
     * Stops accepting connections and lets the workers drain.
     */
    public void shutdown() {
        LOGGER.info(L10N.getString("info.closing_server"));
        dispatcher.shutdown();
        pool.shutdown();
    }

    /**
     * Waits for every worker to finish.
     */
    public void join() throws InterruptedException {
        pool.join();
    }

    private class ShutdownHook extends Thread {
        @Override
        public void run() {
            shutdown();
        }
    }

    /**
     * Parses a port number.
     *
     * @return the port, or -1 if the text is not a port in 1..65535
     */
    static int parsePort(String text) {
        int value;
        try {
            value = Integer.parseInt(text);
        } catch (NumberFormatException e) {
            return -1;
        }
        return (value >= 1 && value <= 65535) ? value : -1;
    }

    /**
     * Reads the bundled logging configuration, unless one was given with
     * {@code java.util.logging.config.file}.
     */
    static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        InputStream in = Mint.class.getResourceAsStream("logging.properties");
        if (in == null) {
            return;
        }
        try (InputStream config = in) {
            LogManager.getLogManager().readConfiguration(config);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, L10N.getString("err.logging_config"), e);
        }
    }

    // -- Main entry point --

    public static void main(String[] args) {
        configureLogging();

        if (args.length != 2) {
            System.err.println(L10N.getString("err.syntax"));
            System.exit(EXIT_USAGE);
        }

        int port = parsePort(args[0]);
        if (port < 0) {
            System.err.println(MessageFormat.format(L10N.getString("err.bad_port"), args[0]));
            System.exit(EXIT_USAGE);
        }

        Path rootPath;
        try {
            rootPath = PathNames.toPath(args[1]);
        } catch (IllegalArgumentException e) {
            rootPath = null;
        }
        if (rootPath == null || !Files.isDirectory(rootPath)) {
            System.err.println(MessageFormat.format(L10N.getString("err.bad_root"), args[1]));
            System.exit(EXIT_USAGE);
            return;
        }

        String address = System.getProperty("mint.address", "0.0.0.0");
        InetAddress bindAddress;
        try {
            bindAddress = InetAddress.getByName(address);
        } catch (UnknownHostException e) {
            System.err.println(MessageFormat.format(L10N.getString("err.bad_address"), address));
            System.exit(EXIT_USAGE);
            return;
        }

        int workerCount = Math.max(1, Integer.getInteger("mint.workers",
                Runtime.getRuntime().availableProcessors()));
        int receiveTimeout = Integer.getInteger("mint.receiveTimeout",
                FileConnection.DEFAULT_RECEIVE_TIMEOUT);
        if (receiveTimeout < 0) {
            System.err.println(MessageFormat.format(L10N.getString("err.bad_timeout"),
                    String.valueOf(receiveTimeout)));
            System.exit(EXIT_USAGE);
            return;
        }

        Mint mint = new Mint(bindAddress, port, rootPath, workerCount, receiveTimeout);
        System.out.println(MessageFormat.format(L10N.getString("banner"), VERSION));
        try {
            mint.start();
        } catch (IOException e) {
            String message = MessageFormat.format(L10N.getString("err.bind"),
                    address, String.valueOf(port));
            LOGGER.log(Level.SEVERE, message, e);
            mint.pool.shutdown();
            System.exit(EXIT_BIND);
            return;
        }
        Runtime.getRuntime().addShutdownHook(mint.new ShutdownHook());

        mint.run();

        // Wait for in-flight connections
        try {
            mint.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        LOGGER.info(L10N.getString("info.mint_end_loop"));
    }

}
