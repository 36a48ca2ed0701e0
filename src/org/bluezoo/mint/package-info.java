/*
 * package-info.java
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

/**
 * Core of the mint file-serving HTTP responder.
 *
 * <p>mint answers HTTP/1.x {@code GET} requests with the contents of files
 * under a document root, or with an HTML listing for directories. Each
 * connection carries exactly one request and is closed after the
 * response.
 *
 * <h2>Architecture</h2>
 *
 * <ul>
 *   <li>{@link org.bluezoo.mint.Dispatcher} - Accepts connections on a
 *       blocking server socket and hands each one to the pool</li>
 *   <li>{@link org.bluezoo.mint.WorkerPool} - Fixed set of worker threads
 *       draining a shared FIFO queue</li>
 *   <li>{@link org.bluezoo.mint.http.file.FileConnection} - Serves one
 *       request on one connection</li>
 *   <li>{@link org.bluezoo.mint.Mint} - Command-line entry point and
 *       lifecycle</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 *
 * <p>The port and document root are given on the command line. The
 * system properties {@code mint.workers}, {@code mint.address} and
 * {@code mint.receiveTimeout} adjust the worker count, bind address and
 * receive timeout.
 *
 * @see org.bluezoo.mint.http
 * @see org.bluezoo.mint.http.file
 */
package org.bluezoo.mint;
