/*
 * DispatcherTest.java
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

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

import java.io.InputStream;
import java.net.InetAddress;
import java.net.Socket;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Unit tests for {@link Dispatcher}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DispatcherTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private WorkerPool pool;
    private Dispatcher dispatcher;

    @Before
    public void setUp() {
        Logger.getLogger("org.bluezoo.mint").setLevel(Level.OFF);
        pool = new WorkerPool(1);
        dispatcher = new Dispatcher(pool, 1000);
    }

    @After
    public void tearDown() {
        dispatcher.shutdown();
        pool.close();
    }

    private Thread startAccepting() {
        Thread thread = new Thread(new Runnable() {
            @Override
            public void run() {
                dispatcher.acceptConnections(folder.getRoot().toPath());
            }
        }, "Dispatcher");
        thread.start();
        return thread;
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeReceiveTimeout() {
        new Dispatcher(pool, -1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullPool() {
        new Dispatcher(null);
    }

    @Test
    public void testLocalPort() throws Exception {
        assertEquals(-1, dispatcher.getLocalPort());
        dispatcher.bind(InetAddress.getLoopbackAddress(), 0);
        assertTrue(dispatcher.getLocalPort() > 0);
    }

    @Test(expected = IllegalStateException.class)
    public void testBindTwice() throws Exception {
        dispatcher.bind(InetAddress.getLoopbackAddress(), 0);
        dispatcher.bind(InetAddress.getLoopbackAddress(), 0);
    }

    @Test
    public void testBindAfterShutdown() throws Exception {
        dispatcher.shutdown();
        try {
            dispatcher.bind(InetAddress.getLoopbackAddress(), 0);
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            // expected
        }
        assertEquals(-1, dispatcher.getLocalPort());
    }

    @Test(expected = IllegalStateException.class)
    public void testAcceptBeforeBind() {
        dispatcher.acceptConnections(folder.getRoot().toPath());
    }

    @Test
    public void testShutdownEndsAcceptLoop() throws Exception {
        dispatcher.bind(InetAddress.getLoopbackAddress(), 0);
        Thread thread = startAccepting();
        dispatcher.shutdown();
        thread.join(5000);
        assertFalse(thread.isAlive());
    }

    @Test
    public void testUndispatchedConnectionClosed() throws Exception {
        dispatcher.bind(InetAddress.getLoopbackAddress(), 0);
        pool.shutdown();
        Thread thread = startAccepting();
        try (Socket socket = new Socket(InetAddress.getLoopbackAddress(), dispatcher.getLocalPort())) {
            socket.setSoTimeout(5000);
            InputStream in = socket.getInputStream();
            assertEquals(-1, in.read());
        } finally {
            dispatcher.shutdown();
            thread.join(5000);
        }
        assertFalse(thread.isAlive());
    }

}
