/*
 * LaconicFormatter.java
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

package org.bluezoo.mint.util;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

/**
 * A logging formatter that prints one line per record: the level, the
 * name of the thread that logged it, and the message. Parameters are
 * substituted if present. A stack trace follows when the record carries
 * a throwable.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class LaconicFormatter extends Formatter {

    private static final String EOL = System.lineSeparator();

    @Override
    public String format(LogRecord record) {
        StringBuilder buf = new StringBuilder();
        buf.append(record.getLevel().getLocalizedName());
        buf.append(" [");
        buf.append(Thread.currentThread().getName());
        buf.append("]: ");
        String message = formatMessage(record);
        if (message != null) {
            buf.append(message);
        }
        buf.append(EOL);
        Throwable t = record.getThrown();
        if (t != null) {
            StringWriter sink = new StringWriter();
            PrintWriter filter = new PrintWriter(sink);
            t.printStackTrace(filter);
            filter.flush();
            buf.append(sink.toString());
        }
        return buf.toString();
    }

}
