/*
 * ResponseBuilder.java
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

import org.bluezoo.mint.http.ContentTypes;
import org.bluezoo.mint.http.HTTPStatus;
import org.bluezoo.mint.http.Response;
import org.bluezoo.mint.util.PathNames;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the response for a resolved target.
 *
 * <p>Regular files are read into memory and sent with a Content-Type
 * taken from {@link ContentTypes}. Directories produce an HTML listing
 * of their immediate children. Anything else, or a file or directory
 * that cannot be read, produces {@link Response#NOT_FOUND}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ResponseBuilder {

    private static final Logger LOGGER = Logger.getLogger(ResponseBuilder.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.mint.http.file.L10N");

    private static final long KB = 1024L;
    private static final long MB = KB * 1024L;
    private static final long GB = MB * 1024L;

    // Largest body a byte array can hold, less room for the status line and headers
    private static final long MAX_FILE_SIZE = Integer.MAX_VALUE - 8192;

    private ResponseBuilder() {
    }

    /**
     * Builds the response for a target.
     *
     * @param target the resolved target
     * @return the response
     * @throws IOException if the response cannot be produced for a reason
     *         other than the target being unreadable
     */
    public static Response build(ResolvedTarget target) throws IOException {
        switch (target.getClassification()) {
            case REGULAR_FILE:
                return serveFile(target.getLocation());
            case DIRECTORY:
                return serveDirectory(target.getLocation(), target.getDecodedPath());
            default:
                return Response.NOT_FOUND;
        }
    }

    private static Response serveFile(Path file) throws IOException {
        byte[] content;
        try {
            long size = Files.size(file);
            if (size > MAX_FILE_SIZE) {
                String message = MessageFormat.format(L10N.getString("err.file_too_large"), file, String.valueOf(size));
                throw new FileTooLargeException(message);
            }
            content = Files.readAllBytes(file);
        } catch (FileTooLargeException e) {
            throw e;
        } catch (IOException e) {
            // Vanished since classification, or unreadable
            if (LOGGER.isLoggable(Level.FINE)) {
                String message = MessageFormat.format(L10N.getString("info.file_unreadable"), file);
                LOGGER.log(Level.FINE, message, e);
            }
            return Response.NOT_FOUND;
        }
        return new Response(HTTPStatus.OK, ContentTypes.getContentType(file), content);
    }

    private static Response serveDirectory(Path directory, String requestPath) throws IOException {
        List<Entry> entries = new ArrayList<Entry>();
        try (DirectoryStream<Path> children = Files.newDirectoryStream(directory)) {
            for (Path child : children) {
                Entry entry = readEntry(child);
                if (entry != null) {
                    entries.add(entry);
                }
            }
        } catch (IOException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                String message = MessageFormat.format(L10N.getString("info.directory_unreadable"), directory);
                LOGGER.log(Level.FINE, message, e);
            }
            return Response.NOT_FOUND;
        }
        Collections.sort(entries, new DirectoryListingComparator());

        String html = generateDirectoryListing(requestPath, entries);
        return new Response(HTTPStatus.OK, Response.HTML, PathNames.encode(html));
    }

    /**
     * Reads what the listing needs to know about one child.
     *
     * @return the entry, or null if the child is to be skipped
     */
    private static Entry readEntry(Path child) {
        String name;
        try {
            name = PathNames.fileName(child);
        } catch (CharacterCodingException e) {
            String message = MessageFormat.format(L10N.getString("warn.unencodable_name"), child);
            LOGGER.warning(message);
            return null;
        }
        try {
            BasicFileAttributes attrs = Files.readAttributes(child, BasicFileAttributes.class);
            return new Entry(name, attrs.isDirectory(), attrs.size());
        } catch (IOException | SecurityException e) {
            // Not permitted to inspect, or a broken link
            if (LOGGER.isLoggable(Level.FINE)) {
                String message = MessageFormat.format(L10N.getString("info.entry_skipped"), child);
                LOGGER.fine(message);
            }
            return null;
        }
    }

    private static String generateDirectoryListing(String requestPath, List<Entry> entries)
            throws CharacterCodingException {
        String displayPath = requestPath;
        if (displayPath == null || displayPath.isEmpty()) {
            displayPath = "/";
        }
        if (!displayPath.startsWith("/")) {
            displayPath = "/" + displayPath;
        }
        if (!displayPath.endsWith("/")) {
            displayPath += "/";
        }
        String base = PathResolver.percentEncodePath(displayPath);
        String title = MessageFormat.format(L10N.getString("listing.title"), escapeHtml(displayPath));

        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>\n");
        html.append("<html><head><meta charset=\"utf-8\"><title>").append(title).append("</title></head>\n");
        html.append("<body>\n");
        html.append("<header><h1>").append(escapeHtml(Response.SERVER)).append("</h1></header>\n");
        html.append("<p>").append(title).append("</p>\n");
        html.append("<hr>\n<ul>\n");
        for (Entry entry : entries) {
            html.append("<li><a href=\"");
            html.append(escapeHtml(base));
            html.append(escapeHtml(PathResolver.percentEncode(entry.name)));
            html.append(entry.directory ? "/" : "");
            html.append("\">");
            html.append(escapeHtml(entry.name));
            html.append(entry.directory ? "/" : "");
            html.append("</a>");
            if (!entry.directory) {
                html.append(" (").append(formatSize(entry.size)).append(")");
            }
            html.append("</li>\n");
        }
        html.append("</ul>\n<hr>\n");
        html.append("</body></html>\n");
        return html.toString();
    }

    /**
     * Formats a file size for people.
     *
     * <p>Sizes below 1024 are given in bytes. Larger sizes are given in the
     * largest of KB, MB and GB (powers of 1024) that does not exceed the
     * size, truncated to a whole number.
     *
     * @param bytes the size in bytes
     * @return the formatted size
     */
    public static String formatSize(long bytes) {
        if (bytes >= GB) {
            return MessageFormat.format(L10N.getString("size.gb"), String.valueOf(bytes / GB));
        }
        if (bytes >= MB) {
            return MessageFormat.format(L10N.getString("size.mb"), String.valueOf(bytes / MB));
        }
        if (bytes >= KB) {
            return MessageFormat.format(L10N.getString("size.kb"), String.valueOf(bytes / KB));
        }
        return MessageFormat.format(L10N.getString("size.bytes"), String.valueOf(bytes));
    }

    static String escapeHtml(String text) {
        return text.replace("&", "&amp;")
                  .replace("<", "&lt;")
                  .replace(">", "&gt;")
                  .replace("\"", "&quot;")
                  .replace("'", "&#x27;");
    }

    /**
     * A file exists and is readable but is too big to hold in memory.
     */
    static class FileTooLargeException extends IOException {

        private static final long serialVersionUID = 1L;

        FileTooLargeException(String message) {
            super(message);
        }
    }

    private static final class Entry {
        final String name;
        final boolean directory;
        final long size;

        Entry(String name, boolean directory, long size) {
            this.name = name;
            this.directory = directory;
            this.size = size;
        }
    }

    private static class DirectoryListingComparator implements Comparator<Entry> {
        @Override
        public int compare(Entry e1, Entry e2) {
            if (e1.directory != e2.directory) {
                return e1.directory ? -1 : 1;
            }
            int cmp = e1.name.compareToIgnoreCase(e2.name);
            return (cmp != 0) ? cmp : e1.name.compareTo(e2.name);
        }
    }

}
