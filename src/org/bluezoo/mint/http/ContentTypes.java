/*
 * ContentTypes.java
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

import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Fixed mapping from file extension to Content-Type.
 * Keys are lowercase and include the leading dot.
 * Anything not in the table is served as {@value #DEFAULT}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ContentTypes {

    public static final String DEFAULT = "text/plain";

    private static final Map<String,String> COMMON;
    static {
        Map<String,String> map = new HashMap<>();
        map.put(".css", "text/css");
        map.put(".gif", "image/gif");
        map.put(".htm", "text/html");
        map.put(".html", "text/html");
        map.put(".ico", "image/x-icon");
        map.put(".jpeg", "image/jpeg");
        map.put(".jpg", "image/jpeg");
        map.put(".js", "application/javascript");
        map.put(".mp4", "video/mp4");
        map.put(".png", "image/png");
        map.put(".svg", "image/svg+xml");
        map.put(".xml", "text/xml");
        COMMON = Collections.unmodifiableMap(map);
    }

    private ContentTypes() {
    }

    /**
     * Returns the Content-Type for the given extension.
     *
     * @param extension the extension including the leading dot, in any case
     * @return the content type, never null
     */
    public static String getContentType(String extension) {
        if (extension == null) {
            return DEFAULT;
        }
        String contentType = COMMON.get(extension.toLowerCase(Locale.ROOT));
        return (contentType != null) ? contentType : DEFAULT;
    }

    /**
     * Returns the Content-Type for a file, based on its name.
     *
     * @param file the file
     * @return the content type, never null
     */
    public static String getContentType(Path file) {
        return getContentType(getExtension(file));
    }

    /**
     * Returns the extension of the file name including the leading dot,
     * or null if the name has none. A leading dot alone (".profile")
     * does not count as an extension.
     */
    static String getExtension(Path file) {
        Path name = (file != null) ? file.getFileName() : null;
        if (name == null) {
            return null;
        }
        String fileName = name.toString();
        int lastDot = fileName.lastIndexOf('.');
        if (lastDot <= 0) {
            return null;
        }
        return fileName.substring(lastDot);
    }

}
