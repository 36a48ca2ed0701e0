/*
 * PathResolver.java
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

import org.bluezoo.mint.util.ByteArrays;
import org.bluezoo.mint.util.PathNames;

import java.io.ByteArrayOutputStream;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.text.MessageFormat;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps request-targets onto locations under the document root.
 *
 * <p>The target is percent-decoded, the resulting bytes are read as UTF-8,
 * and the path is joined onto the root. The joined path is normalized and
 * must stay under the root: a target whose {@code ..} segments climb out
 * of the root is reported as {@link ResolvedTarget.Classification#NOT_FOUND}.
 * Symbolic links inside the root are followed.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class PathResolver {

    private static final Logger LOGGER = Logger.getLogger(PathResolver.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.mint.http.file.L10N");

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private final Path rootPath;

    /**
     * Creates a resolver for the given document root.
     *
     * @param rootPath the document root
     */
    public PathResolver(Path rootPath) {
        if (rootPath == null) {
            throw new IllegalArgumentException("Root path cannot be null");
        }
        this.rootPath = rootPath.toAbsolutePath().normalize();
    }

    public Path getRootPath() {
        return rootPath;
    }

    /**
     * Resolves and classifies a request-target.
     *
     * @param rawTarget the request-target as sent, still percent-encoded
     * @return the resolved target
     */
    public ResolvedTarget resolve(String rawTarget) {
        String decodedPath;
        try {
            decodedPath = PathNames.decode(percentDecode(rawTarget));
        } catch (CharacterCodingException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                String message = MessageFormat.format(L10N.getString("info.undecodable_target"), rawTarget);
                LOGGER.fine(message);
            }
            return new ResolvedTarget(rawTarget, null, ResolvedTarget.Classification.NOT_FOUND);
        }

        Path location;
        if ("/".equals(decodedPath)) {
            location = rootPath;
        } else {
            int start = 0;
            while (start < decodedPath.length() && decodedPath.charAt(start) == '/') {
                start++;
            }
            try {
                location = rootPath.resolve(decodedPath.substring(start)).normalize();
            } catch (InvalidPathException e) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    String message = MessageFormat.format(L10N.getString("info.invalid_path"), decodedPath);
                    LOGGER.fine(message);
                }
                return new ResolvedTarget(decodedPath, null, ResolvedTarget.Classification.NOT_FOUND);
            }
            if (!location.startsWith(rootPath)) {
                String message = MessageFormat.format(L10N.getString("warn.outside_root"), decodedPath);
                LOGGER.warning(message);
                return new ResolvedTarget(decodedPath, null, ResolvedTarget.Classification.NOT_FOUND);
            }
        }

        return new ResolvedTarget(decodedPath, location, classify(location));
    }

    private static ResolvedTarget.Classification classify(Path location) {
        if (Files.isDirectory(location)) {
            return ResolvedTarget.Classification.DIRECTORY;
        }
        if (Files.isRegularFile(location)) {
            return ResolvedTarget.Classification.REGULAR_FILE;
        }
        // Absent, a broken link, inaccessible, or something else
        return ResolvedTarget.Classification.NOT_FOUND;
    }

    /**
     * Percent-decodes a request-target.
     *
     * <p>Every {@code %} followed by two hexadecimal digits becomes the
     * byte they encode. Every other character, including a {@code %}
     * without two hexadecimal digits after it, is copied through. The
     * target is expected to hold one byte per character, as produced by
     * the request parser.
     *
     * @param target the request-target
     * @return the decoded bytes
     */
    public static byte[] percentDecode(String target) {
        byte[] in = target.getBytes(StandardCharsets.ISO_8859_1);
        ByteArrayOutputStream out = new ByteArrayOutputStream(in.length);
        int i = 0;
        while (i < in.length) {
            byte b = in[i];
            if (b == '%' && i + 2 < in.length) {
                int hi = ByteArrays.hexValue(in[i + 1]);
                int lo = ByteArrays.hexValue(in[i + 2]);
                if (hi >= 0 && lo >= 0) {
                    out.write((hi << 4) | lo);
                    i += 3;
                    continue;
                }
            }
            out.write(b);
            i++;
        }
        return out.toByteArray();
    }

    /**
     * Percent-encodes one path segment.
     *
     * <p>The segment is encoded as UTF-8 and every byte that is not an
     * RFC 3986 unreserved character is written as {@code %XX}, including
     * {@code /}.
     *
     * @param segment the path segment
     * @return the encoded segment
     * @throws CharacterCodingException if segment cannot be encoded as UTF-8
     */
    public static String percentEncode(String segment) throws CharacterCodingException {
        byte[] bytes = PathNames.encode(segment);
        StringBuilder buf = new StringBuilder(bytes.length);
        for (byte b : bytes) {
            int c = b & 0xff;
            if (isUnreserved(c)) {
                buf.append((char) c);
            } else {
                buf.append('%').append(HEX[c >> 4]).append(HEX[c & 0xf]);
            }
        }
        return buf.toString();
    }

    /**
     * Percent-encodes a path, leaving the {@code /} separators in place.
     *
     * @param path the decoded path
     * @return the encoded path
     * @throws CharacterCodingException if path cannot be encoded as UTF-8
     */
    public static String percentEncodePath(String path) throws CharacterCodingException {
        StringBuilder buf = new StringBuilder(path.length());
        int start = 0;
        int end;
        while ((end = path.indexOf('/', start)) >= 0) {
            buf.append(percentEncode(path.substring(start, end))).append('/');
            start = end + 1;
        }
        buf.append(percentEncode(path.substring(start)));
        return buf.toString();
    }

    private static boolean isUnreserved(int c) {
        return (c >= 'A' && c <= 'Z')
                || (c >= 'a' && c <= 'z')
                || (c >= '0' && c <= '9')
                || c == '-' || c == '.' || c == '_' || c == '~';
    }

}
