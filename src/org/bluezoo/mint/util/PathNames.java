/*
 * PathNames.java
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

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Conversion between platform path names and UTF-8.
 *
 * <p>Conversions are strict: a byte sequence that is not valid UTF-8, or a
 * name that cannot be represented in UTF-8 (an unpaired surrogate), raises
 * a {@link CharacterCodingException} rather than being replaced.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PathNames {

    private PathNames() {
    }

    /**
     * Decodes UTF-8 bytes into text.
     *
     * @param bytes the UTF-8 bytes
     * @return the decoded text
     * @throws CharacterCodingException if bytes is not valid UTF-8
     */
    public static String decode(byte[] bytes) throws CharacterCodingException {
        CharBuffer chars = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes));
        return chars.toString();
    }

    /**
     * Encodes text as UTF-8.
     *
     * @param text the text, typically a file name
     * @return the UTF-8 bytes
     * @throws CharacterCodingException if text cannot be encoded
     */
    public static byte[] encode(String text) throws CharacterCodingException {
        ByteBuffer buf = StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .encode(CharBuffer.wrap(text));
        byte[] bytes = new byte[buf.remaining()];
        buf.get(bytes);
        return bytes;
    }

    /**
     * Returns the file name of a path in a form safe to write into UTF-8
     * output.
     *
     * @param path the path
     * @return the last name element of path
     * @throws CharacterCodingException if the name cannot be encoded
     */
    public static String fileName(Path path) throws CharacterCodingException {
        Path name = path.getFileName();
        String text = (name != null) ? name.toString() : path.toString();
        encode(text);
        return text;
    }

    /**
     * Converts a command-line path argument into a platform path.
     *
     * @param argument the argument
     * @return the path
     * @throws IllegalArgumentException if the platform cannot represent the
     *         argument as a path
     */
    public static Path toPath(String argument) {
        try {
            encode(argument);
            return Paths.get(argument);
        } catch (CharacterCodingException | InvalidPathException e) {
            throw new IllegalArgumentException("Invalid path: " + argument, e);
        }
    }

}
