/*
 * PathResolverTest.java
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

import org.junit.Assume;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Unit tests for {@link PathResolver}, including confinement to the
 * document root.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class PathResolverTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path root;
    private Path outside;
    private PathResolver resolver;

    @Before
    public void setUp() throws Exception {
        Logger.getLogger(PathResolver.class.getName()).setLevel(Level.OFF);
        outside = folder.newFolder("outside").toPath();
        Files.write(outside.resolve("secret.txt"), "secret".getBytes(StandardCharsets.US_ASCII));
        root = folder.newFolder("root").toPath();
        Files.createDirectory(root.resolve("sub"));
        Files.write(root.resolve("sub").resolve("file.txt"), "x".getBytes(StandardCharsets.US_ASCII));
        Files.write(root.resolve("a b.txt"), "y".getBytes(StandardCharsets.US_ASCII));
        resolver = new PathResolver(root);
    }

    private ResolvedTarget.Classification classify(String target) {
        return resolver.resolve(target).getClassification();
    }

    @Test
    public void testRoot() {
        ResolvedTarget target = resolver.resolve("/");
        assertEquals(ResolvedTarget.Classification.DIRECTORY, target.getClassification());
        assertEquals(resolver.getRootPath(), target.getLocation());
        assertEquals("/", target.getDecodedPath());
    }

    @Test
    public void testRegularFileAndDirectory() {
        assertEquals(ResolvedTarget.Classification.DIRECTORY, classify("/sub"));
        assertEquals(ResolvedTarget.Classification.DIRECTORY, classify("/sub/"));
        assertEquals(ResolvedTarget.Classification.REGULAR_FILE, classify("/sub/file.txt"));
        assertEquals(root.resolve("sub").resolve("file.txt").toAbsolutePath().normalize(),
                resolver.resolve("/sub/file.txt").getLocation());
    }

    @Test
    public void testMissing() {
        assertEquals(ResolvedTarget.Classification.NOT_FOUND, classify("/nope.txt"));
        assertEquals(ResolvedTarget.Classification.NOT_FOUND, classify("/sub/file.txt/more"));
    }

    @Test
    public void testEncodedSameAsLiteral() {
        ResolvedTarget encoded = resolver.resolve("/a%20b.txt");
        ResolvedTarget literal = resolver.resolve("/a b.txt");
        assertEquals(ResolvedTarget.Classification.REGULAR_FILE, encoded.getClassification());
        assertEquals(literal.getLocation(), encoded.getLocation());
        assertEquals("/a b.txt", encoded.getDecodedPath());
    }

    @Test
    public void testUtf8Target() throws Exception {
        try {
            Files.write(root.resolve("caf\u00e9.txt"), "z".getBytes(StandardCharsets.US_ASCII));
        } catch (InvalidPathException e) {
            // Platform file names cannot hold this character
            Assume.assumeNoException(e);
        }
        assertEquals(ResolvedTarget.Classification.REGULAR_FILE, classify("/caf%C3%A9.txt"));
    }

    @Test
    public void testUndecodableTarget() {
        ResolvedTarget target = resolver.resolve("/%FF%FE");
        assertEquals(ResolvedTarget.Classification.NOT_FOUND, target.getClassification());
        assertNull(target.getLocation());
    }

    @Test
    public void testTraversalStaysInRoot() {
        assertEquals(ResolvedTarget.Classification.NOT_FOUND, classify("/../outside/secret.txt"));
        assertEquals(ResolvedTarget.Classification.NOT_FOUND, classify("/%2e%2e/outside/secret.txt"));
        assertEquals(ResolvedTarget.Classification.NOT_FOUND, classify("/sub/../../outside"));
        assertEquals(ResolvedTarget.Classification.NOT_FOUND, classify("/.."));
        assertNull(resolver.resolve("/../outside/secret.txt").getLocation());
    }

    @Test
    public void testDotSegmentsInsideRoot() {
        assertEquals(ResolvedTarget.Classification.REGULAR_FILE, classify("/sub/../sub/./file.txt"));
        assertEquals(ResolvedTarget.Classification.DIRECTORY, classify("/sub/.."));
    }

    @Test
    public void testRepeatedLeadingSlashes() {
        assertEquals(ResolvedTarget.Classification.REGULAR_FILE, classify("//sub/file.txt"));
    }

    @Test
    public void testNulByte() {
        assertEquals(ResolvedTarget.Classification.NOT_FOUND, classify("/sub%00/file.txt"));
    }

    @Test
    public void testPercentDecodeLenient() {
        assertEquals("a b", ascii(PathResolver.percentDecode("a%20b")));
        assertEquals("%zz", ascii(PathResolver.percentDecode("%zz")));
        assertEquals("100%", ascii(PathResolver.percentDecode("100%")));
        assertEquals("%4", ascii(PathResolver.percentDecode("%4")));
        assertEquals("A", ascii(PathResolver.percentDecode("%41")));
        assertEquals("/a", ascii(PathResolver.percentDecode("%2fa")));
        assertEquals("", ascii(PathResolver.percentDecode("")));
    }

    @Test
    public void testPercentEncode() throws Exception {
        assertEquals("a%20b.txt", PathResolver.percentEncode("a b.txt"));
        assertEquals("caf%C3%A9", PathResolver.percentEncode("café"));
        assertEquals("a%2Fb", PathResolver.percentEncode("a/b"));
        assertEquals("AZaz09-._~", PathResolver.percentEncode("AZaz09-._~"));
        assertEquals("/dir%20one/", PathResolver.percentEncodePath("/dir one/"));
    }

    @Test
    public void testEncodeDecodeInverse() throws Exception {
        String name = "résumé #1 & 100%.txt";
        String encoded = PathResolver.percentEncode(name);
        byte[] decoded = PathResolver.percentDecode(encoded);
        assertEquals(name, new String(decoded, StandardCharsets.UTF_8));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullRoot() {
        new PathResolver(null);
    }

    private static String ascii(byte[] bytes) {
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }

}
