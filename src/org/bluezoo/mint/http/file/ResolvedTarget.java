/*
 * ResolvedTarget.java
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

import java.nio.file.Path;

/**
 * A request-target resolved against the document root.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ResolvedTarget {

    /**
     * What the resolved location turned out to be.
     */
    public enum Classification {
        DIRECTORY,
        REGULAR_FILE,
        NOT_FOUND
    }

    private final String decodedPath;
    private final Path location;
    private final Classification classification;

    ResolvedTarget(String decodedPath, Path location, Classification classification) {
        this.decodedPath = decodedPath;
        this.location = location;
        this.classification = classification;
    }

    /**
     * Returns the percent-decoded request path, or the raw target if it
     * could not be decoded.
     */
    public String getDecodedPath() {
        return decodedPath;
    }

    /**
     * Returns the filesystem location, or null if the target could not be
     * mapped to one.
     */
    public Path getLocation() {
        return location;
    }

    public Classification getClassification() {
        return classification;
    }

    @Override
    public String toString() {
        return decodedPath + " -> " + location + " (" + classification + ")";
    }

}
