/*
 * Copyright (c) "Neo4j"
 * Neo4j Sweden AB [http://neo4j.com]
 *
 * This file is part of Neo4j Spatial.
 *
 * Neo4j is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */
package org.neo4j.spatial.api.engine;

/**
 * Opaque reference to a single geometry node owned by a {@link GeometryEngine}.
 * <p>
 * Handles carry no behaviour of their own. Every read or mutation goes through the engine that
 * created the handle, and a handle must never be passed to a different engine instance.
 * </p>
 * <p>
 * Ownership follows the way the handle was obtained:
 * <ul>
 * <li>{@link GeometryEngine#createGeometry(int)} returns an owned top-level handle. The caller destroys it with
 * {@link GeometryEngine#destroyGeometry(GeometryHandle)} or hands it on with
 * {@link GeometryEngine#addChildOwned(GeometryHandle, GeometryHandle)}.</li>
 * <li>{@link GeometryEngine#getChildRef(GeometryHandle, int)} returns a non-owning reference. It lives as long as
 * its parent and must never be destroyed on its own.</li>
 * </ul>
 * </p>
 */
public interface GeometryHandle {

}
