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
 * The primitives a geometry engine exposes to the geometry codec.
 * <p>
 * An engine owns the geometry nodes it allocates and hands out {@link GeometryHandle}s to refer to them. The
 * codec only ever walks handles through the accessors below, or builds new ones through the construction and
 * mutation primitives, so any library able to model simple feature geometries can sit behind this interface.
 * </p>
 * <p>
 * Type codes are the OGC simple feature codes (Point = 1 up to GeometryCollection = 7, LinearRing = 101). The
 * 3D variant of a kind has the high bit {@code 0x80000000} set on top of its base code.
 * </p>
 * <p>
 * Handles are not thread safe. A handle and all of its children must only be used by one call tree at a time.
 * </p>
 */
public interface GeometryEngine {

	/**
	 * Allocates a new, empty top-level geometry of the given kind.
	 *
	 * @param typeCode the type code, optionally with the 3D bit set
	 * @return the new owned handle, or null if the engine cannot create a geometry of that kind
	 */
	GeometryHandle createGeometry(int typeCode);

	/**
	 * Releases a top-level handle and every child it owns. Passing null does nothing.
	 *
	 * @param handle the owned handle to release
	 * @throws GeometryEngineException if the handle is owned by a parent or was already destroyed
	 */
	void destroyGeometry(GeometryHandle handle);

	/**
	 * Populates a freshly created handle from a well-known binary buffer.
	 *
	 * @param handle the empty handle to fill, created with the kind the buffer describes
	 * @param wkb    the buffer
	 * @param length number of bytes of the buffer to consume
	 * @throws GeometryEngineException if the buffer does not parse or describes another kind
	 */
	void importFromBinary(GeometryHandle handle, byte[] wkb, int length);

	/**
	 * Writes the geometry behind the handle as well-known binary.
	 *
	 * @param handle the handle to export
	 * @return the encoded bytes
	 */
	byte[] exportToBinary(GeometryHandle handle);

	/**
	 * @return the number of points held directly by the handle (1 for a point, 0 for containers)
	 */
	int getPointCount(GeometryHandle handle);

	double getX(GeometryHandle handle, int index);

	double getY(GeometryHandle handle, int index);

	/**
	 * @return the z ordinate of the point at index, or 0 if the handle is two dimensional
	 */
	double getZ(GeometryHandle handle, int index);

	/**
	 * @return 2 or 3
	 */
	int getCoordinateDimension(GeometryHandle handle);

	/**
	 * @return the raw type code, with the 3D bit set if the handle is three dimensional
	 */
	int getGeometryType(GeometryHandle handle);

	int getChildCount(GeometryHandle handle);

	/**
	 * Returns a non-owning reference to a child geometry (a ring of a polygon, or a member of a collection).
	 * The reference is only valid as long as the parent lives.
	 */
	GeometryHandle getChildRef(GeometryHandle handle, int index);

	void addPoint2D(GeometryHandle handle, double x, double y);

	void addPoint3D(GeometryHandle handle, double x, double y, double z);

	/**
	 * Attaches a top-level handle as the last child of another handle. Ownership of the child moves to the
	 * parent: from now on it is released when the parent is destroyed.
	 *
	 * @throws GeometryEngineException if the child kind cannot be held by the parent
	 */
	void addChildOwned(GeometryHandle parent, GeometryHandle child);

	/**
	 * Appends a copy of the first point if the first and last points differ. Does nothing for an already closed
	 * or empty ring.
	 */
	void closeRing(GeometryHandle handle);
}
