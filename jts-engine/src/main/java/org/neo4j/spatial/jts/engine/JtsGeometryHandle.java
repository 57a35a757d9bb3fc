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
package org.neo4j.spatial.jts.engine;

import java.util.ArrayList;
import java.util.List;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateList;
import org.neo4j.spatial.api.engine.GeometryEngineException;
import org.neo4j.spatial.api.engine.GeometryHandle;

/**
 * Mutable geometry node behind the handles of {@link JtsGeometryEngine}. JTS geometries are immutable, so the
 * engine builds these nodes first and only turns them into JTS geometries on export.
 */
final class JtsGeometryHandle implements GeometryHandle {

	final int typeCode;
	int dimension;
	final CoordinateList coordinates = new CoordinateList();
	final List<JtsGeometryHandle> children = new ArrayList<>();
	JtsGeometryHandle parent;
	boolean destroyed;

	JtsGeometryHandle(int typeCode, int dimension) {
		this.typeCode = typeCode;
		this.dimension = dimension;
	}

	Coordinate coordinate(int index) {
		if (index < 0 || index >= coordinates.size()) {
			throw new GeometryEngineException(
					"Point index " + index + " out of range for " + coordinates.size() + " points");
		}
		return coordinates.getCoordinate(index);
	}

	boolean isEmpty() {
		return coordinates.isEmpty() && children.isEmpty();
	}

	void markDestroyed() {
		destroyed = true;
		children.forEach(JtsGeometryHandle::markDestroyed);
	}

	/**
	 * Raises the dimension of the whole tree this node belongs to.
	 */
	void promote(int newDimension) {
		JtsGeometryHandle root = this;
		while (root.parent != null) {
			root = root.parent;
		}
		root.setDimensionDown(newDimension);
	}

	private void setDimensionDown(int newDimension) {
		if (dimension < newDimension) {
			dimension = newDimension;
		}
		children.forEach(child -> child.setDimensionDown(newDimension));
	}

	@Override
	public String toString() {
		return "JtsGeometryHandle(type=" + typeCode + ", dimension=" + dimension + ", points=" + coordinates.size()
				+ ", parts=" + children.size() + (destroyed ? ", destroyed" : "") + ")";
	}
}
