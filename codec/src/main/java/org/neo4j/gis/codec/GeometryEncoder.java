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
package org.neo4j.gis.codec;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import org.neo4j.gis.codec.model.GeometryTree;
import org.neo4j.gis.codec.model.GeometryTree.GeometryCollection;
import org.neo4j.gis.codec.model.GeometryTree.LineString;
import org.neo4j.gis.codec.model.GeometryTree.LinearRing;
import org.neo4j.gis.codec.model.GeometryTree.MultiLineString;
import org.neo4j.gis.codec.model.GeometryTree.MultiPoint;
import org.neo4j.gis.codec.model.GeometryTree.MultiPolygon;
import org.neo4j.gis.codec.model.GeometryTree.Point;
import org.neo4j.gis.codec.model.GeometryTree.Polygon;
import org.neo4j.gis.codec.model.Position;
import org.neo4j.spatial.api.engine.GeometryEngine;
import org.neo4j.spatial.api.engine.GeometryHandle;

/**
 * Builds engine geometry handles from {@link GeometryTree}s.
 * <p>
 * Each successful {@link #encode(GeometryTree)} allocates exactly one top-level handle that the caller owns.
 * Sub-geometries (rings, parts, collection members) are built as their own handles and attached to their
 * parent, which takes them over. If anything fails half way, every handle allocated by the call is destroyed
 * before the exception leaves the encoder.
 */
public class GeometryEncoder {

	private static final Logger LOGGER = Logger.getLogger(GeometryEncoder.class.getName());

	private final GeometryEngine engine;

	public GeometryEncoder(GeometryEngine engine) {
		this.engine = Objects.requireNonNull(engine, "engine");
	}

	/**
	 * @return a new top-level handle, to be destroyed by the caller
	 */
	public GeometryHandle encode(GeometryTree tree) {
		try (OwnedGeometry geometry = build(tree)) {
			return geometry.release();
		}
	}

	/**
	 * Encodes the tree and exports it as well-known binary through the engine.
	 */
	public byte[] encodeToBinary(GeometryTree tree) {
		try (OwnedGeometry scratch = build(tree)) {
			byte[] wkb = engine.exportToBinary(scratch.handle());
			LOGGER.fine("Encoded " + tree.type() + " as " + wkb.length + " bytes of WKB");
			return wkb;
		}
	}

	private OwnedGeometry build(GeometryTree tree) {
		if (tree == null) {
			throw new MalformedTreeException("Cannot encode a null geometry tree");
		}
		GeometryType type = tree.type();
		if (type == null) {
			throw new MalformedTreeException("Geometry tree has no type: " + tree);
		}
		return switch (type) {
			case POINT -> buildPoint(as(tree, Point.class).coordinates());
			case LINE_STRING -> buildLine(GeometryType.LINE_STRING, as(tree, LineString.class).coordinates());
			case LINEAR_RING -> buildLine(GeometryType.LINEAR_RING, as(tree, LinearRing.class).coordinates());
			case POLYGON -> buildPolygon(as(tree, Polygon.class).coordinates());
			case MULTI_POINT -> buildMultiPoint(as(tree, MultiPoint.class).coordinates());
			case MULTI_LINE_STRING -> buildMultiLineString(as(tree, MultiLineString.class).coordinates());
			case MULTI_POLYGON -> buildMultiPolygon(as(tree, MultiPolygon.class).coordinates());
			case GEOMETRY_COLLECTION -> buildCollection(as(tree, GeometryCollection.class).geometries());
			case UNKNOWN, NONE -> throw new UnsupportedGeometryTypeException(type);
		};
	}

	private OwnedGeometry buildPoint(Position position) {
		OwnedGeometry point = create(GeometryType.POINT);
		try {
			addPoint(point.handle(), position);
			return point;
		} catch (RuntimeException e) {
			point.close();
			throw e;
		}
	}

	/**
	 * Line strings and rings share the same construction, rings are closed once all points are in.
	 */
	private OwnedGeometry buildLine(GeometryType type, List<Position> positions) {
		OwnedGeometry line = create(type);
		try {
			for (Position position : positions) {
				addPoint(line.handle(), position);
			}
			if (type == GeometryType.LINEAR_RING) {
				engine.closeRing(line.handle());
			}
			return line;
		} catch (RuntimeException e) {
			line.close();
			throw e;
		}
	}

	private OwnedGeometry buildPolygon(List<List<Position>> rings) {
		OwnedGeometry polygon = create(GeometryType.POLYGON);
		try {
			for (List<Position> ring : rings) {
				attach(buildLine(GeometryType.LINEAR_RING, ring), polygon);
			}
			return polygon;
		} catch (RuntimeException e) {
			polygon.close();
			throw e;
		}
	}

	private OwnedGeometry buildMultiPoint(List<Position> points) {
		OwnedGeometry multiPoint = create(GeometryType.MULTI_POINT);
		try {
			for (Position position : points) {
				attach(buildPoint(position), multiPoint);
			}
			return multiPoint;
		} catch (RuntimeException e) {
			multiPoint.close();
			throw e;
		}
	}

	private OwnedGeometry buildMultiLineString(List<List<Position>> lines) {
		OwnedGeometry multiLineString = create(GeometryType.MULTI_LINE_STRING);
		try {
			for (List<Position> line : lines) {
				attach(buildLine(GeometryType.LINE_STRING, line), multiLineString);
			}
			return multiLineString;
		} catch (RuntimeException e) {
			multiLineString.close();
			throw e;
		}
	}

	private OwnedGeometry buildMultiPolygon(List<List<List<Position>>> polygons) {
		OwnedGeometry multiPolygon = create(GeometryType.MULTI_POLYGON);
		try {
			for (List<List<Position>> polygon : polygons) {
				attach(buildPolygon(polygon), multiPolygon);
			}
			return multiPolygon;
		} catch (RuntimeException e) {
			multiPolygon.close();
			throw e;
		}
	}

	private OwnedGeometry buildCollection(List<GeometryTree> members) {
		OwnedGeometry collection = create(GeometryType.GEOMETRY_COLLECTION);
		try {
			for (GeometryTree member : members) {
				attach(build(member), collection);
			}
			return collection;
		} catch (RuntimeException e) {
			collection.close();
			throw e;
		}
	}

	private OwnedGeometry create(GeometryType type) {
		return OwnedGeometry.create(engine, type.getCode());
	}

	private void addPoint(GeometryHandle handle, Position position) {
		if (position.hasZ()) {
			engine.addPoint3D(handle, position.getX(), position.getY(), position.getZ());
		} else {
			engine.addPoint2D(handle, position.getX(), position.getY());
		}
	}

	private static void attach(OwnedGeometry child, OwnedGeometry parent) {
		try (child) {
			child.attachTo(parent);
		}
	}

	private static <T extends GeometryTree> T as(GeometryTree tree, Class<T> shape) {
		if (!shape.isInstance(tree)) {
			throw new MalformedTreeException(
					"Geometry tree declares type " + tree.type() + " but is a " + tree.getClass().getSimpleName());
		}
		return shape.cast(tree);
	}
}
