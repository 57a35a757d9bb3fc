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

import static org.neo4j.gis.codec.Constants.WKB_HEADER_SIZE;
import static org.neo4j.gis.codec.Constants.WKB_NDR;
import static org.neo4j.gis.codec.Constants.WKB_XDR;

import java.util.ArrayList;
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
 * Walks engine geometry handles, or well-known binary buffers, and builds {@link GeometryTree}s from them.
 * <p>
 * The coordinate dimension is read once, at the handle passed to {@link #decode(GeometryHandle)}, and every
 * position produced below that handle uses it. Parts and coordinates keep the index order the engine reports.
 * <p>
 * The decoder only reads the handles it is given and never destroys them. The one handle it owns is the
 * scratch geometry of {@link #decodeFromBinary(byte[])}.
 */
public class GeometryDecoder {

	private static final Logger LOGGER = Logger.getLogger(GeometryDecoder.class.getName());

	private final GeometryEngine engine;

	public GeometryDecoder(GeometryEngine engine) {
		this.engine = Objects.requireNonNull(engine, "engine");
	}

	public GeometryTree decode(GeometryHandle handle) {
		if (handle == null) {
			throw new NullHandleException("Cannot decode a null geometry handle");
		}
		return decode(handle, engine.getCoordinateDimension(handle));
	}

	/**
	 * Decodes a well-known binary buffer through a scratch engine geometry. The kind of the scratch geometry is
	 * taken from the type tag in the buffer header. The scratch geometry is destroyed before this method
	 * returns or throws.
	 */
	public GeometryTree decodeFromBinary(byte[] wkb) {
		int typeCode = binaryTypeTag(wkb);
		try (OwnedGeometry scratch = OwnedGeometry.create(engine, typeCode)) {
			LOGGER.fine("Decoding " + wkb.length + " bytes of WKB as " + GeometryTypeRegistry.describe(typeCode));
			engine.importFromBinary(scratch.handle(), wkb, wkb.length);
			return decode(scratch.handle());
		}
	}

	static int binaryTypeTag(byte[] wkb) {
		if (wkb == null || wkb.length < WKB_HEADER_SIZE) {
			throw new MalformedBinaryException("WKB buffer is shorter than its " + WKB_HEADER_SIZE + " byte header: "
					+ (wkb == null ? "null" : wkb.length + " bytes"));
		}
		// the low order byte of the type word carries the base kind
		return switch (wkb[0]) {
			case WKB_NDR -> wkb[1] & 0xFF;
			case WKB_XDR -> wkb[4] & 0xFF;
			default -> throw new MalformedBinaryException("Unsupported WKB byte order marker: " + wkb[0]);
		};
	}

	private GeometryTree decode(GeometryHandle handle, int dimension) {
		GeometryType type = GeometryTypeRegistry.typeForCode(engine.getGeometryType(handle));
		return switch (type) {
			case POINT -> new Point(readPoint(handle, dimension));
			case LINE_STRING -> new LineString(readPositions(handle, dimension));
			case LINEAR_RING -> new LinearRing(readPositions(handle, dimension));
			case POLYGON -> new Polygon(readParts(handle, dimension, this::lineCoordinates));
			case MULTI_POINT -> new MultiPoint(readParts(handle, dimension, this::pointCoordinates));
			case MULTI_LINE_STRING -> new MultiLineString(readParts(handle, dimension, this::lineCoordinates));
			case MULTI_POLYGON -> new MultiPolygon(readParts(handle, dimension, this::polygonCoordinates));
			case GEOMETRY_COLLECTION -> new GeometryCollection(readParts(handle, dimension, this::decode));
			case UNKNOWN, NONE -> throw new UnsupportedGeometryTypeException(type);
		};
	}

	private Position readPoint(GeometryHandle handle, int dimension) {
		int count = engine.getPointCount(handle);
		if (count != 1) {
			throw new MalformedTreeException("A Point needs exactly one coordinate but the engine reported " + count);
		}
		return readPosition(handle, 0, dimension);
	}

	private Position readPosition(GeometryHandle handle, int index, int dimension) {
		double x = engine.getX(handle, index);
		double y = engine.getY(handle, index);
		if (dimension > 2) {
			return Position.of(x, y, engine.getZ(handle, index));
		}
		return Position.of(x, y);
	}

	private List<Position> readPositions(GeometryHandle handle, int dimension) {
		int count = engine.getPointCount(handle);
		List<Position> positions = new ArrayList<>(count);
		for (int i = 0; i < count; i++) {
			positions.add(readPosition(handle, i, dimension));
		}
		return positions;
	}

	private <T> List<T> readParts(GeometryHandle handle, int dimension, PartReader<T> reader) {
		int count = engine.getChildCount(handle);
		List<T> parts = new ArrayList<>(count);
		for (int i = 0; i < count; i++) {
			GeometryHandle child = engine.getChildRef(handle, i);
			if (child == null) {
				throw new NullHandleException("Geometry engine returned no part at index " + i);
			}
			parts.add(reader.read(child, dimension));
		}
		return parts;
	}

	// Parts of polygons and Multi* geometries only contribute their coordinates, their own type is dropped

	private Position pointCoordinates(GeometryHandle child, int dimension) {
		GeometryTree part = decode(child, dimension);
		if (part instanceof Point point) {
			return point.coordinates();
		}
		throw unexpectedPart(part, GeometryType.POINT);
	}

	private List<Position> lineCoordinates(GeometryHandle child, int dimension) {
		GeometryTree part = decode(child, dimension);
		if (part instanceof LineString lineString) {
			return lineString.coordinates();
		}
		if (part instanceof LinearRing ring) {
			return ring.coordinates();
		}
		throw unexpectedPart(part, GeometryType.LINE_STRING);
	}

	private List<List<Position>> polygonCoordinates(GeometryHandle child, int dimension) {
		GeometryTree part = decode(child, dimension);
		if (part instanceof Polygon polygon) {
			return polygon.coordinates();
		}
		throw unexpectedPart(part, GeometryType.POLYGON);
	}

	private static GeometryCodecException unexpectedPart(GeometryTree part, GeometryType expected) {
		if (part.type() == GeometryType.GEOMETRY_COLLECTION) {
			return new UnsupportedGeometryTypeException(part.type());
		}
		return new MalformedTreeException("Expected a " + expected + " part but the engine returned a " + part.type());
	}

	@FunctionalInterface
	private interface PartReader<T> {

		T read(GeometryHandle child, int dimension);
	}
}
