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

import java.util.Arrays;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.ByteOrderValues;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKBReader;
import org.locationtech.jts.io.WKBWriter;
import org.neo4j.spatial.api.Configurable;
import org.neo4j.spatial.api.engine.GeometryEngine;
import org.neo4j.spatial.api.engine.GeometryEngineException;
import org.neo4j.spatial.api.engine.GeometryHandle;

/**
 * Geometry engine built on the JTS Topology Suite. Handles are mutable {@link JtsGeometryHandle} nodes; binary
 * import goes through {@link WKBReader} and export through {@link WKBWriter}.
 * <p>
 * The engine itself can be shared between threads, the handles it creates can not. A configuration change is
 * seen by exports started after it, on any thread.
 */
public class JtsGeometryEngine implements GeometryEngine, Configurable {

	private static final Logger LOGGER = Logger.getLogger(JtsGeometryEngine.class.getName());

	static final int TYPE_POINT = 1;
	static final int TYPE_LINESTRING = 2;
	static final int TYPE_POLYGON = 3;
	static final int TYPE_MULTIPOINT = 4;
	static final int TYPE_MULTILINESTRING = 5;
	static final int TYPE_MULTIPOLYGON = 6;
	static final int TYPE_GEOMETRYCOLLECTION = 7;
	static final int TYPE_LINEARRING = 101;
	static final int FLAG_3D = 0x80000000;

	public static final String BYTE_ORDER_NDR = "NDR";
	public static final String BYTE_ORDER_XDR = "XDR";

	private final GeometryFactory geometryFactory;
	private final Set<JtsGeometryHandle> liveHandles = ConcurrentHashMap.newKeySet();
	private volatile int byteOrder = ByteOrderValues.LITTLE_ENDIAN;
	private volatile int outputDimension = 3;

	public JtsGeometryEngine() {
		this(new GeometryFactory());
	}

	public JtsGeometryEngine(GeometryFactory geometryFactory) {
		this.geometryFactory = geometryFactory;
	}

	@Override
	public GeometryHandle createGeometry(int typeCode) {
		int baseCode = typeCode & ~FLAG_3D;
		if (!isSupported(baseCode)) {
			LOGGER.finer("Refusing to create geometry of type code " + typeCode);
			return null;
		}
		JtsGeometryHandle handle = new JtsGeometryHandle(baseCode, (typeCode & FLAG_3D) != 0 ? 3 : 2);
		liveHandles.add(handle);
		LOGGER.finer("Created " + handle);
		return handle;
	}

	@Override
	public void destroyGeometry(GeometryHandle geometryHandle) {
		if (geometryHandle == null) {
			return;
		}
		JtsGeometryHandle handle = unwrap(geometryHandle);
		if (handle.parent != null) {
			LOGGER.warning("Attempt to destroy a geometry owned by its parent: " + handle);
			throw new GeometryEngineException("Cannot destroy a geometry that is owned by its parent: " + handle);
		}
		handle.markDestroyed();
		liveHandles.remove(handle);
		LOGGER.finer("Destroyed " + handle);
	}

	@Override
	public void importFromBinary(GeometryHandle geometryHandle, byte[] wkb, int length) {
		JtsGeometryHandle handle = unwrap(geometryHandle);
		if (!handle.isEmpty()) {
			throw new GeometryEngineException("Can only import into an empty geometry: " + handle);
		}
		if (wkb == null || length < 0 || length > wkb.length) {
			throw new GeometryEngineException("Invalid WKB buffer length " + length);
		}
		Geometry geometry;
		try {
			geometry = new WKBReader(geometryFactory).read(length == wkb.length ? wkb : Arrays.copyOf(wkb, length));
		} catch (ParseException | RuntimeException e) {
			throw new GeometryEngineException("Failed to parse WKB: " + e.getMessage(), e);
		}
		int parsedType = typeCodeOf(geometry);
		if (parsedType != handle.typeCode) {
			throw new GeometryEngineException(
					"WKB holds a " + geometry.getGeometryType() + " but the geometry has type code " + handle.typeCode);
		}
		populate(handle, geometry);
		handle.promote(dimensionOf(geometry));
		LOGGER.fine("Imported " + length + " bytes of WKB into " + handle);
	}

	@Override
	public byte[] exportToBinary(GeometryHandle geometryHandle) {
		JtsGeometryHandle handle = unwrap(geometryHandle);
		Geometry geometry = toGeometry(handle);
		byte[] wkb = new WKBWriter(outputDimension, byteOrder).write(geometry);
		LOGGER.fine("Exported " + handle + " as " + wkb.length + " bytes of WKB");
		return wkb;
	}

	@Override
	public int getPointCount(GeometryHandle handle) {
		return unwrap(handle).coordinates.size();
	}

	@Override
	public double getX(GeometryHandle handle, int index) {
		return unwrap(handle).coordinate(index).getX();
	}

	@Override
	public double getY(GeometryHandle handle, int index) {
		return unwrap(handle).coordinate(index).getY();
	}

	@Override
	public double getZ(GeometryHandle geometryHandle, int index) {
		JtsGeometryHandle handle = unwrap(geometryHandle);
		double z = handle.coordinate(index).getZ();
		return handle.dimension < 3 || Double.isNaN(z) ? 0.0 : z;
	}

	@Override
	public int getCoordinateDimension(GeometryHandle handle) {
		return unwrap(handle).dimension;
	}

	@Override
	public int getGeometryType(GeometryHandle geometryHandle) {
		JtsGeometryHandle handle = unwrap(geometryHandle);
		return handle.dimension == 3 ? handle.typeCode | FLAG_3D : handle.typeCode;
	}

	@Override
	public int getChildCount(GeometryHandle handle) {
		return unwrap(handle).children.size();
	}

	@Override
	public GeometryHandle getChildRef(GeometryHandle geometryHandle, int index) {
		JtsGeometryHandle handle = unwrap(geometryHandle);
		if (index < 0 || index >= handle.children.size()) {
			throw new GeometryEngineException(
					"Part index " + index + " out of range for " + handle.children.size() + " parts");
		}
		return handle.children.get(index);
	}

	@Override
	public void addPoint2D(GeometryHandle handle, double x, double y) {
		addPoint(unwrap(handle), new Coordinate(x, y));
	}

	@Override
	public void addPoint3D(GeometryHandle geometryHandle, double x, double y, double z) {
		JtsGeometryHandle handle = unwrap(geometryHandle);
		addPoint(handle, new Coordinate(x, y, z));
		handle.promote(3);
	}

	@Override
	public void addChildOwned(GeometryHandle parentHandle, GeometryHandle childHandle) {
		JtsGeometryHandle parent = unwrap(parentHandle);
		JtsGeometryHandle child = unwrap(childHandle);
		if (child.parent != null || !liveHandles.contains(child)) {
			throw new GeometryEngineException("Only a top-level geometry can be attached: " + child);
		}
		if (!canHold(parent.typeCode, child.typeCode)) {
			throw new GeometryEngineException("A geometry of type code " + parent.typeCode
					+ " cannot hold a part of type code " + child.typeCode);
		}
		parent.children.add(child);
		child.parent = parent;
		liveHandles.remove(child);
		parent.promote(Math.max(parent.dimension, child.dimension));
	}

	@Override
	public void closeRing(GeometryHandle geometryHandle) {
		JtsGeometryHandle handle = unwrap(geometryHandle);
		if (handle.typeCode == TYPE_POLYGON) {
			handle.children.forEach(JtsGeometryEngine::closeRing);
		} else if (handle.typeCode == TYPE_LINEARRING || handle.typeCode == TYPE_LINESTRING) {
			closeRing(handle);
		} else {
			throw new GeometryEngineException("Cannot close a geometry of type code " + handle.typeCode);
		}
	}

	/**
	 * @return the number of top-level handles created and not yet destroyed or attached to a parent
	 */
	public int getLiveHandleCount() {
		return liveHandles.size();
	}

	// Configurable

	@Override
	public String getConfiguration() {
		return (byteOrder == ByteOrderValues.LITTLE_ENDIAN ? BYTE_ORDER_NDR : BYTE_ORDER_XDR) + ":" + outputDimension;
	}

	@Override
	public void setConfiguration(String configuration) {
		if (configuration != null && !configuration.trim().isEmpty()) {
			String[] fields = configuration.split(":");
			if (fields.length > 0 && !fields[0].isEmpty()) {
				byteOrder = parseByteOrder(fields[0].trim());
			}
			if (fields.length > 1) {
				outputDimension = parseOutputDimension(fields[1].trim());
			}
		}
	}

	public String getSignature() {
		return "JtsGeometryEngine(byteOrder='"
				+ (byteOrder == ByteOrderValues.LITTLE_ENDIAN ? BYTE_ORDER_NDR : BYTE_ORDER_XDR)
				+ "', outputDimension=" + outputDimension + ")";
	}

	private static int parseByteOrder(String value) {
		return switch (value.toUpperCase()) {
			case BYTE_ORDER_NDR -> ByteOrderValues.LITTLE_ENDIAN;
			case BYTE_ORDER_XDR -> ByteOrderValues.BIG_ENDIAN;
			default -> throw new IllegalArgumentException("Unknown WKB byte order: " + value);
		};
	}

	private static int parseOutputDimension(String value) {
		int dimension = Integer.parseInt(value);
		if (dimension != 2 && dimension != 3) {
			throw new IllegalArgumentException("WKB output dimension must be 2 or 3: " + value);
		}
		return dimension;
	}

	// Handle bookkeeping

	private static JtsGeometryHandle unwrap(GeometryHandle handle) {
		if (!(handle instanceof JtsGeometryHandle jtsHandle)) {
			throw new GeometryEngineException("Not a handle of this engine: " + handle);
		}
		if (jtsHandle.destroyed) {
			throw new GeometryEngineException("Geometry was already destroyed: " + jtsHandle);
		}
		return jtsHandle;
	}

	private static boolean isSupported(int baseCode) {
		return (baseCode >= TYPE_POINT && baseCode <= TYPE_GEOMETRYCOLLECTION) || baseCode == TYPE_LINEARRING;
	}

	private static boolean canHold(int parentType, int childType) {
		return switch (parentType) {
			case TYPE_POLYGON -> childType == TYPE_LINEARRING;
			case TYPE_MULTIPOINT -> childType == TYPE_POINT;
			case TYPE_MULTILINESTRING -> childType == TYPE_LINESTRING;
			case TYPE_MULTIPOLYGON -> childType == TYPE_POLYGON;
			case TYPE_GEOMETRYCOLLECTION -> true;
			default -> false;
		};
	}

	private static void addPoint(JtsGeometryHandle handle, Coordinate coordinate) {
		switch (handle.typeCode) {
			case TYPE_POINT -> {
				// a point holds exactly one coordinate, adding again replaces it
				handle.coordinates.clear();
				handle.coordinates.add(coordinate, true);
			}
			case TYPE_LINESTRING, TYPE_LINEARRING -> handle.coordinates.add(coordinate, true);
			default -> throw new GeometryEngineException("Cannot add points to a geometry of type code " + handle.typeCode);
		}
	}

	private static void closeRing(JtsGeometryHandle ring) {
		if (ring.coordinates.size() < 2) {
			return;
		}
		Coordinate first = ring.coordinates.getCoordinate(0);
		Coordinate last = ring.coordinates.getCoordinate(ring.coordinates.size() - 1);
		if (!first.equals2D(last) || !sameZ(first, last)) {
			ring.coordinates.add(first.copy(), true);
		}
	}

	private static boolean sameZ(Coordinate a, Coordinate b) {
		return Double.compare(a.getZ(), b.getZ()) == 0 || (Double.isNaN(a.getZ()) && Double.isNaN(b.getZ()));
	}

	// JTS geometry to handle tree

	private static int typeCodeOf(Geometry geometry) {
		return switch (geometry.getGeometryType()) {
			case Geometry.TYPENAME_POINT -> TYPE_POINT;
			case Geometry.TYPENAME_LINEARRING -> TYPE_LINEARRING;
			case Geometry.TYPENAME_LINESTRING -> TYPE_LINESTRING;
			case Geometry.TYPENAME_POLYGON -> TYPE_POLYGON;
			case Geometry.TYPENAME_MULTIPOINT -> TYPE_MULTIPOINT;
			case Geometry.TYPENAME_MULTILINESTRING -> TYPE_MULTILINESTRING;
			case Geometry.TYPENAME_MULTIPOLYGON -> TYPE_MULTIPOLYGON;
			case Geometry.TYPENAME_GEOMETRYCOLLECTION -> TYPE_GEOMETRYCOLLECTION;
			default -> throw new GeometryEngineException("Unsupported JTS geometry type: " + geometry.getGeometryType());
		};
	}

	private static void populate(JtsGeometryHandle handle, Geometry geometry) {
		if (geometry instanceof Point || geometry instanceof LineString) {
			for (Coordinate coordinate : geometry.getCoordinates()) {
				handle.coordinates.add(coordinate.copy(), true);
			}
		} else if (geometry instanceof Polygon polygon) {
			if (!polygon.isEmpty()) {
				attachPart(handle, polygon.getExteriorRing(), TYPE_LINEARRING);
				for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
					attachPart(handle, polygon.getInteriorRingN(i), TYPE_LINEARRING);
				}
			}
		} else if (geometry instanceof GeometryCollection collection) {
			for (int i = 0; i < collection.getNumGeometries(); i++) {
				Geometry member = collection.getGeometryN(i);
				attachPart(handle, member, typeCodeOf(member));
			}
		}
	}

	private static void attachPart(JtsGeometryHandle parent, Geometry part, int typeCode) {
		JtsGeometryHandle child = new JtsGeometryHandle(typeCode, parent.dimension);
		child.parent = parent;
		parent.children.add(child);
		populate(child, part);
	}

	private static int dimensionOf(Geometry geometry) {
		if (geometry instanceof Point point) {
			return dimensionOf(point.getCoordinateSequence());
		}
		if (geometry instanceof LineString lineString) {
			return dimensionOf(lineString.getCoordinateSequence());
		}
		int dimension = 2;
		if (geometry instanceof Polygon polygon && !polygon.isEmpty()) {
			dimension = dimensionOf(polygon.getExteriorRing());
			for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
				dimension = Math.max(dimension, dimensionOf(polygon.getInteriorRingN(i)));
			}
		} else if (geometry instanceof GeometryCollection collection) {
			for (int i = 0; i < collection.getNumGeometries(); i++) {
				dimension = Math.max(dimension, dimensionOf(collection.getGeometryN(i)));
			}
		}
		return dimension;
	}

	private static int dimensionOf(CoordinateSequence sequence) {
		return sequence.getDimension() - sequence.getMeasures() >= 3 ? 3 : 2;
	}

	// Handle tree to JTS geometry

	private Geometry toGeometry(JtsGeometryHandle handle) {
		try {
			return switch (handle.typeCode) {
				case TYPE_POINT -> toPoint(handle);
				case TYPE_LINESTRING -> geometryFactory.createLineString(coordinatesOf(handle));
				case TYPE_LINEARRING -> toRing(handle);
				case TYPE_POLYGON -> toPolygon(handle);
				case TYPE_MULTIPOINT -> geometryFactory.createMultiPoint(
						handle.children.stream().map(this::toPoint).toArray(Point[]::new));
				case TYPE_MULTILINESTRING -> geometryFactory.createMultiLineString(handle.children.stream()
						.map(child -> geometryFactory.createLineString(coordinatesOf(child)))
						.toArray(LineString[]::new));
				case TYPE_MULTIPOLYGON -> geometryFactory.createMultiPolygon(
						handle.children.stream().map(this::toPolygon).toArray(Polygon[]::new));
				case TYPE_GEOMETRYCOLLECTION -> geometryFactory.createGeometryCollection(
						handle.children.stream().map(this::toGeometry).toArray(Geometry[]::new));
				default -> throw new GeometryEngineException("Cannot export geometry of type code " + handle.typeCode);
			};
		} catch (IllegalArgumentException e) {
			throw new GeometryEngineException("Cannot build a JTS geometry from " + handle + ": " + e.getMessage(), e);
		}
	}

	private Point toPoint(JtsGeometryHandle handle) {
		Coordinate[] coordinates = coordinatesOf(handle);
		return coordinates.length == 0 ? geometryFactory.createPoint() : geometryFactory.createPoint(coordinates[0]);
	}

	private LinearRing toRing(JtsGeometryHandle handle) {
		return geometryFactory.createLinearRing(coordinatesOf(handle));
	}

	private Polygon toPolygon(JtsGeometryHandle handle) {
		if (handle.children.isEmpty()) {
			return geometryFactory.createPolygon();
		}
		LinearRing shell = toRing(handle.children.get(0));
		LinearRing[] holes = handle.children.stream().skip(1).map(this::toRing).toArray(LinearRing[]::new);
		return geometryFactory.createPolygon(shell, holes);
	}

	private static Coordinate[] coordinatesOf(JtsGeometryHandle handle) {
		Coordinate[] coordinates = handle.coordinates.toCoordinateArray();
		Coordinate[] copies = new Coordinate[coordinates.length];
		for (int i = 0; i < coordinates.length; i++) {
			Coordinate c = coordinates[i];
			if (handle.dimension == 3) {
				copies[i] = new Coordinate(c.getX(), c.getY(), Double.isNaN(c.getZ()) ? 0.0 : c.getZ());
			} else {
				copies[i] = new CoordinateXY(c.getX(), c.getY());
			}
		}
		return copies;
	}
}
