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
package org.neo4j.gis.codec.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;
import org.neo4j.gis.codec.GeometryType;
import org.neo4j.gis.codec.MalformedTreeException;

/**
 * In-memory geometry modeled on GeoJSON geometry objects: a type name plus the coordinates or parts of that
 * type.
 * <p>
 * Polygons and the Multi* kinds hold plain coordinate sequences for their parts, the way GeoJSON nests
 * {@code coordinates} arrays. Only {@link GeometryCollection} nests complete, typed trees.
 * <p>
 * Every variant validates its shape on construction and keeps immutable copies of its lists, so a tree can
 * never disagree with its declared type.
 */
public interface GeometryTree {

	GeometryType type();

	/**
	 * @return every position of this tree, in order
	 */
	Stream<Position> positions();

	/**
	 * @return 3 if any position carries a z ordinate, otherwise 2
	 */
	default int coordinateDimension() {
		return positions().anyMatch(Position::hasZ) ? 3 : 2;
	}

	record Point(Position coordinates) implements GeometryTree {

		public Point {
			if (coordinates == null) {
				throw new MalformedTreeException("Point requires exactly one position");
			}
		}

		@Override
		public GeometryType type() {
			return GeometryType.POINT;
		}

		@Override
		public Stream<Position> positions() {
			return Stream.of(coordinates);
		}
	}

	record LineString(List<Position> coordinates) implements GeometryTree {

		public LineString {
			coordinates = positionList(coordinates, "LineString");
		}

		@Override
		public GeometryType type() {
			return GeometryType.LINE_STRING;
		}

		@Override
		public Stream<Position> positions() {
			return coordinates.stream();
		}
	}

	record LinearRing(List<Position> coordinates) implements GeometryTree {

		public LinearRing {
			coordinates = positionList(coordinates, "LinearRing");
		}

		@Override
		public GeometryType type() {
			return GeometryType.LINEAR_RING;
		}

		@Override
		public Stream<Position> positions() {
			return coordinates.stream();
		}
	}

	/**
	 * The first ring is the shell, any following rings are holes.
	 */
	record Polygon(List<List<Position>> coordinates) implements GeometryTree {

		public Polygon {
			coordinates = partList(coordinates, "Polygon", ring -> positionList(ring, "Polygon ring"));
		}

		@Override
		public GeometryType type() {
			return GeometryType.POLYGON;
		}

		@Override
		public Stream<Position> positions() {
			return coordinates.stream().flatMap(List::stream);
		}
	}

	record MultiPoint(List<Position> coordinates) implements GeometryTree {

		public MultiPoint {
			coordinates = positionList(coordinates, "MultiPoint");
		}

		@Override
		public GeometryType type() {
			return GeometryType.MULTI_POINT;
		}

		@Override
		public Stream<Position> positions() {
			return coordinates.stream();
		}
	}

	record MultiLineString(List<List<Position>> coordinates) implements GeometryTree {

		public MultiLineString {
			coordinates = partList(coordinates, "MultiLineString", line -> positionList(line, "MultiLineString part"));
		}

		@Override
		public GeometryType type() {
			return GeometryType.MULTI_LINE_STRING;
		}

		@Override
		public Stream<Position> positions() {
			return coordinates.stream().flatMap(List::stream);
		}
	}

	record MultiPolygon(List<List<List<Position>>> coordinates) implements GeometryTree {

		public MultiPolygon {
			coordinates = partList(coordinates, "MultiPolygon",
					polygon -> partList(polygon, "MultiPolygon part", ring -> positionList(ring, "MultiPolygon ring")));
		}

		@Override
		public GeometryType type() {
			return GeometryType.MULTI_POLYGON;
		}

		@Override
		public Stream<Position> positions() {
			return coordinates.stream().flatMap(List::stream).flatMap(List::stream);
		}
	}

	record GeometryCollection(List<GeometryTree> geometries) implements GeometryTree {

		public GeometryCollection {
			geometries = partList(geometries, "GeometryCollection", member -> member);
		}

		@Override
		public GeometryType type() {
			return GeometryType.GEOMETRY_COLLECTION;
		}

		@Override
		public Stream<Position> positions() {
			return geometries.stream().flatMap(GeometryTree::positions);
		}
	}

	private static List<Position> positionList(List<Position> positions, String what) {
		return partList(positions, what, position -> position);
	}

	private static <T, R> List<R> partList(List<T> parts, String what, Function<T, R> validator) {
		if (parts == null) {
			throw new MalformedTreeException(what + " coordinates must not be null");
		}
		List<R> copy = new ArrayList<>(parts.size());
		for (T part : parts) {
			if (part == null) {
				throw new MalformedTreeException(what + " contains a null element");
			}
			copy.add(validator.apply(part));
		}
		return Collections.unmodifiableList(copy);
	}
}
