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

package org.neo4j.gis.codec.utilities;

import static org.neo4j.gis.codec.Constants.GEOJSON_COORDINATES;
import static org.neo4j.gis.codec.Constants.GEOJSON_GEOMETRIES;
import static org.neo4j.gis.codec.Constants.GEOJSON_TYPE;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.apache.commons.lang3.ArrayUtils;
import org.json.simple.JSONValue;
import org.json.simple.parser.ParseException;
import org.neo4j.gis.codec.GeometryType;
import org.neo4j.gis.codec.GeometryTypeRegistry;
import org.neo4j.gis.codec.MalformedTreeException;
import org.neo4j.gis.codec.UnsupportedGeometryTypeException;
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

public class GeoJsonUtils {

	private GeoJsonUtils() {
	}

	public static Map<String, Object> toGeoJsonStructure(GeometryTree tree) {
		if (tree instanceof GeometryCollection collection) {
			return geoJson(tree, GEOJSON_GEOMETRIES, collection.geometries().stream()
					.map(GeoJsonUtils::toGeoJsonStructure)
					.toList());
		}
		return geoJson(tree, GEOJSON_COORDINATES, getCoordinates(tree));
	}

	public static String toJson(GeometryTree tree) {
		return JSONValue.toJSONString(toGeoJsonStructure(tree));
	}

	public static GeometryTree fromJson(String json) {
		Object parsed;
		try {
			parsed = JSONValue.parseWithException(json);
		} catch (ParseException e) {
			throw new MalformedTreeException("Invalid GeoJSON text: " + e, e);
		}
		return fromGeoJsonStructure(parsed);
	}

	/**
	 * Builds a tree from a GeoJSON geometry object. Positions may be given as lists of numbers, as
	 * {@code double[]} or as {@code Double[]}.
	 */
	public static GeometryTree fromGeoJsonStructure(Object structure) {
		if (!(structure instanceof Map<?, ?> map)) {
			throw new MalformedTreeException("A GeoJSON geometry must be an object, got: " + structure);
		}
		if (!(map.get(GEOJSON_TYPE) instanceof String typeName)) {
			throw new MalformedTreeException("A GeoJSON geometry needs a string '" + GEOJSON_TYPE + "': " + map);
		}
		GeometryType type = GeometryTypeRegistry.typeForName(typeName);
		if (type == GeometryType.GEOMETRY_COLLECTION) {
			return new GeometryCollection(list(map.get(GEOJSON_GEOMETRIES), typeName, GeoJsonUtils::fromGeoJsonStructure));
		}
		Object coordinates = map.get(GEOJSON_COORDINATES);
		return switch (type) {
			case POINT -> new Point(position(coordinates));
			case LINE_STRING -> new LineString(positions(coordinates, typeName));
			case LINEAR_RING -> new LinearRing(positions(coordinates, typeName));
			case POLYGON -> new Polygon(rings(coordinates, typeName));
			case MULTI_POINT -> new MultiPoint(positions(coordinates, typeName));
			case MULTI_LINE_STRING -> new MultiLineString(rings(coordinates, typeName));
			case MULTI_POLYGON -> new MultiPolygon(list(coordinates, typeName, polygon -> rings(polygon, typeName)));
			default -> throw new UnsupportedGeometryTypeException(type);
		};
	}

	private static Map<String, Object> geoJson(GeometryTree tree, String key, Object value) {
		Map<String, Object> structure = new LinkedHashMap<>();
		structure.put(GEOJSON_TYPE, tree.type().getTypeName());
		structure.put(key, value);
		return structure;
	}

	private static List<?> getCoordinates(GeometryTree tree) {
		if (tree instanceof Point point) {
			return point.coordinates().toList();
		}
		if (tree instanceof LineString lineString) {
			return getPoints(lineString.coordinates());
		}
		if (tree instanceof LinearRing ring) {
			return getPoints(ring.coordinates());
		}
		if (tree instanceof MultiPoint multiPoint) {
			return getPoints(multiPoint.coordinates());
		}
		if (tree instanceof Polygon polygon) {
			return polygon.coordinates().stream().map(GeoJsonUtils::getPoints).toList();
		}
		if (tree instanceof MultiLineString multiLineString) {
			return multiLineString.coordinates().stream().map(GeoJsonUtils::getPoints).toList();
		}
		if (tree instanceof MultiPolygon multiPolygon) {
			return multiPolygon.coordinates().stream()
					.map(polygon -> polygon.stream().map(GeoJsonUtils::getPoints).toList())
					.toList();
		}
		throw new UnsupportedGeometryTypeException(tree.type());
	}

	private static List<List<Double>> getPoints(List<Position> positions) {
		return positions.stream().map(Position::toList).toList();
	}

	private static List<List<Position>> rings(Object value, String typeName) {
		return list(value, typeName, ring -> positions(ring, typeName));
	}

	private static List<Position> positions(Object value, String typeName) {
		return list(value, typeName, GeoJsonUtils::position);
	}

	private static <T> List<T> list(Object value, String typeName, Function<Object, T> element) {
		if (!(value instanceof List<?> values)) {
			throw new MalformedTreeException(
					"Unexpected " + typeName + " shape, expected a list but got: " + describe(value));
		}
		return values.stream().map(element).toList();
	}

	private static Position position(Object value) {
		if (value instanceof double[] ordinates) {
			return Position.of(ordinates);
		}
		if (value instanceof Double[] ordinates) {
			return Position.of(ArrayUtils.toPrimitive(ordinates));
		}
		if (value instanceof List<?> values) {
			double[] ordinates = new double[values.size()];
			for (int i = 0; i < ordinates.length; i++) {
				if (!(values.get(i) instanceof Number number)) {
					throw new MalformedTreeException("A position must only hold numbers, got: " + values);
				}
				ordinates[i] = number.doubleValue();
			}
			return Position.of(ordinates);
		}
		throw new MalformedTreeException("Expected a position but got: " + describe(value));
	}

	private static String describe(Object value) {
		return value == null ? "nothing" : value.toString();
	}
}
