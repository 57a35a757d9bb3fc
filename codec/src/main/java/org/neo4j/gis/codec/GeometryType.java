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

import static org.neo4j.gis.codec.Constants.GTYPE_GEOMETRYCOLLECTION;
import static org.neo4j.gis.codec.Constants.GTYPE_LINEARRING;
import static org.neo4j.gis.codec.Constants.GTYPE_LINESTRING;
import static org.neo4j.gis.codec.Constants.GTYPE_MULTILINESTRING;
import static org.neo4j.gis.codec.Constants.GTYPE_MULTIPOINT;
import static org.neo4j.gis.codec.Constants.GTYPE_MULTIPOLYGON;
import static org.neo4j.gis.codec.Constants.GTYPE_NONE;
import static org.neo4j.gis.codec.Constants.GTYPE_POINT;
import static org.neo4j.gis.codec.Constants.GTYPE_POLYGON;
import static org.neo4j.gis.codec.Constants.GTYPE_UNKNOWN;

/**
 * The geometry kinds known to the codec, each with its base type code and its GeoJSON type name.
 */
public enum GeometryType {
	UNKNOWN(GTYPE_UNKNOWN, "Unknown", false),
	POINT(GTYPE_POINT, "Point", true),
	LINE_STRING(GTYPE_LINESTRING, "LineString", true),
	POLYGON(GTYPE_POLYGON, "Polygon", true),
	MULTI_POINT(GTYPE_MULTIPOINT, "MultiPoint", true),
	MULTI_LINE_STRING(GTYPE_MULTILINESTRING, "MultiLineString", true),
	MULTI_POLYGON(GTYPE_MULTIPOLYGON, "MultiPolygon", true),
	GEOMETRY_COLLECTION(GTYPE_GEOMETRYCOLLECTION, "GeometryCollection", true),
	NONE(GTYPE_NONE, "None", false),
	LINEAR_RING(GTYPE_LINEARRING, "LinearRing", true);

	private final int code;
	private final String typeName;
	private final boolean constructible;

	GeometryType(int code, String typeName, boolean constructible) {
		this.code = code;
		this.typeName = typeName;
		this.constructible = constructible;
	}

	public int getCode() {
		return code;
	}

	public String getTypeName() {
		return typeName;
	}

	/**
	 * Unknown and None can be read from an engine but never built from a tree.
	 */
	public boolean isConstructible() {
		return constructible;
	}

	@Override
	public String toString() {
		return typeName;
	}
}
