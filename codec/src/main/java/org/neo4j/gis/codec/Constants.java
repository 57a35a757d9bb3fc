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

public interface Constants {

	// OpenGIS geometry type numbers

	int GTYPE_UNKNOWN = 0;
	int GTYPE_POINT = 1;
	int GTYPE_LINESTRING = 2;
	int GTYPE_POLYGON = 3;
	int GTYPE_MULTIPOINT = 4;
	int GTYPE_MULTILINESTRING = 5;
	int GTYPE_MULTIPOLYGON = 6;
	int GTYPE_GEOMETRYCOLLECTION = 7;
	int GTYPE_NONE = 100;
	int GTYPE_LINEARRING = 101;

	/**
	 * Set on top of a base type code to mark the 3D variant of the same kind.
	 */
	int GTYPE_3D_FLAG = 0x80000000;

	// WKB header layout

	byte WKB_XDR = 0;
	byte WKB_NDR = 1;
	int WKB_HEADER_SIZE = 5;

	// GeoJSON keys

	String GEOJSON_TYPE = "type";
	String GEOJSON_COORDINATES = "coordinates";
	String GEOJSON_GEOMETRIES = "geometries";
}
