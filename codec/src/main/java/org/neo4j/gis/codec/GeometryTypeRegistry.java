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

import static org.neo4j.gis.codec.Constants.GTYPE_3D_FLAG;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Static two-way mapping between integer geometry type codes and geometry type names.
 * <p>
 * Codes with the 3D flag set resolve to the same kind as their base code. Lookups never fall back to a default
 * kind: an unknown code or name is an error. The mapping is immutable and safe to share between threads.
 */
public final class GeometryTypeRegistry {

	private static final Map<Integer, GeometryType> BY_CODE;
	private static final Map<String, GeometryType> BY_NAME;

	static {
		Map<Integer, GeometryType> byCode = new LinkedHashMap<>();
		Map<String, GeometryType> byName = new LinkedHashMap<>();
		for (GeometryType type : GeometryType.values()) {
			byCode.put(type.getCode(), type);
			if (type.isConstructible()) {
				byName.put(type.getTypeName(), type);
			}
		}
		BY_CODE = Collections.unmodifiableMap(byCode);
		BY_NAME = Collections.unmodifiableMap(byName);
	}

	private GeometryTypeRegistry() {
	}

	public static GeometryType typeForCode(int code) {
		GeometryType type = BY_CODE.get(baseCode(code));
		if (type == null) {
			throw new UnknownTypeCodeException(code);
		}
		return type;
	}

	public static String nameForCode(int code) {
		return typeForCode(code).getTypeName();
	}

	public static GeometryType typeForName(String name) {
		GeometryType type = name == null ? null : BY_NAME.get(name);
		if (type == null) {
			throw new UnknownTypeNameException(name);
		}
		return type;
	}

	public static int codeForName(String name) {
		return typeForName(name).getCode();
	}

	public static boolean is3D(int code) {
		return (code & GTYPE_3D_FLAG) != 0;
	}

	public static int baseCode(int code) {
		return code & ~GTYPE_3D_FLAG;
	}

	public static int to3D(int code) {
		return code | GTYPE_3D_FLAG;
	}

	/**
	 * @return the type name, prefixed with "3D " for flagged codes, e.g. "3D Point"
	 */
	public static String describe(int code) {
		String name = nameForCode(code);
		return is3D(code) ? "3D " + name : name;
	}
}
