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
package org.neo4j.spatial.cli.tools;

import java.util.logging.Logger;
import org.locationtech.jts.io.WKBReader;
import org.locationtech.jts.io.WKBWriter;
import org.neo4j.gis.codec.GeometryDecoder;
import org.neo4j.gis.codec.GeometryEncoder;
import org.neo4j.gis.codec.utilities.GeoJsonUtils;
import org.neo4j.spatial.api.engine.GeometryEngine;
import org.neo4j.spatial.jts.engine.JtsGeometryEngine;

/**
 * Converts geometries between hex encoded WKB and GeoJSON text.
 */
public class GeometryConverter {

	private static final Logger LOGGER = Logger.getLogger(GeometryConverter.class.getName());

	public static final String WKB_TO_JSON = "wkb2json";
	public static final String JSON_TO_WKB = "json2wkb";

	private final GeometryEncoder encoder;
	private final GeometryDecoder decoder;

	public GeometryConverter(GeometryEngine engine) {
		this.encoder = new GeometryEncoder(engine);
		this.decoder = new GeometryDecoder(engine);
	}

	public String wkbToJson(String hex) {
		return GeoJsonUtils.toJson(decoder.decodeFromBinary(WKBReader.hexToBytes(hex.trim())));
	}

	public String jsonToWkb(String json) {
		return WKBWriter.toHex(encoder.encodeToBinary(GeoJsonUtils.fromJson(json)));
	}

	public String convert(String command, String input) {
		return switch (command) {
			case WKB_TO_JSON -> wkbToJson(input);
			case JSON_TO_WKB -> jsonToWkb(input);
			default -> throw new IllegalArgumentException("Unknown conversion: " + command);
		};
	}

	public static void main(String[] args) {
		if (args.length < 2 || !(WKB_TO_JSON.equals(args[0]) || JSON_TO_WKB.equals(args[0]))) {
			LOGGER.warning("Usage: GeometryConverter <" + WKB_TO_JSON + "|" + JSON_TO_WKB
					+ "> <input> [byteOrder:outputDimension]");
			return;
		}
		JtsGeometryEngine engine = new JtsGeometryEngine();
		if (args.length > 2) {
			engine.setConfiguration(args[2]);
		}
		LOGGER.fine("Converting with " + engine.getSignature());
		System.out.println(new GeometryConverter(engine).convert(args[0], args[1]));
	}
}
