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

import org.neo4j.gis.codec.model.GeometryTree;
import org.neo4j.spatial.api.engine.GeometryEngine;

/**
 * Encodes a tree to an engine handle and decodes it straight back, to check that encoder and decoder agree.
 */
public class GeometryRoundTrip {

	private final GeometryEngine engine;
	private final GeometryEncoder encoder;
	private final GeometryDecoder decoder;

	public GeometryRoundTrip(GeometryEngine engine) {
		this.engine = engine;
		this.encoder = new GeometryEncoder(engine);
		this.decoder = new GeometryDecoder(engine);
	}

	public GeometryTree roundTrip(GeometryTree tree) {
		try (OwnedGeometry geometry = OwnedGeometry.adopt(engine, encoder.encode(tree))) {
			return decoder.decode(geometry.handle());
		}
	}

	/**
	 * Same as {@link #roundTrip(GeometryTree)} but through well-known binary instead of a live handle.
	 */
	public GeometryTree roundTripBinary(GeometryTree tree) {
		return decoder.decodeFromBinary(encoder.encodeToBinary(tree));
	}
}
