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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.neo4j.gis.codec.GeometryType;
import org.neo4j.gis.codec.MalformedTreeException;
import org.neo4j.gis.codec.model.GeometryTree.GeometryCollection;
import org.neo4j.gis.codec.model.GeometryTree.LineString;
import org.neo4j.gis.codec.model.GeometryTree.LinearRing;
import org.neo4j.gis.codec.model.GeometryTree.MultiLineString;
import org.neo4j.gis.codec.model.GeometryTree.MultiPoint;
import org.neo4j.gis.codec.model.GeometryTree.MultiPolygon;
import org.neo4j.gis.codec.model.GeometryTree.Point;
import org.neo4j.gis.codec.model.GeometryTree.Polygon;

public class GeometryTreeTest {

	private static final List<Position> SQUARE = List.of(
			Position.of(0, 0), Position.of(0, 1), Position.of(1, 1), Position.of(1, 0), Position.of(0, 0));

	@Test
	public void shouldReportDeclaredTypes() {
		assertThat(new Point(Position.of(0, 0)).type()).isEqualTo(GeometryType.POINT);
		assertThat(new LineString(SQUARE).type()).isEqualTo(GeometryType.LINE_STRING);
		assertThat(new LinearRing(SQUARE).type()).isEqualTo(GeometryType.LINEAR_RING);
		assertThat(new Polygon(List.of(SQUARE)).type()).isEqualTo(GeometryType.POLYGON);
		assertThat(new MultiPoint(SQUARE).type()).isEqualTo(GeometryType.MULTI_POINT);
		assertThat(new MultiLineString(List.of(SQUARE)).type()).isEqualTo(GeometryType.MULTI_LINE_STRING);
		assertThat(new MultiPolygon(List.of(List.of(SQUARE))).type()).isEqualTo(GeometryType.MULTI_POLYGON);
		assertThat(new GeometryCollection(List.of()).type()).isEqualTo(GeometryType.GEOMETRY_COLLECTION);
	}

	@Test
	public void shouldCopyCoordinateLists() {
		List<Position> positions = new ArrayList<>(List.of(Position.of(0, 0), Position.of(1, 1)));
		LineString line = new LineString(positions);
		positions.add(Position.of(2, 2));
		assertThat(line.coordinates()).hasSize(2);
		assertThatThrownBy(() -> line.coordinates().add(Position.of(3, 3)))
				.isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	public void shouldRejectNullParts() {
		assertThatThrownBy(() -> new Point(null)).isInstanceOf(MalformedTreeException.class);
		assertThatThrownBy(() -> new LineString(null)).isInstanceOf(MalformedTreeException.class);
		assertThatThrownBy(() -> new MultiPoint(Arrays.asList(Position.of(0, 0), null)))
				.isInstanceOf(MalformedTreeException.class);
		assertThatThrownBy(() -> new Polygon(Arrays.asList(SQUARE, null)))
				.isInstanceOf(MalformedTreeException.class);
		assertThatThrownBy(() -> new MultiPolygon(List.of(Arrays.asList(SQUARE, null))))
				.isInstanceOf(MalformedTreeException.class)
				.hasMessageContaining("MultiPolygon part");
		assertThatThrownBy(() -> new GeometryCollection(Arrays.asList(new Point(Position.of(0, 0)), null)))
				.isInstanceOf(MalformedTreeException.class);
	}

	@Test
	public void shouldStreamPositionsInOrder() {
		GeometryCollection collection = new GeometryCollection(List.of(
				new Point(Position.of(9, 9)),
				new MultiLineString(List.of(List.of(Position.of(1, 1)), List.of(Position.of(2, 2), Position.of(3, 3))))));
		assertThat(collection.positions()).containsExactly(
				Position.of(9, 9), Position.of(1, 1), Position.of(2, 2), Position.of(3, 3));
	}

	@Test
	public void shouldDeriveCoordinateDimension() {
		assertThat(new Polygon(List.of(SQUARE)).coordinateDimension()).isEqualTo(2);
		assertThat(new MultiPoint(List.of(Position.of(0, 0), Position.of(1, 1, 1))).coordinateDimension()).isEqualTo(3);
		assertThat(new GeometryCollection(List.of()).coordinateDimension()).isEqualTo(2);
	}
}
