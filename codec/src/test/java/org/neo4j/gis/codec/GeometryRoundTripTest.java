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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
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

public class GeometryRoundTripTest extends AbstractCodecTest {

	@Test
	public void testPoint() {
		GeometryTree decoded = roundTrip.roundTrip(new Point(p(1.0, 2.0)));
		assertThat(decoded, equalTo(new Point(p(1.0, 2.0))));
		assertFalse(((Point) decoded).coordinates().hasZ());
	}

	@Test
	public void testLineString() {
		LineString lineString = new LineString(line(p(30, 10), p(10, 30), p(40, 40)));
		assertThat(roundTrip.roundTrip(lineString), equalTo(lineString));
	}

	@Test
	public void testPolygon() {
		GeometryTree decoded = roundTrip.roundTrip(new Polygon(List.of(unitSquare())));
		assertThat(decoded, instanceOf(Polygon.class));
		List<List<Position>> rings = ((Polygon) decoded).coordinates();
		assertThat(rings, hasSize(1));
		assertThat(rings.get(0), contains(p(0, 0), p(0, 1), p(1, 1), p(1, 0), p(0, 0)));
	}

	@Test
	public void testPolygonWithHole() {
		Polygon polygon = new Polygon(List.of(
				line(p(35, 10), p(45, 45), p(15, 40), p(10, 20), p(35, 10)),
				line(p(20, 30), p(35, 35), p(30, 20), p(20, 30))));
		assertThat(roundTrip.roundTrip(polygon), equalTo(polygon));
	}

	@Test
	public void testMultiPoint() {
		GeometryTree decoded = roundTrip.roundTrip(new MultiPoint(line(p(0, 0), p(1, 1))));
		assertThat(decoded, instanceOf(MultiPoint.class));
		assertThat(((MultiPoint) decoded).coordinates(), contains(p(0, 0), p(1, 1)));
	}

	@Test
	public void testMultiLineString() {
		MultiLineString multiLineString = new MultiLineString(List.of(
				line(p(10, 10), p(20, 20), p(10, 40)),
				line(p(40, 40), p(30, 30), p(40, 20), p(30, 10))));
		assertThat(roundTrip.roundTrip(multiLineString), equalTo(multiLineString));
	}

	@Test
	public void testMultiPolygon() {
		MultiPolygon multiPolygon = new MultiPolygon(List.of(
				List.of(line(p(30, 20), p(45, 40), p(10, 40), p(30, 20))),
				List.of(line(p(15, 5), p(40, 10), p(10, 20), p(5, 10), p(15, 5)))));
		assertThat(roundTrip.roundTrip(multiPolygon), equalTo(multiPolygon));
	}

	@Test
	public void testGeometryCollectionKeepsNestedTypes() {
		GeometryCollection collection = new GeometryCollection(List.of(
				new Point(p(40, 10)),
				new LineString(line(p(10, 10), p(20, 20), p(10, 40))),
				new GeometryCollection(List.of(new MultiPoint(line(p(1, 2), p(3, 4)))))));
		GeometryTree decoded = roundTrip.roundTrip(collection);
		assertThat(decoded, equalTo(collection));
		assertThat(((GeometryCollection) decoded).geometries().get(2), instanceOf(GeometryCollection.class));
	}

	@Test
	public void testEmptyGeometries() {
		assertThat(roundTrip.roundTrip(new LineString(List.of())), equalTo(new LineString(List.of())));
		assertThat(roundTrip.roundTrip(new Polygon(List.of())), equalTo(new Polygon(List.of())));
		assertThat(roundTrip.roundTrip(new GeometryCollection(List.of())), equalTo(new GeometryCollection(List.of())));
	}

	@Test
	public void testPartOrderIsPreserved() {
		MultiPoint multiPoint = new MultiPoint(line(p(5, 5), p(1, 1), p(3, 3), p(1, 1)));
		assertThat(roundTrip.roundTrip(multiPoint), equalTo(multiPoint));
	}

	@Nested
	class Rings {

		@Test
		public void shouldCloseOpenRing() {
			GeometryTree decoded = roundTrip.roundTrip(new LinearRing(line(p(0, 0), p(0, 1), p(1, 1))));
			List<Position> ring = ((LinearRing) decoded).coordinates();
			assertThat(ring, contains(p(0, 0), p(0, 1), p(1, 1), p(0, 0)));
		}

		@Test
		public void shouldNotAddClosingPointTwice() {
			LinearRing closed = new LinearRing(unitSquare());
			GeometryTree once = roundTrip.roundTrip(closed);
			GeometryTree twice = roundTrip.roundTrip(once);
			assertThat(once, equalTo(closed));
			assertThat(twice, equalTo(closed));
		}

		@Test
		public void shouldCloseOpenPolygonRings() {
			GeometryTree decoded = roundTrip.roundTrip(new Polygon(List.of(line(p(0, 0), p(0, 1), p(1, 1), p(1, 0)))));
			List<Position> shell = ((Polygon) decoded).coordinates().get(0);
			assertThat(shell, hasSize(5));
			assertEquals(shell.get(0), shell.get(4));
		}
	}

	@Nested
	class Dimensions {

		@Test
		public void shouldKeepThirdOrdinate() {
			assertThat(roundTrip.roundTrip(new Point(p(1, 2, 3))), equalTo(new Point(p(1, 2, 3))));
		}

		@Test
		public void shouldNeverEmitThirdOrdinateFor2DGeometries() {
			GeometryCollection collection = new GeometryCollection(List.of(
					new Polygon(List.of(unitSquare())),
					new MultiLineString(List.of(line(p(1, 1), p(2, 2)))),
					new MultiPoint(line(p(3, 3)))));
			GeometryTree decoded = roundTrip.roundTrip(collection);
			assertEquals(2, decoded.coordinateDimension());
			assertTrue(decoded.positions().noneMatch(Position::hasZ));
		}

		@Test
		public void shouldApplyRootDimensionToEveryPosition() {
			LineString mixed = new LineString(line(p(0, 0), p(1, 1, 5)));
			GeometryTree decoded = roundTrip.roundTrip(mixed);
			assertThat(((LineString) decoded).coordinates(), contains(p(0, 0, 0), p(1, 1, 5)));
		}

		@Test
		public void shouldApplyRootDimensionThroughCollections() {
			GeometryCollection collection = new GeometryCollection(List.of(
					new Point(p(1, 2, 3)),
					new Polygon(List.of(unitSquare()))));
			GeometryTree decoded = roundTrip.roundTrip(collection);
			assertTrue(decoded.positions().allMatch(Position::hasZ));
			assertThat(((GeometryCollection) decoded).geometries().get(0), equalTo(new Point(p(1, 2, 3))));
		}

		@Test
		public void shouldRoundTrip3DMultiPolygon() {
			MultiPolygon multiPolygon = new MultiPolygon(List.of(List.of(
					line(p(0, 0, 1), p(0, 1, 2), p(1, 1, 3), p(0, 0, 1)))));
			assertThat(roundTrip.roundTrip(multiPolygon), equalTo(multiPolygon));
		}
	}

	@Nested
	class Binary {

		@Test
		public void shouldRoundTripThroughWkb() {
			GeometryCollection collection = new GeometryCollection(List.of(
					new Point(p(40, 10)),
					new Polygon(List.of(unitSquare())),
					new MultiLineString(List.of(line(p(1, 1), p(2, 2))))));
			assertThat(roundTrip.roundTripBinary(collection), equalTo(collection));
			assertEquals(engine.getCreated(), engine.getDestroyed() + engine.getAttached());
		}

		@Test
		public void shouldRoundTrip3DThroughWkb() {
			Polygon polygon = new Polygon(List.of(line(p(0, 0, 7), p(0, 1, 7), p(1, 1, 7), p(0, 0, 7))));
			assertThat(roundTrip.roundTripBinary(polygon), equalTo(polygon));
		}
	}
}
