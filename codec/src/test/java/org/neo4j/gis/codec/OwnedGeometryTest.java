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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.neo4j.spatial.api.engine.GeometryEngineException;
import org.neo4j.spatial.api.engine.GeometryHandle;

public class OwnedGeometryTest extends AbstractCodecTest {

	@Test
	public void shouldDestroyOnClose() {
		try (OwnedGeometry point = OwnedGeometry.create(engine, Constants.GTYPE_POINT)) {
			assertThat(point.isOwned()).isTrue();
		}
		assertThat(engine.getDestroyed()).isEqualTo(1);
	}

	@Test
	public void shouldNotDestroyReleasedHandle() {
		GeometryHandle handle;
		try (OwnedGeometry point = OwnedGeometry.create(engine, Constants.GTYPE_POINT)) {
			handle = point.release();
			assertThat(point.isOwned()).isFalse();
			assertThatThrownBy(point::handle).isInstanceOf(IllegalStateException.class);
		}
		assertThat(engine.getDestroyed()).isZero();
		destroy(handle);
	}

	@Test
	public void shouldHandOverToParent() {
		try (OwnedGeometry multiPoint = OwnedGeometry.create(engine, Constants.GTYPE_MULTIPOINT)) {
			try (OwnedGeometry point = OwnedGeometry.create(engine, Constants.GTYPE_POINT)) {
				point.attachTo(multiPoint);
				assertThat(point.isOwned()).isFalse();
			}
			assertThat(engine.getChildCount(multiPoint.handle())).isEqualTo(1);
		}
		assertThat(engine.getDestroyed()).isEqualTo(1);
		assertThat(engine.getAttached()).isEqualTo(1);
	}

	@Test
	public void shouldKeepChildWhenParentRejectsIt() {
		try (OwnedGeometry multiPoint = OwnedGeometry.create(engine, Constants.GTYPE_MULTIPOINT);
				OwnedGeometry line = OwnedGeometry.create(engine, Constants.GTYPE_LINESTRING)) {
			assertThatThrownBy(() -> line.attachTo(multiPoint)).isInstanceOf(GeometryEngineException.class);
			assertThat(line.isOwned()).isTrue();
		}
		assertThat(engine.getDestroyed()).isEqualTo(2);
	}

	@Test
	public void shouldCloseOnlyOnce() {
		OwnedGeometry point = OwnedGeometry.create(engine, Constants.GTYPE_POINT);
		point.close();
		point.close();
		assertThat(engine.getDestroyed()).isEqualTo(1);
	}

	@Test
	public void shouldFailToCreateUnsupportedKind() {
		assertThatThrownBy(() -> OwnedGeometry.create(engine, Constants.GTYPE_NONE))
				.isInstanceOf(HandleCreationFailedException.class)
				.extracting(e -> ((HandleCreationFailedException) e).getTypeCode())
				.isEqualTo(Constants.GTYPE_NONE);
	}

	@Test
	public void shouldNotAdoptNull() {
		assertThatThrownBy(() -> OwnedGeometry.adopt(engine, null)).isInstanceOf(NullHandleException.class);
	}
}
