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

import org.neo4j.spatial.api.engine.GeometryEngine;
import org.neo4j.spatial.api.engine.GeometryHandle;

/**
 * An engine handle owned by the current call tree. Closing it destroys the handle unless ownership was handed
 * on first, either to the caller with {@link #release()} or to a parent geometry with {@link #attachTo}.
 * Intended for try-with-resources, so the handle is released on every exit path including exceptions.
 */
public final class OwnedGeometry implements AutoCloseable {

	private final GeometryEngine engine;
	private GeometryHandle handle;

	private OwnedGeometry(GeometryEngine engine, GeometryHandle handle) {
		this.engine = engine;
		this.handle = handle;
	}

	/**
	 * Allocates a new top-level handle of the given kind.
	 *
	 * @throws HandleCreationFailedException if the engine returns no handle
	 */
	public static OwnedGeometry create(GeometryEngine engine, int typeCode) {
		GeometryHandle handle = engine.createGeometry(typeCode);
		if (handle == null) {
			throw new HandleCreationFailedException(typeCode);
		}
		return new OwnedGeometry(engine, handle);
	}

	/**
	 * Takes ownership of a top-level handle created elsewhere.
	 */
	public static OwnedGeometry adopt(GeometryEngine engine, GeometryHandle handle) {
		if (handle == null) {
			throw new NullHandleException("Cannot take ownership of a null geometry handle");
		}
		return new OwnedGeometry(engine, handle);
	}

	public GeometryHandle handle() {
		if (handle == null) {
			throw new IllegalStateException("Geometry handle was already released");
		}
		return handle;
	}

	/**
	 * Hands the handle to the caller, who becomes responsible for destroying it.
	 */
	public GeometryHandle release() {
		GeometryHandle released = handle();
		handle = null;
		return released;
	}

	/**
	 * Moves the handle into the parent geometry. If the engine rejects the child it stays owned here and is
	 * destroyed on close.
	 */
	public void attachTo(OwnedGeometry parent) {
		engine.addChildOwned(parent.handle(), handle());
		handle = null;
	}

	public boolean isOwned() {
		return handle != null;
	}

	@Override
	public void close() {
		if (handle != null) {
			GeometryHandle toDestroy = handle;
			handle = null;
			engine.destroyGeometry(toDestroy);
		}
	}
}
