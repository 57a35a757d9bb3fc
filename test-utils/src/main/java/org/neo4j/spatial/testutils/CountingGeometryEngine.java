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
package org.neo4j.spatial.testutils;

import java.util.HashSet;
import java.util.Set;
import org.neo4j.spatial.api.engine.GeometryEngine;
import org.neo4j.spatial.api.engine.GeometryHandle;

/**
 * Wraps a geometry engine and counts the handles passing through it, so tests can check that every owned
 * handle was either destroyed or handed to a parent. Handle creation can be made to fail on demand.
 */
public class CountingGeometryEngine implements GeometryEngine {

	private final GeometryEngine delegate;
	private final Set<GeometryHandle> outstanding = new HashSet<>();
	private final Set<Integer> refusedTypeCodes = new HashSet<>();
	private int created = 0;
	private int destroyed = 0;
	private int attached = 0;
	private int createLimit = Integer.MAX_VALUE;

	public CountingGeometryEngine(GeometryEngine delegate) {
		this.delegate = delegate;
	}

	/**
	 * Make {@link #createGeometry(int)} return null for the given type code.
	 */
	public CountingGeometryEngine refuse(int typeCode) {
		refusedTypeCodes.add(typeCode);
		return this;
	}

	/**
	 * Make {@link #createGeometry(int)} return null once this many handles were created.
	 */
	public CountingGeometryEngine limitCreations(int limit) {
		createLimit = limit;
		return this;
	}

	public GeometryEngine getDelegate() {
		return delegate;
	}

	public int getCreated() {
		return created;
	}

	public int getDestroyed() {
		return destroyed;
	}

	public int getAttached() {
		return attached;
	}

	/**
	 * @return handles created through this engine that were neither destroyed nor attached to a parent
	 */
	public int getOutstanding() {
		return outstanding.size();
	}

	@Override
	public GeometryHandle createGeometry(int typeCode) {
		if (refusedTypeCodes.contains(typeCode) || created >= createLimit) {
			return null;
		}
		GeometryHandle handle = delegate.createGeometry(typeCode);
		if (handle != null) {
			created++;
			outstanding.add(handle);
		}
		return handle;
	}

	@Override
	public void destroyGeometry(GeometryHandle handle) {
		delegate.destroyGeometry(handle);
		if (handle != null) {
			destroyed++;
			outstanding.remove(handle);
		}
	}

	@Override
	public void addChildOwned(GeometryHandle parent, GeometryHandle child) {
		delegate.addChildOwned(parent, child);
		attached++;
		outstanding.remove(child);
	}

	@Override
	public void importFromBinary(GeometryHandle handle, byte[] wkb, int length) {
		delegate.importFromBinary(handle, wkb, length);
	}

	@Override
	public byte[] exportToBinary(GeometryHandle handle) {
		return delegate.exportToBinary(handle);
	}

	@Override
	public int getPointCount(GeometryHandle handle) {
		return delegate.getPointCount(handle);
	}

	@Override
	public double getX(GeometryHandle handle, int index) {
		return delegate.getX(handle, index);
	}

	@Override
	public double getY(GeometryHandle handle, int index) {
		return delegate.getY(handle, index);
	}

	@Override
	public double getZ(GeometryHandle handle, int index) {
		return delegate.getZ(handle, index);
	}

	@Override
	public int getCoordinateDimension(GeometryHandle handle) {
		return delegate.getCoordinateDimension(handle);
	}

	@Override
	public int getGeometryType(GeometryHandle handle) {
		return delegate.getGeometryType(handle);
	}

	@Override
	public int getChildCount(GeometryHandle handle) {
		return delegate.getChildCount(handle);
	}

	@Override
	public GeometryHandle getChildRef(GeometryHandle handle, int index) {
		return delegate.getChildRef(handle, index);
	}

	@Override
	public void addPoint2D(GeometryHandle handle, double x, double y) {
		delegate.addPoint2D(handle, x, y);
	}

	@Override
	public void addPoint3D(GeometryHandle handle, double x, double y, double z) {
		delegate.addPoint3D(handle, x, y, z);
	}

	@Override
	public void closeRing(GeometryHandle handle) {
		delegate.closeRing(handle);
	}

	@Override
	public String toString() {
		return "CountingGeometryEngine(created=" + created + ", destroyed=" + destroyed + ", attached=" + attached
				+ ", outstanding=" + outstanding.size() + ")";
	}
}
