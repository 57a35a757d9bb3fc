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

import java.util.Arrays;
import java.util.List;
import org.neo4j.gis.codec.MalformedTreeException;

/**
 * A single coordinate: x and y, optionally followed by z.
 */
public final class Position {

	private final double x;
	private final double y;
	private final double z;
	private final boolean hasZ;

	private Position(double x, double y, double z, boolean hasZ) {
		this.x = x;
		this.y = y;
		this.z = z;
		this.hasZ = hasZ;
	}

	public static Position of(double x, double y) {
		return new Position(x, y, Double.NaN, false);
	}

	/**
	 * @throws MalformedTreeException if z is NaN, use {@link #of(double, double)} for positions without z
	 */
	public static Position of(double x, double y, double z) {
		if (Double.isNaN(z)) {
			throw new MalformedTreeException("A three dimensional position needs a z ordinate, got NaN");
		}
		return new Position(x, y, z, true);
	}

	public static Position of(double[] ordinates) {
		if (ordinates == null || ordinates.length < 2 || ordinates.length > 3) {
			throw new MalformedTreeException("A position needs 2 or 3 ordinates, got: " + Arrays.toString(ordinates));
		}
		return ordinates.length == 2 ? of(ordinates[0], ordinates[1]) : of(ordinates[0], ordinates[1], ordinates[2]);
	}

	public double getX() {
		return x;
	}

	public double getY() {
		return y;
	}

	/**
	 * @return z, or NaN for a two dimensional position
	 */
	public double getZ() {
		return z;
	}

	public boolean hasZ() {
		return hasZ;
	}

	public int getDimension() {
		return hasZ ? 3 : 2;
	}

	public List<Double> toList() {
		return hasZ ? List.of(x, y, z) : List.of(x, y);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Position other)) {
			return false;
		}
		return hasZ == other.hasZ
				&& Double.compare(x, other.x) == 0
				&& Double.compare(y, other.y) == 0
				&& (!hasZ || Double.compare(z, other.z) == 0);
	}

	@Override
	public int hashCode() {
		int result = Double.hashCode(x);
		result = 31 * result + Double.hashCode(y);
		return hasZ ? 31 * result + Double.hashCode(z) : result;
	}

	@Override
	public String toString() {
		return toList().toString();
	}
}
