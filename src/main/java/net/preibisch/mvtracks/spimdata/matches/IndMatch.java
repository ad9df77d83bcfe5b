/*-
 * #%L
 * Software for the reconstruction of multi-view microscopic acquisitions
 * like Selective Plane Illumination Microscopy (SPIM) Data.
 * %%
 * Copyright (C) 2012 - 2024 Multiview Reconstruction developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 2 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-2.0.html>.
 * #L%
 */
package net.preibisch.mvtracks.spimdata.matches;

/**
 * A putative correspondence between feature i of view I and feature j of view J
 */
public class IndMatch
{
	final int i, j;

	public IndMatch( final int i, final int j )
	{
		this.i = i;
		this.j = j;
	}

	/**
	 * @return the feature index in the first view
	 */
	public int getI() { return i; }

	/**
	 * @return the feature index in the second view
	 */
	public int getJ() { return j; }

	@Override
	public int hashCode() { return 31 * i + j; }

	@Override
	public boolean equals( final Object obj )
	{
		if ( this == obj )
			return true;
		if ( !( obj instanceof IndMatch ) )
			return false;

		final IndMatch other = (IndMatch)obj;
		return i == other.i && j == other.j;
	}

	@Override
	public String toString() { return i + " <-> " + j; }
}
