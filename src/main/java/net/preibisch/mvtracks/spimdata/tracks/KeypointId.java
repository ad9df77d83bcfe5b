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
package net.preibisch.mvtracks.spimdata.tracks;

/**
 * Unique id of a feature inside one view: describer type plus feature index
 */
public class KeypointId implements Comparable< KeypointId >
{
	final DescriberType descType;
	final int featIndex;

	public KeypointId( final DescriberType descType, final int featIndex )
	{
		this.descType = descType;
		this.featIndex = featIndex;
	}

	public DescriberType getDescType() { return descType; }
	public int getFeatIndex() { return featIndex; }

	/**
	 * Order by describer type, then feature index.
	 */
	@Override
	public int compareTo( final KeypointId o )
	{
		if ( descType == o.descType )
			return Integer.compare( featIndex, o.featIndex );
		else
			return descType.compareTo( o.descType );
	}

	@Override
	public int hashCode()
	{
		return 31 * descType.hashCode() + featIndex;
	}

	@Override
	public boolean equals( final Object obj )
	{
		if ( this == obj )
			return true;
		if ( !( obj instanceof KeypointId ) )
			return false;

		final KeypointId other = (KeypointId)obj;
		return descType == other.descType && featIndex == other.featIndex;
	}

	@Override
	public String toString() { return descType + ", " + featIndex; }
}
