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
 * One occurrence of a feature in a view, i.e. a node of the track graph
 */
public class Observation implements Comparable< Observation >
{
	final int viewId;
	final KeypointId keypointId;

	public Observation( final int viewId, final KeypointId keypointId )
	{
		this.viewId = viewId;
		this.keypointId = keypointId;
	}

	public Observation( final int viewId, final DescriberType descType, final int featIndex )
	{
		this( viewId, new KeypointId( descType, featIndex ) );
	}

	public int getViewId() { return viewId; }
	public KeypointId getKeypointId() { return keypointId; }
	public DescriberType getDescType() { return keypointId.getDescType(); }
	public int getFeatIndex() { return keypointId.getFeatIndex(); }

	/**
	 * Order by view id, then {@link KeypointId}.
	 */
	@Override
	public int compareTo( final Observation o )
	{
		if ( viewId == o.viewId )
			return keypointId.compareTo( o.keypointId );
		else
			return Integer.compare( viewId, o.viewId );
	}

	@Override
	public int hashCode()
	{
		return 31 * viewId + keypointId.hashCode();
	}

	@Override
	public boolean equals( final Object obj )
	{
		if ( this == obj )
			return true;
		if ( !( obj instanceof Observation ) )
			return false;

		final Observation other = (Observation)obj;
		return viewId == other.viewId && keypointId.equals( other.keypointId );
	}

	@Override
	public String toString() { return viewId + "  " + keypointId; }
}
