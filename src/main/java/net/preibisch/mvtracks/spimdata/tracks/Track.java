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

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A feature visible across multiple views. A track is the fusion of all pairwise
 * matches that transitively connect the same scene point, stored as {viewId -&gt; featIndex}.
 * Every view occurs at most once. Immutable.
 */
public class Track
{
	final DescriberType descType;
	final SortedMap< Integer, Integer > featPerView;

	/**
	 * @param descType - the describer type shared by all observations of the track
	 * @param featPerView - {viewId -&gt; featIndex}, copied
	 */
	public Track( final DescriberType descType, final Map< Integer, Integer > featPerView )
	{
		if ( descType == null )
			throw new IllegalArgumentException( "describer type of a track cannot be null" );

		this.descType = descType;
		this.featPerView = Collections.unmodifiableSortedMap( new TreeMap<>( featPerView ) );
	}

	public DescriberType getDescType() { return descType; }

	/**
	 * @return unmodifiable {viewId -&gt; featIndex}, ordered by view id
	 */
	public SortedMap< Integer, Integer > getFeatPerView() { return featPerView; }

	public Set< Integer > getViewIds() { return featPerView.keySet(); }

	public boolean containsView( final int viewId ) { return featPerView.containsKey( viewId ); }

	/**
	 * @param viewId - the view
	 * @return the feature index in this view or null if the track is not visible in it
	 */
	public Integer getFeatIndex( final int viewId ) { return featPerView.get( viewId ); }

	/**
	 * @return number of views the track is visible in
	 */
	public int length() { return featPerView.size(); }

	@Override
	public int hashCode()
	{
		return 31 * descType.hashCode() + featPerView.hashCode();
	}

	@Override
	public boolean equals( final Object obj )
	{
		if ( this == obj )
			return true;
		if ( !( obj instanceof Track ) )
			return false;

		final Track other = (Track)obj;
		return descType == other.descType && featPerView.equals( other.featPerView );
	}

	@Override
	public String toString() { return "Track[" + descType + ", " + featPerView + "]"; }
}
