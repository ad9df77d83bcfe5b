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

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * List of visible track ids for each view: {viewId -&gt; ascending, duplicate-free trackIds}.
 * Always derived from a {@link Tracks} collection, never updated incrementally. Immutable.
 */
public class TracksPerView
{
	private static final int[] NONE = new int[ 0 ];

	final SortedMap< Integer, int[] > tracksPerView;

	/**
	 * @param tracksPerView - {viewId -&gt; trackIds}, every array must be sorted ascending without duplicates; arrays are copied
	 */
	public TracksPerView( final Map< Integer, int[] > tracksPerView )
	{
		final TreeMap< Integer, int[] > copy = new TreeMap<>();

		for ( final Entry< Integer, int[] > entry : tracksPerView.entrySet() )
		{
			final int[] trackIds = entry.getValue();

			for ( int i = 1; i < trackIds.length; ++i )
				if ( trackIds[ i - 1 ] >= trackIds[ i ] )
					throw new IllegalArgumentException( "track ids of view " + entry.getKey() + " are not strictly ascending" );

			copy.put( entry.getKey(), trackIds.clone() );
		}

		this.tracksPerView = Collections.unmodifiableSortedMap( copy );
	}

	/**
	 * @param viewId - the view
	 * @return a copy of the ascending track ids visible in the view, empty if the view is unknown
	 */
	public int[] getTrackIds( final int viewId )
	{
		final int[] trackIds = tracksPerView.get( viewId );
		return trackIds == null ? NONE : trackIds.clone();
	}

	public boolean containsView( final int viewId ) { return tracksPerView.containsKey( viewId ); }

	/**
	 * @param viewId - the view
	 * @param trackId - the track
	 * @return if the track is visible in the view (binary search)
	 */
	public boolean isVisible( final int viewId, final int trackId )
	{
		final int[] trackIds = tracksPerView.get( viewId );
		return trackIds != null && Arrays.binarySearch( trackIds, trackId ) >= 0;
	}

	public int numTracks( final int viewId )
	{
		final int[] trackIds = tracksPerView.get( viewId );
		return trackIds == null ? 0 : trackIds.length;
	}

	public Set< Integer > getViewIds() { return tracksPerView.keySet(); }

	public int numViews() { return tracksPerView.size(); }

	@Override
	public int hashCode()
	{
		int hash = 1;

		for ( final Entry< Integer, int[] > entry : tracksPerView.entrySet() )
			hash = 31 * hash + entry.getKey() * 17 + Arrays.hashCode( entry.getValue() );

		return hash;
	}

	@Override
	public boolean equals( final Object obj )
	{
		if ( this == obj )
			return true;
		if ( !( obj instanceof TracksPerView ) )
			return false;

		final SortedMap< Integer, int[] > other = ( (TracksPerView)obj ).tracksPerView;

		if ( !tracksPerView.keySet().equals( other.keySet() ) )
			return false;

		for ( final Entry< Integer, int[] > entry : tracksPerView.entrySet() )
			if ( !Arrays.equals( entry.getValue(), other.get( entry.getKey() ) ) )
				return false;

		return true;
	}

	@Override
	public String toString() { return "TracksPerView[" + tracksPerView.size() + " views]"; }
}
