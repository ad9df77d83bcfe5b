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
import java.util.Iterator;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The collection of all tracks of a scene: {trackId -&gt; {@link Track}}, ordered by track id.
 * Immutable once created, so it can be shared between any number of readers.
 */
public class Tracks implements Iterable< Entry< Integer, Track > >
{
	private static final Tracks EMPTY = new Tracks( Collections.emptyMap() );

	final SortedMap< Integer, Track > tracks;

	/**
	 * @param tracks - {trackId -&gt; track}, copied
	 */
	public Tracks( final Map< Integer, Track > tracks )
	{
		this.tracks = Collections.unmodifiableSortedMap( new TreeMap<>( tracks ) );
	}

	public static Tracks empty() { return EMPTY; }

	/**
	 * @param trackId - the id
	 * @return the track or null if there is no track with this id
	 */
	public Track get( final int trackId ) { return tracks.get( trackId ); }

	public boolean contains( final int trackId ) { return tracks.containsKey( trackId ); }

	public Set< Integer > getTrackIds() { return tracks.keySet(); }

	/**
	 * @return unmodifiable {trackId -&gt; track}
	 */
	public SortedMap< Integer, Track > getTracks() { return tracks; }

	public int size() { return tracks.size(); }

	public boolean isEmpty() { return tracks.isEmpty(); }

	@Override
	public Iterator< Entry< Integer, Track > > iterator() { return tracks.entrySet().iterator(); }

	@Override
	public int hashCode() { return tracks.hashCode(); }

	@Override
	public boolean equals( final Object obj )
	{
		if ( this == obj )
			return true;
		if ( !( obj instanceof Tracks ) )
			return false;

		return tracks.equals( ( (Tracks)obj ).tracks );
	}

	@Override
	public String toString() { return "Tracks[" + tracks.size() + " tracks]"; }
}
