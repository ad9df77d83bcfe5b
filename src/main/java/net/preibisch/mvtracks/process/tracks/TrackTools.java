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
package net.preibisch.mvtracks.process.tracks;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map.Entry;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

import net.imglib2.util.RealSum;
import net.preibisch.mvtracks.Threads;
import net.preibisch.mvtracks.spimdata.matches.IndMatch;
import net.preibisch.mvtracks.spimdata.tracks.KeypointId;
import net.preibisch.mvtracks.spimdata.tracks.Track;
import net.preibisch.mvtracks.spimdata.tracks.Tracks;
import net.preibisch.mvtracks.spimdata.tracks.TracksPerView;

/**
 * Queries on a {@link Tracks} collection. None of the methods modify their input,
 * so they can be called concurrently on the same tracks.
 */
public class TrackTools
{
	/**
	 * @param tracks - all tracks of the scene
	 * @return for each view the ascending ids of the tracks visible in it
	 */
	public static TracksPerView computeTracksPerView( final Tracks tracks )
	{
		return computeTracksPerView( tracks, null );
	}

	/**
	 * @param tracks - all tracks of the scene
	 * @param service - sorts the lists of the views concurrently, may be null
	 * @return for each view the ascending ids of the tracks visible in it
	 */
	public static TracksPerView computeTracksPerView( final Tracks tracks, final ExecutorService service )
	{
		final HashMap< Integer, int[] > buckets = new HashMap<>();
		final HashMap< Integer, Integer > sizes = new HashMap<>();

		for ( final Entry< Integer, Track > track : tracks )
		{
			final int trackId = track.getKey();

			for ( final int viewId : track.getValue().getViewIds() )
			{
				int[] bucket = buckets.get( viewId );
				final int size = sizes.getOrDefault( viewId, 0 );

				if ( bucket == null )
					bucket = new int[ 16 ];
				else if ( size == bucket.length )
					bucket = Arrays.copyOf( bucket, bucket.length * 2 );

				bucket[ size ] = trackId;
				buckets.put( viewId, bucket );
				sizes.put( viewId, size + 1 );
			}
		}

		final HashMap< Integer, int[] > tracksPerView = new HashMap<>();

		if ( service == null )
		{
			for ( final Entry< Integer, int[] > bucket : buckets.entrySet() )
				tracksPerView.put( bucket.getKey(), sortedUnique( bucket.getValue(), sizes.get( bucket.getKey() ) ) );
		}
		else
		{
			// every view is independent
			final ArrayList< Integer > views = new ArrayList<>( buckets.keySet() );
			final ArrayList< Callable< int[] > > tasks = new ArrayList<>();

			for ( final int viewId : views )
				tasks.add( () -> sortedUnique( buckets.get( viewId ), sizes.get( viewId ) ) );

			final List< int[] > sorted = Threads.execTasks( tasks, service, "sort tracks per view" );

			for ( int i = 0; i < views.size(); ++i )
				tracksPerView.put( views.get( i ), sorted.get( i ) );
		}

		return new TracksPerView( tracksPerView );
	}

	protected static int[] sortedUnique( final int[] values, final int size )
	{
		final int[] sorted = Arrays.copyOf( values, size );
		Arrays.sort( sorted );

		int n = 0;

		for ( int i = 0; i < sorted.length; ++i )
			if ( n == 0 || sorted[ i ] != sorted[ n - 1 ] )
				sorted[ n++ ] = sorted[ i ];

		return n == sorted.length ? sorted : Arrays.copyOf( sorted, n );
	}

	/**
	 * Find common tracks among a set of views using the per-view index. If any of the views is not
	 * part of the index, no track can be common and the result is empty.
	 *
	 * @param viewIds - views we are looking for common tracks in, not empty
	 * @param tracksPerView - for each view the ids of the visible tracks
	 * @return ids of the tracks visible in all views
	 */
	public static SortedSet< Integer > getCommonTracksInImages( final Set< Integer > viewIds, final TracksPerView tracksPerView )
	{
		checkViews( viewIds );

		final TreeSet< Integer > visibleTracks = new TreeSet<>();

		final Iterator< Integer > it = viewIds.iterator();

		// take the first view id
		final int firstView = it.next();

		if ( !tracksPerView.containsView( firstView ) )
			return visibleTracks;

		int[] common = tracksPerView.getTrackIds( firstView );

		// for each of the remaining views
		while ( it.hasNext() && common.length > 0 )
		{
			final int viewId = it.next();

			// one view is not part of the index, so there is no track in common
			if ( !tracksPerView.containsView( viewId ) )
				return visibleTracks;

			common = intersect( common, tracksPerView.getTrackIds( viewId ) );
		}

		// the remaining views still have to exist
		while ( it.hasNext() )
			if ( !tracksPerView.containsView( it.next() ) )
				return visibleTracks;

		for ( final int trackId : common )
			visibleTracks.add( trackId );

		return visibleTracks;
	}

	/**
	 * Ordered merge of two ascending arrays.
	 *
	 * @param a - ascending, no duplicates
	 * @param b - ascending, no duplicates
	 * @return ascending elements contained in both
	 */
	protected static int[] intersect( final int[] a, final int[] b )
	{
		final int[] result = new int[ Math.min( a.length, b.length ) ];
		int i = 0, j = 0, n = 0;

		while ( i < a.length && j < b.length )
		{
			if ( a[ i ] < b[ j ] )
				++i;
			else if ( a[ i ] > b[ j ] )
				++j;
			else
			{
				result[ n++ ] = a[ i ];
				++i;
				++j;
			}
		}

		return n == result.length ? result : Arrays.copyOf( result, n );
	}

	/**
	 * Find common tracks between views by testing every track. The returned tracks only contain
	 * the entries of the requested views.
	 *
	 * @param viewIds - views we are looking for common tracks in, not empty
	 * @param tracks - all tracks of the scene
	 * @return the common tracks, reduced to the requested views
	 */
	public static Tracks getTracksInImages( final Set< Integer > viewIds, final Tracks tracks )
	{
		checkViews( viewIds );

		final HashMap< Integer, Track > tracksOut = new HashMap<>();

		for ( final Entry< Integer, Track > trackIn : tracks )
		{
			final Track track = trackIn.getValue();
			final TreeMap< Integer, Integer > featPerView = new TreeMap<>();

			// look if the track contains all requested views and save the feature ids
			for ( final int viewId : viewIds )
			{
				final Integer featIndex = track.getFeatIndex( viewId );

				// at least one requested view is not in the track
				if ( featIndex == null )
					break;

				featPerView.put( viewId, featIndex );
			}

			if ( featPerView.size() == viewIds.size() )
				tracksOut.put( trackIn.getKey(), new Track( track.getDescType(), featPerView ) );
		}

		return new Tracks( tracksOut );
	}

	/**
	 * Find common tracks between views using the per-view index. Returns the same as
	 * {@link #getTracksInImages(Set, Tracks)}, but only visits tracks that are visible in all views.
	 *
	 * @param viewIds - views we are looking for common tracks in, not empty
	 * @param tracks - all tracks of the scene
	 * @param tracksPerView - the index computed from these tracks
	 * @return the common tracks, reduced to the requested views
	 */
	public static Tracks getTracksInImagesFast( final Set< Integer > viewIds, final Tracks tracks, final TracksPerView tracksPerView )
	{
		final HashMap< Integer, Track > tracksOut = new HashMap<>();

		for ( final int trackId : getCommonTracksInImages( viewIds, tracksPerView ) )
		{
			final Track track = tracks.get( trackId );

			if ( track == null )
				continue;

			final TreeMap< Integer, Integer > featPerView = new TreeMap<>();

			for ( final int viewId : viewIds )
			{
				final Integer featIndex = track.getFeatIndex( viewId );

				if ( featIndex != null )
					featPerView.put( viewId, featIndex );
			}

			// only happens if the index does not belong to the tracks
			if ( featPerView.size() == viewIds.size() )
				tracksOut.put( trackId, new Track( track.getDescType(), featPerView ) );
		}

		return new Tracks( tracksOut );
	}

	/**
	 * @param tracks - all tracks of the scene
	 * @param viewId - the view
	 * @return the ids of all tracks visible in this view
	 */
	public static SortedSet< Integer > getImageTracksId( final Tracks tracks, final int viewId )
	{
		final TreeSet< Integer > trackIds = new TreeSet<>();

		for ( final Entry< Integer, Track > track : tracks )
			if ( track.getValue().containsView( viewId ) )
				trackIds.add( track.getKey() );

		return trackIds;
	}

	/**
	 * @param tracks - all tracks of the scene
	 * @return all track ids, ascending
	 */
	public static SortedSet< Integer > getTracksIdVector( final Tracks tracks )
	{
		return new TreeSet<>( tracks.getTrackIds() );
	}

	/**
	 * @param tracks - all tracks of the scene
	 * @param trackIds - the tracks of interest, unknown ids are ignored
	 * @param viewId - the view
	 * @return describer type and feature index in the view for each requested track that is visible in it
	 */
	public static List< KeypointId > getFeatureIdInViewPerTrack( final Tracks tracks, final Collection< Integer > trackIds, final int viewId )
	{
		final ArrayList< KeypointId > featIds = new ArrayList<>();

		for ( final int trackId : trackIds )
		{
			final Track track = tracks.get( trackId );

			// ignore it if the track doesn't exist
			if ( track == null )
				continue;

			final Integer featIndex = track.getFeatIndex( viewId );

			if ( featIndex != null )
				featIds.add( new KeypointId( track.getDescType(), featIndex ) );
		}

		return featIds;
	}

	/**
	 * Converts tracks of exactly two views back to matches (feature index in the lower view id, feature index in the higher view id).
	 *
	 * @param tracks - the tracks
	 * @param trackIds - the tracks to convert, in this order
	 * @return one match per requested track
	 * @throws IllegalArgumentException if a track does not exist or is not visible in exactly two views
	 */
	public static List< IndMatch > tracksToIndexedMatches( final Tracks tracks, final List< Integer > trackIds )
	{
		final ArrayList< IndMatch > matches = new ArrayList<>( trackIds.size() );

		for ( final int trackId : trackIds )
		{
			final Track track = tracks.get( trackId );

			if ( track == null )
				throw new IllegalArgumentException( "Track " + trackId + " does not exist." );

			if ( track.length() != 2 )
				throw new IllegalArgumentException( "Track " + trackId + " is visible in " + track.length() + " views, it must be 2." );

			final Iterator< Integer > it = track.getFeatPerView().values().iterator();
			final int indexI = it.next();
			final int indexJ = it.next();

			matches.add( new IndMatch( indexI, indexJ ) );
		}

		return matches;
	}

	/**
	 * @param tracks - all tracks of the scene
	 * @return {track length -&gt; number of tracks of this length}
	 */
	public static SortedMap< Integer, Integer > tracksLength( final Tracks tracks )
	{
		final TreeMap< Integer, Integer > occurrence = new TreeMap<>();

		for ( final Entry< Integer, Track > track : tracks )
			occurrence.merge( track.getValue().length(), 1, Integer::sum );

		return occurrence;
	}

	/**
	 * @param tracks - all tracks of the scene
	 * @return the average number of views per track, NaN if there are no tracks
	 */
	public static double meanTrackLength( final Tracks tracks )
	{
		if ( tracks.isEmpty() )
			return Double.NaN;

		final RealSum sum = new RealSum();

		for ( final Entry< Integer, Track > track : tracks )
			sum.add( track.getValue().length() );

		return sum.getSum() / tracks.size();
	}

	/**
	 * @param tracksPerView - the per-view index
	 * @return all view ids that see at least one track
	 */
	public static SortedSet< Integer > imageIdInTracks( final TracksPerView tracksPerView )
	{
		return new TreeSet<>( tracksPerView.getViewIds() );
	}

	/**
	 * @param tracks - all tracks of the scene
	 * @return all view ids that see at least one track
	 */
	public static SortedSet< Integer > imageIdInTracks( final Tracks tracks )
	{
		final TreeSet< Integer > viewIds = new TreeSet<>();

		for ( final Entry< Integer, Track > track : tracks )
			viewIds.addAll( track.getValue().getViewIds() );

		return viewIds;
	}

	private static void checkViews( final Set< Integer > viewIds )
	{
		if ( viewIds == null || viewIds.isEmpty() )
			throw new IllegalArgumentException( "At least one view id is required to look for common tracks." );
	}
}
