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

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map.Entry;
import java.util.TreeMap;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.mvtracks.Threads;
import net.preibisch.mvtracks.process.tracks.unionfind.UnionFind;
import net.preibisch.mvtracks.spimdata.matches.IndMatch;
import net.preibisch.mvtracks.spimdata.matches.PairwiseMatches;
import net.preibisch.mvtracks.spimdata.matches.ViewPair;
import net.preibisch.mvtracks.spimdata.tracks.DescriberType;
import net.preibisch.mvtracks.spimdata.tracks.Observation;
import net.preibisch.mvtracks.spimdata.tracks.Track;
import net.preibisch.mvtracks.spimdata.tracks.Tracks;

/**
 * Computes tracks from pairwise matches across views, following
 * "Unordered feature tracking made fast and easy" (Moulon and Monasse, CVMP 2012).
 * Every observation (view, describer type, feature index) becomes a node of a union-find
 * structure, every match joins two nodes, every remaining class is a track.
 *
 * <pre>
 * final TracksBuilder builder = new TracksBuilder();
 * builder.build( pairwiseMatches ); // fusion of all correspondences
 * builder.filter();                 // remove tracks that are too short or have conflicts
 * final Tracks tracks = builder.exportTracks();
 * </pre>
 *
 * An instance can build once and export once, {@link State} documents the order of calls.
 * Not thread-safe, the builder must not be shared while building or filtering.
 */
public class TracksBuilder
{
	private static final Logger LOG = LoggerFactory.getLogger( TracksBuilder.class );

	public enum State { EMPTY, BUILT, FILTERED, EXPORTED }

	final TracksBuilderParameters params;

	private State state = State.EMPTY;

	private ObservationIndex index;
	private UnionFind tracksUF;

	// view id of every node, so filtering does not need to touch the index
	private int[] viewOfNode;

	public TracksBuilder()
	{
		this( new TracksBuilderParameters() );
	}

	public TracksBuilder( final TracksBuilderParameters params )
	{
		this.params = params;
	}

	/**
	 * Builds the tracks for a given series of pairwise matches. The matches are traversed twice,
	 * first all observations are assigned a node, then the nodes of every match are joined.
	 *
	 * @param pairwiseMatches - all matches, not modified
	 * @throws InvalidInputException if a match references an invalid observation, the builder stays empty in this case
	 */
	public void build( final PairwiseMatches pairwiseMatches ) throws InvalidInputException
	{
		if ( state != State.EMPTY )
			throw new IllegalStateException( "TracksBuilder.build() can only be called once, current state: " + state );

		final long t0 = System.currentTimeMillis();
		final long numMatches = pairwiseMatches.numMatches();

		// all features of all views
		final ObservationIndex newIndex = new ObservationIndex( (int)Math.min( 1 << 24, 2 * numMatches ) );

		for ( final ViewPair pair : pairwiseMatches.getViewPairs() )
		{
			final int viewI = pair.getViewI();
			final int viewJ = pair.getViewJ();

			for ( final Entry< DescriberType, List< IndMatch > > matchesPerDesc : pairwiseMatches.getMatches( pair ).entrySet() )
			{
				final DescriberType descType = matchesPerDesc.getKey();

				for ( final IndMatch m : matchesPerDesc.getValue() )
				{
					newIndex.intern( viewI, descType, m.getI() );
					newIndex.intern( viewJ, descType, m.getJ() );
				}
			}
		}

		final int numNodes = newIndex.size();
		final UnionFind uf = new UnionFind( numNodes );
		final int[] views = new int[ numNodes ];

		for ( int node = 0; node < numNodes; ++node )
		{
			uf.makeSet();
			views[ node ] = newIndex.observation( node ).getViewId();
		}

		final long t1 = System.currentTimeMillis();
		LOG.debug( "Indexed {} observations of {} view pairs in {} ms", numNodes, pairwiseMatches.numViewPairs(), t1 - t0 );

		// make the union according to the pairwise matches
		for ( final ViewPair pair : pairwiseMatches.getViewPairs() )
		{
			final int viewI = pair.getViewI();
			final int viewJ = pair.getViewJ();

			for ( final Entry< DescriberType, List< IndMatch > > matchesPerDesc : pairwiseMatches.getMatches( pair ).entrySet() )
			{
				final DescriberType descType = matchesPerDesc.getKey();

				for ( final IndMatch m : matchesPerDesc.getValue() )
				{
					uf.union(
							newIndex.nodeId( new Observation( viewI, descType, m.getI() ) ),
							newIndex.nodeId( new Observation( viewJ, descType, m.getJ() ) ) );
				}
			}
		}

		this.index = newIndex;
		this.tracksUF = uf;
		this.viewOfNode = views;
		this.state = State.BUILT;

		LOG.info( "Built {} tracks from {} matches ({} observations) in {} ms", uf.numClasses(), numMatches, numNodes, System.currentTimeMillis() - t0 );
	}

	/**
	 * Removes bad tracks using the parameters of this builder.
	 *
	 * @return the number of removed tracks
	 * @see #filter(int, boolean)
	 */
	public int filter()
	{
		return filter( params.getMinViewCount(), params.isMultithreaded() );
	}

	public int filter( final int minViewCount )
	{
		return filter( minViewCount, params.isMultithreaded() );
	}

	/**
	 * Removes bad tracks: tracks that are too short and tracks with id conflicts, i.e. the same view contributes
	 * more than one feature. Conflicting tracks are removed entirely, they are not repaired. All tracks are evaluated
	 * first (concurrently if requested), the erasure happens afterwards.
	 *
	 * @param minViewCount - minimal number of views a track must be visible in
	 * @param multithreaded - evaluate the tracks on multiple threads
	 * @return the number of removed tracks
	 */
	public int filter( final int minViewCount, final boolean multithreaded )
	{
		checkBuilt( "filter tracks" );

		if ( minViewCount < 0 )
			throw new IllegalArgumentException( "minViewCount must be >= 0, but is " + minViewCount );

		final long t0 = System.currentTimeMillis();
		final int[] classes = tracksUF.classes();

		final int numBatches = multithreaded ? Math.min( params.getNumThreads(), Math.max( 1, classes.length / params.getMinClassesPerThread() ) ) : 1;
		final List< int[] > intervals = Threads.splitIntervals( classes.length, numBatches );

		final List< int[] > toErase;

		if ( intervals.size() <= 1 )
		{
			toErase = new ArrayList<>();
			toErase.add( classesToErase( classes, 0, classes.length, minViewCount ) );
		}
		else
		{
			final ArrayList< Callable< int[] > > tasks = new ArrayList<>();

			for ( final int[] interval : intervals )
				tasks.add( () -> classesToErase( classes, interval[ 0 ], interval[ 1 ], minViewCount ) );

			toErase = Threads.execTasks( tasks, intervals.size(), "filter tracks" );
		}

		int numErased = 0;

		for ( final int[] classIds : toErase )
			for ( final int classId : classIds )
			{
				tracksUF.eraseClass( classId );
				++numErased;
			}

		this.state = State.FILTERED;

		LOG.info( "Removed {} of {} tracks (minViewCount={}, threads={}) in {} ms, {} tracks remaining",
				numErased, classes.length, minViewCount, intervals.size(), System.currentTimeMillis() - t0, tracksUF.numClasses() );

		return numErased;
	}

	/*
	 * Only reads the union-find structure, so it can run concurrently for disjoint intervals.
	 */
	protected int[] classesToErase( final int[] classes, final int start, final int end, final int minViewCount )
	{
		final int[] erase = new int[ end - start ];
		int numErase = 0;

		for ( int c = start; c < end; ++c )
		{
			final int[] members = tracksUF.membersOf( classes[ c ] );
			final int numViews = numDistinctViews( members );

			if ( numViews != members.length || numViews < minViewCount )
				erase[ numErase++ ] = classes[ c ];
		}

		return Arrays.copyOf( erase, numErase );
	}

	protected int numDistinctViews( final int[] members )
	{
		final int[] views = new int[ members.length ];

		for ( int i = 0; i < members.length; ++i )
			views[ i ] = viewOfNode[ members[ i ] ];

		Arrays.sort( views );

		int distinct = views.length > 0 ? 1 : 0;

		for ( int i = 1; i < views.length; ++i )
			if ( views[ i ] != views[ i - 1 ] )
				++distinct;

		return distinct;
	}

	/**
	 * Exports all remaining tracks, the track ids are assigned sequentially starting at 0.
	 * The builder cannot be used anymore afterwards.
	 *
	 * @return the tracks
	 */
	public Tracks exportTracks()
	{
		checkBuilt( "export tracks" );

		final int[] classes = tracksUF.classes();
		final HashMap< Integer, Track > tracks = new HashMap<>( Math.max( 16, (int)( classes.length / 0.75 ) + 1 ) );

		int trackId = 0;

		for ( final int classId : classes )
		{
			final TreeMap< Integer, Integer > featPerView = new TreeMap<>();
			DescriberType descType = DescriberType.UNINITIALIZED;

			for ( final int node : tracksUF.membersOf( classId ) )
			{
				final Observation observation = index.observation( node );

				// all descTypes inside the track are the same, both ends of a match share it
				descType = observation.getDescType();
				featPerView.put( observation.getViewId(), observation.getFeatIndex() );
			}

			tracks.put( trackId++, new Track( descType, featPerView ) );
		}

		this.state = State.EXPORTED;
		this.index = null;
		this.tracksUF = null;
		this.viewOfNode = null;

		LOG.info( "Exported {} tracks", tracks.size() );

		return tracks.isEmpty() ? Tracks.empty() : new Tracks( tracks );
	}

	/**
	 * @return the number of tracks (connected sets in the union-find structure)
	 */
	public int numTracks()
	{
		checkBuilt( "count tracks" );

		return tracksUF.numClasses();
	}

	/**
	 * Writes a human-readable listing of all current tracks, including the ones
	 * that would be removed by {@link #filter()} if it was not called yet.
	 *
	 * @param os - where to write
	 * @throws IOException if writing fails
	 */
	public void exportToStream( final Writer os ) throws IOException
	{
		checkBuilt( "write tracks" );

		int cpt = 0;

		for ( final int classId : tracksUF.classes() )
		{
			final int[] members = tracksUF.membersOf( classId );

			os.write( "Class: " + cpt++ + "\n" );
			os.write( "\ttrack length: " + members.length + "\n" );

			for ( final int node : members )
				os.write( index.observation( node ) + "\n" );
		}

		os.flush();
	}

	public State getState() { return state; }

	public TracksBuilderParameters getParameters() { return params; }

	/**
	 * @return the node index, null unless built and not yet exported
	 */
	public ObservationIndex getObservationIndex() { return index; }

	/**
	 * @return the union-find structure, null unless built and not yet exported
	 */
	public UnionFind getUnionFind() { return tracksUF; }

	protected void checkBuilt( final String action )
	{
		if ( state == State.EMPTY )
			throw new IllegalStateException( "Cannot " + action + ", TracksBuilder.build() was not called yet." );

		if ( state == State.EXPORTED )
			throw new IllegalStateException( "Cannot " + action + ", tracks were already exported." );
	}
}
