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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map.Entry;
import java.util.Random;
import java.util.TreeMap;

import org.junit.Test;

import net.preibisch.mvtracks.spimdata.matches.PairwiseMatches;
import net.preibisch.mvtracks.spimdata.tracks.DescriberType;
import net.preibisch.mvtracks.spimdata.tracks.Track;
import net.preibisch.mvtracks.spimdata.tracks.Tracks;

public class TracksBuilderTests {

	@Test
	public void testTransitiveTrack() throws InvalidInputException {

		final PairwiseMatches matches = new PairwiseMatches();
		matches.addMatch( 0, 1, DescriberType.SIFT, 0, 0 );
		matches.addMatch( 1, 2, DescriberType.SIFT, 0, 0 );

		final TracksBuilder builder = new TracksBuilder();
		builder.build( matches );
		assertEquals( TracksBuilder.State.BUILT, builder.getState() );
		assertEquals( 3, builder.getObservationIndex().size() );

		assertEquals( 0, builder.filter( 2 ) );

		final Tracks tracks = builder.exportTracks();
		assertEquals( TracksBuilder.State.EXPORTED, builder.getState() );
		assertEquals( 1, tracks.size() );

		final Track track = tracks.get( 0 );
		assertEquals( DescriberType.SIFT, track.getDescType() );
		assertEquals( 3, track.length() );

		final TreeMap< Integer, Integer > expected = new TreeMap<>();
		expected.put( 0, 0 );
		expected.put( 1, 0 );
		expected.put( 2, 0 );
		assertEquals( expected, track.getFeatPerView() );
	}

	@Test
	public void testConflictingTrackIsRemoved() throws InvalidInputException {

		final PairwiseMatches matches = new PairwiseMatches();

		// view 0 contributes feature 0 and feature 1 to the same class
		matches.addMatch( 0, 1, DescriberType.SIFT, 0, 0 );
		matches.addMatch( 1, 2, DescriberType.SIFT, 0, 0 );
		matches.addMatch( 0, 2, DescriberType.SIFT, 1, 0 );
		matches.addMatch( 2, 3, DescriberType.SIFT, 0, 4 );
		matches.addMatch( 3, 4, DescriberType.SIFT, 4, 2 );

		// an unrelated, consistent track
		matches.addMatch( 0, 1, DescriberType.SIFT, 5, 5 );

		final TracksBuilder builder = new TracksBuilder();
		builder.build( matches );
		assertEquals( 2, builder.numTracks() );

		assertEquals( 1, builder.filter() );
		assertEquals( TracksBuilder.State.FILTERED, builder.getState() );
		assertEquals( 1, builder.numTracks() );

		final Tracks tracks = builder.exportTracks();
		assertEquals( 1, tracks.size() );
		assertEquals( 5, (int)tracks.get( 0 ).getFeatIndex( 0 ) );
		assertEquals( 5, (int)tracks.get( 0 ).getFeatIndex( 1 ) );
		assertEquals( 2, tracks.get( 0 ).length() );
	}

	@Test
	public void testEmptyInput() throws InvalidInputException {

		final TracksBuilder builder = new TracksBuilder();
		builder.build( new PairwiseMatches() );

		assertEquals( 0, builder.numTracks() );
		assertEquals( 0, builder.filter() );

		final Tracks tracks = builder.exportTracks();
		assertTrue( tracks.isEmpty() );
	}

	@Test
	public void testMinViewCount() throws InvalidInputException {

		final PairwiseMatches matches = new PairwiseMatches();
		matches.addMatch( 0, 1, DescriberType.SIFT, 1, 1 );
		matches.addMatch( 0, 1, DescriberType.SIFT, 2, 2 );
		matches.addMatch( 1, 2, DescriberType.SIFT, 2, 2 );

		final TracksBuilder builder = new TracksBuilder();
		builder.build( matches );

		assertEquals( 0, builder.filter( 2 ) );
		assertEquals( 1, builder.filter( 3 ) );

		// already removed classes are not touched again
		assertEquals( 0, builder.filter( 3 ) );
		assertEquals( 0, builder.filter( 2 ) );

		final Tracks tracks = builder.exportTracks();
		assertEquals( 1, tracks.size() );
		assertEquals( 3, tracks.get( 0 ).length() );

		for ( final Entry< Integer, Track > track : tracks )
			assertTrue( track.getValue().length() >= 3 );
	}

	@Test
	public void testDescriberTypesDoNotMix() throws InvalidInputException {

		final PairwiseMatches matches = new PairwiseMatches();
		matches.addMatch( 0, 1, DescriberType.SIFT, 3, 3 );
		matches.addMatch( 0, 1, DescriberType.AKAZE, 3, 3 );

		final TracksBuilder builder = new TracksBuilder();
		builder.build( matches );
		builder.filter();

		final Tracks tracks = builder.exportTracks();
		assertEquals( 2, tracks.size() );
		assertTrue( tracks.get( 0 ).getDescType() != tracks.get( 1 ).getDescType() );
	}

	@Test( expected = IllegalStateException.class )
	public void testBuildTwice() throws InvalidInputException {

		final PairwiseMatches matches = new PairwiseMatches();
		matches.addMatch( 0, 1, DescriberType.SIFT, 0, 0 );

		final TracksBuilder builder = new TracksBuilder();
		builder.build( matches );
		builder.build( matches );
	}

	@Test( expected = IllegalStateException.class )
	public void testFilterBeforeBuild() {

		new TracksBuilder().filter();
	}

	@Test( expected = IllegalStateException.class )
	public void testExportTwice() throws InvalidInputException {

		final TracksBuilder builder = new TracksBuilder();
		builder.build( new PairwiseMatches() );
		builder.exportTracks();
		builder.exportTracks();
	}

	@Test( expected = IllegalArgumentException.class )
	public void testNegativeMinViewCount() throws InvalidInputException {

		final TracksBuilder builder = new TracksBuilder();
		builder.build( new PairwiseMatches() );
		builder.filter( -1 );
	}

	@Test
	public void testInvalidInputLeavesBuilderEmpty() throws InvalidInputException {

		final PairwiseMatches invalid = new PairwiseMatches();
		invalid.addMatch( 0, 1, DescriberType.SIFT, 0, 0 );
		invalid.addMatch( 1, 2, DescriberType.SIFT, 0, -4 );

		final TracksBuilder builder = new TracksBuilder();

		try
		{
			builder.build( invalid );
			fail( "negative feature index must be rejected" );
		}
		catch ( final InvalidInputException e )
		{
			assertEquals( TracksBuilder.State.EMPTY, builder.getState() );
			assertNull( builder.getUnionFind() );
			assertNull( builder.getObservationIndex() );
		}

		final PairwiseMatches valid = new PairwiseMatches();
		valid.addMatch( 0, 1, DescriberType.SIFT, 0, 0 );
		builder.build( valid );
		assertEquals( 1, builder.numTracks() );
	}

	@Test( expected = InvalidInputException.class )
	public void testUninitializedDescriberTypeIsInvalid() throws InvalidInputException {

		final PairwiseMatches matches = new PairwiseMatches();
		matches.addMatch( 0, 1, DescriberType.UNINITIALIZED, 0, 0 );

		new TracksBuilder().build( matches );
	}

	@Test
	public void testExportToStream() throws InvalidInputException, IOException {

		final PairwiseMatches matches = new PairwiseMatches();
		matches.addMatch( 0, 1, DescriberType.SIFT, 7, 8 );
		matches.addMatch( 1, 2, DescriberType.SIFT, 8, 9 );

		final TracksBuilder builder = new TracksBuilder();
		builder.build( matches );

		final StringWriter writer = new StringWriter();
		builder.exportToStream( writer );

		final String dump = writer.toString();
		assertTrue( dump.startsWith( "Class: 0\n" ) );
		assertTrue( dump.contains( "\ttrack length: 3\n" ) );
		assertTrue( dump.contains( "2  sift, 9\n" ) );
		assertFalse( dump.contains( "Class: 1" ) );

		// writing does not change anything
		assertEquals( TracksBuilder.State.BUILT, builder.getState() );
		assertEquals( 1, builder.exportTracks().size() );
	}

	@Test
	public void testMultithreadedFilterEqualsSingleThreaded() throws InvalidInputException {

		final PairwiseMatches matches = randomMatches( new Random( 42 ), 3000, 8 );

		final TracksBuilder single = new TracksBuilder( new TracksBuilderParameters( 2, false, 1 ) );
		single.build( matches );
		final int removedSingle = single.filter();
		final Tracks tracksSingle = single.exportTracks();

		final TracksBuilder multi = new TracksBuilder( new TracksBuilderParameters( 2, true, 4, 1 ) );
		multi.build( matches );
		final int removedMulti = multi.filter();
		final Tracks tracksMulti = multi.exportTracks();

		assertTrue( removedSingle > 0 );
		assertEquals( removedSingle, removedMulti );
		assertEquals( tracksSingle, tracksMulti );

		for ( final Entry< Integer, Track > track : tracksMulti )
			assertTrue( track.getValue().length() >= 2 );
	}

	@Test
	public void testFilteredTracksHaveNoConflicts() throws InvalidInputException {

		final PairwiseMatches matches = randomMatches( new Random( 7 ), 2000, 6 );

		final TracksBuilder builder = new TracksBuilder( new TracksBuilderParameters( 2, true, 3, 1 ) );
		builder.build( matches );
		builder.filter();

		// every remaining class has as many distinct views as members
		for ( final int classId : builder.getUnionFind().classes() )
		{
			final int[] members = builder.getUnionFind().membersOf( classId );
			final TreeMap< Integer, Integer > views = new TreeMap<>();

			for ( final int node : members )
				views.merge( builder.getObservationIndex().observation( node ).getViewId(), 1, Integer::sum );

			assertEquals( members.length, views.size() );
			assertTrue( views.size() >= 2 );
		}
	}

	/*
	 * Scene points seen in random subsets of views (feature index == point id), plus random
	 * wrong matches that create conflicting tracks.
	 */
	private static PairwiseMatches randomMatches( final Random rnd, final int numPoints, final int numViews ) {

		final PairwiseMatches matches = new PairwiseMatches();

		for ( int p = 0; p < numPoints; ++p )
		{
			int previous = -1;

			for ( int v = 0; v < numViews; ++v )
			{
				if ( rnd.nextDouble() < 0.5 )
					continue;

				if ( previous >= 0 )
					matches.addMatch( previous, v, DescriberType.SIFT, p, p );

				previous = v;
			}
		}

		for ( int k = 0; k < numPoints / 20; ++k )
		{
			final int viewI = rnd.nextInt( numViews - 1 );
			final int viewJ = viewI + 1 + rnd.nextInt( numViews - viewI - 1 );
			matches.addMatch( viewI, viewJ, DescriberType.SIFT, rnd.nextInt( numPoints ), rnd.nextInt( numPoints ) );
		}

		return matches;
	}
}
