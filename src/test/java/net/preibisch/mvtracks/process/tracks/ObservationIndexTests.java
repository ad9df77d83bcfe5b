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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.junit.Test;

import net.preibisch.mvtracks.Threads;
import net.preibisch.mvtracks.spimdata.tracks.DescriberType;
import net.preibisch.mvtracks.spimdata.tracks.Observation;

public class ObservationIndexTests {

	@Test
	public void testInternIsDeduplicated() throws InvalidInputException {

		final ObservationIndex index = new ObservationIndex();

		final int a = index.intern( 0, DescriberType.SIFT, 5 );
		final int b = index.intern( 1, DescriberType.SIFT, 5 );
		final int c = index.intern( 0, DescriberType.AKAZE, 5 );

		assertEquals( 0, a );
		assertEquals( 1, b );
		assertEquals( 2, c );
		assertEquals( a, index.intern( 0, DescriberType.SIFT, 5 ) );
		assertEquals( 3, index.size() );

		assertEquals( new Observation( 1, DescriberType.SIFT, 5 ), index.observation( b ) );
		assertEquals( c, index.nodeId( new Observation( 0, DescriberType.AKAZE, 5 ) ) );
		assertEquals( -1, index.nodeId( new Observation( 7, DescriberType.SIFT, 5 ) ) );
	}

	@Test( expected = InvalidInputException.class )
	public void testNegativeFeatureIndex() throws InvalidInputException {

		new ObservationIndex().intern( 0, DescriberType.SIFT, -1 );
	}

	@Test( expected = InvalidInputException.class )
	public void testNegativeViewId() throws InvalidInputException {

		new ObservationIndex().intern( -3, DescriberType.SIFT, 0 );
	}

	@Test( expected = InvalidInputException.class )
	public void testUninitializedDescriberType() throws InvalidInputException {

		new ObservationIndex().intern( 0, DescriberType.UNINITIALIZED, 0 );
	}

	@Test
	public void testConcurrentInternYieldsOneIdPerObservation() {

		final ObservationIndex index = new ObservationIndex();
		final int numObservations = 2000;

		final ArrayList< Callable< int[] > > tasks = new ArrayList<>();

		for ( int t = 0; t < 8; ++t )
		{
			final boolean reverse = t % 2 == 1;

			tasks.add( () -> {
				final int[] ids = new int[ numObservations ];

				for ( int k = 0; k < numObservations; ++k )
				{
					final int i = reverse ? numObservations - 1 - k : k;
					ids[ i ] = index.intern( i % 10, DescriberType.SIFT, i );
				}

				return ids;
			});
		}

		final List< int[] > results = Threads.execTasks( tasks, 8, "intern observations" );

		assertEquals( numObservations, index.size() );

		for ( final int[] ids : results )
			assertArrayEquals( results.get( 0 ), ids );

		for ( int i = 0; i < numObservations; ++i )
			assertEquals( i, index.observation( results.get( 0 )[ i ] ).getFeatIndex() );

		assertNotEquals( results.get( 0 )[ 0 ], results.get( 0 )[ 1 ] );
	}
}
