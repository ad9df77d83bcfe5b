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
package net.preibisch.mvtracks;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.junit.Test;

public class ThreadsTests {

	@Test
	public void testSplitIntervals() {

		final List< int[] > intervals = Threads.splitIntervals( 10, 3 );

		assertEquals( 3, intervals.size() );
		assertArrayEquals( new int[] { 0, 4 }, intervals.get( 0 ) );
		assertArrayEquals( new int[] { 4, 8 }, intervals.get( 1 ) );
		assertArrayEquals( new int[] { 8, 10 }, intervals.get( 2 ) );

		assertEquals( 2, Threads.splitIntervals( 2, 8 ).size() );
		assertTrue( Threads.splitIntervals( 0, 4 ).isEmpty() );
	}

	@Test
	public void testExecTasksKeepsOrder() {

		final ArrayList< Callable< Integer > > tasks = new ArrayList<>();

		for ( int i = 0; i < 20; ++i )
		{
			final int j = i;
			tasks.add( () -> j * j );
		}

		final List< Integer > results = Threads.execTasks( tasks, 4, "square" );

		for ( int i = 0; i < 20; ++i )
			assertEquals( i * i, (int)results.get( i ) );
	}

	@Test
	public void testExecTasksPropagatesFailure() {

		final ArrayList< Callable< Void > > tasks = new ArrayList<>();
		tasks.add( () -> null );
		tasks.add( () -> { throw new IllegalStateException( "broken task" ); } );

		try
		{
			Threads.execTasks( tasks, 2, "fail" );
			fail( "failing task must fail the job" );
		}
		catch ( final RuntimeException e )
		{
			assertTrue( e.getCause() instanceof IllegalStateException );
		}
	}
}
