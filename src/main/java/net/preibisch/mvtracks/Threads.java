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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Threads
{
	private static final Logger LOG = LoggerFactory.getLogger( Threads.class );

	/**
	 * @return num threads for the executorService, one per available processor
	 */
	public static int numThreads() { return Math.max( 1, Runtime.getRuntime().availableProcessors() ); }

	public static ExecutorService createFixedExecutorService( final int nThreads ) { return Executors.newFixedThreadPool( nThreads ); }
	public static ExecutorService createFixedExecutorService() { return createFixedExecutorService( numThreads() ); }

	/**
	 * Splits [0, numElements) into at most numBatches contiguous intervals of (almost) equal size.
	 *
	 * @param numElements - total number of elements
	 * @param numBatches - maximal number of intervals
	 * @return list of {start, end} intervals, end exclusive
	 */
	public static List< int[] > splitIntervals( final int numElements, final int numBatches )
	{
		final ArrayList< int[] > intervals = new ArrayList<>();

		if ( numElements <= 0 )
			return intervals;

		final int n = Math.max( 1, Math.min( numBatches, numElements ) );
		final int perBatch = numElements / n + ( numElements % n == 0 ? 0 : 1 );

		for ( int start = 0; start < numElements; start += perBatch )
			intervals.add( new int[] { start, Math.min( start + perBatch, numElements ) } );

		return intervals;
	}

	/**
	 * Runs all tasks on the service and waits for them. A failing task fails the whole job.
	 *
	 * @param tasks - the tasks
	 * @param taskExecutor - where to run them
	 * @param jobDescription - for the log
	 * @param <T> - result type
	 * @return the results in the order of the tasks
	 */
	public static < T > List< T > execTasks( final List< ? extends Callable< T > > tasks, final ExecutorService taskExecutor, final String jobDescription )
	{
		final ArrayList< T > results = new ArrayList<>( tasks.size() );

		try
		{
			// invokeAll() returns when all tasks are complete
			for ( final Future< T > future : taskExecutor.invokeAll( tasks ) )
				results.add( future.get() );
		}
		catch ( final InterruptedException e )
		{
			LOG.warn( "Interrupted while trying to {}", jobDescription );
			Thread.currentThread().interrupt();
			throw new RuntimeException( "Failed to " + jobDescription + ": " + e, e );
		}
		catch ( final ExecutionException e )
		{
			throw new RuntimeException( "Failed to " + jobDescription + ": " + e.getCause(), e.getCause() );
		}

		return results;
	}

	public static < T > List< T > execTasks( final List< ? extends Callable< T > > tasks, final int nThreads, final String jobDescription )
	{
		final ExecutorService taskExecutor = createFixedExecutorService( nThreads );

		try
		{
			return execTasks( tasks, taskExecutor, jobDescription );
		}
		finally
		{
			taskExecutor.shutdown();
		}
	}
}
