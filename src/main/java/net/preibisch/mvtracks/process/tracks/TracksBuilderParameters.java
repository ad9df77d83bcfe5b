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

import net.preibisch.mvtracks.Threads;

public class TracksBuilderParameters
{
	public static int defaultMinViewCount = 2;
	public static boolean defaultMultithreaded = true;
	public static int defaultNumThreads = Threads.numThreads();

	// below this number of classes the filter does not spawn threads
	public static int defaultMinClassesPerThread = 10000;

	protected final int minViewCount;
	protected final boolean multithreaded;
	protected final int numThreads;
	protected final int minClassesPerThread;

	public TracksBuilderParameters()
	{
		this( defaultMinViewCount, defaultMultithreaded, defaultNumThreads, defaultMinClassesPerThread );
	}

	public TracksBuilderParameters(
			final int minViewCount,
			final boolean multithreaded,
			final int numThreads )
	{
		this( minViewCount, multithreaded, numThreads, defaultMinClassesPerThread );
	}

	public TracksBuilderParameters(
			final int minViewCount,
			final boolean multithreaded,
			final int numThreads,
			final int minClassesPerThread )
	{
		if ( minViewCount < 0 )
			throw new IllegalArgumentException( "minViewCount must be >= 0, but is " + minViewCount );

		if ( numThreads < 1 )
			throw new IllegalArgumentException( "numThreads must be >= 1, but is " + numThreads );

		this.minViewCount = minViewCount;
		this.multithreaded = multithreaded;
		this.numThreads = numThreads;
		this.minClassesPerThread = Math.max( 1, minClassesPerThread );
	}

	public int getMinViewCount() { return minViewCount; }
	public boolean isMultithreaded() { return multithreaded; }
	public int getNumThreads() { return numThreads; }
	public int getMinClassesPerThread() { return minClassesPerThread; }
}
