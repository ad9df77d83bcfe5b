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
import java.util.HashMap;

import net.preibisch.mvtracks.spimdata.tracks.DescriberType;
import net.preibisch.mvtracks.spimdata.tracks.Observation;

/**
 * Assigns dense node ids [0, size()) to observations (viewId, describer type, feature index).
 * Keeps both directions: a hash index observation -&gt; node id and a list node id -&gt; observation.
 *
 * All methods are synchronized, so concurrent interning yields exactly one node id per observation.
 */
public class ObservationIndex
{
	private final ArrayList< Observation > nodeToObservation;
	private final HashMap< Observation, Integer > observationToNode;

	public ObservationIndex()
	{
		this( 16 );
	}

	public ObservationIndex( final int expectedSize )
	{
		this.nodeToObservation = new ArrayList<>( expectedSize );
		this.observationToNode = new HashMap<>( Math.max( 16, (int)( expectedSize / 0.75 ) + 1 ) );
	}

	/**
	 * @param viewId - the view
	 * @param descType - the describer type of the feature
	 * @param featIndex - index of the feature in the view
	 * @return the existing node id of the observation, or a newly assigned one
	 * @throws InvalidInputException if the observation cannot exist
	 */
	public synchronized int intern( final int viewId, final DescriberType descType, final int featIndex ) throws InvalidInputException
	{
		if ( viewId < 0 )
			throw new InvalidInputException( "Invalid view id " + viewId + " (must be >= 0)." );

		if ( featIndex < 0 )
			throw new InvalidInputException( "Invalid feature index " + featIndex + " in view " + viewId + " (must be >= 0)." );

		if ( descType == null || !descType.isValid() )
			throw new InvalidInputException( "Invalid describer type '" + descType + "' for feature " + featIndex + " in view " + viewId + "." );

		final Observation observation = new Observation( viewId, descType, featIndex );
		final Integer node = observationToNode.get( observation );

		if ( node != null )
			return node;

		final int newNode = nodeToObservation.size();

		nodeToObservation.add( observation );
		observationToNode.put( observation, newNode );

		return newNode;
	}

	/**
	 * @param observation - the observation
	 * @return its node id or -1 if it was never interned
	 */
	public synchronized int nodeId( final Observation observation )
	{
		final Integer node = observationToNode.get( observation );
		return node == null ? -1 : node;
	}

	/**
	 * @param nodeId - a node id
	 * @return the observation of this node
	 */
	public synchronized Observation observation( final int nodeId )
	{
		return nodeToObservation.get( nodeId );
	}

	public synchronized int size() { return nodeToObservation.size(); }
}
