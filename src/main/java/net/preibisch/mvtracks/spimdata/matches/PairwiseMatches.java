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
package net.preibisch.mvtracks.spimdata.matches;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import net.preibisch.mvtracks.spimdata.tracks.DescriberType;

/**
 * All putative matches of a scene, {(viewI, viewJ) -&gt; {describer type -&gt; matches}},
 * as computed by the pairwise feature matching. Iteration is ordered by view pair, then describer type.
 *
 * The container does not check for duplicate matches or for pairs given in both orders,
 * providing canonical input (viewI &lt; viewJ, every pair once) is up to the caller.
 */
public class PairwiseMatches
{
	final TreeMap< ViewPair, EnumMap< DescriberType, List< IndMatch > > > matches = new TreeMap<>();

	public void addMatches( final int viewI, final int viewJ, final DescriberType descType, final Collection< IndMatch > indMatches )
	{
		getOrCreate( viewI, viewJ, descType ).addAll( indMatches );
	}

	public void addMatch( final int viewI, final int viewJ, final DescriberType descType, final int i, final int j )
	{
		getOrCreate( viewI, viewJ, descType ).add( new IndMatch( i, j ) );
	}

	protected List< IndMatch > getOrCreate( final int viewI, final int viewJ, final DescriberType descType )
	{
		return matches
				.computeIfAbsent( new ViewPair( viewI, viewJ ), pair -> new EnumMap<>( DescriberType.class ) )
				.computeIfAbsent( descType, type -> new ArrayList<>() );
	}

	public Set< ViewPair > getViewPairs() { return Collections.unmodifiableSet( matches.keySet() ); }

	/**
	 * @param viewPair - the pair of views
	 * @return unmodifiable {describer type -&gt; matches} of this pair, empty if the pair has no matches
	 */
	public Map< DescriberType, List< IndMatch > > getMatches( final ViewPair viewPair )
	{
		final EnumMap< DescriberType, List< IndMatch > > perDesc = matches.get( viewPair );

		if ( perDesc == null )
			return Collections.emptyMap();

		return Collections.unmodifiableMap( perDesc );
	}

	public List< IndMatch > getMatches( final int viewI, final int viewJ, final DescriberType descType )
	{
		final List< IndMatch > list = getMatches( new ViewPair( viewI, viewJ ) ).get( descType );
		return list == null ? Collections.emptyList() : Collections.unmodifiableList( list );
	}

	/**
	 * @return all views that are part of at least one pair
	 */
	public HashSet< Integer > getAllViews()
	{
		final HashSet< Integer > views = new HashSet<>();

		for ( final ViewPair pair : matches.keySet() )
		{
			views.add( pair.getA() );
			views.add( pair.getB() );
		}

		return views;
	}

	/**
	 * @return total number of matched feature pairs over all view pairs and describer types
	 */
	public long numMatches()
	{
		long sum = 0;

		for ( final EnumMap< DescriberType, List< IndMatch > > perDesc : matches.values() )
			for ( final List< IndMatch > list : perDesc.values() )
				sum += list.size();

		return sum;
	}

	public int numViewPairs() { return matches.size(); }

	public boolean isEmpty() { return numMatches() == 0; }
}
