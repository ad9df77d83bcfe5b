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

import net.imglib2.util.Pair;

/**
 * Key of the pairwise matches, (viewI, viewJ). By convention viewI &lt; viewJ,
 * but this is not enforced.
 */
public class ViewPair implements Pair< Integer, Integer >, Comparable< ViewPair >
{
	final int viewI, viewJ;

	public ViewPair( final int viewI, final int viewJ )
	{
		this.viewI = viewI;
		this.viewJ = viewJ;
	}

	public int getViewI() { return viewI; }
	public int getViewJ() { return viewJ; }

	@Override
	public Integer getA() { return viewI; }

	@Override
	public Integer getB() { return viewJ; }

	@Override
	public int compareTo( final ViewPair o )
	{
		if ( viewI == o.viewI )
			return Integer.compare( viewJ, o.viewJ );
		else
			return Integer.compare( viewI, o.viewI );
	}

	@Override
	public int hashCode() { return 31 * viewI + viewJ; }

	@Override
	public boolean equals( final Object obj )
	{
		if ( this == obj )
			return true;
		if ( !( obj instanceof ViewPair ) )
			return false;

		final ViewPair other = (ViewPair)obj;
		return viewI == other.viewI && viewJ == other.viewJ;
	}

	@Override
	public String toString() { return "(" + viewI + ", " + viewJ + ")"; }
}
