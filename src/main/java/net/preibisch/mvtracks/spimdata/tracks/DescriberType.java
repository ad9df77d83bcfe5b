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
package net.preibisch.mvtracks.spimdata.tracks;

import java.util.Locale;

/**
 * The closed set of descriptor families a feature can be described with.
 */
public enum DescriberType
{
	UNINITIALIZED( "uninitialized" ),
	UNKNOWN( "unknown" ),

	SIFT( "sift" ),
	SIFT_FLOAT( "sift_float" ),
	SIFT_UPRIGHT( "sift_upright" ),
	DSPSIFT( "dspsift" ),

	AKAZE( "akaze" ),
	AKAZE_LIOP( "akaze_liop" ),
	AKAZE_MLDB( "akaze_mldb" ),

	CCTAG3( "cctag3" ),
	CCTAG4( "cctag4" ),

	SIFT_OCV( "sift_ocv" ),
	AKAZE_OCV( "akaze_ocv" ),

	APRILTAG16H5( "tag16h5" );

	private final String tag;

	DescriberType( final String tag )
	{
		this.tag = tag;
	}

	public String getTag() { return tag; }

	/**
	 * @return true if features can actually be described with this type
	 */
	public boolean isValid() { return this != UNINITIALIZED; }

	/**
	 * @param tag - the lower-case tag, case is ignored
	 * @return the matching type
	 * @throws IllegalArgumentException if no type uses this tag
	 */
	public static DescriberType fromString( final String tag )
	{
		if ( tag == null )
			throw new IllegalArgumentException( "describer type tag is null" );

		final String t = tag.trim().toLowerCase( Locale.ROOT );

		for ( final DescriberType type : values() )
			if ( type.tag.equals( t ) )
				return type;

		throw new IllegalArgumentException( "Unknown describer type: '" + tag + "'" );
	}

	@Override
	public String toString() { return tag; }
}
