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
package net.preibisch.mvtracks.process.tracks.unionfind;

import java.util.Arrays;

/**
 * Disjoint-set forest over dense integer node ids [0, size()). Union by size, find with path compression.
 * Every class additionally keeps a circular list of its members so classes can be enumerated and erased
 * without touching the parent pointers.
 *
 * Not thread-safe. {@link #classes()}, {@link #membersOf(int)} and {@link #classSize(int)} only read,
 * so they can be called concurrently as long as nobody calls {@link #makeSet()}, {@link #find(int)},
 * {@link #union(int, int)} or {@link #eraseClass(int)} at the same time.
 */
public class UnionFind
{
	private int[] parent, size, next;
	private boolean[] erased;

	private int numNodes, numClasses;

	public UnionFind()
	{
		this( 16 );
	}

	/**
	 * @param capacity - expected number of nodes, the structure grows if necessary
	 */
	public UnionFind( final int capacity )
	{
		final int c = Math.max( 1, capacity );

		this.parent = new int[ c ];
		this.size = new int[ c ];
		this.next = new int[ c ];
		this.erased = new boolean[ c ];
		this.numNodes = 0;
		this.numClasses = 0;
	}

	/**
	 * Adds a new node that forms its own class.
	 *
	 * @return the id of the new node
	 */
	public int makeSet()
	{
		if ( numNodes == parent.length )
			grow();

		final int id = numNodes++;

		parent[ id ] = id;
		size[ id ] = 1;
		next[ id ] = id;
		erased[ id ] = false;

		++numClasses;

		return id;
	}

	private void grow()
	{
		final int capacity = parent.length + ( parent.length >> 1 ) + 1;

		parent = Arrays.copyOf( parent, capacity );
		size = Arrays.copyOf( size, capacity );
		next = Arrays.copyOf( next, capacity );
		erased = Arrays.copyOf( erased, capacity );
	}

	/**
	 * @param node - a node id
	 * @return the id of the class (the root node) the node belongs to
	 */
	public int find( final int node )
	{
		checkAlive( node );

		int root = node;

		// find root
		while ( root != parent[ root ] )
			root = parent[ root ];

		// label all nodes on the way to root as children of root
		int n = node;
		while ( n != root )
		{
			final int tmp = parent[ n ];
			parent[ n ] = root;
			n = tmp;
		}

		return root;
	}

	/**
	 * Merges the classes of both nodes, the smaller class is attached to the larger.
	 *
	 * @param a - a node id
	 * @param b - a node id
	 * @return the class id of the merged class
	 */
	public int union( final int a, final int b )
	{
		int rootA = find( a );
		int rootB = find( b );

		if ( rootA == rootB )
			return rootA;

		if ( size[ rootA ] < size[ rootB ] )
		{
			final int tmp = rootA;
			rootA = rootB;
			rootB = tmp;
		}

		parent[ rootB ] = rootA;
		size[ rootA ] += size[ rootB ];

		// splice the two circular member lists
		final int tmp = next[ rootA ];
		next[ rootA ] = next[ rootB ];
		next[ rootB ] = tmp;

		--numClasses;

		return rootA;
	}

	/**
	 * @param a - a node id
	 * @param b - a node id
	 * @return if both nodes are in the same class
	 */
	public boolean connected( final int a, final int b ) { return find( a ) == find( b ); }

	/**
	 * @return the ids of all classes that were not erased, ascending
	 */
	public int[] classes()
	{
		final int[] classes = new int[ numClasses ];
		int c = 0;

		for ( int i = 0; i < numNodes; ++i )
			if ( !erased[ i ] && parent[ i ] == i )
				classes[ c++ ] = i;

		return classes;
	}

	/**
	 * @param classId - a class id as returned by {@link #find(int)} or {@link #classes()}
	 * @return all nodes of the class, starting with the class id
	 */
	public int[] membersOf( final int classId )
	{
		checkClass( classId );

		final int[] members = new int[ size[ classId ] ];

		int n = classId, i = 0;
		do
		{
			members[ i++ ] = n;
			n = next[ n ];
		}
		while ( n != classId );

		return members;
	}

	/**
	 * @param classId - a class id
	 * @return the number of nodes in the class
	 */
	public int classSize( final int classId )
	{
		checkClass( classId );

		return size[ classId ];
	}

	/**
	 * Removes the class and all its members. The ids of erased nodes stay allocated but cannot be used anymore.
	 *
	 * @param classId - a class id
	 */
	public void eraseClass( final int classId )
	{
		checkClass( classId );

		int n = classId;
		do
		{
			erased[ n ] = true;
			n = next[ n ];
		}
		while ( n != classId );

		--numClasses;
	}

	public boolean isErased( final int node )
	{
		checkIndex( node );

		return erased[ node ];
	}

	/**
	 * @return number of nodes ever created, including erased ones
	 */
	public int size() { return numNodes; }

	/**
	 * @return number of classes that were not erased
	 */
	public int numClasses() { return numClasses; }

	private void checkIndex( final int node )
	{
		if ( node < 0 || node >= numNodes )
			throw new IndexOutOfBoundsException( "node " + node + " does not exist, size=" + numNodes );
	}

	private void checkAlive( final int node )
	{
		checkIndex( node );

		if ( erased[ node ] )
			throw new IllegalArgumentException( "node " + node + " belongs to an erased class" );
	}

	private void checkClass( final int classId )
	{
		checkAlive( classId );

		if ( parent[ classId ] != classId )
			throw new IllegalArgumentException( "node " + classId + " is not a class id" );
	}
}
