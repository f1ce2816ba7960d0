/*
 * $Id$
 *
 * Copyright (c) 2005-2009 Fran Lattanzio
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.teneighty.pairing;

import java.util.Comparator;
import java.util.Iterator;

/**
 * This class contains static methods which operate on heaps. For now, that
 * means a synchronized decorator around the specified heap.
 * <p>
 * Unless otherwise noted, all methods throw a <code>NullPointerException</code>
 * if the target heap is <code>null</code>.
 * <p>
 * This is a stateless class that cannot be instantiated.
 *
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 * @see org.teneighty.pairing.Heap
 */
public final class Heaps
	extends Object
{

	/**
	 * Create and return a threadsafe view around the specified heap.
	 * <p>
	 * In order to guarantee serial access, it is critical that
	 * <strong>all</strong> access to the backing heap is accomplished through
	 * the returned heap. Iteration must additionally be done while holding the
	 * returned heap's monitor, as with <code>java.util.Collections</code>.
	 * <p>
	 * The decorated/returned heap uses itself as a mutex.
	 *
	 * @param <TKey> the key type.
	 * @param <TValue> the value type.
	 * @param heap the heap to wrap in a threadsafe view.
	 * @return a synchronized view of the specified heap.
	 * @throws NullPointerException if <code>heap</code> is <code>null</code>.
	 */
	public static <TKey, TValue> Heap<TKey, TValue> synchronizedHeap(
			final Heap<TKey, TValue> heap)
		throws NullPointerException
	{
		if (heap == null)
		{
			throw new NullPointerException();
		}

		return new SynchronizedHeap<TKey, TValue>(heap);
	}

	/**
	 * Synchronized heap decorator.
	 *
	 * @param <TKey> the key type.
	 * @param <TValue> the value type.
	 * @author Fran Lattanzio
	 * @version $Revision$ $Date$
	 */
	private static final class SynchronizedHeap<TKey, TValue>
		extends Object
		implements Heap<TKey, TValue>
	{

		/**
		 * The backing heap.
		 */
		private final Heap<TKey, TValue> heap;

		/**
		 * The locking object.
		 */
		private final Object mutex;

		/**
		 * Constructor.
		 *
		 * @param heap the backing heap.
		 */
		SynchronizedHeap(final Heap<TKey, TValue> heap)
		{
			super();

			this.heap = heap;

			// Use self as mutex.
			this.mutex = this;
		}

		public Comparator<? super TKey> getComparator()
		{
			synchronized (this.mutex)
			{
				return this.heap.getComparator();
			}
		}

		public void clear()
		{
			synchronized (this.mutex)
			{
				this.heap.clear();
			}
		}

		public int getSize()
		{
			synchronized (this.mutex)
			{
				return this.heap.getSize();
			}
		}

		public boolean isEmpty()
		{
			synchronized (this.mutex)
			{
				return this.heap.isEmpty();
			}
		}

		public Entry<TKey, TValue> insert(final TKey key, final TValue value)
			throws ClassCastException, NullPointerException
		{
			synchronized (this.mutex)
			{
				return this.heap.insert(key, value);
			}
		}

		public Element<TKey, TValue> getMinimum()
			throws EmptyHeapException
		{
			synchronized (this.mutex)
			{
				return this.heap.getMinimum();
			}
		}

		public Element<TKey, TValue> extractMinimum()
			throws EmptyHeapException
		{
			synchronized (this.mutex)
			{
				return this.heap.extractMinimum();
			}
		}

		public Element<TKey, TValue> delete(final Entry<TKey, TValue> e)
			throws InvalidHandleException, NullPointerException
		{
			synchronized (this.mutex)
			{
				return this.heap.delete(e);
			}
		}

		public void decreaseKey(final Entry<TKey, TValue> e, final TKey key)
			throws InvalidHandleException, ClassCastException,
			NullPointerException
		{
			synchronized (this.mutex)
			{
				this.heap.decreaseKey(e, key);
			}
		}

		public boolean holdsEntry(final Entry<TKey, TValue> e)
			throws NullPointerException
		{
			synchronized (this.mutex)
			{
				return this.heap.holdsEntry(e);
			}
		}

		/**
		 * Union the backing heap with another heap.
		 * <p>
		 * <code>other</code> must be a heap the backing heap can absorb, not
		 * another decorator. Its monitor is not taken.
		 *
		 * @param other the other heap.
		 * @throws NullPointerException If <code>other</code> is
		 *             <code>null</code>.
		 * @throws ClassCastException If <code>other</code> is of an
		 *             incompatible implementation.
		 * @throws IllegalArgumentException If you attempt to union a heap with
		 *             itself.
		 */
		public void union(final Heap<TKey, TValue> other)
			throws NullPointerException, ClassCastException,
			IllegalArgumentException
		{
			if (other == this)
			{
				throw new IllegalArgumentException();
			}

			synchronized (this.mutex)
			{
				this.heap.union(other);
			}
		}

		/**
		 * Get an iterator over the entries in this heap. The caller must hold
		 * this heap's monitor for the whole iteration.
		 *
		 * @return an iterator over the heap entries.
		 */
		public Iterator<Heap.Entry<TKey, TValue>> iterator()
		{
			synchronized (this.mutex)
			{
				return this.heap.iterator();
			}
		}

		@Override
		public String toString()
		{
			synchronized (this.mutex)
			{
				return this.heap.toString();
			}
		}

	}

	/**
	 * Constructor. Instances of this class are not allowed, so don't bother
	 * trying.
	 *
	 * @throws InternalError Always.
	 */
	private Heaps()
			throws InternalError
	{
		throw new InternalError("Instances are not allowed");
	}

}
