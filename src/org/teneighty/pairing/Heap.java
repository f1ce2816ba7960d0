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
 * An addressable, mergeable heap. Each key/value pair lives in an
 * <i>entry</i>; the entry returned by <code>insert()</code> is a handle that
 * can later be passed to <code>decreaseKey()</code> or <code>delete()</code>
 * to target that particular element without searching for it.
 * <p>
 * The value of an entry is its <i>identity</i>: it is supplied by the caller,
 * never changes, and carries no meaning for the heap itself. The key is the
 * priority and may only ever be lowered.
 * <p>
 * A handle remains valid from the moment it is returned by
 * <code>insert()</code> until its entry is removed, whether by
 * <code>extractMinimum()</code>, <code>delete()</code> or
 * <code>clear()</code>. Using a handle after that point is detected and
 * rejected with an {@link InvalidHandleException}. Handles survive
 * <code>union()</code>; a handle issued by the absorbed heap is held by the
 * absorbing heap afterwards.
 * <p>
 * Implementations are not required to be synchronized. See
 * {@link Heaps#synchronizedHeap(Heap)}.
 *
 * @param <TKey> the key type.
 * @param <TValue> the value type.
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
public interface Heap<TKey, TValue>
	extends Iterable<Heap.Entry<TKey, TValue>>
{

	/**
	 * Get the comparator used for decision in this heap.
	 * <p>
	 * If this method returns <code>null</code> then this heap uses the keys'
	 * <i>natural ordering</i>.
	 *
	 * @return the comparator or <code>null</code>.
	 */
	public Comparator<? super TKey> getComparator();

	/**
	 * Remove every entry from this heap. All outstanding handles become
	 * invalid.
	 */
	public void clear();

	/**
	 * Get the number of entries in this heap.
	 *
	 * @return the size.
	 */
	public int getSize();

	/**
	 * Is this heap empty?
	 *
	 * @return <code>true</code> if this heap is empty; <code>false</code>
	 *         otherwise.
	 */
	public boolean isEmpty();

	/**
	 * Add a key/value pair to this heap.
	 *
	 * @param key the key.
	 * @param value the value (identity).
	 * @return the handle of the new entry.
	 * @throws ClassCastException If <code>key</code> is not mutually
	 *             comparable with the other keys of this heap.
	 * @throws NullPointerException If <code>key</code> is <code>null</code> and
	 *             the ordering of this heap does not permit <code>null</code>.
	 */
	public Entry<TKey, TValue> insert(TKey key, TValue value)
		throws ClassCastException, NullPointerException;

	/**
	 * Get the element with the minimum key, without removing it.
	 *
	 * @return the minimum element.
	 * @throws EmptyHeapException If this heap is empty.
	 */
	public Element<TKey, TValue> getMinimum()
		throws EmptyHeapException;

	/**
	 * Remove and return the element with the minimum key.
	 *
	 * @return the removed element.
	 * @throws EmptyHeapException If this heap is empty.
	 */
	public Element<TKey, TValue> extractMinimum()
		throws EmptyHeapException;

	/**
	 * Remove the specified entry from this heap.
	 *
	 * @param e the handle of the entry to remove.
	 * @return the removed element.
	 * @throws InvalidHandleException If <code>e</code> is not held by this
	 *             heap.
	 * @throws NullPointerException If <code>e</code> is <code>null</code>.
	 */
	public Element<TKey, TValue> delete(Entry<TKey, TValue> e)
		throws InvalidHandleException, NullPointerException;

	/**
	 * Decrease the key of the specified entry.
	 * <p>
	 * If <code>key</code> is larger than the entry's current key, this method
	 * does nothing.
	 *
	 * @param e the handle of the entry.
	 * @param key the new key.
	 * @throws InvalidHandleException If <code>e</code> is not held by this
	 *             heap.
	 * @throws ClassCastException If <code>key</code> is not mutually
	 *             comparable with the other keys of this heap.
	 * @throws NullPointerException If <code>e</code> is <code>null</code>.
	 */
	public void decreaseKey(Entry<TKey, TValue> e, TKey key)
		throws InvalidHandleException, ClassCastException,
		NullPointerException;

	/**
	 * Does this heap hold the specified entry?
	 *
	 * @param e the handle to check.
	 * @return <code>true</code> if <code>e</code> is live in this heap;
	 *         <code>false</code> otherwise.
	 * @throws NullPointerException If <code>e</code> is <code>null</code>.
	 */
	public boolean holdsEntry(Entry<TKey, TValue> e)
		throws NullPointerException;

	/**
	 * Union this heap with another heap. After this call, <code>other</code>
	 * is empty and every handle it had issued is held by this heap.
	 *
	 * @param other the other heap.
	 * @throws NullPointerException If <code>other</code> is <code>null</code>.
	 * @throws ClassCastException If <code>other</code> is of an incompatible
	 *             implementation.
	 * @throws IllegalArgumentException If <code>other == this</code> or the
	 *             heaps are ordered differently.
	 */
	public void union(Heap<TKey, TValue> other)
		throws NullPointerException, ClassCastException,
		IllegalArgumentException;

	/**
	 * Get an iterator over the handles of this heap, in no particular order.
	 *
	 * @return an iterator.
	 */
	public Iterator<Heap.Entry<TKey, TValue>> iterator();

	/**
	 * A handle to one element of a heap.
	 *
	 * @param <K> the key type.
	 * @param <V> the value type.
	 * @author Fran Lattanzio
	 * @version $Revision$ $Date$
	 */
	public static interface Entry<K, V>
	{

		/**
		 * Get the current key of this entry.
		 *
		 * @return the key.
		 */
		public K getKey();

		/**
		 * Get the value (identity) of this entry.
		 *
		 * @return the value.
		 */
		public V getValue();

	}

}
