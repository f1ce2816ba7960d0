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

/**
 * Base class for heaps built from linked entries.
 * <p>
 * The interesting part here is how a heap decides whether it <i>holds</i> a
 * given entry. Each entry keeps a reference not to its heap but to a
 * {@link HeapReference}, which is shared by every entry the heap created. When
 * one heap absorbs another, the absorbed heap's reference is simply redirected
 * to the absorbing heap's reference, so every entry changes owner in
 * <code>O(1)</code> time. Resolving a reference follows the redirect chain
 * (compressing it as it goes, the same trick used by union-find).
 *
 * @param <TKey> the key type.
 * @param <TValue> the value type.
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
public abstract class AbstractLinkedHeap<TKey, TValue>
	extends Object
	implements Heap<TKey, TValue>
{

	/**
	 * Comparator to use, or <code>null</code> for natural order.
	 */
	private final Comparator<? super TKey> comp;

	/**
	 * Constructor.
	 *
	 * @param comp the comparator, or <code>null</code> for natural ordering.
	 */
	protected AbstractLinkedHeap(final Comparator<? super TKey> comp)
	{
		super();

		this.comp = comp;
	}

	/**
	 * Get the comparator used for decision in this heap.
	 *
	 * @return the comparator or <code>null</code>.
	 */
	public Comparator<? super TKey> getComparator()
	{
		return this.comp;
	}

	/**
	 * Is this heap empty?
	 *
	 * @return <code>true</code> if this heap is empty; <code>false</code>
	 *         otherwise.
	 */
	public boolean isEmpty()
	{
		return (this.getSize() == 0);
	}

	/**
	 * Compare two keys, using the comparator if there is one and the keys'
	 * natural ordering otherwise.
	 *
	 * @param k1 the first key.
	 * @param k2 the second key.
	 * @return the usual comparison result.
	 * @throws ClassCastException If the keys are not mutually comparable.
	 * @throws NullPointerException If a key is <code>null</code> and the
	 *             ordering does not allow it.
	 */
	@SuppressWarnings("unchecked")
	protected int compareKeys(final TKey k1, final TKey k2)
		throws ClassCastException, NullPointerException
	{
		if (this.comp == null)
		{
			return ((Comparable<? super TKey>) k1).compareTo(k2);
		}

		return this.comp.compare(k1, k2);
	}

	/**
	 * Compare the keys of two entries.
	 *
	 * @param e1 the first entry.
	 * @param e2 the second entry.
	 * @return the usual comparison result.
	 * @throws ClassCastException If the keys are not mutually comparable.
	 */
	protected int compare(final AbstractLinkedHeapEntry<TKey, TValue> e1,
			final AbstractLinkedHeapEntry<TKey, TValue> e2)
		throws ClassCastException
	{
		return this.compareKeys(e1.getKey(), e2.getKey());
	}

	/**
	 * Get a string representation of this heap.
	 *
	 * @return a string.
	 */
	@Override
	public String toString()
	{
		return String.format("%1$s(size=%2$d)", this.getClass().getSimpleName(),
				Integer.valueOf(this.getSize()));
	}

	/**
	 * A shared, redirectable pointer from entries to the heap that holds them.
	 *
	 * @author Fran Lattanzio
	 * @version $Revision$ $Date$
	 */
	protected static final class HeapReference
		extends Object
	{

		/**
		 * The heap, or <code>null</code> if cleared or redirected.
		 */
		private AbstractLinkedHeap<?, ?> heap;

		/**
		 * The reference this one now forwards to, if any.
		 */
		private HeapReference forward;

		/**
		 * Constructor.
		 *
		 * @param heap the heap.
		 */
		HeapReference(final AbstractLinkedHeap<?, ?> heap)
		{
			super();

			this.heap = heap;
			this.forward = null;
		}

		/**
		 * Get the heap this reference currently resolves to.
		 *
		 * @return the heap, or <code>null</code> if it was cleared.
		 */
		AbstractLinkedHeap<?, ?> getHeap()
		{
			HeapReference end = this;
			while (end.forward != null)
			{
				end = end.forward;
			}

			// Compress the chain.
			HeapReference iter = this;
			while (iter.forward != null && iter.forward != end)
			{
				HeapReference next = iter.forward;
				iter.forward = end;
				iter = next;
			}

			return end.heap;
		}

		/**
		 * Redirect this reference so that it resolves wherever
		 * <code>target</code> does.
		 *
		 * @param target the reference to follow.
		 */
		void redirect(final HeapReference target)
		{
			this.heap = null;
			this.forward = target;
		}

		/**
		 * Orphan every entry that resolves through this reference.
		 */
		void clearHeap()
		{
			this.heap = null;
			this.forward = null;
		}

	}

	/**
	 * Base entry for linked heaps.
	 *
	 * @param <TKey> the key type.
	 * @param <TValue> the value type.
	 * @author Fran Lattanzio
	 * @version $Revision$ $Date$
	 */
	protected abstract static class AbstractLinkedHeapEntry<TKey, TValue>
		extends Object
		implements Heap.Entry<TKey, TValue>
	{

		/**
		 * The key.
		 */
		private TKey key;

		/**
		 * The value. Never changes.
		 */
		private final TValue value;

		/**
		 * The reference to the containing heap.
		 */
		private HeapReference source;

		/**
		 * Constructor.
		 *
		 * @param key the key.
		 * @param value the value.
		 * @param source the containing heap's reference.
		 */
		protected AbstractLinkedHeapEntry(final TKey key, final TValue value,
				final HeapReference source)
		{
			super();

			this.key = key;
			this.value = value;
			this.source = source;
		}

		/**
		 * Get the key.
		 *
		 * @return the key.
		 */
		public final TKey getKey()
		{
			return this.key;
		}

		/**
		 * Set the key. Only the containing heap may do this.
		 *
		 * @param key the new key.
		 */
		final void setKey(final TKey key)
		{
			this.key = key;
		}

		/**
		 * Get the value.
		 *
		 * @return the value.
		 */
		public final TValue getValue()
		{
			return this.value;
		}

		/**
		 * Is this entry contained by the specified heap?
		 *
		 * @param heap the heap.
		 * @return <code>true</code> if so.
		 */
		final boolean isContainedBy(final AbstractLinkedHeap<?, ?> heap)
		{
			return (this.source != null && this.source.getHeap() == heap);
		}

		/**
		 * Drop the reference to the containing heap. Called when this entry is
		 * removed.
		 */
		final void clearSourceReference()
		{
			this.source = null;
		}

		/**
		 * Get a string representation of this entry.
		 *
		 * @return a string.
		 */
		@Override
		public String toString()
		{
			return String.format("%1$s -> %2$s", this.key, this.value);
		}

	}

}
