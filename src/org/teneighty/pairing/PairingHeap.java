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

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A pairing heap implementation. A pairing heap is really just a tree that
 * maintains the heap invariant: Every entry has a key less than or equal to the
 * keys of its children. The pairing heap places no restrictions on the child
 * count or the heights of child trees at any point.
 * <p>
 * Every entry contains four references:
 * <ul>
 * <li>A parent reference, which is <code>null</code> iff the entry is the
 * root.</li>
 * <li>A child reference. This points to an arbitrary member of the entry's
 * child ring (the <i>anchor</i>), or is <code>null</code> if the entry has no
 * children.</li>
 * <li>Left and right references, which link all the children of one parent
 * into a circular, doubly-linked ring. An entry without siblings points to
 * itself in both directions.</li>
 * </ul>
 * <p>
 * The heap invariant is maintained by one method, <code>merge()</code>. It
 * takes two roots and makes the larger a child of the smaller; on a tie, the
 * first argument wins. The new child is spliced in just left of the anchor
 * and becomes the new anchor. Below are brief descriptions of how each method
 * works:
 * <ul>
 * <li>Insert creates a singleton entry and merges the root with it. Insert
 * takes <code>O(1)</code> worst-case time.</li>
 * <li>The union of two pairing heaps is the merge of the two roots, and also
 * takes <code>O(1)</code> time.</li>
 * <li>Extract min removes the root and combines its children into a new tree
 * with <code>combineSiblings()</code>: first adjacent pairs are merged left to
 * right, then the resulting trees are folded together right to left. This
 * two-pass strategy is what gives the heap its <code>O(log n)</code> amortized
 * bound.</li>
 * <li>Decrease key cuts the entry out of its parent's child ring, updates the
 * key, and merges the entry with the root, passing the entry first so that it
 * becomes the root on a tie.</li>
 * <li>Delete cuts the entry, combines the entry's own children into a
 * replacement tree, and merges that tree with the root.</li>
 * </ul>
 * <p>
 * The iterator of this class is <i>fail-fast</i>: If the heap is structurally
 * modified at any time after the iterator is created, the iterator throws a
 * <code>ConcurrentModificationException</code>. The iterator does not support
 * the <code>remove()</code> operation.
 * <p>
 * This class is not synchronized (by choice). You must ensure sequential access
 * externally, or you may damage instances of this class. You can use
 * {@link org.teneighty.pairing.Heaps#synchronizedHeap(Heap)} to obtain
 * synchronized instances of this class.
 *
 * @param <TKey> the key type.
 * @param <TValue> the value type.
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 * @see "<i>The pairing heap: A new form of self-adjusting heap</i>,
 *      <u>Algorithmica</u>, 1, March 1986, 111-129, by M. Fredman, R.
 *      Sedgewick, R. Sleator, and R. Tarjan"
 */
public class PairingHeap<TKey, TValue>
	extends AbstractLinkedHeap<TKey, TValue>
{

	/**
	 * The size of this heap.
	 */
	private int size;

	/**
	 * The mod count.
	 */
	private volatile int mod_count;

	/**
	 * The root, which is also the minimum.
	 */
	private PairingHeapEntry<TKey, TValue> root;

	/**
	 * Heap reference shared by all entries created by (or absorbed into) this
	 * heap.
	 */
	private HeapReference source;

	/**
	 * Constructor.
	 * <p>
	 * The nodes of this heap will be ordered by their keys' <i>natural
	 * ordering</i>.
	 * <p>
	 * The keys of all nodes inserted into the heap must implement the
	 * <code>Comparable</code> interface. Furthermore, all such keys must be
	 * <i>mutually comparable</i>:<code>k1.compareTo(k2)</code> must not throw a
	 * <code>ClassCastException</code> for any elements <code>k1</code> and
	 * <code>k2</code> in the heap.
	 */
	public PairingHeap()
	{
		this(null);
	}

	/**
	 * Constructor.
	 * <p>
	 * Pass an inverted comparator (see {@link Comparators}) to get a max-heap.
	 *
	 * @param comp the comparator, or <code>null</code> for natural ordering.
	 */
	public PairingHeap(final Comparator<? super TKey> comp)
	{
		super(comp);

		this.source = new HeapReference(this);
		this.size = 0;
		this.mod_count = 0;
		this.root = null;
	}

	/**
	 * Get the number of key/value pairs (i.e. the size) of this heap.
	 *
	 * @return the size.
	 */
	public int getSize()
	{
		return this.size;
	}

	/**
	 * Clear this heap.
	 * <p>
	 * Every entry is unlinked and orphaned. The tree may be arbitrarily deep,
	 * so the walk uses an explicit stack rather than recursion. This takes
	 * <code>O(n)</code> time.
	 */
	public void clear()
	{
		Deque<PairingHeapEntry<TKey, TValue>> stack = new ArrayDeque<PairingHeapEntry<TKey, TValue>>();
		if (this.root != null)
		{
			stack.push(this.root);
		}

		while (stack.isEmpty() == false)
		{
			PairingHeapEntry<TKey, TValue> entry = stack.pop();

			PairingHeapEntry<TKey, TValue> first = entry.child;
			if (first != null)
			{
				PairingHeapEntry<TKey, TValue> iter = first;
				do
				{
					stack.push(iter);
					iter = iter.right;
				}
				while (iter != first);
			}

			entry.detach();
		}

		this.root = null;
		this.size = 0;
		this.mod_count += 1;

		// Entries that came in through a union resolve via this reference too.
		this.source.clearHeap();
		this.source = new HeapReference(this);
	}

	/**
	 * Add a key/value pair to this heap.
	 *
	 * @param key the node key.
	 * @param value the node value.
	 * @return the entry created.
	 * @throws ClassCastException If the specified key is not mutually
	 *             comparable with the other keys of this heap.
	 * @throws NullPointerException If <code>key</code> is <code>null</code> and
	 *             this heap does not support <code>null</code> keys.
	 */
	public Entry<TKey, TValue> insert(final TKey key, final TValue value)
		throws ClassCastException, NullPointerException
	{
		PairingHeapEntry<TKey, TValue> entry = new PairingHeapEntry<TKey, TValue>(
				key, value, this.source);

		if (this.isEmpty())
		{
			// Check the key is usable before we store it.
			this.compareKeys(key, key);
			this.root = entry;
		}
		else
		{
			this.root = this.merge(this.root, entry);
		}

		this.size += 1;
		this.mod_count += 1;

		return entry;
	}

	/**
	 * Get the element with the minimum key.
	 *
	 * @return the element.
	 * @throws EmptyHeapException If this heap is empty.
	 * @see #extractMinimum()
	 */
	public Element<TKey, TValue> getMinimum()
		throws EmptyHeapException
	{
		if (this.isEmpty())
		{
			throw new EmptyHeapException();
		}

		return this.root.toElement();
	}

	/**
	 * Remove and return the element with the minimum key.
	 *
	 * @return the element.
	 * @throws EmptyHeapException If the heap is empty.
	 * @see #getMinimum()
	 */
	public Element<TKey, TValue> extractMinimum()
		throws EmptyHeapException
	{
		if (this.isEmpty())
		{
			throw new EmptyHeapException();
		}

		PairingHeapEntry<TKey, TValue> old_root = this.root;
		this.root = this.combineSiblings(old_root.child);

		this.size -= 1;
		this.mod_count += 1;

		old_root.detach();
		return old_root.toElement();
	}

	/**
	 * Delete the specified entry.
	 *
	 * @param e entry to delete.
	 * @return the deleted element.
	 * @throws InvalidHandleException If <code>e</code> is not held by this
	 *             heap.
	 * @throws NullPointerException If <code>e</code> is <code>null</code>.
	 */
	public Element<TKey, TValue> delete(final Heap.Entry<TKey, TValue> e)
		throws InvalidHandleException, NullPointerException
	{
		PairingHeapEntry<TKey, TValue> entry = this.narrow(e);

		if (entry == this.root)
		{
			return this.extractMinimum();
		}

		this.cut(entry);
		PairingHeapEntry<TKey, TValue> replacement = this
				.combineSiblings(entry.child);
		entry.child = null;
		this.root = this.merge(this.root, replacement);

		this.size -= 1;
		this.mod_count += 1;

		entry.detach();
		return entry.toElement();
	}

	/**
	 * Decrease the key of the given entry.
	 * <p>
	 * If <code>key</code> is greater than the entry's current key, nothing
	 * happens. Otherwise the entry is cut and merged back in as the first
	 * argument, so an entry whose new key equals the minimum becomes the root,
	 * even if its key did not actually change.
	 *
	 * @param e the entry for which to decrease the key.
	 * @param key the new key.
	 * @throws InvalidHandleException If <code>e</code> is not held by this
	 *             heap.
	 * @throws ClassCastException If the new key is not mutually comparable with
	 *             other keys in the heap.
	 * @throws NullPointerException If <code>e</code> is <code>null</code>.
	 */
	public void decreaseKey(final Heap.Entry<TKey, TValue> e, final TKey key)
		throws InvalidHandleException, ClassCastException,
		NullPointerException
	{
		PairingHeapEntry<TKey, TValue> entry = this.narrow(e);

		if (this.compareKeys(entry.getKey(), key) < 0)
		{
			// Not a decrease.
			return;
		}

		if (entry == this.root)
		{
			entry.setKey(key);
		}
		else
		{
			this.cut(entry);
			entry.setKey(key);
			this.root = this.merge(entry, this.root);
		}

		this.mod_count += 1;
	}

	/**
	 * Does this heap hold the specified entry?
	 *
	 * @param e entry to check.
	 * @throws NullPointerException If <code>e</code> is <code>null</code>.
	 * @return <code>true</code> if this heap holds <code>e</code>;
	 *         <code>false</code> otherwise.
	 */
	public boolean holdsEntry(final Heap.Entry<TKey, TValue> e)
		throws NullPointerException
	{
		if (e == null)
		{
			throw new NullPointerException();
		}

		if (e.getClass().equals(PairingHeapEntry.class) == false)
		{
			return false;
		}

		PairingHeapEntry<TKey, TValue> entry = (PairingHeapEntry<TKey, TValue>) e;

		// Use reference trickery.
		return entry.isContainedBy(this);
	}

	/**
	 * Union this heap with another heap.
	 * <p>
	 * The other heap is left empty (and usable); the entries it held are
	 * held by this heap afterward.
	 *
	 * @param other the other heap.
	 * @throws NullPointerException If <code>other</code> is <code>null</code>.
	 * @throws ClassCastException If <code>other</code> is not a
	 *             <code>PairingHeap</code>.
	 * @throws IllegalArgumentException If you attempt to union a heap with
	 *             itself, or with a heap using a different comparator.
	 */
	@SuppressWarnings("unchecked")
	public void union(final Heap<TKey, TValue> other)
		throws NullPointerException, ClassCastException,
		IllegalArgumentException
	{
		if (other == null)
		{
			throw new NullPointerException();
		}

		if (other == this)
		{
			throw new IllegalArgumentException();
		}

		if (other.getClass().equals(PairingHeap.class) == false)
		{
			throw new ClassCastException();
		}

		// erased cast - hence we have to suppress unchecked.
		PairingHeap<TKey, TValue> that = (PairingHeap<TKey, TValue>) other;

		if (Objects.equals(this.getComparator(), that.getComparator()) == false)
		{
			throw new IllegalArgumentException("Heaps are ordered differently");
		}

		this.root = this.merge(this.root, that.root);
		this.size += that.size;
		this.mod_count += 1;

		// All of that's entries now resolve to this heap.
		that.source.redirect(this.source);
		that.source = new HeapReference(that);
		that.root = null;
		that.size = 0;
		that.mod_count += 1;
	}

	/**
	 * Get an iterator over the entries of this heap.
	 *
	 * @return an iterator over the entry set.
	 */
	public Iterator<Heap.Entry<TKey, TValue>> iterator()
	{
		return new EntryIterator();
	}

	/**
	 * Check and narrow the specified handle.
	 *
	 * @param e the handle.
	 * @return the entry.
	 * @throws InvalidHandleException If <code>e</code> is not held by this
	 *             heap.
	 * @throws NullPointerException If <code>e</code> is <code>null</code>.
	 */
	private PairingHeapEntry<TKey, TValue> narrow(final Heap.Entry<TKey, TValue> e)
		throws InvalidHandleException, NullPointerException
	{
		if (this.holdsEntry(e) == false)
		{
			throw new InvalidHandleException(e);
		}

		return (PairingHeapEntry<TKey, TValue>) e;
	}

	/**
	 * Merge two roots. Neither may have a parent or siblings.
	 * <p>
	 * If the keys are equal, <code>x</code> ends up on top.
	 *
	 * @param x the first root, possibly <code>null</code>.
	 * @param y the second root, possibly <code>null</code>.
	 * @return the root of the merged tree.
	 */
	private PairingHeapEntry<TKey, TValue> merge(
			final PairingHeapEntry<TKey, TValue> x,
			final PairingHeapEntry<TKey, TValue> y)
	{
		if (x == null)
		{
			return y;
		}

		if (y == null)
		{
			return x;
		}

		PairingHeapEntry<TKey, TValue> parent = x;
		PairingHeapEntry<TKey, TValue> child = y;
		if (this.compare(y, x) < 0)
		{
			parent = y;
			child = x;
		}

		child.parent = parent;
		PairingHeapEntry<TKey, TValue> anchor = parent.child;
		if (anchor != null)
		{
			// Splice in just left of the anchor.
			child.left = anchor.left;
			anchor.left.right = child;
			child.right = anchor;
			anchor.left = child;
		}

		parent.child = child;
		return parent;
	}

	/**
	 * Combine the ring of siblings containing the specified entry into a single
	 * tree.
	 * <p>
	 * First pass: walk the ring left to right, merging adjacent pairs, and
	 * string the results (plus any odd one out) into a list linked through
	 * <code>left</code>/<code>right</code>. Second pass: fold that list right
	 * to left, merging the running result with its left neighbour.
	 *
	 * @param first an entry of the ring, or <code>null</code>.
	 * @return the new root, or <code>null</code> if <code>first</code> was.
	 */
	private PairingHeapEntry<TKey, TValue> combineSiblings(
			final PairingHeapEntry<TKey, TValue> first)
	{
		if (first == null)
		{
			return null;
		}

		PairingHeapEntry<TKey, TValue> iter = first;
		PairingHeapEntry<TKey, TValue> end = null;
		do
		{
			PairingHeapEntry<TKey, TValue> one = iter;
			PairingHeapEntry<TKey, TValue> two = iter.right;
			one.isolate();

			if (two == first)
			{
				// Odd one out.
				end = this.append(end, one);
				break;
			}

			iter = two.right;
			two.isolate();

			end = this.append(end, this.merge(one, two));
		}
		while (iter != first);

		PairingHeapEntry<TKey, TValue> result = end;
		iter = end.left;
		result.left = result;
		result.right = result;

		while (iter != null)
		{
			PairingHeapEntry<TKey, TValue> next = iter.left;
			iter.left = iter;
			iter.right = iter;
			result = this.merge(result, iter);
			iter = next;
		}

		return result;
	}

	/**
	 * Append an entry to the temporary list used by
	 * <code>combineSiblings()</code>.
	 *
	 * @param tail the current tail, or <code>null</code> if the list is empty.
	 * @param entry the entry to append.
	 * @return the new tail.
	 */
	private PairingHeapEntry<TKey, TValue> append(
			final PairingHeapEntry<TKey, TValue> tail,
			final PairingHeapEntry<TKey, TValue> entry)
	{
		entry.left = tail;
		if (tail != null)
		{
			tail.right = entry;
		}

		return entry;
	}

	/**
	 * Cut the specified entry (and its subtree) away from its parent. Does
	 * nothing to the root.
	 *
	 * @param entry the entry to cut.
	 */
	private void cut(final PairingHeapEntry<TKey, TValue> entry)
	{
		PairingHeapEntry<TKey, TValue> parent = entry.parent;
		if (parent == null)
		{
			return;
		}

		if (entry.right == entry)
		{
			// Only child.
			parent.child = null;
		}
		else
		{
			if (parent.child == entry)
			{
				parent.child = entry.left;
			}

			entry.left.right = entry.right;
			entry.right.left = entry.left;
		}

		entry.isolate();
	}

	/**
	 * Walk the whole tree and verify every structural invariant.
	 * <p>
	 * Used by the unit tests. Takes <code>O(n)</code> time.
	 *
	 * @throws IllegalStateException If the structure is damaged.
	 */
	void checkInvariants()
		throws IllegalStateException
	{
		if (this.root == null)
		{
			if (this.size != 0)
			{
				throw new IllegalStateException("Empty tree, size " + this.size);
			}

			return;
		}

		if (this.root.parent != null || this.root.left != this.root
				|| this.root.right != this.root)
		{
			throw new IllegalStateException("Root has a parent or siblings");
		}

		Deque<PairingHeapEntry<TKey, TValue>> stack = new ArrayDeque<PairingHeapEntry<TKey, TValue>>();
		stack.push(this.root);
		int count = 0;

		while (stack.isEmpty() == false)
		{
			PairingHeapEntry<TKey, TValue> entry = stack.pop();
			count += 1;

			if (entry.isContainedBy(this) == false)
			{
				throw new IllegalStateException("Foreign entry " + entry);
			}

			PairingHeapEntry<TKey, TValue> first = entry.child;
			if (first == null)
			{
				continue;
			}

			PairingHeapEntry<TKey, TValue> iter = first;
			do
			{
				if (iter.parent != entry)
				{
					throw new IllegalStateException("Bad parent link at " + iter);
				}

				if (iter.right.left != iter || iter.left.right != iter)
				{
					throw new IllegalStateException("Broken ring at " + iter);
				}

				if (this.compare(iter, entry) < 0)
				{
					throw new IllegalStateException("Heap order violated at "
							+ iter);
				}

				if (count + stack.size() > this.size)
				{
					throw new IllegalStateException("More entries than size "
							+ this.size);
				}

				stack.push(iter);
				iter = iter.right;
			}
			while (iter != first);
		}

		if (count != this.size)
		{
			throw new IllegalStateException(String.format(
					"Counted %1$d entries, size is %2$d", Integer.valueOf(count),
					Integer.valueOf(this.size)));
		}
	}

	/**
	 * Entry iterator class. Walks the tree in pre-order with an explicit
	 * stack.
	 * <p>
	 * This iterator does not support the <code>remove()</code> operation.
	 *
	 * @author Fran Lattanzio
	 * @version $Revision$ $Date$
	 */
	private class EntryIterator
		extends Object
		implements Iterator<Heap.Entry<TKey, TValue>>
	{

		/**
		 * The mod count.
		 */
		private final int my_mod_count;

		/**
		 * Entries still to visit.
		 */
		private final Deque<PairingHeapEntry<TKey, TValue>> pending;

		/**
		 * Constructor.
		 */
		EntryIterator()
		{
			super();

			this.my_mod_count = PairingHeap.this.mod_count;
			this.pending = new ArrayDeque<PairingHeapEntry<TKey, TValue>>();
			if (PairingHeap.this.root != null)
			{
				this.pending.push(PairingHeap.this.root);
			}
		}

		/**
		 * Does this iterator have another object?
		 *
		 * @return <code>true</code> if this iterator has another entry;
		 *         <code>false</code> otherwise.
		 * @throws ConcurrentModificationException If concurrent modification
		 *             occurs.
		 */
		public boolean hasNext()
			throws ConcurrentModificationException
		{
			if (this.my_mod_count != PairingHeap.this.mod_count)
			{
				throw new ConcurrentModificationException();
			}

			return (this.pending.isEmpty() == false);
		}

		/**
		 * Get the next object from this iterator.
		 *
		 * @return the next object.
		 * @throws NoSuchElementException If the iterator has no more elements.
		 * @throws ConcurrentModificationException If concurrent modification
		 *             occurs.
		 */
		public Heap.Entry<TKey, TValue> next()
			throws NoSuchElementException, ConcurrentModificationException
		{
			if (this.hasNext() == false)
			{
				throw new NoSuchElementException();
			}

			PairingHeapEntry<TKey, TValue> entry = this.pending.pop();
			PairingHeapEntry<TKey, TValue> first = entry.child;
			if (first != null)
			{
				PairingHeapEntry<TKey, TValue> iter = first;
				do
				{
					this.pending.push(iter);
					iter = iter.right;
				}
				while (iter != first);
			}

			return entry;
		}

	}

	/**
	 * Pairing heap entry.
	 *
	 * @param <TKey> the key type.
	 * @param <TValue> the value type.
	 * @author Fran Lattanzio
	 * @version $Revision$ $Date$
	 */
	private static final class PairingHeapEntry<TKey, TValue>
		extends AbstractLinkedHeap.AbstractLinkedHeapEntry<TKey, TValue>
		implements Heap.Entry<TKey, TValue>
	{

		/**
		 * The parent, <code>null</code> for the root.
		 */
		PairingHeapEntry<TKey, TValue> parent;

		/**
		 * Any one of the children.
		 */
		PairingHeapEntry<TKey, TValue> child;

		/**
		 * Left sibling in the ring.
		 */
		PairingHeapEntry<TKey, TValue> left;

		/**
		 * Right sibling in the ring.
		 */
		PairingHeapEntry<TKey, TValue> right;

		/**
		 * Constructor.
		 *
		 * @param key the key.
		 * @param val the value.
		 * @param source the source.
		 */
		PairingHeapEntry(final TKey key, final TValue val,
				final HeapReference source)
		{
			super(key, val, source);

			this.parent = null;
			this.child = null;
			this.left = this;
			this.right = this;
		}

		/**
		 * Drop the parent link and make this a singleton ring. The child ring
		 * is left alone.
		 */
		void isolate()
		{
			this.parent = null;
			this.left = this;
			this.right = this;
		}

		/**
		 * Unlink this entry completely and orphan it. After this, no heap holds
		 * it.
		 */
		void detach()
		{
			this.isolate();
			this.child = null;
			this.clearSourceReference();
		}

		/**
		 * Snapshot this entry.
		 *
		 * @return an immutable element.
		 */
		Element<TKey, TValue> toElement()
		{
			return new Element<TKey, TValue>(this.getKey(), this.getValue());
		}

	}

}
