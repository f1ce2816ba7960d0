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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Union tests for {@link PairingHeap}, mostly about which heap holds which
 * handle afterward.
 *
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
public class PairingHeapUnionTest
{

	/**
	 * Fill a heap.
	 *
	 * @param heap the heap.
	 * @param keys the keys; each key is also used as the value.
	 * @return the handles, in key order of the arguments.
	 */
	private static List<Heap.Entry<Integer, Integer>> fill(
			final PairingHeap<Integer, Integer> heap, final int... keys)
	{
		List<Heap.Entry<Integer, Integer>> handles = new ArrayList<Heap.Entry<Integer, Integer>>();
		for (int key : keys)
		{
			handles.add(heap.insert(key, key));
		}

		return handles;
	}

	/**
	 * Drain a heap.
	 *
	 * @param heap the heap.
	 * @return the keys, in extraction order.
	 */
	private static List<Integer> drain(final PairingHeap<Integer, Integer> heap)
	{
		List<Integer> keys = new ArrayList<Integer>();
		while (heap.isEmpty() == false)
		{
			keys.add(heap.extractMinimum().getKey());
		}

		return keys;
	}

	@Test
	public void unionMergesContentsAndEmptiesOther()
	{
		PairingHeap<Integer, Integer> a = new PairingHeap<Integer, Integer>();
		PairingHeap<Integer, Integer> b = new PairingHeap<Integer, Integer>();
		fill(a, 5, 1, 9);
		fill(b, 3, 7);

		a.union(b);

		a.checkInvariants();
		b.checkInvariants();
		assertEquals(5, a.getSize());
		assertEquals(0, b.getSize());
		assertTrue(b.isEmpty());
		assertThrows(EmptyHeapException.class, () -> b.getMinimum());
		assertEquals(Arrays.asList(1, 3, 5, 7, 9), drain(a));
	}

	@Test
	public void absorbedHandlesMoveToReceivingHeap()
	{
		PairingHeap<Integer, Integer> a = new PairingHeap<Integer, Integer>();
		PairingHeap<Integer, Integer> b = new PairingHeap<Integer, Integer>();
		fill(a, 5, 1, 9);
		List<Heap.Entry<Integer, Integer>> fromB = fill(b, 3, 7);

		a.union(b);

		for (Heap.Entry<Integer, Integer> handle : fromB)
		{
			assertTrue(a.holdsEntry(handle));
			assertFalse(b.holdsEntry(handle));
		}

		assertThrows(InvalidHandleException.class, () -> b.delete(fromB.get(0)));

		a.decreaseKey(fromB.get(1), 0);
		a.checkInvariants();
		assertEquals(new Element<Integer, Integer>(0, 7), a.getMinimum());

		assertEquals(new Element<Integer, Integer>(3, 3), a.delete(fromB.get(0)));
		a.checkInvariants();
		assertEquals(Arrays.asList(0, 1, 5, 9), drain(a));
	}

	@Test
	public void emptiedHeapIsReusable()
	{
		PairingHeap<Integer, Integer> a = new PairingHeap<Integer, Integer>();
		PairingHeap<Integer, Integer> b = new PairingHeap<Integer, Integer>();
		fill(a, 2);
		List<Heap.Entry<Integer, Integer>> old = fill(b, 1);

		a.union(b);
		Heap.Entry<Integer, Integer> fresh = b.insert(4, 4);

		assertTrue(b.holdsEntry(fresh));
		assertFalse(a.holdsEntry(fresh));
		assertFalse(b.holdsEntry(old.get(0)));
		assertEquals(1, b.getSize());
		assertEquals(2, a.getSize());
		b.checkInvariants();
		a.checkInvariants();
	}

	@Test
	public void unionWithEmptyHeaps()
	{
		PairingHeap<Integer, Integer> a = new PairingHeap<Integer, Integer>();
		PairingHeap<Integer, Integer> b = new PairingHeap<Integer, Integer>();

		a.union(b);
		assertTrue(a.isEmpty());

		fill(b, 4, 2);
		a.union(b);
		assertEquals(2, a.getSize());

		a.union(new PairingHeap<Integer, Integer>());
		a.checkInvariants();
		assertEquals(Arrays.asList(2, 4), drain(a));
	}

	@Test
	public void chainedUnionsFollowEveryRedirect()
	{
		PairingHeap<Integer, Integer> a = new PairingHeap<Integer, Integer>();
		PairingHeap<Integer, Integer> b = new PairingHeap<Integer, Integer>();
		PairingHeap<Integer, Integer> c = new PairingHeap<Integer, Integer>();
		List<Heap.Entry<Integer, Integer>> fromA = fill(a, 10, 20);
		List<Heap.Entry<Integer, Integer>> fromB = fill(b, 30, 40);
		fill(c, 50);

		a.union(b);
		c.union(a);

		c.checkInvariants();
		assertEquals(5, c.getSize());
		for (Heap.Entry<Integer, Integer> handle : fromB)
		{
			assertTrue(c.holdsEntry(handle));
			assertFalse(a.holdsEntry(handle));
			assertFalse(b.holdsEntry(handle));
		}

		assertTrue(c.holdsEntry(fromA.get(1)));

		// Clearing the final owner orphans everything, however it got there.
		c.clear();
		for (Heap.Entry<Integer, Integer> handle : fromB)
		{
			assertFalse(c.holdsEntry(handle));
		}

		assertFalse(c.holdsEntry(fromA.get(0)));
		assertThrows(InvalidHandleException.class, () -> c.delete(fromB.get(0)));
	}

	@Test
	public void clearAfterUnionOrphansAbsorbedHandles()
	{
		PairingHeap<Integer, Integer> a = new PairingHeap<Integer, Integer>();
		PairingHeap<Integer, Integer> b = new PairingHeap<Integer, Integer>();
		fill(a, 1);
		List<Heap.Entry<Integer, Integer>> fromB = fill(b, 2);

		a.union(b);
		a.clear();

		assertFalse(a.holdsEntry(fromB.get(0)));
		assertFalse(b.holdsEntry(fromB.get(0)));

		// And the fresh a does not claim them either.
		a.insert(3, 3);
		assertFalse(a.holdsEntry(fromB.get(0)));
	}

	@Test
	public void invalidUnionsLeaveBothHeapsAlone()
	{
		PairingHeap<Integer, Integer> a = new PairingHeap<Integer, Integer>();
		PairingHeap<Integer, Integer> reversed = new PairingHeap<Integer, Integer>(
				Comparators.<Integer> reverseOrder());
		fill(a, 1, 2);
		fill(reversed, 3);

		assertThrows(IllegalArgumentException.class, () -> a.union(a));
		assertThrows(NullPointerException.class, () -> a.union(null));
		assertThrows(IllegalArgumentException.class, () -> a.union(reversed));
		assertThrows(ClassCastException.class,
				() -> a.union(Heaps.synchronizedHeap(reversed)));

		assertEquals(2, a.getSize());
		assertEquals(1, reversed.getSize());
		a.checkInvariants();
		reversed.checkInvariants();
	}

	@Test
	public void equalComparatorsFromSeparateCallsMayUnion()
	{
		PairingHeap<Integer, Integer> a = new PairingHeap<Integer, Integer>(
				Comparators.<Integer> reverseOrder());
		PairingHeap<Integer, Integer> b = new PairingHeap<Integer, Integer>(
				Comparators.<Integer> reverseOrder());
		fill(a, 1, 8);
		fill(b, 5);

		a.union(b);

		assertEquals(Arrays.asList(8, 5, 1), drain(a));
	}

	@Test
	public void tiesOnUnionKeepReceivingRoot()
	{
		PairingHeap<Integer, String> a = new PairingHeap<Integer, String>();
		PairingHeap<Integer, String> b = new PairingHeap<Integer, String>();
		a.insert(1, "a");
		b.insert(1, "b");

		a.union(b);

		assertEquals("a", a.getMinimum().getValue());
	}

}
