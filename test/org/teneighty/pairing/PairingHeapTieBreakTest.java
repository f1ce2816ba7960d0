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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Pins down which of several equal-key entries comes out first. The order
 * depends on the exact argument order of every internal merge and on where a
 * cut leaves the parent's child anchor, so these tests fix the extraction
 * order of identities rather than keys.
 * <p>
 * Inserting equal keys under a smaller root makes them all children of that
 * root, and each new child becomes the anchor, so walking the child ring
 * rightward from the anchor visits them newest first.
 *
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
public class PairingHeapTieBreakTest
{

	/**
	 * Drain the heap, checking the structure after every extraction.
	 *
	 * @param heap the heap.
	 * @return the values, in extraction order.
	 */
	private static List<String> drainValues(
			final PairingHeap<Integer, String> heap)
	{
		List<String> values = new ArrayList<String>();
		while (heap.isEmpty() == false)
		{
			values.add(heap.extractMinimum().getValue());
			heap.checkInvariants();
		}

		return values;
	}

	/**
	 * Ring e, d, c, b, a under r. Pairing gives (e over d), (c over b) and a
	 * alone; folding from the right gives a over c, then a over e.
	 */
	@Test
	public void combinePairsLeftFirstAndFoldsFromTheRight()
	{
		PairingHeap<Integer, String> heap = new PairingHeap<Integer, String>();
		heap.insert(0, "r");
		for (String value : new String[] { "a", "b", "c", "d", "e" })
		{
			heap.insert(5, value);
		}

		assertEquals(Arrays.asList("r", "a", "e", "c", "d", "b"),
				drainValues(heap));
	}

	/**
	 * With only the pairing pass involved (even ring, one pair), the left
	 * member of the pair wins.
	 */
	@Test
	public void pairKeepsLeftMemberOnTop()
	{
		PairingHeap<Integer, String> heap = new PairingHeap<Integer, String>();
		heap.insert(0, "r");
		heap.insert(5, "a");
		heap.insert(5, "b");

		heap.extractMinimum();

		assertEquals("b", heap.getMinimum().getValue());
		assertEquals(Arrays.asList("b", "a"), drainValues(heap));
	}

	/**
	 * Deleting the anchor c from ring c, b, a moves the anchor to its left
	 * neighbour a, so the next combine starts at a.
	 */
	@Test
	public void cutMovesAnchorToLeftSibling()
	{
		PairingHeap<Integer, String> heap = new PairingHeap<Integer, String>();
		heap.insert(0, "r");
		heap.insert(5, "a");
		heap.insert(5, "b");
		Heap.Entry<Integer, String> c = heap.insert(5, "c");

		assertEquals(new Element<Integer, String>(5, "c"), heap.delete(c));
		heap.checkInvariants();

		assertEquals(Arrays.asList("r", "a", "b"), drainValues(heap));
	}

	/**
	 * Root b holds ring d, a, and d holds c; all four keys are equal. Deleting
	 * d re-merges its child c with the root, and the root keeps its place.
	 */
	@Test
	public void deleteKeepsRootOnTieWithReplacement()
	{
		PairingHeap<Integer, String> heap = new PairingHeap<Integer, String>();
		heap.insert(0, "p");
		heap.insert(1, "a");
		heap.insert(1, "b");
		heap.insert(1, "c");
		Heap.Entry<Integer, String> d = heap.insert(1, "d");

		assertEquals("p", heap.extractMinimum().getValue());
		assertEquals("b", heap.getMinimum().getValue());

		heap.delete(d);
		heap.checkInvariants();

		assertEquals("b", heap.getMinimum().getValue());
		assertEquals(Arrays.asList("b", "c", "a"), drainValues(heap));
	}

}
