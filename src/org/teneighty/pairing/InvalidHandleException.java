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

/**
 * Thrown when a handle is used against a heap that does not hold it: the entry
 * was already removed, the heap was cleared, or the handle came from some
 * other heap altogether.
 *
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 * @see Heap#holdsEntry(Heap.Entry)
 */
public class InvalidHandleException
	extends IllegalArgumentException
{

	/**
	 * Serial version UID.
	 */
	private static final long serialVersionUID = 982341L;

	/**
	 * Constructor.
	 *
	 * @param entry the offending handle.
	 */
	public InvalidHandleException(final Heap.Entry<?, ?> entry)
	{
		super(String.format("Entry %1$s is not held by this heap", entry));
	}

}
