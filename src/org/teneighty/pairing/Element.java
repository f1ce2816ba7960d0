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
 * An immutable key/value snapshot, as returned by
 * {@link Heap#getMinimum()}, {@link Heap#extractMinimum()} and
 * {@link Heap#delete(Heap.Entry)}.
 * <p>
 * Two elements are equal if their keys and values are equal.
 *
 * @param <TKey> the key type.
 * @param <TValue> the value type.
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
public final class Element<TKey, TValue>
	extends Object
{

	/**
	 * The key.
	 */
	private final TKey key;

	/**
	 * The value.
	 */
	private final TValue value;

	/**
	 * Constructor.
	 *
	 * @param key the key.
	 * @param value the value.
	 */
	public Element(final TKey key, final TValue value)
	{
		super();

		this.key = key;
		this.value = value;
	}

	/**
	 * Get the key.
	 *
	 * @return the key.
	 */
	public TKey getKey()
	{
		return this.key;
	}

	/**
	 * Get the value.
	 *
	 * @return the value.
	 */
	public TValue getValue()
	{
		return this.value;
	}

	/**
	 * Compare for equality.
	 *
	 * @param other the other object.
	 * @return <code>true</code> if <code>other</code> is an element with an
	 *         equal key and value.
	 */
	@Override
	public boolean equals(final Object other)
	{
		if (other == null)
		{
			return false;
		}

		if (other == this)
		{
			return true;
		}

		if (other.getClass().equals(Element.class) == false)
		{
			return false;
		}

		Element<?, ?> that = (Element<?, ?>) other;
		return (this.key == null ? that.key == null : this.key.equals(that.key))
				&& (this.value == null ? that.value == null : this.value
						.equals(that.value));
	}

	/**
	 * Get a hashcode, inline with equals.
	 *
	 * @return the hashcode.
	 */
	@Override
	public int hashCode()
	{
		int hash = (this.key == null) ? 0 : this.key.hashCode();
		return (31 * hash) + ((this.value == null) ? 0 : this.value.hashCode());
	}

	/**
	 * Get a string representation of this element.
	 *
	 * @return a string.
	 */
	@Override
	public String toString()
	{
		return String.format("(%1$s, %2$s)", this.key, this.value);
	}

}
