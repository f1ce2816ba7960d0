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
 * Static helpers for the orderings a heap can be built with. A heap built with
 * an inverted ordering is a max-heap; nothing else about it changes.
 * <p>
 * The comparators returned here have value semantics for <code>equals()</code>,
 * so two heaps built from separate calls to, say, <code>reverseOrder()</code>
 * may still be unioned.
 *
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
public final class Comparators
	extends Object
{

	/**
	 * Get a comparator that imposes the natural (ascending) order.
	 *
	 * @param <T> the type of the comparator.
	 * @return a natural order comparator.
	 */
	public static <T extends Comparable<? super T>> Comparator<T> naturalOrder()
	{
		return new NaturalOrderComparator<T>();
	}

	/**
	 * Get a comparator that imposes the reverse of the natural order. A heap
	 * using it hands out its largest key first.
	 *
	 * @param <T> the type of the comparator.
	 * @return a reverse order comparator.
	 */
	public static <T extends Comparable<? super T>> Comparator<T> reverseOrder()
	{
		return invertComparator(Comparators.<T> naturalOrder());
	}

	/**
	 * Invert the action of the specified comparator.
	 *
	 * @param <T> the type of the comparator.
	 * @param comp the comparator.
	 * @return an inverted comparator.
	 * @throws NullPointerException If <code>comp</code> is <code>null</code>.
	 */
	public static <T> Comparator<T> invertComparator(final Comparator<T> comp)
		throws NullPointerException
	{
		if (comp == null)
		{
			throw new NullPointerException("comp");
		}

		return new InvertedComparator<T>(comp);
	}

	/**
	 * A natural order comparator.
	 *
	 * @param <T> the comparator type.
	 * @author Fran Lattanzio
	 * @version $Revision$ $Date$
	 */
	private static final class NaturalOrderComparator<T extends Comparable<? super T>>
		extends Object
		implements Comparator<T>
	{

		/**
		 * Constructor.
		 */
		NaturalOrderComparator()
		{
			super();
		}

		/**
		 * Compare two objects.
		 *
		 * @param o1 the first object.
		 * @param o2 the second object.
		 * @return like you'd expect from a
		 *         {@link java.util.Comparator#compare(Object, Object)} call.
		 * @throws NullPointerException If <code>o1</code> or <code>o2</code>
		 *             are <code>null</code>.
		 */
		public int compare(final T o1, final T o2)
			throws NullPointerException
		{
			if (o1 == null || o2 == null)
			{
				throw new NullPointerException();
			}

			return o1.compareTo(o2);
		}

		/**
		 * All instances are equal; the class is stateless.
		 *
		 * @param other the other object.
		 * @return <code>true</code> if <code>other</code> is of the same
		 *         class.
		 */
		@Override
		public boolean equals(final Object other)
		{
			if (other == null)
			{
				return false;
			}

			return this.getClass().equals(other.getClass());
		}

		/**
		 * Constant, in accordance with equals.
		 *
		 * @return the hashcode.
		 */
		@Override
		public int hashCode()
		{
			return 1;
		}

		/**
		 * Get a string representation of this object.
		 *
		 * @return a string.
		 */
		@Override
		public String toString()
		{
			return "Natural order";
		}

	}

	/**
	 * An inverted comparator.
	 *
	 * @param <T> the comparator type.
	 * @author Fran Lattanzio
	 * @version $Revision$ $Date$
	 */
	private static final class InvertedComparator<T>
		extends Object
		implements Comparator<T>
	{

		/**
		 * The backing comparator.
		 */
		private final Comparator<T> comp;

		/**
		 * Constructor.
		 *
		 * @param comp the comparator.
		 */
		InvertedComparator(final Comparator<T> comp)
		{
			super();

			this.comp = comp;
		}

		/**
		 * Compare the specified objects.
		 *
		 * @param o1 the first object
		 * @param o2 the second object.
		 * @return the opposite of what the underlying comparator does.
		 */
		public int compare(final T o1, final T o2)
		{
			return this.comp.compare(o2, o1);
		}

		/**
		 * Compare for equality.
		 *
		 * @param other the other object.
		 * @return true if <code>other</code> inverts an equal comparator.
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

			if (other.getClass().equals(InvertedComparator.class))
			{
				InvertedComparator<?> that = (InvertedComparator<?>) other;
				return this.comp.equals(that.comp);
			}

			return false;
		}

		/**
		 * Get a hashcode, inline with equals.
		 *
		 * @return the hashcode.
		 */
		@Override
		public int hashCode()
		{
			return ~this.comp.hashCode();
		}

		/**
		 * Produce a string version of this class.
		 *
		 * @return a string.
		 */
		@Override
		public String toString()
		{
			return String.format("Inverse of %1$s", this.comp.toString());
		}

	}

	/**
	 * Constructor. Instances of this class are not allowed.
	 *
	 * @throws InternalError Always.
	 */
	private Comparators()
			throws InternalError
	{
		throw new InternalError("Instances are not allowed");
	}

}
