package geoskel.array;

import java.util.Arrays;

/**
 * Helpers for array shapes given as {@code int[]} lengths, outermost
 * dimension first.
 */
public abstract class Shapes
{
	/**
	 * Number of elements described by the shape. The empty shape describes a
	 * single scalar.
	 * @param nShape dimension lengths
	 * @return product of the lengths
	 */
	public static int size(int[] nShape)
	{
		int nSize = 1;
		for (int nLen : nShape)
			nSize *= nLen;
		return nSize;
	}


	/**
	 * @param nShape dimension lengths
	 * @return the shape with every length one dimension removed
	 */
	public static int[] squeeze(int[] nShape)
	{
		int nCount = 0;
		for (int nLen : nShape)
		{
			if (nLen != 1)
				++nCount;
		}
		int[] nRet = new int[nCount];
		nCount = 0;
		for (int nLen : nShape)
		{
			if (nLen != 1)
				nRet[nCount++] = nLen;
		}
		return nRet;
	}


	/**
	 * Reorders a shape the way {@link NumericArray#permute(int[])} reorders
	 * the axes of an array.
	 * @param nShape dimension lengths
	 * @param nAxes for each output axis, the input axis it is taken from
	 * @return permuted shape
	 */
	public static int[] permute(int[] nShape, int[] nAxes)
	{
		if (nAxes.length != nShape.length)
			throw new IllegalArgumentException(String.format("Cannot permute %s with axes %s", Arrays.toString(nShape), Arrays.toString(nAxes)));
		boolean[] bSeen = new boolean[nShape.length];
		int[] nRet = new int[nShape.length];
		for (int nIndex = 0; nIndex < nAxes.length; nIndex++)
		{
			int nAxis = nAxes[nIndex];
			if (nAxis < 0 || nAxis >= nShape.length || bSeen[nAxis])
				throw new IllegalArgumentException(String.format("Invalid axis order %s", Arrays.toString(nAxes)));
			bSeen[nAxis] = true;
			nRet[nIndex] = nShape[nAxis];
		}
		return nRet;
	}


	/**
	 * @param nShape rank two shape
	 * @return the shape with its two lengths swapped
	 */
	public static int[] transpose(int[] nShape)
	{
		if (nShape.length != 2)
			throw new IllegalArgumentException(String.format("Transpose needs a rank 2 shape, got %s", Arrays.toString(nShape)));
		return new int[]{nShape[1], nShape[0]};
	}



	/**
	 * Shape after picking elements along one axis
	 * @param nShape dimension lengths
	 * @param nAxis axis to pick along
	 * @param nIndices positions along the axis, each within its length
	 * @return the shape with the axis length replaced by the pick count
	 * @throws IndexOutOfBoundsException if a position is outside the axis
	 */
	public static int[] take(int[] nShape, int nAxis, int[] nIndices)
	{
		if (nAxis < 0 || nAxis >= nShape.length)
			throw new IllegalArgumentException(String.format("No axis %d in %s", nAxis, toString(nShape)));
		for (int nIndex : nIndices)
		{
			if (nIndex < 0 || nIndex >= nShape[nAxis])
				throw new IndexOutOfBoundsException(String.format("Index %d outside axis %d of %s", nIndex, nAxis, toString(nShape)));
		}
		int[] nRet = nShape.clone();
		nRet[nAxis] = nIndices.length;
		return nRet;
	}


	/**
	 * @param nShape dimension lengths
	 * @param nAxis axis of length one
	 * @return the shape without the axis
	 */
	public static int[] reduce(int[] nShape, int nAxis)
	{
		if (nAxis < 0 || nAxis >= nShape.length || nShape[nAxis] != 1)
			throw new IllegalArgumentException(String.format("Axis %d of %s cannot be removed", nAxis, toString(nShape)));
		int[] nRet = new int[nShape.length - 1];
		for (int nIndex = 0, nOut = 0; nIndex < nShape.length; nIndex++)
		{
			if (nIndex != nAxis)
				nRet[nOut++] = nShape[nIndex];
		}
		return nRet;
	}


	/**
	 * Steps a position through a shape in row major order, last axis
	 * fastest
	 * @param nCounter position, updated in place
	 * @param nShape dimension lengths
	 * @return false once the position wrapped around past the last element
	 */
	public static boolean next(int[] nCounter, int[] nShape)
	{
		for (int nAxis = nShape.length - 1; nAxis >= 0; nAxis--)
		{
			if (++nCounter[nAxis] < nShape[nAxis])
				return true;
			nCounter[nAxis] = 0;
		}
		return false;
	}


	public static String toString(int[] nShape)
	{
		StringBuilder sBuf = new StringBuilder("(");
		for (int nIndex = 0; nIndex < nShape.length; nIndex++)
		{
			if (nIndex > 0)
				sBuf.append(", ");
			sBuf.append(nShape[nIndex]);
		}
		if (nShape.length == 1)
			sBuf.append(',');
		return sBuf.append(')').toString();
	}
}
