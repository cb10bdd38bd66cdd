package geoskel.array;

import java.util.Arrays;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import ucar.ma2.Array;
import ucar.ma2.DataType;
import ucar.ma2.Index;
import ucar.ma2.IndexIterator;

/**
 * Concrete array backed by a {@link ucar.ma2.Array} of doubles or ints.
 */
public class EagerArray implements NumericArray
{
	/**
	 * Backing storage
	 */
	private final Array m_oArray;

	/**
	 * True if the storage holds ints
	 */
	private final boolean m_bInteger;


	/**
	 * Wraps a CDM array. Any numeric element type is accepted; types other
	 * than int are read as doubles.
	 * @param oArray backing array
	 */
	public EagerArray(Array oArray)
	{
		DataType oType = oArray.getDataType();
		if (oType == DataType.INT)
		{
			m_oArray = oArray;
			m_bInteger = true;
		}
		else if (oType == DataType.DOUBLE)
		{
			m_oArray = oArray;
			m_bInteger = false;
		}
		else
		{
			Array oCopy = Array.factory(DataType.DOUBLE, oArray.getShape());
			IndexIterator oSrc = oArray.getIndexIterator();
			IndexIterator oDst = oCopy.getIndexIterator();
			while (oSrc.hasNext())
				oDst.setDoubleNext(oSrc.getDoubleNext());
			m_oArray = oCopy;
			m_bInteger = false;
		}
	}


	/**
	 * Creates an array from row major values
	 * @param dValues values, copied
	 * @param nShape dimension lengths whose product equals the value count
	 * @return the new array
	 */
	public static EagerArray of(double[] dValues, int... nShape)
	{
		if (Shapes.size(nShape) != dValues.length)
			throw new IllegalArgumentException(String.format("%d values do not fit shape %s", dValues.length, Shapes.toString(nShape)));
		return new EagerArray(Array.factory(DataType.DOUBLE, nShape.clone(), dValues.clone()));
	}


	/**
	 * @param dValues values, copied
	 * @return one dimensional array of the values
	 */
	public static EagerArray of(double[] dValues)
	{
		return of(dValues, dValues.length);
	}


	/**
	 * @param dRows rectangular rows, copied
	 * @return two dimensional array with one row per element
	 */
	public static EagerArray of(double[][] dRows)
	{
		int nRows = dRows.length;
		int nCols = nRows == 0 ? 0 : dRows[0].length;
		double[] dFlat = new double[nRows * nCols];
		for (int nRow = 0; nRow < nRows; nRow++)
		{
			if (dRows[nRow].length != nCols)
				throw new IllegalArgumentException("Rows must all have the same length");
			System.arraycopy(dRows[nRow], 0, dFlat, nRow * nCols, nCols);
		}
		return of(dFlat, nRows, nCols);
	}


	/**
	 * Creates an integer array from row major values
	 * @param nValues values, copied
	 * @param nShape dimension lengths
	 * @return the new array
	 */
	public static EagerArray ofInts(int[] nValues, int... nShape)
	{
		if (Shapes.size(nShape) != nValues.length)
			throw new IllegalArgumentException(String.format("%d values do not fit shape %s", nValues.length, Shapes.toString(nShape)));
		return new EagerArray(Array.factory(DataType.INT, nShape.clone(), nValues.clone()));
	}


	/**
	 * Creates a boolean valued integer array, 1 for true and 0 for false
	 * @param bValues values
	 * @param nShape dimension lengths
	 * @return the new array
	 */
	public static EagerArray ofBooleans(boolean[] bValues, int... nShape)
	{
		int[] nValues = new int[bValues.length];
		for (int nIndex = 0; nIndex < bValues.length; nIndex++)
			nValues[nIndex] = bValues[nIndex] ? 1 : 0;
		return ofInts(nValues, nShape);
	}


	/**
	 * @param nShape dimension lengths
	 * @param dValue fill value
	 * @return array of the shape with every element set to the value
	 */
	public static EagerArray full(int[] nShape, double dValue)
	{
		double[] dValues = new double[Shapes.size(nShape)];
		Arrays.fill(dValues, dValue);
		return of(dValues, nShape);
	}


	/**
	 * @return the backing CDM array
	 */
	public Array getArray()
	{
		return m_oArray;
	}


	/**
	 * @param nIndex position, one entry per dimension
	 * @return element at the position
	 */
	public double getDouble(int... nIndex)
	{
		Index oIndex = m_oArray.getIndex();
		oIndex.set(nIndex);
		return m_oArray.getDouble(oIndex);
	}


	@Override
	public int[] getShape()
	{
		return m_oArray.getShape();
	}


	@Override
	public int getRank()
	{
		return m_oArray.getRank();
	}


	@Override
	public int getSize()
	{
		return (int)m_oArray.getSize();
	}


	@Override
	public boolean isInteger()
	{
		return m_bInteger;
	}


	@Override
	public boolean isRealized()
	{
		return true;
	}


	@Override
	public EagerArray map(DoubleUnaryOperator oOp)
	{
		Array oRet = Array.factory(DataType.DOUBLE, m_oArray.getShape());
		IndexIterator oSrc = m_oArray.getIndexIterator();
		IndexIterator oDst = oRet.getIndexIterator();
		while (oSrc.hasNext())
			oDst.setDoubleNext(oOp.applyAsDouble(oSrc.getDoubleNext()));
		return new EagerArray(oRet);
	}


	@Override
	public EagerArray combine(NumericArray oOther, DoubleBinaryOperator oOp)
	{
		int[] nShape = m_oArray.getShape();
		if (!Arrays.equals(nShape, oOther.getShape()))
			throw new IllegalArgumentException(String.format("Cannot combine shapes %s and %s", Shapes.toString(nShape), Shapes.toString(oOther.getShape())));
		Array oRet = Array.factory(DataType.DOUBLE, nShape);
		IndexIterator oLeft = m_oArray.getIndexIterator();
		IndexIterator oRight = oOther.realize().m_oArray.getIndexIterator();
		IndexIterator oDst = oRet.getIndexIterator();
		while (oLeft.hasNext())
			oDst.setDoubleNext(oOp.applyAsDouble(oLeft.getDoubleNext(), oRight.getDoubleNext()));
		return new EagerArray(oRet);
	}


	@Override
	public EagerArray permute(int[] nAxes)
	{
		Shapes.permute(m_oArray.getShape(), nAxes); // validates the axes
		return new EagerArray(m_oArray.permute(nAxes).copy());
	}


	@Override
	public EagerArray squeeze()
	{
		return new EagerArray(m_oArray.reduce().copy());
	}


	@Override
	public EagerArray reshape(int[] nShape)
	{
		if (Shapes.size(nShape) != getSize())
			throw new IllegalArgumentException(String.format("Cannot reshape %s to %s", Shapes.toString(getShape()), Shapes.toString(nShape)));
		return new EagerArray(m_oArray.reshape(nShape));
	}


	@Override
	public EagerArray take(int nAxis, int[] nIndices)
	{
		int[] nShape = Shapes.take(m_oArray.getShape(), nAxis, nIndices);
		Array oRet = Array.factory(m_oArray.getDataType(), nShape);
		if (oRet.getSize() == 0)
			return new EagerArray(oRet);
		Index oSrc = m_oArray.getIndex();
		IndexIterator oDst = oRet.getIndexIterator();
		int[] nCounter = new int[nShape.length];
		do
		{
			int[] nPos = nCounter.clone();
			nPos[nAxis] = nIndices[nCounter[nAxis]];
			oSrc.set(nPos);
			oDst.setDoubleNext(m_oArray.getDouble(oSrc));
		}
		while (Shapes.next(nCounter, nShape));
		return new EagerArray(oRet);
	}


	@Override
	public EagerArray reduce(int nAxis)
	{
		Shapes.reduce(m_oArray.getShape(), nAxis); // validates the axis
		return new EagerArray(m_oArray.reduce(nAxis).copy());
	}


	/**
	 * Joins two arrays along an axis. The result holds integers only if both
	 * inputs do.
	 * @param oFirst values placed first
	 * @param oSecond values appended after them
	 * @param nAxis axis to join along, all other lengths must agree
	 * @return the joined array
	 */
	public static EagerArray concat(NumericArray oFirst, NumericArray oSecond, int nAxis)
	{
		int[] nFirst = oFirst.getShape();
		int[] nSecond = oSecond.getShape();
		boolean bFits = nFirst.length == nSecond.length && nAxis >= 0 && nAxis < nFirst.length;
		for (int nIndex = 0; bFits && nIndex < nFirst.length; nIndex++)
			bFits = nIndex == nAxis || nFirst[nIndex] == nSecond[nIndex];
		if (!bFits)
			throw new IllegalArgumentException(String.format("Cannot join %s and %s along axis %d", Shapes.toString(nFirst), Shapes.toString(nSecond), nAxis));

		int[] nShape = nFirst.clone();
		nShape[nAxis] += nSecond[nAxis];
		DataType oType = oFirst.isInteger() && oSecond.isInteger() ? DataType.INT : DataType.DOUBLE;
		Array oRet = Array.factory(oType, nShape);
		if (oRet.getSize() == 0)
			return new EagerArray(oRet);
		EagerArray oA = oFirst.realize();
		EagerArray oB = oSecond.realize();
		IndexIterator oDst = oRet.getIndexIterator();
		int[] nCounter = new int[nShape.length];
		do
		{
			if (nCounter[nAxis] < nFirst[nAxis])
				oDst.setDoubleNext(oA.getDouble(nCounter));
			else
			{
				int[] nPos = nCounter.clone();
				nPos[nAxis] -= nFirst[nAxis];
				oDst.setDoubleNext(oB.getDouble(nPos));
			}
		}
		while (Shapes.next(nCounter, nShape));
		return new EagerArray(oRet);
	}


	/**
	 * Copies the array and overwrites a block of it. The block is given by
	 * the positions picked along every axis; its values are read in row major
	 * order.
	 * @param nIndices for each axis, the positions written
	 * @param oBlock values, as many as the block has elements
	 * @return the modified copy
	 */
	public EagerArray assign(int[][] nIndices, NumericArray oBlock)
	{
		int[] nShape = m_oArray.getShape();
		if (nIndices.length != nShape.length)
			throw new IllegalArgumentException(String.format("Need positions for %d axes, got %d", nShape.length, nIndices.length));
		int[] nBlock = new int[nShape.length];
		for (int nAxis = 0; nAxis < nShape.length; nAxis++)
			nBlock[nAxis] = Shapes.take(nShape, nAxis, nIndices[nAxis])[nAxis];
		if (Shapes.size(nBlock) != oBlock.getSize())
			throw new IllegalArgumentException(String.format("Block %s cannot take %d values", Shapes.toString(nBlock), oBlock.getSize()));

		Array oRet = m_oArray.copy();
		if (oBlock.getSize() == 0)
			return new EagerArray(oRet);
		Index oIndex = oRet.getIndex();
		double[] dValues = oBlock.toDoubleArray();
		int[] nCounter = new int[nShape.length];
		int[] nPos = new int[nShape.length];
		int nFlat = 0;
		do
		{
			for (int nAxis = 0; nAxis < nPos.length; nAxis++)
				nPos[nAxis] = nIndices[nAxis][nCounter[nAxis]];
			oIndex.set(nPos);
			oRet.setDouble(oIndex, dValues[nFlat++]);
		}
		while (Shapes.next(nCounter, nBlock));
		return new EagerArray(oRet);
	}


	@Override
	public EagerArray transpose()
	{
		if (getRank() != 2)
			throw new IllegalArgumentException(String.format("Transpose needs a rank 2 array, got %s", Shapes.toString(getShape())));
		return new EagerArray(m_oArray.transpose(0, 1).copy());
	}


	@Override
	public EagerArray toInteger()
	{
		if (m_bInteger)
			return this;
		Array oRet = Array.factory(DataType.INT, m_oArray.getShape());
		IndexIterator oSrc = m_oArray.getIndexIterator();
		IndexIterator oDst = oRet.getIndexIterator();
		while (oSrc.hasNext())
			oDst.setIntNext((int)Math.round(oSrc.getDoubleNext()));
		return new EagerArray(oRet);
	}


	@Override
	public EagerArray toDouble()
	{
		if (!m_bInteger)
			return this;
		return map(DoubleUnaryOperator.identity());
	}


	@Override
	public EagerArray realize()
	{
		return this;
	}


	@Override
	public NumericArray defer()
	{
		return new LazyArray(getShape(), m_bInteger, () -> this);
	}


	@Override
	public double[] toDoubleArray()
	{
		double[] dRet = new double[getSize()];
		IndexIterator oIt = m_oArray.getIndexIterator();
		int nIndex = 0;
		while (oIt.hasNext())
			dRet[nIndex++] = oIt.getDoubleNext();
		return dRet;
	}


	@Override
	public String toString()
	{
		return String.format("EagerArray%s %s", Shapes.toString(getShape()), Arrays.toString(toDoubleArray()));
	}
}
