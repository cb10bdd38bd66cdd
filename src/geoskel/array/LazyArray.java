package geoskel.array;

import java.util.Arrays;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Supplier;

/**
 * Array whose values come from a deferred computation. Operations on a lazy
 * array build new lazy arrays and compute nothing; the shape of every result
 * is worked out immediately. The computation runs the first time
 * {@link #realize()} is called and its result is kept.
 */
public class LazyArray implements NumericArray
{
	/**
	 * Shape of the values the computation produces
	 */
	private final int[] m_nShape;

	/**
	 * True if the computation produces integers
	 */
	private final boolean m_bInteger;

	/**
	 * Deferred computation, dropped once it has run
	 */
	private Supplier<EagerArray> m_oSource;

	/**
	 * Result of the computation once realized
	 */
	private EagerArray m_oValue;


	/**
	 * Creates a deferred array
	 * @param nShape shape the computation will produce
	 * @param bInteger true if the computation produces integers
	 * @param oSource the computation
	 */
	public LazyArray(int[] nShape, boolean bInteger, Supplier<EagerArray> oSource)
	{
		m_nShape = nShape.clone();
		m_bInteger = bInteger;
		m_oSource = oSource;
	}


	@Override
	public int[] getShape()
	{
		return m_nShape.clone();
	}


	@Override
	public int getRank()
	{
		return m_nShape.length;
	}


	@Override
	public int getSize()
	{
		return Shapes.size(m_nShape);
	}


	@Override
	public boolean isInteger()
	{
		return m_bInteger;
	}


	@Override
	public synchronized boolean isRealized()
	{
		return m_oValue != null;
	}


	@Override
	public NumericArray map(DoubleUnaryOperator oOp)
	{
		return new LazyArray(m_nShape, false, () -> realize().map(oOp));
	}


	@Override
	public NumericArray combine(NumericArray oOther, DoubleBinaryOperator oOp)
	{
		if (!Arrays.equals(m_nShape, oOther.getShape()))
			throw new IllegalArgumentException(String.format("Cannot combine shapes %s and %s", Shapes.toString(m_nShape), Shapes.toString(oOther.getShape())));
		return new LazyArray(m_nShape, false, () -> realize().combine(oOther, oOp));
	}


	@Override
	public NumericArray permute(int[] nAxes)
	{
		return new LazyArray(Shapes.permute(m_nShape, nAxes), m_bInteger, () -> realize().permute(nAxes));
	}


	@Override
	public NumericArray squeeze()
	{
		return new LazyArray(Shapes.squeeze(m_nShape), m_bInteger, () -> realize().squeeze());
	}


	@Override
	public NumericArray reshape(int[] nShape)
	{
		if (Shapes.size(nShape) != getSize())
			throw new IllegalArgumentException(String.format("Cannot reshape %s to %s", Shapes.toString(m_nShape), Shapes.toString(nShape)));
		int[] nCopy = nShape.clone();
		return new LazyArray(nCopy, m_bInteger, () -> realize().reshape(nCopy));
	}


	@Override
	public NumericArray take(int nAxis, int[] nIndices)
	{
		int[] nPicks = nIndices.clone();
		return new LazyArray(Shapes.take(m_nShape, nAxis, nPicks), m_bInteger, () -> realize().take(nAxis, nPicks));
	}


	@Override
	public NumericArray reduce(int nAxis)
	{
		return new LazyArray(Shapes.reduce(m_nShape, nAxis), m_bInteger, () -> realize().reduce(nAxis));
	}


	@Override
	public NumericArray transpose()
	{
		return new LazyArray(Shapes.transpose(m_nShape), m_bInteger, () -> realize().transpose());
	}


	@Override
	public NumericArray toInteger()
	{
		if (m_bInteger)
			return this;
		return new LazyArray(m_nShape, true, () -> realize().toInteger());
	}


	@Override
	public NumericArray toDouble()
	{
		if (!m_bInteger)
			return this;
		return new LazyArray(m_nShape, false, () -> realize().toDouble());
	}


	/**
	 * Runs the deferred computation, once, and returns its result
	 * @return the concrete values
	 */
	@Override
	public synchronized EagerArray realize()
	{
		if (m_oValue == null)
		{
			EagerArray oValue = m_oSource.get();
			if (!Arrays.equals(m_nShape, oValue.getShape()))
				throw new IllegalStateException(String.format("Deferred computation produced %s, expected %s", Shapes.toString(oValue.getShape()), Shapes.toString(m_nShape)));
			m_oValue = oValue;
			m_oSource = null;
		}
		return m_oValue;
	}


	@Override
	public NumericArray defer()
	{
		return this;
	}


	@Override
	public double[] toDoubleArray()
	{
		return realize().toDoubleArray();
	}


	@Override
	public String toString()
	{
		return String.format("LazyArray%s%s", Shapes.toString(m_nShape), isRealized() ? " realized" : "");
	}
}
