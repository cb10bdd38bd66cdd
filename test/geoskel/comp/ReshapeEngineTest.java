package geoskel.comp;

import static org.junit.jupiter.api.Assertions.*;

import geoskel.array.EagerArray;
import geoskel.array.NumericArray;
import geoskel.error.IrreconcilableShapeException;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ReshapeEngineTest
{
	private static final List<String> DIMS = Arrays.asList("time", "y", "x");

	private final ReshapeEngine m_oEngine = new ReshapeEngine(true);


	private static EagerArray range(int... nShape)
	{
		int nSize = 1;
		for (int nLen : nShape)
			nSize *= nLen;
		double[] dValues = new double[nSize];
		for (int nIndex = 0; nIndex < nSize; nIndex++)
			dValues[nIndex] = nIndex;
		return EagerArray.of(dValues, nShape);
	}


	@Nested
	@DisplayName("Named axes")
	class NamedAxes
	{
		@Test
		@DisplayName("Axes are permuted into canonical order")
		void permute()
		{
			NumericArray oOut = m_oEngine.align("hs", range(3, 2), Arrays.asList("x", "y"), Arrays.asList("y", "x"), new int[]{2, 3});
			assertArrayEquals(new int[]{2, 3}, oOut.getShape());
			assertArrayEquals(new double[]{0, 2, 4, 1, 3, 5}, oOut.toDoubleArray());
		}


		@Test
		@DisplayName("Trivial axes are dropped and restored")
		void trivial()
		{
			NumericArray oOut = m_oEngine.align("hs", range(3, 2), Arrays.asList("x", "y"), DIMS, new int[]{1, 2, 3});
			assertArrayEquals(new int[]{1, 2, 3}, oOut.getShape());
			assertArrayEquals(new double[]{0, 2, 4, 1, 3, 5}, oOut.toDoubleArray());
		}


		@Test
		@DisplayName("Unknown axes of length above one fail")
		void unknown()
		{
			assertThrows(IrreconcilableShapeException.class,
				() -> m_oEngine.align("hs", range(3, 2), Arrays.asList("x", "freq"), Arrays.asList("y", "x"), new int[]{2, 3}));
		}
	}


	@Nested
	@DisplayName("Unnamed axes")
	class UnnamedAxes
	{
		@Test
		@DisplayName("Aligning a canonical array returns it unchanged")
		void idempotent()
		{
			EagerArray oIn = range(1, 2, 3);
			assertSame(oIn, m_oEngine.align("hs", oIn, null, DIMS, new int[]{1, 2, 3}));
		}


		@Test
		@DisplayName("Missing length one axes are restored")
		void expand()
		{
			NumericArray oOut = m_oEngine.align("hs", range(2, 3), null, DIMS, new int[]{1, 2, 3});
			assertArrayEquals(new int[]{1, 2, 3}, oOut.getShape());
		}


		@Test
		@DisplayName("Rank two arrays may be transposed")
		void transpose()
		{
			NumericArray oOut = m_oEngine.align("hs", range(3, 2), null, Arrays.asList("y", "x"), new int[]{2, 3});
			assertArrayEquals(new double[]{0, 2, 4, 1, 3, 5}, oOut.toDoubleArray());
		}


		@Test
		@DisplayName("Transposing can be switched off")
		void noTranspose()
		{
			ReshapeEngine oStrict = new ReshapeEngine(false);
			assertThrows(IrreconcilableShapeException.class,
				() -> oStrict.align("hs", range(3, 2), null, Arrays.asList("y", "x"), new int[]{2, 3}));
		}


		@Test
		@DisplayName("Incompatible shapes fail with both shapes")
		void irreconcilable()
		{
			IrreconcilableShapeException oEx = assertThrows(IrreconcilableShapeException.class,
				() -> m_oEngine.align("hs", range(5, 5), null, Arrays.asList("y", "x"), new int[]{2, 3}));
			assertArrayEquals(new int[]{5, 5}, oEx.getGivenShape());
			assertArrayEquals(new int[]{2, 3}, oEx.getExpectedShape());
		}


		@Test
		@DisplayName("Lazy input stays lazy")
		void lazy()
		{
			NumericArray oOut = m_oEngine.align("hs", range(3, 2).defer(), null, Arrays.asList("y", "x"), new int[]{2, 3});
			assertFalse(oOut.isRealized());
			assertArrayEquals(new double[]{0, 2, 4, 1, 3, 5}, oOut.toDoubleArray());
		}
	}
}
