package geoskel.array;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EagerArrayTest
{
	@Nested
	@DisplayName("Construction")
	class Construction
	{
		@Test
		@DisplayName("Rows become a two dimensional row major array")
		void rows()
		{
			EagerArray oArray = EagerArray.of(new double[][]{{1, 2, 3}, {4, 5, 6}});
			assertArrayEquals(new int[]{2, 3}, oArray.getShape());
			assertEquals(6.0, oArray.getDouble(1, 2));
			assertArrayEquals(new double[]{1, 2, 3, 4, 5, 6}, oArray.toDoubleArray());
		}


		@Test
		@DisplayName("Value count must fit the shape")
		void badShape()
		{
			assertThrows(IllegalArgumentException.class, () -> EagerArray.of(new double[]{1, 2, 3}, 2, 2));
		}


		@Test
		@DisplayName("Booleans are stored as integers")
		void booleans()
		{
			EagerArray oArray = EagerArray.ofBooleans(new boolean[]{true, false, true}, 3);
			assertTrue(oArray.isInteger());
			assertArrayEquals(new double[]{1, 0, 1}, oArray.toDoubleArray());
		}
	}


	@Nested
	@DisplayName("Shape operations")
	class ShapeOps
	{
		@Test
		@DisplayName("Transpose swaps rows and columns")
		void transpose()
		{
			EagerArray oArray = EagerArray.of(new double[][]{{1, 2, 3}, {4, 5, 6}}).transpose();
			assertArrayEquals(new int[]{3, 2}, oArray.getShape());
			assertArrayEquals(new double[]{1, 4, 2, 5, 3, 6}, oArray.toDoubleArray());
		}


		@Test
		@DisplayName("Permute reorders axes and copies values")
		void permute()
		{
			EagerArray oArray = EagerArray.of(new double[]{0, 1, 2, 3, 4, 5}, 1, 2, 3).permute(new int[]{2, 0, 1});
			assertArrayEquals(new int[]{3, 1, 2}, oArray.getShape());
			assertArrayEquals(new double[]{0, 3, 1, 4, 2, 5}, oArray.toDoubleArray());
		}


		@Test
		@DisplayName("Squeeze drops length one axes")
		void squeeze()
		{
			EagerArray oArray = EagerArray.of(new double[]{1, 2, 3}, 1, 3, 1).squeeze();
			assertArrayEquals(new int[]{3}, oArray.getShape());
		}


		@Test
		@DisplayName("Combine requires equal shapes")
		void combine()
		{
			EagerArray oA = EagerArray.of(new double[]{1, 2});
			EagerArray oB = EagerArray.of(new double[]{3, 4});
			assertArrayEquals(new double[]{4, 6}, oA.combine(oB, Double::sum).toDoubleArray());
			assertThrows(IllegalArgumentException.class, () -> oA.combine(EagerArray.of(new double[]{1, 2, 3}), Double::sum));
		}


		@Test
		@DisplayName("Integer conversion rounds")
		void toInteger()
		{
			EagerArray oArray = EagerArray.of(new double[]{0.4, 1.6}).toInteger();
			assertTrue(oArray.isInteger());
			assertArrayEquals(new double[]{0, 2}, oArray.toDoubleArray());
		}
	}


	@Nested
	@DisplayName("Picking and joining")
	class Picking
	{
		private final EagerArray m_oGrid = EagerArray.of(new double[][]{{1, 2, 3}, {4, 5, 6}});


		@Test
		@DisplayName("Take picks along one axis in the given order")
		void take()
		{
			EagerArray oCols = m_oGrid.take(1, new int[]{2, 0});
			assertArrayEquals(new int[]{2, 2}, oCols.getShape());
			assertArrayEquals(new double[]{3, 1, 6, 4}, oCols.toDoubleArray());
			assertArrayEquals(new double[]{4, 5, 6}, m_oGrid.take(0, new int[]{1}).reduce(0).toDoubleArray());
			assertThrows(IndexOutOfBoundsException.class, () -> m_oGrid.take(1, new int[]{3}));
			assertThrows(IllegalArgumentException.class, () -> m_oGrid.reduce(1));
		}


		@Test
		@DisplayName("Concat keeps integers only when both inputs are")
		void concat()
		{
			EagerArray oJoined = EagerArray.concat(m_oGrid, EagerArray.of(new double[][]{{7}, {8}}), 1);
			assertArrayEquals(new int[]{2, 4}, oJoined.getShape());
			assertArrayEquals(new double[]{1, 2, 3, 7, 4, 5, 6, 8}, oJoined.toDoubleArray());
			assertFalse(oJoined.isInteger());

			EagerArray oInts = EagerArray.concat(EagerArray.ofInts(new int[]{1}, 1), EagerArray.ofInts(new int[]{0, 1}, 2), 0);
			assertTrue(oInts.isInteger());
			assertArrayEquals(new double[]{1, 0, 1}, oInts.toDoubleArray());
			assertThrows(IllegalArgumentException.class, () -> EagerArray.concat(m_oGrid, EagerArray.of(new double[]{1, 2}), 0));
		}


		@Test
		@DisplayName("Assign writes a block into a copy")
		void assign()
		{
			EagerArray oRet = m_oGrid.assign(new int[][]{{1}, {0, 2}}, EagerArray.of(new double[]{-1, -2}));
			assertArrayEquals(new double[]{1, 2, 3, -1, 5, -2}, oRet.toDoubleArray());
			assertArrayEquals(new double[]{1, 2, 3, 4, 5, 6}, m_oGrid.toDoubleArray());
			assertThrows(IllegalArgumentException.class, () -> m_oGrid.assign(new int[][]{{0}, {0}}, EagerArray.of(new double[]{1, 2})));
		}
	}
}
