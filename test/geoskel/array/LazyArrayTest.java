package geoskel.array;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LazyArrayTest
{
	private static LazyArray counting(AtomicInteger oCount, double[] dValues)
	{
		return new LazyArray(new int[]{dValues.length}, false, () ->
		{
			oCount.incrementAndGet();
			return EagerArray.of(dValues);
		});
	}


	@Test
	@DisplayName("Nothing is computed until realize")
	void deferred()
	{
		AtomicInteger oCount = new AtomicInteger();
		NumericArray oArray = counting(oCount, new double[]{1, 2, 3}).map(dVal -> dVal * 2).reshape(new int[]{3, 1});
		assertEquals(0, oCount.get());
		assertArrayEquals(new int[]{3, 1}, oArray.getShape());
		assertFalse(oArray.isRealized());

		assertArrayEquals(new double[]{2, 4, 6}, oArray.realize().toDoubleArray());
		assertEquals(1, oCount.get());
		oArray.realize();
		assertEquals(1, oCount.get());
	}


	@Test
	@DisplayName("Lazy and eager operations give the same values")
	void equivalence()
	{
		double[] dValues = new double[]{1, 2, 3, 4, 5, 6};
		NumericArray oEager = EagerArray.of(dValues, 2, 3).transpose().map(Math::sqrt);
		NumericArray oLazy = EagerArray.of(dValues, 2, 3).defer().transpose().map(Math::sqrt);
		assertArrayEquals(oEager.getShape(), oLazy.getShape());
		assertArrayEquals(oEager.toDoubleArray(), oLazy.toDoubleArray(), 1e-12);
	}


	@Test
	@DisplayName("Picking positions stays deferred")
	void take()
	{
		AtomicInteger oCount = new AtomicInteger();
		NumericArray oArray = counting(oCount, new double[]{1, 2, 3, 4}).take(0, new int[]{3, 1});
		assertArrayEquals(new int[]{2}, oArray.getShape());
		assertEquals(0, oCount.get());
		assertArrayEquals(new double[]{4, 2}, oArray.toDoubleArray());
		assertThrows(IndexOutOfBoundsException.class, () -> counting(oCount, new double[]{1}).take(0, new int[]{1}));
	}


	@Test
	@DisplayName("A computation producing the wrong shape fails on realize")
	void wrongShape()
	{
		LazyArray oArray = new LazyArray(new int[]{4}, false, () -> EagerArray.of(new double[]{1}));
		assertThrows(IllegalStateException.class, oArray::realize);
	}


	@Test
	@DisplayName("Array mode defers or realizes")
	void arrayMode()
	{
		ArrayMode oMode = new ArrayMode(false);
		NumericArray oEager = EagerArray.of(new double[]{1});
		assertTrue(oMode.apply(oEager.defer()) instanceof EagerArray);
		oMode.activate();
		assertTrue(oMode.apply(oEager) instanceof LazyArray);
		assertTrue(oMode.apply(oEager, Boolean.TRUE) instanceof EagerArray);
		assertSame(oEager, oMode.apply(oEager, Boolean.FALSE));
		assertNull(oMode.apply(null));
	}
}
