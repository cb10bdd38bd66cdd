package geoskel.store;

import static org.junit.jupiter.api.Assertions.*;

import geoskel.array.EagerArray;
import geoskel.array.LazyArray;
import geoskel.array.NumericArray;
import geoskel.error.LengthMismatchException;
import geoskel.geosrv.GeoUtil;
import geoskel.schema.CoordGroup;
import geoskel.schema.DirType;
import geoskel.schema.Params;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PointSkeletonTest
{
	private static Map<String, double[]> coords(String sX, double[] dX, String sY, double[] dY)
	{
		HashMap<String, double[]> oCoords = new HashMap();
		if (dX != null)
			oCoords.put(sX, dX);
		if (dY != null)
			oCoords.put(sY, dY);
		return oCoords;
	}


	@Nested
	@DisplayName("Construction")
	class Construction
	{
		@Test
		@DisplayName("Positions are fields over the point index")
		void positions()
		{
			Skeleton oPoints = new PointSkeleton(coords("x", new double[]{1, 2, 3}, "y", new double[]{4, 5, 6}));
			assertFalse(oPoints.isGridded());
			assertEquals(Arrays.asList("inds"), oPoints.coords(CoordGroup.ALL));
			assertArrayEquals(new double[]{0, 1, 2}, oPoints.get("inds").toDoubleArray());
			assertArrayEquals(new double[]{4, 5, 6}, oPoints.get("y").toDoubleArray());
			assertEquals(Arrays.asList("x", "y"), oPoints.fields(CoordGroup.SPATIAL));
		}


		@Test
		@DisplayName("Single values are repeated")
		void broadcast()
		{
			Skeleton oPoints = new PointSkeleton(coords("lon", new double[]{1, 2, 3}, "lat", new double[]{60}));
			assertArrayEquals(new double[]{60, 60, 60}, oPoints.lat());
			assertEquals(Arrays.asList("lon", "lat"), oPoints.fields(CoordGroup.SPATIAL));
		}


		@Test
		@DisplayName("Lengths must agree")
		void mismatch()
		{
			assertThrows(LengthMismatchException.class, () -> new PointSkeleton(coords("x", new double[]{1, 2}, "y", new double[]{1, 2, 3})));
			assertThrows(LengthMismatchException.class, () -> new PointSkeleton(coords("x", new double[]{1, 2}, "y", null)));
		}
	}


	@Test
	@DisplayName("Spherical points convert to the detected zone and back")
	void roundTrip()
	{
		double[] dLon = new double[]{14.0, 15.0, 16.5};
		double[] dLat = new double[]{-1.0, 0.5, 2.0};
		Skeleton oPoints = new PointSkeleton(coords("lon", dLon, "lat", dLat));
		assertEquals(33, oPoints.zone().getNumber());
		double[][] dXy = oPoints.xy();
		assertTrue(dXy[1][0] < 0.0);
		Skeleton oCart = new PointSkeleton(SkeletonType.POINT, coords("x", dXy[0], "y", dXy[1]), oPoints.zone());
		assertArrayEquals(dLon, oCart.lon(), 1e-5);
		assertArrayEquals(dLat, oCart.lat(), 1e-5);
		assertArrayEquals(new double[]{0.0, dXy[0][1] - dXy[0][0], dXy[0][2] - dXy[0][0]}, oPoints.x(false, false, true, null), 1e-6);
	}


	@Test
	@DisplayName("Nearest points can be made unique")
	void yank()
	{
		Skeleton oPoints = new PointSkeleton(coords("lon", new double[]{0, 10, 20}, "lat", new double[]{0, 0, 0}));
		Skeleton.YankResult oResult = oPoints.yankPoint(new double[]{9, 11, 19}, new double[]{1, -1, 0}, null, null, true);
		assertArrayEquals(new int[]{1, 2}, oResult.getInds());
		assertEquals(GeoUtil.distanceFromLatLon(1, 9, 0, 10), oResult.getDistances()[0], 1e-9);
	}


	@Test
	@DisplayName("Points can be taken from a masked grid")
	void fromSkeleton()
	{
		SkeletonType oType = SkeletonType.GRIDDED.addField("topo", Params.TOPO, CoordGroup.SPATIAL, 0.0)
			.addMask("sea", "land", "topo");
		Skeleton oGrid = oType.create(coords("lon", new double[]{5, 6, 7}, "lat", new double[]{60, 61}));
		oGrid.set("topo", new double[][]{{-1, 10, 20}, {-5, -5, 30}});
		boolean[] bSea = oGrid.getMask("sea_mask");
		assertArrayEquals(new boolean[]{false, true, true, false, false, true}, bSea);

		PointSkeleton oPoints = PointSkeleton.fromSkeleton(oGrid, bSea);
		assertArrayEquals(new double[]{6, 7, 7}, oPoints.lon());
		assertArrayEquals(new double[]{60, 60, 61}, oPoints.lat());
		assertEquals(oGrid.zone(), oPoints.zone());

		double[][] dLand = oGrid.maskedPoints("land_mask");
		assertArrayEquals(new double[]{5, 5, 6}, dLand[0]);
	}



	@Test
	@DisplayName("Writing a trigger field recomputes both masks")
	void seaMask()
	{
		SkeletonType oType = SkeletonType.POINT.addField("hs", Params.HS, CoordGroup.SPATIAL, 0.0)
			.addMask("sea", "land", "hs");
		Skeleton oPoints = oType.create(coords("x", new double[]{0, 1, 2}, "y", new double[]{0, 0, 0}));
		oPoints.set("hs", new double[]{-1, 0, 5});
		assertArrayEquals(new boolean[]{false, true, true}, oPoints.getMask("sea_mask"));
		assertArrayEquals(new boolean[]{true, false, false}, oPoints.getMask("land_mask"));

		oPoints.set("land_mask", new boolean[]{false, false, true});
		assertArrayEquals(new boolean[]{true, true, false}, oPoints.getMask("sea_mask"));
		assertTrue(oPoints.get("sea_mask").isInteger());
	}


	@Test
	@DisplayName("Magnitude and direction rewrite the components")
	void wind()
	{
		SkeletonType oType = SkeletonType.POINT.addField("u", Params.X_WIND, CoordGroup.SPATIAL, 0.0)
			.addField("v", Params.Y_WIND, CoordGroup.SPATIAL, 0.0)
			.addMagnitude("wind", Params.WIND, "u", "v", "wind_dir", Params.WIND_DIR, DirType.FROM);
		Skeleton oPoints = oType.create(coords("lon", new double[]{5, 6}, "lat", new double[]{60, 60}));
		oPoints.set("u", 1.0);
		oPoints.setMagnitude("wind", 10.0);
		oPoints.setDirection("wind_dir", 0.0, DirType.FROM);

		assertArrayEquals(new double[]{0, 0}, oPoints.get("u").toDoubleArray(), 1e-9);
		assertArrayEquals(new double[]{-10, -10}, oPoints.get("v").toDoubleArray(), 1e-9);
		assertArrayEquals(new double[]{10, 10}, oPoints.get("wind").toDoubleArray(), 1e-9);
		assertArrayEquals(new double[]{180, 180}, oPoints.get("wind_dir", false, DirType.TO, null).toDoubleArray(), 1e-9);
	}


	@Nested
	@DisplayName("Lazy mode")
	class Lazy
	{
		private final AtomicInteger m_oCalls = new AtomicInteger();


		private LazyArray counted(double... dValues)
		{
			return new LazyArray(new int[]{dValues.length}, false, () ->
			{
				m_oCalls.incrementAndGet();
				return EagerArray.of(dValues);
			});
		}


		private Skeleton points()
		{
			SkeletonType oType = SkeletonType.POINT.addField("hs", Params.HS, CoordGroup.SPATIAL, 0.0);
			return oType.create(coords("x", new double[]{0, 1, 2}, "y", new double[]{0, 0, 0}));
		}


		@Test
		@DisplayName("Values are computed once and only when realized")
		void deferred()
		{
			Skeleton oPoints = points();
			oPoints.activateLazy();
			assertTrue(oPoints.isLazy());
			oPoints.set("hs", counted(1, 2, 3));
			NumericArray oStored = oPoints.get("hs");
			assertFalse(oStored.isRealized());
			assertArrayEquals(new int[]{3}, oStored.getShape());
			assertEquals(0, m_oCalls.get());

			NumericArray oReal = oPoints.get("hs", false, null, true);
			assertTrue(oReal.isRealized());
			assertArrayEquals(new double[]{1, 2, 3}, oReal.toDoubleArray());
			oPoints.get("hs", false, null, true);
			assertEquals(1, m_oCalls.get());
		}


		@Test
		@DisplayName("Lazy and eager containers hold the same values")
		void equivalent()
		{
			Skeleton oLazy = points();
			oLazy.activateLazy();
			oLazy.set("hs", counted(4, 5, 6));
			Skeleton oEager = points();
			oEager.set("hs", counted(4, 5, 6));
			assertTrue(oEager.get("hs").isRealized());
			assertArrayEquals(oEager.get("hs").toDoubleArray(), oLazy.get("hs").toDoubleArray());

			oLazy.deactivateLazy(true);
			assertFalse(oLazy.isLazy());
			assertTrue(oLazy.get("hs").isRealized());
		}
	}
}
