package geoskel.store;

import static org.junit.jupiter.api.Assertions.*;

import geoskel.array.EagerArray;
import geoskel.array.NumericArray;
import geoskel.error.GeoSkelException;
import geoskel.error.NameCollisionException;
import geoskel.error.UnknownNameException;
import geoskel.schema.CoordGroup;
import geoskel.schema.DirType;
import geoskel.schema.Params;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SkeletonTypeTest
{
	@Nested
	@DisplayName("Deriving types")
	class Deriving
	{
		@Test
		@DisplayName("Bare types are never changed by derived ones")
		void copyOnWrite()
		{
			List<String> oBefore = SkeletonType.GRIDDED.fields(CoordGroup.ALL);
			SkeletonType oWave = SkeletonType.GRIDDED.addField("hs", Params.HS, CoordGroup.SPATIAL, 0.0);
			SkeletonType oPeriod = SkeletonType.GRIDDED.addField("tp", Params.TP, CoordGroup.SPATIAL, 0.0);

			assertTrue(SkeletonType.GRIDDED.isInitialState());
			assertFalse(oWave.isInitialState());
			assertEquals(oBefore, SkeletonType.GRIDDED.fields(CoordGroup.ALL));
			assertTrue(oWave.fields(CoordGroup.ALL).contains("hs"));
			assertFalse(oWave.fields(CoordGroup.ALL).contains("tp"));
			assertFalse(oPeriod.fields(CoordGroup.ALL).contains("hs"));
		}


		@Test
		@DisplayName("Names can only be used once")
		void collisions()
		{
			SkeletonType oWave = SkeletonType.GRIDDED.addField("hs", CoordGroup.SPATIAL, 0.0);
			assertThrows(NameCollisionException.class, () -> oWave.addField("hs", CoordGroup.GRID, 1.0));
			assertThrows(NameCollisionException.class, () -> oWave.addField("x", CoordGroup.SPATIAL, 0.0));
			assertThrows(NameCollisionException.class, () -> oWave.addCoordinate("hs", CoordGroup.GRID));
		}


		@Test
		@DisplayName("Invalid additions are rejected")
		void rejected()
		{
			assertThrows(GeoSkelException.class, () -> SkeletonType.POINT.addCoordinate("z", CoordGroup.SPATIAL));
			assertThrows(UnknownNameException.class, () -> SkeletonType.POINT.addMask("sea", "land", "topo"));
			assertThrows(UnknownNameException.class, () -> SkeletonType.POINT.addMagnitude("wind", "u", "v"));
		}


		@Test
		@DisplayName("Only stored fields can trigger a mask")
		void triggers()
		{
			SkeletonType oWind = SkeletonType.POINT.addField("u", CoordGroup.SPATIAL, 0.0)
				.addField("v", CoordGroup.SPATIAL, 0.0)
				.addMagnitude("wind", "u", "v");
			for (String sTrigger : new String[]{"wind", "inds"})
			{
				GeoSkelException oEx = assertThrows(GeoSkelException.class, () -> oWind.addMask("calm", null, sTrigger));
				assertFalse(oEx instanceof UnknownNameException);
			}
			SkeletonType oMasked = oWind.addMask("calm", CoordGroup.GRID, false, null, null, null, null, true, true);
			assertThrows(GeoSkelException.class, () -> oMasked.addMask("gust", null, "calm_mask"));
			assertTrue(oWind.addMask("calm", null, "u").fields(CoordGroup.ALL).contains("calm_mask"));
		}


		@Test
		@DisplayName("Accessors are listed in the order they were added")
		void accessors()
		{
			SkeletonType oType = SkeletonType.POINT.named("WindPoints")
				.addField("u", Params.X_WIND, CoordGroup.SPATIAL, 0.0)
				.addField("v", Params.Y_WIND, CoordGroup.SPATIAL, 0.0)
				.addMask("calm", null, null)
				.addMagnitude("wind", Params.WIND, "u", "v", "wind_dir", Params.WIND_DIR, DirType.FROM);
			assertEquals("WindPoints", oType.getName());
			assertEquals(Arrays.asList("u", "v", "calm_mask", "wind", "wind_dir"), oType.accessors());
			assertTrue(SkeletonType.POINT.accessors().isEmpty());
		}


		@Test
		@DisplayName("Time comes first in canonical order")
		void time()
		{
			SkeletonType oGridTime = SkeletonType.GRIDDED.addTime(true).addCoordinate("freq", CoordGroup.GRID);
			assertEquals(Arrays.asList("time", "y", "x", "freq"), oGridTime.coordinates(CoordGroup.ALL));
			assertEquals(Arrays.asList("time", "y", "x", "freq"), oGridTime.coordinates(CoordGroup.GRID));

			SkeletonType oPointTime = SkeletonType.POINT.addTime(false);
			assertEquals(Arrays.asList("inds"), oPointTime.coordinates(CoordGroup.GRID));
			assertEquals(Arrays.asList("time"), oPointTime.coordinates(CoordGroup.GRIDPOINT));
		}
	}


	@Test
	@DisplayName("Descriptors are available without a container")
	void delegates()
	{
		SkeletonType oType = SkeletonType.GRIDDED.addField("topo", Params.TOPO, CoordGroup.SPATIAL, 999.0);
		assertEquals(Params.TOPO, oType.physicalParameter("topo"));
		assertEquals(999.0, oType.defaultValue("topo"));
		assertEquals(CoordGroup.SPATIAL, oType.coordinateGroup("topo"));
		assertEquals(CoordGroup.SPATIAL, oType.coordinateGroup("x"));
	}


	@Test
	@DisplayName("Fields can be filled from arrays named differently")
	void fromStore()
	{
		SkeletonType oType = SkeletonType.GRIDDED.addField("hs", Params.HS, CoordGroup.SPATIAL, 0.0)
			.addField("tp", Params.TP, CoordGroup.SPATIAL, 0.0);
		HashMap<String, double[]> oCoords = new HashMap();
		oCoords.put("lon", new double[]{5, 6, 7});
		oCoords.put("lat", new double[]{60, 61});
		HashMap<String, String> oFieldMap = new HashMap();
		oFieldMap.put("hs", "HS");
		oFieldMap.put("tp", "TP");
		HashMap<String, NumericArray> oData = new HashMap();
		oData.put("HS", EagerArray.of(new double[][]{{1, 2}, {3, 4}, {5, 6}}));
		Map<String, List<String>> oDims = new HashMap();
		oDims.put("HS", Arrays.asList("lon", "lat"));

		Skeleton oGrid = oType.fromStore(oCoords, oFieldMap, oData, oDims, null);
		assertArrayEquals(new int[]{2, 3}, oGrid.get("hs").getShape());
		assertArrayEquals(new double[]{1, 3, 5, 2, 4, 6}, oGrid.get("hs").toDoubleArray());
		assertFalse(oGrid.isSet("tp"));
		assertArrayEquals(new double[]{0, 0, 0, 0, 0, 0}, oGrid.get("tp", true).toDoubleArray());
	}
}
