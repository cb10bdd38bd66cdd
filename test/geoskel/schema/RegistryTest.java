package geoskel.schema;

import static org.junit.jupiter.api.Assertions.*;

import geoskel.error.InvalidRangeException;
import geoskel.error.MissingCoordinateException;
import geoskel.error.NameCollisionException;
import geoskel.error.UnknownNameException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RegistryTest
{
	private Registry m_oRegistry;


	@BeforeEach
	void setUp()
	{
		m_oRegistry = new Registry();
		m_oRegistry.addCoordinate(new Coordinate("y", CoordGroup.SPATIAL));
		m_oRegistry.addCoordinate(new Coordinate("x", CoordGroup.SPATIAL));
		m_oRegistry.addCoordinate(new Coordinate("freq", CoordGroup.GRIDPOINT));
		m_oRegistry.addCoordinate(new Coordinate("time", Params.TIME, CoordGroup.GRID));
		m_oRegistry.addVar(new DataVar("hs", Params.HS, CoordGroup.GRID, 0.0));
		m_oRegistry.addVar(new DataVar("spec", Params.SPEC, CoordGroup.ALL, 0.0));
		m_oRegistry.addVar(new DataVar("topo", Params.TOPO, CoordGroup.SPATIAL, 999.0));
	}


	@Nested
	@DisplayName("Registration")
	class Registration
	{
		@Test
		@DisplayName("Names are unique across all kinds")
		void collision()
		{
			assertThrows(NameCollisionException.class, () -> m_oRegistry.addVar(new DataVar("x", CoordGroup.GRID, 0.0)));
			assertThrows(NameCollisionException.class, () -> m_oRegistry.addCoordinate(new Coordinate("hs", CoordGroup.GRID)));
			assertThrows(NameCollisionException.class, () -> m_oRegistry.addMask(new GridMask("hs", CoordGroup.GRID, false, null)));
		}


		@Test
		@DisplayName("Mask ranges must be increasing")
		void invalidRange()
		{
			assertThrows(InvalidRangeException.class,
				() -> m_oRegistry.addMask(new GridMask("bad", CoordGroup.GRID, false, null, "hs", 5.0, 5.0, true, true)));
			assertFalse(m_oRegistry.has("bad"));
		}


		@Test
		@DisplayName("A mask registers its opposite")
		void opposite()
		{
			m_oRegistry.addMask(new GridMask("sea_mask", CoordGroup.GRID, true, "land_mask"));
			GridMask oLand = m_oRegistry.getMask("land_mask");
			assertFalse(oLand.isPrimary());
			assertEquals("sea_mask", oLand.getOpposite());
			assertEquals(Arrays.asList("sea_mask"), m_oRegistry.masks(CoordGroup.ALL, true));
			assertEquals(Arrays.asList("sea_mask", "land_mask"), m_oRegistry.masks(CoordGroup.ALL, false));
		}


		@Test
		@DisplayName("Magnitude components must be stored fields")
		void components()
		{
			assertThrows(UnknownNameException.class,
				() -> m_oRegistry.addMagnitude(new Magnitude("ff", null, "u", "v", CoordGroup.GRID, null)));
		}
	}


	@Nested
	@DisplayName("Groups")
	class Groups
	{
		@Test
		@DisplayName("Time comes first, then spatial, then registration order")
		void canonicalOrder()
		{
			assertEquals(Arrays.asList("time", "y", "x", "freq"), m_oRegistry.coords(CoordGroup.ALL));
			assertEquals(Arrays.asList("time", "y", "x"), m_oRegistry.coords(CoordGroup.GRID));
			assertEquals(Arrays.asList("y", "x"), m_oRegistry.coords(CoordGroup.SPATIAL));
			assertEquals(Arrays.asList("time", "freq"), m_oRegistry.coords(CoordGroup.NONSPATIAL));
			assertEquals(Collections.singletonList("freq"), m_oRegistry.coords(CoordGroup.GRIDPOINT));
		}


		@Test
		@DisplayName("Fields are selected by their own group")
		void fields()
		{
			assertEquals(Arrays.asList("hs", "spec", "topo"), m_oRegistry.fields(CoordGroup.ALL));
			assertEquals(Collections.singletonList("topo"), m_oRegistry.fields(CoordGroup.SPATIAL));
			assertEquals(Arrays.asList("hs", "spec"), m_oRegistry.fields(CoordGroup.NONSPATIAL));
			assertEquals(CoordGroup.GRID, m_oRegistry.coordGroup("hs"));
			assertEquals(999.0, m_oRegistry.defaultValue("topo"));
		}


		@Test
		@DisplayName("Shapes follow the live coordinate lengths")
		void shapes()
		{
			HashMap<String, double[]> oValues = new HashMap();
			oValues.put("x", new double[]{1, 2, 3});
			oValues.put("y", new double[]{10, 20});
			oValues.put("time", new double[]{0});
			oValues.put("freq", new double[]{0.1, 0.2, 0.3, 0.4});
			assertArrayEquals(new int[]{2, 3}, ShapeResolver.shapeOf(m_oRegistry, CoordGroup.SPATIAL, oValues));
			assertArrayEquals(new int[]{1, 2, 3, 4}, ShapeResolver.shapeOf(m_oRegistry, CoordGroup.ALL, oValues));
			oValues.remove("freq");
			assertThrows(MissingCoordinateException.class, () -> ShapeResolver.shapeOf(m_oRegistry, CoordGroup.ALL, oValues));
		}
	}


	@Nested
	@DisplayName("Copies")
	class Copies
	{
		@Test
		@DisplayName("Changing a copy leaves the original untouched")
		void isolation()
		{
			Registry oCopy = m_oRegistry.copy();
			oCopy.addVar(new DataVar("tp", Params.TP, CoordGroup.GRID, 0.0));
			assertTrue(oCopy.has("tp"));
			assertFalse(m_oRegistry.has("tp"));
			assertTrue(m_oRegistry.isInitialState());
			assertFalse(oCopy.isInitialState());
		}


		@Test
		@DisplayName("Spatial coordinates can be swapped for point positions")
		void setSpatial()
		{
			m_oRegistry.setSpatial(Collections.singletonList(new Coordinate("inds", CoordGroup.SPATIAL)),
				Arrays.asList(new DataVar("lon", CoordGroup.SPATIAL, 0.0), new DataVar("lat", CoordGroup.SPATIAL, 0.0)),
				Arrays.asList("x", "y", "lon", "lat"));
			List<String> oCoords = m_oRegistry.coords(CoordGroup.ALL);
			assertEquals(Arrays.asList("time", "inds", "freq"), oCoords);
			assertTrue(m_oRegistry.isSpherical());
			assertTrue(m_oRegistry.isPointIndexed());
			assertEquals(Arrays.asList("lon", "lat", "topo"), m_oRegistry.vars(CoordGroup.SPATIAL));
		}
	}


	@Test
	@DisplayName("Mask ranges honour inclusive bounds")
	void inRange()
	{
		GridMask oMask = new GridMask("sea_mask", CoordGroup.GRID, false, null, "hs", 0.0, 10.0, true, false);
		assertFalse(oMask.inRange(-1.0));
		assertTrue(oMask.inRange(0.0));
		assertTrue(oMask.inRange(5.0));
		assertFalse(oMask.inRange(10.0));
		assertFalse(oMask.inRange(Double.NaN));
	}


	@Test
	@DisplayName("Directional parameters carry their convention")
	void params()
	{
		assertEquals(DirType.FROM, Params.WIND_DIR.getDirType());
		assertEquals(DirType.TO, Params.CURRENT_DIR.getDirType());
		assertNull(Params.HS.getDirType());
		assertEquals("wind_from_direction", Params.WIND_DIR.toMeta().getString("standard_name"));
		assertEquals("unknown", Params.getOrGeneric("unknown").getName());
	}
}
