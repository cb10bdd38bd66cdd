package geoskel.geosrv;

import static org.junit.jupiter.api.Assertions.*;

import geoskel.error.InvalidCrsException;
import geoskel.error.NoProjectionSetException;
import org.json.JSONObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ProjectionTest
{
	private static void assertRoundTrip(Proj oProj, double[] dLon, double[] dLat, double dTol)
	{
		double[][] dXy = ProjManager.toProjected(oProj, dLon, dLat);
		double[][] dGeo = ProjManager.toGeographic(oProj, dXy[0], dXy[1]);
		assertArrayEquals(dLon, dGeo[0], dTol);
		assertArrayEquals(dLat, dGeo[1], dTol);
		double[][] dBack = ProjManager.toProjected(oProj, dGeo[0], dGeo[1]);
		assertArrayEquals(dXy[0], dBack[0], 0.5);
		assertArrayEquals(dXy[1], dBack[1], 0.5);
	}


	@Nested
	@DisplayName("UTM")
	class Utm
	{
		@Test
		@DisplayName("The central meridian has the false easting")
		void centralMeridian()
		{
			Proj oProj = CrsFactory.create("33W");
			double[][] dXy = ProjManager.toProjected(oProj, new double[]{15.0, 15.0}, new double[]{0.0, 60.0});
			assertEquals(500000.0, dXy[0][0], 1e-3);
			assertEquals(0.0, dXy[1][0], 1e-3);
			assertEquals(500000.0, dXy[0][1], 1e-3);
			assertEquals(6651411.0, dXy[1][1], 50.0);
		}


		@Test
		@DisplayName("Round trips work in the northern hemisphere")
		void north()
		{
			assertRoundTrip(CrsFactory.create("33V"), new double[]{12.0, 15.0, 17.5}, new double[]{58.0, 60.0, 63.9}, 1e-5);
		}


		@Test
		@DisplayName("Southern points get negative northings and round trip")
		void south()
		{
			Proj oProj = CrsFactory.create("33J");
			double[][] dXy = ProjManager.toProjected(oProj, new double[]{15.0}, new double[]{-30.0});
			assertTrue(dXy[1][0] < 0.0);
			assertRoundTrip(oProj, new double[]{13.0, 15.0, 16.0}, new double[]{-30.0, 2.0, -0.5}, 1e-5);
		}


		@Test
		@DisplayName("Positions across the antimeridian round trip")
		void antimeridian()
		{
			UtmZone oZone = ProjManager.detect(new double[]{179.0, -179.0, 179.5}, new double[]{-10.0, -10.0, -11.0});
			assertEquals(60, oZone.getNumber());
			assertRoundTrip(CrsFactory.utm(oZone), new double[]{179.0, -179.0, 179.5}, new double[]{-10.0, -10.0, -11.0}, 1e-5);
		}


		@Test
		@DisplayName("Latitudes beyond the UTM range are clamped")
		void clamp()
		{
			Proj oProj = CrsFactory.create("33X");
			double[][] dXy = ProjManager.toProjected(oProj, new double[]{15.0}, new double[]{89.0});
			double[][] dGeo = ProjManager.toGeographic(oProj, dXy[0], dXy[1]);
			assertEquals(84.0, dGeo[1][0], 1e-5);
		}
	}


	@Nested
	@DisplayName("Reference systems")
	class Systems
	{
		@Test
		@DisplayName("EPSG codes select UTM zones and hemispheres")
		void epsg()
		{
			assertEquals(new UtmZone(33, 'N'), CrsFactory.create(32633).getZone());
			assertEquals(new UtmZone(33, 'M'), CrsFactory.create("EPSG:32733").getZone());
			assertThrows(InvalidCrsException.class, () -> CrsFactory.create(1234));
		}


		@Test
		@DisplayName("Proj strings are read")
		void projString()
		{
			assertEquals(new UtmZone(32, 'M'), CrsFactory.create("+proj=utm +zone=32 +south +ellps=WGS84").getZone());
			assertTrue(CrsFactory.create("+proj=merc +a=6378137 +b=6378137") instanceof WebMercatorProj);
			assertThrows(InvalidCrsException.class, () -> CrsFactory.create("+proj=nope"));
		}


		@Test
		@DisplayName("JSON descriptors round trip")
		void json()
		{
			Proj oUtm = CrsFactory.create("33W");
			assertEquals(oUtm.getZone(), CrsFactory.create(oUtm.toJson()).getZone());

			JSONObject oLcc = new JSONObject();
			oLcc.put("grid_mapping_name", "lambert_conformal_conic");
			oLcc.put("standard_parallel", 63.3);
			oLcc.put("longitude_of_central_meridian", 15.0);
			oLcc.put("latitude_of_projection_origin", 63.3);
			Proj oProj = CrsFactory.create(oLcc);
			assertRoundTrip(oProj, new double[]{10.0, 15.0, 20.0}, new double[]{60.0, 63.3, 66.0}, 1e-5);
			assertRoundTrip(CrsFactory.create(oProj.toJson()), new double[]{10.0}, new double[]{60.0}, 1e-5);
		}


		@Test
		@DisplayName("Web Mercator spans the standard extent")
		void webMercator()
		{
			assertEquals(20037508.34, WebMercatorProj.lonToMeters(180.0), 0.01);
			assertEquals(0.0, WebMercatorProj.latToMeters(0.0), 1e-6);
			assertRoundTrip(CrsFactory.create(3857), new double[]{-120.0, 10.0}, new double[]{-45.0, 70.0}, 1e-9);
		}
	}


	@Test
	@DisplayName("Conversions need a projection")
	void unset()
	{
		ProjManager oManager = new ProjManager();
		assertFalse(oManager.isSet());
		assertThrows(NoProjectionSetException.class, () -> oManager.toProjected(new double[]{1}, new double[]{1}));
		oManager.reset(new double[]{5.0, 6.0}, new double[]{60.0, 61.0});
		assertEquals(new UtmZone(32, 'V'), oManager.getZone());
		oManager.unset();
		assertNull(oManager.getZone());
	}


	@Test
	@DisplayName("Great circle distances are in kilometres")
	void distance()
	{
		assertEquals(111.19, GeoUtil.distanceFromLatLon(0.0, 0.0, 1.0, 0.0), 0.01);
		assertEquals(0.0, GeoUtil.distanceFromLatLon(10.0, 179.9, 10.0, 179.9), 1e-9);
		assertEquals(180.0, GeoUtil.adjustLon(-180.0));
		assertEquals(-170.0, GeoUtil.adjustLon(190.0));
	}
}
