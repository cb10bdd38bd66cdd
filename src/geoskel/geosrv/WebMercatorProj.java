package geoskel.geosrv;

import org.json.JSONObject;

/**
 * Spherical (web) Mercator, EPSG:3857, in metres.
 */
public class WebMercatorProj extends Proj
{
	/**
	 * Major (equatorial) radius of the earth in m
	 */
	private static final double R_MAJOR = 6378137.0;


	/**
	 * Pi divided by 2
	 */
	public static final double PI_OVER_TWO = Math.PI / 2.0;


	/**
	 * Pi times equatorial radius of earth
	 */
	private static final double ORIGIN_SHIFT = Math.PI * R_MAJOR;


	/**
	 * Pi times equatorial radius of earth divided by 180
	 */
	private static final double ORIGIN_SHIFT_DIVIDED_BY_180 = ORIGIN_SHIFT / 180.0;


	/**
	 * Pi divided by 360
	 */
	private static final double PI_OVER_360 = Math.PI / 360.0;


	/**
	 * Latitude limit of the projection
	 */
	public static final double MAX_LAT = 85.0511287798066;


	/**
	 * Converts a WGS 84 longitude to Spherical Mercator meters
	 * @param dLon longitude in decimal degrees
	 * @return Corresponding mercator meter x coordinate
	 */
	public static double lonToMeters(double dLon)
	{
		return dLon * ORIGIN_SHIFT_DIVIDED_BY_180;
	}


	/**
	 * Converts a WGS 84 latitude to Spherical Mercator meters
	 * @param dLat latitude in decimal degrees
	 * @return Corresponding mercator meter y coordinate
	 */
	public static double latToMeters(double dLat)
	{
		return Math.log(Math.tan((90.0 + GeoUtil.clamp(dLat, -MAX_LAT, MAX_LAT)) * PI_OVER_360)) * R_MAJOR;
	}


	public static double metersToLon(double dX)
	{
		return GeoUtil.adjustLon(dX / ORIGIN_SHIFT * 180.0);
	}


	public static double metersToLat(double dY)
	{
		return 180.0 * (2.0 * Math.atan(Math.exp(Math.PI * dY / ORIGIN_SHIFT)) - PI_OVER_TWO) / Math.PI;
	}


	@Override
	public String getName()
	{
		return "EPSG:3857";
	}


	@Override
	public void toProjected(double[] dLon, double[] dLat, double[] dX, double[] dY)
	{
		for (int nIndex = 0; nIndex < dLon.length; nIndex++)
		{
			dX[nIndex] = lonToMeters(GeoUtil.adjustLon(dLon[nIndex]));
			dY[nIndex] = latToMeters(dLat[nIndex]);
		}
	}


	@Override
	public void toGeographic(double[] dX, double[] dY, double[] dLon, double[] dLat)
	{
		for (int nIndex = 0; nIndex < dX.length; nIndex++)
		{
			dLon[nIndex] = metersToLon(dX[nIndex]);
			dLat[nIndex] = metersToLat(dY[nIndex]);
		}
	}


	@Override
	public JSONObject toJson()
	{
		JSONObject oJson = new JSONObject();
		oJson.put("epsg", 3857);
		return oJson;
	}
}
