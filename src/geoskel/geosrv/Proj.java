package geoskel.geosrv;

import org.json.JSONObject;

/**
 * Conversion between geographic coordinates (decimal degrees) and the
 * coordinates of one projected reference system (metres unless the system is
 * itself geographic).
 */
public abstract class Proj
{
	/**
	 * @return short description of the reference system
	 */
	public abstract String getName();


	/**
	 * Projects positions. The output arrays must have the length of the input.
	 * @param dLon longitudes in decimal degrees
	 * @param dLat latitudes in decimal degrees
	 * @param dX filled with projected x values
	 * @param dY filled with projected y values
	 */
	public abstract void toProjected(double[] dLon, double[] dLat, double[] dX, double[] dY);


	/**
	 * Inverse of {@link #toProjected}
	 * @param dX projected x values
	 * @param dY projected y values
	 * @param dLon filled with longitudes within (-180, 180]
	 * @param dLat filled with latitudes
	 */
	public abstract void toGeographic(double[] dX, double[] dY, double[] dLon, double[] dLat);


	/**
	 * @return description of the reference system that {@link CrsFactory}
	 * can turn back into an equal projection
	 */
	public abstract JSONObject toJson();


	/**
	 * @return the UTM zone, or null if the system is not a UTM projection
	 */
	public UtmZone getZone()
	{
		return null;
	}


	@Override
	public String toString()
	{
		return getName();
	}
}
