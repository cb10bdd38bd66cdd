package geoskel.geosrv;

import geoskel.error.NoProjectionSetException;
import geoskel.system.SkelConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Holds the projection of one container. The projection is unset until it is
 * given explicitly or detected from geographic coordinates, and conversions
 * fail until then.
 */
public class ProjManager
{
	private static final Logger m_oLogger = LogManager.getLogger(ProjManager.class);

	/**
	 * Current projection, null while unset
	 */
	private Proj m_oProj;


	/**
	 * Sets the projection
	 * @param oCrs anything {@link CrsFactory#create(Object)} accepts
	 */
	public void set(Object oCrs)
	{
		m_oProj = CrsFactory.create(oCrs);
		m_oLogger.info("Projection set to {}", m_oProj.getName());
	}


	/**
	 * Returns to the unset state
	 */
	public void unset()
	{
		m_oProj = null;
	}


	/**
	 * Detects and sets the UTM zone of the positions. Does nothing if there
	 * are no positions.
	 * @param dLon longitudes in decimal degrees
	 * @param dLat latitudes in decimal degrees
	 */
	public void reset(double[] dLon, double[] dLat)
	{
		UtmZone oZone = detect(dLon, dLat);
		if (oZone == null)
		{
			m_oLogger.debug("No positions to detect a UTM zone from");
			return;
		}
		m_oProj = CrsFactory.utm(oZone);
		m_oLogger.info("Detected UTM zone {}", oZone);
	}


	/**
	 * Finds the zone of the mean position. Longitudes are averaged on the
	 * circle and the mean latitude is clamped to the UTM range.
	 * @param dLon longitudes in decimal degrees
	 * @param dLat latitudes in decimal degrees
	 * @return the zone, or null if there are no positions
	 */
	public static UtmZone detect(double[] dLon, double[] dLat)
	{
		if (dLon.length == 0 || dLat.length == 0)
			return null;
		SkelConfig oConfig = SkelConfig.getInstance();
		double dMeanLat = GeoUtil.mean(dLat);
		double dClamped = GeoUtil.clamp(dMeanLat, oConfig.getUtmLatMin(), oConfig.getUtmLatMax());
		if (dClamped != dMeanLat)
			m_oLogger.warn("Mean latitude {} clamped to {} to detect UTM zone", dMeanLat, dClamped);
		return UtmZone.detect(GeoUtil.circularMeanLon(dLon), dClamped);
	}


	public boolean isSet()
	{
		return m_oProj != null;
	}


	/**
	 * @return the projection
	 * @throws NoProjectionSetException if none is set
	 */
	public Proj get()
	{
		if (m_oProj == null)
			throw new NoProjectionSetException();
		return m_oProj;
	}


	/**
	 * @return the UTM zone, or null if unset or not a UTM projection
	 */
	public UtmZone getZone()
	{
		return m_oProj == null ? null : m_oProj.getZone();
	}


	/**
	 * @param dLon longitudes in decimal degrees
	 * @param dLat latitudes in decimal degrees
	 * @return projected {x, y}
	 */
	public double[][] toProjected(double[] dLon, double[] dLat)
	{
		return toProjected(get(), dLon, dLat);
	}


	/**
	 * @param dX projected x values
	 * @param dY projected y values
	 * @return geographic {lon, lat}
	 */
	public double[][] toGeographic(double[] dX, double[] dY)
	{
		return toGeographic(get(), dX, dY);
	}


	public static double[][] toProjected(Proj oProj, double[] dLon, double[] dLat)
	{
		checkLengths(dLon, dLat);
		double[][] dRet = new double[2][dLon.length];
		oProj.toProjected(dLon, dLat, dRet[0], dRet[1]);
		return dRet;
	}


	public static double[][] toGeographic(Proj oProj, double[] dX, double[] dY)
	{
		checkLengths(dX, dY);
		double[][] dRet = new double[2][dX.length];
		oProj.toGeographic(dX, dY, dRet[0], dRet[1]);
		return dRet;
	}


	private static void checkLengths(double[] dFirst, double[] dSecond)
	{
		if (dFirst.length != dSecond.length)
			throw new IllegalArgumentException(String.format("Coordinate arrays differ in length (%d, %d)", dFirst.length, dSecond.length));
	}


	@Override
	public String toString()
	{
		return m_oProj == null ? "unset" : m_oProj.getName();
	}
}
