package geoskel.geosrv;

import java.util.ArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import ucar.unidata.geoloc.LatLonPointImpl;
import ucar.unidata.geoloc.ProjectionPointImpl;
import ucar.unidata.geoloc.projection.UtmProjection;

/**
 * WGS 84 UTM projection of one zone. Coordinates are in metres with a false
 * easting of 500 km. Positions south of the equator are projected with the
 * northern formula on their absolute latitude and get a negative northing,
 * so one dataset may span both hemispheres. Latitudes outside the configured
 * UTM range are clamped before projecting.
 * <p>
 * Longitudes are taken relative to the zone's central meridian and projected
 * with the reference zone 31, whose central meridian is far from the
 * antimeridian, so positions on the other side of 180 degrees project
 * continuously.
 */
public class UtmProj extends Proj
{
	private static final Logger m_oLogger = LogManager.getLogger(UtmProj.class);

	/**
	 * Metres per kilometre, the unit of the CDM projection
	 */
	private static final double KM = 1000.0;

	private static final int REF_ZONE = 31;

	/**
	 * Central meridian of the reference zone
	 */
	private static final double REF_MERIDIAN = 3.0;

	private final UtmZone m_oZone;

	/**
	 * Northern hemisphere projection of the reference zone
	 */
	private final UtmProjection m_oProj;

	private final double m_dMeridian;

	private final double m_dLatMin;

	private final double m_dLatMax;


	/**
	 * @param oZone zone to project in
	 * @param dLatMin southern clamp limit
	 * @param dLatMax northern clamp limit
	 */
	public UtmProj(UtmZone oZone, double dLatMin, double dLatMax)
	{
		m_oZone = oZone;
		m_oProj = new UtmProjection(REF_ZONE, true);
		m_dMeridian = oZone.getCentralMeridian();
		m_dLatMin = dLatMin;
		m_dLatMax = dLatMax;
	}


	@Override
	public String getName()
	{
		return String.format("UTM %s", m_oZone);
	}


	@Override
	public UtmZone getZone()
	{
		return m_oZone;
	}


	@Override
	public void toProjected(double[] dLon, double[] dLat, double[] dX, double[] dY)
	{
		double[] dClamped = new double[dLat.length];
		int nClamped = 0;
		ArrayList<Integer> oNorth = new ArrayList();
		ArrayList<Integer> oSouth = new ArrayList();
		for (int nIndex = 0; nIndex < dLat.length; nIndex++)
		{
			dClamped[nIndex] = GeoUtil.clamp(dLat[nIndex], m_dLatMin, m_dLatMax);
			if (dClamped[nIndex] != dLat[nIndex])
				++nClamped;
			if (dClamped[nIndex] < 0.0)
				oSouth.add(nIndex);
			else
				oNorth.add(nIndex);
		}
		if (nClamped > 0)
			m_oLogger.warn("{} latitudes clamped to [{}, {}] for zone {}", nClamped, m_dLatMin, m_dLatMax, m_oZone);

		project(oNorth, dLon, dClamped, dX, dY, 1.0);
		project(oSouth, dLon, dClamped, dX, dY, -1.0);
	}


	/**
	 * Projects one hemisphere's batch of positions
	 * @param oBatch indices of the positions
	 * @param dSign 1 for north, -1 for south
	 */
	private void project(ArrayList<Integer> oBatch, double[] dLon, double[] dLat, double[] dX, double[] dY, double dSign)
	{
		ProjectionPointImpl oProjPt = new ProjectionPointImpl();
		LatLonPointImpl oLatLonPt = new LatLonPointImpl();
		for (int nIndex : oBatch)
		{
			oLatLonPt.set(dSign * dLat[nIndex], REF_MERIDIAN + GeoUtil.adjustLon(dLon[nIndex] - m_dMeridian));
			m_oProj.latLonToProj(oLatLonPt, oProjPt);
			dX[nIndex] = oProjPt.getX() * KM;
			dY[nIndex] = dSign * oProjPt.getY() * KM;
		}
	}


	@Override
	public void toGeographic(double[] dX, double[] dY, double[] dLon, double[] dLat)
	{
		ArrayList<Integer> oNorth = new ArrayList();
		ArrayList<Integer> oSouth = new ArrayList();
		for (int nIndex = 0; nIndex < dY.length; nIndex++)
		{
			if (dY[nIndex] < 0.0)
				oSouth.add(nIndex);
			else
				oNorth.add(nIndex);
		}
		unproject(oNorth, dX, dY, dLon, dLat, 1.0);
		unproject(oSouth, dX, dY, dLon, dLat, -1.0);
	}


	private void unproject(ArrayList<Integer> oBatch, double[] dX, double[] dY, double[] dLon, double[] dLat, double dSign)
	{
		ProjectionPointImpl oProjPt = new ProjectionPointImpl();
		LatLonPointImpl oLatLonPt = new LatLonPointImpl();
		for (int nIndex : oBatch)
		{
			oProjPt.setLocation(dX[nIndex] / KM, dSign * dY[nIndex] / KM);
			m_oProj.projToLatLon(oProjPt, oLatLonPt);
			dLon[nIndex] = GeoUtil.adjustLon(oLatLonPt.getLongitude() - REF_MERIDIAN + m_dMeridian);
			dLat[nIndex] = dSign * oLatLonPt.getLatitude();
		}
	}


	@Override
	public JSONObject toJson()
	{
		JSONObject oJson = new JSONObject();
		oJson.put("utm_zone", m_oZone.toString());
		oJson.put("epsg", m_oZone.getEpsg());
		return oJson;
	}
}
