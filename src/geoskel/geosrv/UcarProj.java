package geoskel.geosrv;

import org.json.JSONObject;
import ucar.unidata.geoloc.LatLonPointImpl;
import ucar.unidata.geoloc.ProjectionImpl;
import ucar.unidata.geoloc.ProjectionPointImpl;

/**
 * Adapts a CDM projection. CDM projections work in km, or in degrees for the
 * geographic one, so projected values are scaled into metres. False easting
 * and northing are applied here, in projected units, rather than by the CDM
 * projection.
 */
public class UcarProj extends Proj
{
	private final ProjectionImpl m_oProj;

	/**
	 * Projected units per CDM unit
	 */
	private final double m_dScale;

	private final double m_dFalseEasting;

	private final double m_dFalseNorthing;

	/**
	 * Description the projection was created from
	 */
	private final JSONObject m_oDescriptor;


	/**
	 * @param oProj CDM projection without false origin
	 * @param dScale projected units per CDM unit, 1000 for km based
	 * projections
	 * @param dFalseEasting added to projected x
	 * @param dFalseNorthing added to projected y
	 * @param oDescriptor description the projection was created from
	 */
	public UcarProj(ProjectionImpl oProj, double dScale, double dFalseEasting, double dFalseNorthing, JSONObject oDescriptor)
	{
		m_oProj = oProj;
		m_dScale = dScale;
		m_dFalseEasting = dFalseEasting;
		m_dFalseNorthing = dFalseNorthing;
		m_oDescriptor = oDescriptor;
	}


	@Override
	public String getName()
	{
		return m_oDescriptor.optString("grid_mapping_name", m_oProj.getClass().getSimpleName());
	}


	@Override
	public void toProjected(double[] dLon, double[] dLat, double[] dX, double[] dY)
	{
		ProjectionPointImpl oProjPt = new ProjectionPointImpl();
		LatLonPointImpl oLatLonPt = new LatLonPointImpl();
		for (int nIndex = 0; nIndex < dLon.length; nIndex++)
		{
			oLatLonPt.set(dLat[nIndex], dLon[nIndex]);
			m_oProj.latLonToProj(oLatLonPt, oProjPt);
			dX[nIndex] = oProjPt.getX() * m_dScale + m_dFalseEasting;
			dY[nIndex] = oProjPt.getY() * m_dScale + m_dFalseNorthing;
		}
	}


	@Override
	public void toGeographic(double[] dX, double[] dY, double[] dLon, double[] dLat)
	{
		ProjectionPointImpl oProjPt = new ProjectionPointImpl();
		LatLonPointImpl oLatLonPt = new LatLonPointImpl();
		for (int nIndex = 0; nIndex < dX.length; nIndex++)
		{
			oProjPt.setLocation((dX[nIndex] - m_dFalseEasting) / m_dScale, (dY[nIndex] - m_dFalseNorthing) / m_dScale);
			m_oProj.projToLatLon(oProjPt, oLatLonPt);
			dLon[nIndex] = GeoUtil.adjustLon(oLatLonPt.getLongitude());
			dLat[nIndex] = oLatLonPt.getLatitude();
		}
	}


	@Override
	public JSONObject toJson()
	{
		return new JSONObject(m_oDescriptor.toString());
	}
}
