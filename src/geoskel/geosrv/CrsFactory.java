package geoskel.geosrv;

import geoskel.error.InvalidCrsException;
import geoskel.system.SkelConfig;
import java.util.HashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import ucar.unidata.geoloc.ProjectionImpl;
import ucar.unidata.geoloc.projection.LambertConformal;
import ucar.unidata.geoloc.projection.LatLonProjection;
import ucar.unidata.geoloc.projection.Mercator;
import ucar.unidata.geoloc.projection.Stereographic;
import ucar.unidata.geoloc.projection.TransverseMercator;

/**
 * Creates projections from the ways a reference system can be specified: a
 * {@link UtmZone} or zone string such as "33W", an EPSG code (number or
 * "EPSG:32633"), a proj string ("+proj=utm +zone=33"), or a JSON descriptor
 * using CF grid mapping attributes.
 */
public abstract class CrsFactory
{
	private static final Logger m_oLogger = LogManager.getLogger(CrsFactory.class);

	/**
	 * Metres per kilometre, the unit of CDM projections
	 */
	private static final double KM = 1000.0;


	/**
	 * @param oCrs a {@link Proj}, {@link UtmZone}, Number, String or
	 * JSONObject
	 * @return the projection
	 * @throws InvalidCrsException if the specifier cannot be interpreted
	 */
	public static Proj create(Object oCrs)
	{
		if (oCrs instanceof Proj)
			return (Proj)oCrs;
		if (oCrs instanceof UtmZone)
			return utm((UtmZone)oCrs);
		if (oCrs instanceof Number)
			return fromEpsg(((Number)oCrs).intValue());
		if (oCrs instanceof JSONObject)
			return fromJson((JSONObject)oCrs);
		if (oCrs instanceof String)
			return fromString((String)oCrs);
		throw new InvalidCrsException(String.format("Cannot create a projection from %s", oCrs));
	}


	/**
	 * @param oZone zone
	 * @return UTM projection using the configured latitude limits
	 */
	public static Proj utm(UtmZone oZone)
	{
		SkelConfig oConfig = SkelConfig.getInstance();
		return new UtmProj(oZone, oConfig.getUtmLatMin(), oConfig.getUtmLatMax());
	}


	/**
	 * Supports 4326, 3857 (and 900913), and the WGS 84 UTM codes 32601 to
	 * 32660 and 32701 to 32760
	 * @param nEpsg EPSG code
	 * @return the projection
	 */
	public static Proj fromEpsg(int nEpsg)
	{
		if (nEpsg == 4326)
			return latLon();
		if (nEpsg == 3857 || nEpsg == 900913)
			return new WebMercatorProj();
		if (nEpsg > 32600 && nEpsg <= 32660)
			return utm(new UtmZone(nEpsg - 32600, 'N'));
		if (nEpsg > 32700 && nEpsg <= 32760)
			return utm(new UtmZone(nEpsg - 32700, 'M'));
		throw new InvalidCrsException(String.format("EPSG:%d is not supported", nEpsg));
	}


	public static Proj fromString(String sCrs)
	{
		String sTrim = sCrs.trim();
		if (sTrim.startsWith("+"))
			return fromProjString(sTrim);
		if (sTrim.toLowerCase().startsWith("epsg:"))
			return fromEpsg(parseInt(sTrim.substring(5), sCrs));
		if (UtmZone.looksLikeZone(sTrim))
			return utm(UtmZone.parse(sTrim));
		if (sTrim.matches("\\d+"))
			return fromEpsg(parseInt(sTrim, sCrs));
		throw new InvalidCrsException(String.format("Cannot interpret '%s' as a reference system", sCrs));
	}


	private static int parseInt(String sValue, String sCrs)
	{
		try
		{
			return Integer.parseInt(sValue.trim());
		}
		catch (NumberFormatException oEx)
		{
			throw new InvalidCrsException(String.format("Cannot interpret '%s' as a reference system", sCrs), oEx);
		}
	}


	/**
	 * Reads a proj string. Supported projections are utm, longlat, merc, lcc,
	 * tmerc and stere.
	 * @param sProj proj string such as "+proj=utm +zone=33 +south"
	 * @return the projection
	 */
	public static Proj fromProjString(String sProj)
	{
		HashMap<String, String> oArgs = new HashMap();
		for (String sToken : sProj.trim().split("\\s+"))
		{
			if (!sToken.startsWith("+"))
				continue;
			int nEq = sToken.indexOf('=');
			if (nEq < 0)
				oArgs.put(sToken.substring(1), "");
			else
				oArgs.put(sToken.substring(1, nEq), sToken.substring(nEq + 1));
		}

		String sType = oArgs.getOrDefault("proj", "");
		try
		{
			switch (sType)
			{
				case "utm":
				{
					if (!oArgs.containsKey("zone"))
						throw new InvalidCrsException(String.format("'%s' has no zone", sProj));
					char cLetter = oArgs.containsKey("south") ? 'M' : 'N';
					return utm(new UtmZone(Integer.parseInt(oArgs.get("zone")), cLetter));
				}
				case "longlat":
				case "latlong":
				case "lonlat":
				case "latlon":
					return latLon();
				case "merc":
				{
					if ("6378137".equals(oArgs.get("a")) && "6378137".equals(oArgs.get("b")))
						return new WebMercatorProj();
					return mercator(arg(oArgs, "lon_0", 0.0), arg(oArgs, "lat_ts", 0.0), arg(oArgs, "x_0", 0.0), arg(oArgs, "y_0", 0.0));
				}
				case "lcc":
				{
					double dPar1 = arg(oArgs, "lat_1", arg(oArgs, "lat_0", 0.0));
					return lambert(arg(oArgs, "lat_0", dPar1), arg(oArgs, "lon_0", 0.0), dPar1, arg(oArgs, "lat_2", dPar1),
						arg(oArgs, "x_0", 0.0), arg(oArgs, "y_0", 0.0));
				}
				case "tmerc":
					return transverseMercator(arg(oArgs, "lat_0", 0.0), arg(oArgs, "lon_0", 0.0), arg(oArgs, "k_0", arg(oArgs, "k", 1.0)),
						arg(oArgs, "x_0", 0.0), arg(oArgs, "y_0", 0.0));
				case "stere":
					return stereographic(arg(oArgs, "lat_0", 90.0), arg(oArgs, "lon_0", 0.0), arg(oArgs, "k_0", arg(oArgs, "k", 1.0)),
						arg(oArgs, "x_0", 0.0), arg(oArgs, "y_0", 0.0));
				default:
					throw new InvalidCrsException(String.format("Projection '%s' in '%s' is not supported", sType, sProj));
			}
		}
		catch (NumberFormatException oEx)
		{
			throw new InvalidCrsException(String.format("Malformed number in '%s'", sProj), oEx);
		}
	}


	private static double arg(HashMap<String, String> oArgs, String sKey, double dDefault)
	{
		String sValue = oArgs.get(sKey);
		if (sValue == null || sValue.isEmpty())
			return dDefault;
		return Double.parseDouble(sValue);
	}


	/**
	 * Reads a JSON descriptor. It may hold "utm_zone", "epsg", "proj4", or a
	 * "grid_mapping_name" with CF grid mapping attributes.
	 * @param oJson descriptor
	 * @return the projection
	 */
	public static Proj fromJson(JSONObject oJson)
	{
		if (oJson.has("utm_zone"))
			return utm(UtmZone.parse(oJson.getString("utm_zone")));
		if (oJson.has("epsg"))
			return fromEpsg(oJson.getInt("epsg"));
		if (oJson.has("proj4"))
			return fromProjString(oJson.getString("proj4"));

		String sMapping = oJson.optString("grid_mapping_name", "");
		double dFalseEasting = oJson.optDouble("false_easting", 0.0);
		double dFalseNorthing = oJson.optDouble("false_northing", 0.0);
		switch (sMapping)
		{
			case "latitude_longitude":
				return latLon();
			case "lambert_conformal_conic":
			{
				double[] dPars = parallels(oJson);
				return lambert(oJson.optDouble("latitude_of_projection_origin", dPars[0]), oJson.getDouble("longitude_of_central_meridian"),
					dPars[0], dPars[1], dFalseEasting, dFalseNorthing);
			}
			case "transverse_mercator":
				return transverseMercator(oJson.optDouble("latitude_of_projection_origin", 0.0), oJson.getDouble("longitude_of_central_meridian"),
					oJson.optDouble("scale_factor_at_central_meridian", 1.0), dFalseEasting, dFalseNorthing);
			case "stereographic":
			case "polar_stereographic":
			{
				double dLon0 = oJson.has("straight_vertical_longitude_from_pole") ? oJson.getDouble("straight_vertical_longitude_from_pole")
					: oJson.optDouble("longitude_of_projection_origin", 0.0);
				return stereographic(oJson.optDouble("latitude_of_projection_origin", 90.0), dLon0,
					oJson.optDouble("scale_factor_at_projection_origin", 1.0), dFalseEasting, dFalseNorthing);
			}
			case "mercator":
				return mercator(oJson.optDouble("longitude_of_projection_origin", 0.0), oJson.optDouble("standard_parallel", 0.0),
					dFalseEasting, dFalseNorthing);
			default:
				throw new InvalidCrsException(String.format("Cannot create a projection from %s", oJson));
		}
	}


	/**
	 * @return the one or two standard parallels, the first repeated if only
	 * one is given
	 */
	private static double[] parallels(JSONObject oJson)
	{
		JSONArray oPars = oJson.optJSONArray("standard_parallel");
		if (oPars != null && oPars.length() > 0)
			return new double[]{oPars.getDouble(0), oPars.getDouble(oPars.length() > 1 ? 1 : 0)};
		double dPar = oJson.getDouble("standard_parallel");
		return new double[]{dPar, dPar};
	}


	private static Proj latLon()
	{
		JSONObject oDesc = new JSONObject();
		oDesc.put("grid_mapping_name", "latitude_longitude");
		return new UcarProj(new LatLonProjection(), 1.0, 0.0, 0.0, oDesc);
	}


	private static Proj lambert(double dLat0, double dLon0, double dPar1, double dPar2, double dFalseEasting, double dFalseNorthing)
	{
		JSONObject oDesc = new JSONObject();
		oDesc.put("grid_mapping_name", "lambert_conformal_conic");
		oDesc.put("latitude_of_projection_origin", dLat0);
		oDesc.put("longitude_of_central_meridian", dLon0);
		oDesc.put("standard_parallel", new JSONArray().put(dPar1).put(dPar2));
		oDesc.put("false_easting", dFalseEasting);
		oDesc.put("false_northing", dFalseNorthing);
		return create(new LambertConformal(dLat0, dLon0, dPar1, dPar2), dFalseEasting, dFalseNorthing, oDesc);
	}


	private static Proj transverseMercator(double dLat0, double dLon0, double dScale, double dFalseEasting, double dFalseNorthing)
	{
		JSONObject oDesc = new JSONObject();
		oDesc.put("grid_mapping_name", "transverse_mercator");
		oDesc.put("latitude_of_projection_origin", dLat0);
		oDesc.put("longitude_of_central_meridian", dLon0);
		oDesc.put("scale_factor_at_central_meridian", dScale);
		oDesc.put("false_easting", dFalseEasting);
		oDesc.put("false_northing", dFalseNorthing);
		return create(new TransverseMercator(dLat0, dLon0, dScale), dFalseEasting, dFalseNorthing, oDesc);
	}


	private static Proj stereographic(double dLat0, double dLon0, double dScale, double dFalseEasting, double dFalseNorthing)
	{
		JSONObject oDesc = new JSONObject();
		oDesc.put("grid_mapping_name", "stereographic");
		oDesc.put("latitude_of_projection_origin", dLat0);
		oDesc.put("longitude_of_projection_origin", dLon0);
		oDesc.put("scale_factor_at_projection_origin", dScale);
		oDesc.put("false_easting", dFalseEasting);
		oDesc.put("false_northing", dFalseNorthing);
		return create(new Stereographic(dLat0, dLon0, dScale), dFalseEasting, dFalseNorthing, oDesc);
	}


	private static Proj mercator(double dLon0, double dPar, double dFalseEasting, double dFalseNorthing)
	{
		JSONObject oDesc = new JSONObject();
		oDesc.put("grid_mapping_name", "mercator");
		oDesc.put("longitude_of_projection_origin", dLon0);
		oDesc.put("standard_parallel", dPar);
		oDesc.put("false_easting", dFalseEasting);
		oDesc.put("false_northing", dFalseNorthing);
		return create(new Mercator(dLon0, dPar), dFalseEasting, dFalseNorthing, oDesc);
	}


	private static Proj create(ProjectionImpl oProj, double dFalseEasting, double dFalseNorthing, JSONObject oDesc)
	{
		m_oLogger.debug("Created {} projection", oDesc.getString("grid_mapping_name"));
		return new UcarProj(oProj, KM, dFalseEasting, dFalseNorthing, oDesc);
	}
}
