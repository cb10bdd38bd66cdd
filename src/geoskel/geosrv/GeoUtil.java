package geoskel.geosrv;

import java.util.Arrays;

/**
 * Geodesic helpers and simple statistics over coordinate vectors.
 */
public abstract class GeoUtil
{
	/**
	 * Approximate radius of the earth in km
	 */
	public static final double EARTH_RADIUS_KM = 6371;


	/**
	 * Pi divided by 180
	 */
	public static final double PIOVER180 = Math.PI / 180;


	/**
	 * Adjusts the longitude into the range {@literal -180 < dLon <= 180}
	 *
	 * @param dLon longitude to adjust if needed
	 * @return longitude in decimal degrees
	 */
	public static double adjustLon(double dLon)
	{
		if (dLon > 180 || dLon <= -180)
		{
			dLon = dLon % 360.0;
			if (dLon > 180)
				dLon -= 360.0;
			else if (dLon <= -180)
				dLon += 360.0;
		}
		return dLon;
	}


	/**
	 * Adjusts every longitude of the array
	 * @param dLon longitudes, left unchanged
	 * @return new array of adjusted longitudes
	 */
	public static double[] adjustLon(double[] dLon)
	{
		double[] dRet = new double[dLon.length];
		for (int nIndex = 0; nIndex < dLon.length; nIndex++)
			dRet[nIndex] = adjustLon(dLon[nIndex]);
		return dRet;
	}


	/**
	 * Gets the distance between the 2 geo-coordinates in km using the Haversine
	 * formula.
	 *
	 * @param dLat1 latitude in decimal degrees of the first point
	 * @param dLon1 longitude in decimal degrees of the first point
	 * @param dLat2 latitude in decimal degrees of the second point
	 * @param dLon2 longitude in decimal degrees of the second point
	 * @return distance in km between the 2 geo-coordinates.
	 */
	public static double distanceFromLatLon(double dLat1, double dLon1, double dLat2, double dLon2)
	{
		double dLat = (dLat2 - dLat1) * PIOVER180;
		double dLon = (dLon2 - dLon1) * PIOVER180;
		double dA = Math.sin(dLat / 2) * Math.sin(dLat /2) + Math.cos(dLat1 * PIOVER180) * Math.cos(dLat2 * PIOVER180) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
		return 2 * EARTH_RADIUS_KM * Math.asin(Math.sqrt(Math.min(1.0, dA)));
	}


	/**
	 * Mean of longitudes taken on the circle, so points on both sides of the
	 * antimeridian average to a longitude near it.
	 * @param dLon longitudes in decimal degrees
	 * @return mean longitude within (-180, 180], NaN for an empty array
	 */
	public static double circularMeanLon(double[] dLon)
	{
		if (dLon.length == 0)
			return Double.NaN;
		double dSin = 0.0;
		double dCos = 0.0;
		for (double dVal : dLon)
		{
			dSin += Math.sin(dVal * PIOVER180);
			dCos += Math.cos(dVal * PIOVER180);
		}
		return adjustLon(Math.atan2(dSin, dCos) / PIOVER180);
	}


	/**
	 * @param dValues values
	 * @return arithmetic mean, NaN for an empty array
	 */
	public static double mean(double[] dValues)
	{
		if (dValues.length == 0)
			return Double.NaN;
		double dSum = 0.0;
		for (double dVal : dValues)
			dSum += dVal;
		return dSum / dValues.length;
	}


	/**
	 * @param dValues values, left unchanged
	 * @return median, NaN for an empty array
	 */
	public static double median(double[] dValues)
	{
		if (dValues.length == 0)
			return Double.NaN;
		double[] dSorted = dValues.clone();
		Arrays.sort(dSorted);
		int nMid = dSorted.length / 2;
		if (dSorted.length % 2 == 1)
			return dSorted[nMid];
		return (dSorted[nMid - 1] + dSorted[nMid]) / 2.0;
	}


	/**
	 * @param dValues values
	 * @return the smallest value, NaN for an empty array
	 */
	public static double min(double[] dValues)
	{
		double dMin = Double.NaN;
		for (double dVal : dValues)
		{
			if (Double.isNaN(dMin) || dVal < dMin)
				dMin = dVal;
		}
		return dMin;
	}


	/**
	 * @param dValues values
	 * @return the largest value, NaN for an empty array
	 */
	public static double max(double[] dValues)
	{
		double dMax = Double.NaN;
		for (double dVal : dValues)
		{
			if (Double.isNaN(dMax) || dVal > dMax)
				dMax = dVal;
		}
		return dMax;
	}


	/**
	 * Clamps a value into a range
	 * @param dValue value
	 * @param dMin lower limit
	 * @param dMax upper limit
	 * @return the value limited to [dMin, dMax]
	 */
	public static double clamp(double dValue, double dMin, double dMax)
	{
		if (dValue < dMin)
			return dMin;
		if (dValue > dMax)
			return dMax;
		return dValue;
	}
}
