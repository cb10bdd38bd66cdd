package geoskel.system;

import java.util.ArrayList;
import java.util.List;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Conversions between org.json values and the primitive arrays used by the
 * containers.
 */
public abstract class JSONUtil
{
	public static JSONArray optJSONArray(JSONObject oObj, String sKey)
	{
		JSONArray oRet = oObj.optJSONArray(sKey);
		if (oRet == null)
		{
			oRet = new JSONArray();
		}
		return oRet;
	}


	public static List<String> getStringList(JSONObject oObj, String sKey)
	{
		JSONArray oArr = optJSONArray(oObj, sKey);
		ArrayList<String> oRet = new ArrayList(oArr.length());
		for (int nIndex = 0; nIndex < oArr.length(); nIndex++)
			oRet.add(oArr.getString(nIndex));

		return oRet;
	}


	public static int[] getIntArray(JSONObject oObj, String sKey)
	{
		JSONArray oArr = optJSONArray(oObj, sKey);
		int[] nRet = new int[oArr.length()];
		for (int nIndex = 0; nIndex < nRet.length; nIndex++)
			nRet[nIndex] = oArr.getInt(nIndex);

		return nRet;
	}


	/**
	 * Reads a numeric array. Nulls in the JSON become NaN.
	 * @param oObj object holding the array
	 * @param sKey key of the array
	 * @return the values, empty if the key is missing
	 */
	public static double[] getDoubleArray(JSONObject oObj, String sKey)
	{
		JSONArray oArr = optJSONArray(oObj, sKey);
		double[] dRet = new double[oArr.length()];
		for (int nIndex = 0; nIndex < dRet.length; nIndex++)
			dRet[nIndex] = oArr.optDouble(nIndex, Double.NaN);

		return dRet;
	}


	/**
	 * Builds a JSON array from numeric values. NaN and infinities are written
	 * as null since JSON has no literal for them.
	 * @param dValues values to write
	 * @return the JSON array
	 */
	public static JSONArray toJSONArray(double[] dValues)
	{
		JSONArray oArr = new JSONArray();
		for (double dVal : dValues)
		{
			if (Double.isFinite(dVal))
				oArr.put(dVal);
			else
				oArr.put(JSONObject.NULL);
		}
		return oArr;
	}


	public static JSONArray toJSONArray(int[] nValues)
	{
		JSONArray oArr = new JSONArray();
		for (int nVal : nValues)
			oArr.put(nVal);
		return oArr;
	}
}
