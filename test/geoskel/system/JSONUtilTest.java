package geoskel.system;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

class JSONUtilTest
{
	@Test
	void nullsReadAsNaN()
	{
		JSONObject oObj = new JSONObject("{\"values\": [1.5, null, 3]}");
		double[] dValues = JSONUtil.getDoubleArray(oObj, "values");
		assertEquals(3, dValues.length);
		assertEquals(1.5, dValues[0]);
		assertTrue(Double.isNaN(dValues[1]));
		assertEquals(0, JSONUtil.getDoubleArray(oObj, "missing").length);
	}


	@Test
	void nonFiniteWrittenAsNull()
	{
		JSONArray oArr = JSONUtil.toJSONArray(new double[]{Double.NaN, Double.POSITIVE_INFINITY, 2.0});
		assertTrue(oArr.isNull(0));
		assertTrue(oArr.isNull(1));
		assertEquals(2.0, oArr.getDouble(2));
	}


	@Test
	void listsAndIntegers()
	{
		JSONObject oObj = new JSONObject("{\"dims\": [\"time\", \"inds\"], \"shape\": [4, 2]}");
		assertEquals(Arrays.asList("time", "inds"), JSONUtil.getStringList(oObj, "dims"));
		assertArrayEquals(new int[]{4, 2}, JSONUtil.getIntArray(oObj, "shape"));
		assertArrayEquals(new int[]{4, 2}, JSONUtil.getIntArray(new JSONObject().put("shape", JSONUtil.toJSONArray(new int[]{4, 2})), "shape"));
	}
}
