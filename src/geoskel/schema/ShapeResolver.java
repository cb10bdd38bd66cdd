package geoskel.schema;

import geoskel.error.MissingCoordinateException;
import java.util.List;
import java.util.Map;

/**
 * Turns coordinate groups into concrete array shapes using the live
 * coordinate values of a container.
 */
public abstract class ShapeResolver
{
	/**
	 * @param oRegistry schema of the container
	 * @param eGroup coordinate group
	 * @param oValues coordinate values by name
	 * @return one length per coordinate of the group, in canonical order
	 */
	public static int[] shapeOf(Registry oRegistry, CoordGroup eGroup, Map<String, double[]> oValues)
	{
		return shapeOf(oRegistry.coords(eGroup), oValues);
	}


	/**
	 * @param oCoords coordinate names in axis order
	 * @param oValues coordinate values by name
	 * @return one length per coordinate
	 * @throws MissingCoordinateException if a coordinate has no values
	 */
	public static int[] shapeOf(List<String> oCoords, Map<String, double[]> oValues)
	{
		int[] nShape = new int[oCoords.size()];
		for (int nIndex = 0; nIndex < nShape.length; nIndex++)
		{
			double[] dValues = oValues.get(oCoords.get(nIndex));
			if (dValues == null)
				throw new MissingCoordinateException(oCoords.get(nIndex));
			nShape[nIndex] = dValues.length;
		}
		return nShape;
	}
}
