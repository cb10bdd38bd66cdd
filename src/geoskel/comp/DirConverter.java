package geoskel.comp;

import geoskel.array.NumericArray;
import geoskel.schema.DirType;

/**
 * Converts directional values between the "from", "to" and mathematical
 * conventions. Compass conventions are in degrees, the mathematical one in
 * radians within (-pi, pi].
 */
public abstract class DirConverter
{
	/**
	 * Two times Pi
	 */
	private static final double TWO_PI = 2.0 * Math.PI;


	/**
	 * Modulo that is never negative
	 */
	private static double mod360(double dValue)
	{
		double dMod = dValue % 360.0;
		if (dMod < 0.0)
			dMod += 360.0;
		if (dMod >= 360.0)
			dMod -= 360.0;
		return dMod;
	}


	/**
	 * @param dValue direction in the given convention
	 * @param eType convention of the value
	 * @return counter clockwise angle from the positive x axis in radians,
	 * within (-pi, pi]
	 */
	public static double toMath(double dValue, DirType eType)
	{
		if (eType == DirType.MATH)
			return dValue;
		double dMath = Math.toRadians(mod360(90.0 - dValue + eType.getOffset()));
		if (dMath > Math.PI)
			dMath -= TWO_PI;
		return dMath;
	}


	/**
	 * @param dMath counter clockwise angle from the positive x axis in radians
	 * @param eType convention to convert to
	 * @return the direction in the requested convention, degrees within
	 * [0, 360) for compass conventions
	 */
	public static double fromMath(double dMath, DirType eType)
	{
		if (eType == DirType.MATH)
			return dMath;
		return mod360(90.0 - Math.toDegrees(dMath) + eType.getOffset());
	}


	public static double convert(double dValue, DirType eIn, DirType eOut)
	{
		return fromMath(toMath(dValue, eIn), eOut);
	}


	public static NumericArray toMath(NumericArray oValues, DirType eType)
	{
		if (eType == DirType.MATH)
			return oValues;
		return oValues.map(dVal -> toMath(dVal, eType));
	}


	public static NumericArray fromMath(NumericArray oValues, DirType eType)
	{
		if (eType == DirType.MATH)
			return oValues;
		return oValues.map(dVal -> fromMath(dVal, eType));
	}


	/**
	 * Converts every element of an array
	 * @param oValues directions in the input convention
	 * @param eIn convention of the values
	 * @param eOut convention to convert to
	 * @return converted directions, the input itself if the conventions match
	 */
	public static NumericArray convert(NumericArray oValues, DirType eIn, DirType eOut)
	{
		if (eIn == eOut)
			return oValues;
		return oValues.map(dVal -> convert(dVal, eIn, eOut));
	}
}
