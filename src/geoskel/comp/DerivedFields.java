package geoskel.comp;

import geoskel.array.NumericArray;
import geoskel.schema.DirType;

/**
 * Arithmetic of magnitude and direction fields derived from an x and a y
 * component.
 */
public abstract class DerivedFields
{
	/**
	 * @param oX x component
	 * @param oY y component
	 * @return length of the vectors
	 */
	public static NumericArray magnitude(NumericArray oX, NumericArray oY)
	{
		return oX.combine(oY, Math::hypot);
	}


	/**
	 * @param oX x component
	 * @param oY y component
	 * @return counter clockwise angle of the vectors from the x axis, radians
	 */
	public static NumericArray mathDirection(NumericArray oX, NumericArray oY)
	{
		return oX.combine(oY, (dX, dY) -> Math.atan2(dY, dX));
	}


	/**
	 * @param oX x component
	 * @param oY y component
	 * @param eType convention of the result
	 * @return direction of the vectors
	 */
	public static NumericArray direction(NumericArray oX, NumericArray oY, DirType eType)
	{
		return DirConverter.fromMath(mathDirection(oX, oY), eType);
	}


	/**
	 * Splits vectors given as magnitude and mathematical direction into
	 * components
	 * @param oMagnitude vector lengths
	 * @param oMath counter clockwise angles from the x axis, radians
	 * @return the x and the y component
	 */
	public static NumericArray[] decompose(NumericArray oMagnitude, NumericArray oMath)
	{
		return new NumericArray[]
		{
			oMagnitude.combine(oMath, (dMag, dDir) -> dMag * Math.cos(dDir)),
			oMagnitude.combine(oMath, (dMag, dDir) -> dMag * Math.sin(dDir))
		};
	}
}
