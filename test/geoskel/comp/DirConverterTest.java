package geoskel.comp;

import static org.junit.jupiter.api.Assertions.*;

import geoskel.array.EagerArray;
import geoskel.schema.DirType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DirConverterTest
{
	private static final double EPS = 1e-9;


	@Test
	@DisplayName("Compass directions map to mathematical angles")
	void toMath()
	{
		assertEquals(Math.PI / 2, DirConverter.toMath(0.0, DirType.TO), EPS);
		assertEquals(0.0, DirConverter.toMath(90.0, DirType.TO), EPS);
		assertEquals(-Math.PI / 2, DirConverter.toMath(0.0, DirType.FROM), EPS);
		assertEquals(Math.PI, DirConverter.toMath(90.0, DirType.FROM), EPS);
		assertEquals(1.25, DirConverter.toMath(1.25, DirType.MATH), EPS);
	}


	@Test
	@DisplayName("Mathematical angles stay within (-pi, pi]")
	void mathRange()
	{
		for (double dDir = -720.0; dDir <= 720.0; dDir += 7.5)
		{
			for (DirType eType : new DirType[]{DirType.FROM, DirType.TO})
			{
				double dMath = DirConverter.toMath(dDir, eType);
				assertTrue(dMath > -Math.PI - EPS && dMath <= Math.PI + EPS, String.format("%f %s gave %f", dDir, eType, dMath));
			}
		}
	}


	@Test
	@DisplayName("Converting there and back returns the value modulo 360")
	void roundTrip()
	{
		DirType[] eTypes = new DirType[]{DirType.FROM, DirType.TO};
		for (double dDir = 0.0; dDir < 360.0; dDir += 11.0)
		{
			for (DirType eIn : eTypes)
			{
				for (DirType eOut : eTypes)
				{
					double dBack = DirConverter.convert(DirConverter.convert(dDir, eIn, eOut), eOut, eIn);
					double dDiff = Math.abs(dBack - dDir) % 360.0;
					assertTrue(dDiff < 1e-6 || 360.0 - dDiff < 1e-6, String.format("%f %s %s gave %f", dDir, eIn, eOut, dBack));
				}
			}
		}
	}


	@Test
	@DisplayName("From and to differ by half a turn")
	void fromTo()
	{
		assertEquals(180.0, DirConverter.convert(0.0, DirType.FROM, DirType.TO), EPS);
		assertEquals(90.0, DirConverter.convert(270.0, DirType.TO, DirType.FROM), EPS);
	}


	@Test
	@DisplayName("Arrays are converted element by element")
	void arrays()
	{
		double[] dOut = DirConverter.convert(EagerArray.of(new double[]{0, 90, 180}), DirType.FROM, DirType.TO).toDoubleArray();
		assertArrayEquals(new double[]{180, 270, 0}, dOut, 1e-6);
	}
}
