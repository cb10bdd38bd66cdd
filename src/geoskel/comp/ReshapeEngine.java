package geoskel.comp;

import geoskel.array.NumericArray;
import geoskel.array.Shapes;
import geoskel.error.IrreconcilableShapeException;
import geoskel.system.SkelConfig;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Brings incoming arrays to the shape and axis order a field is stored in.
 * <p>
 * When the caller names the axes of the input, trivial axes are dropped and
 * the rest are permuted into canonical order. Otherwise, or if the shape
 * still differs, length one axes are squeezed out and the remaining shape
 * must equal the expected one, or be its transpose when both have rank two.
 * Length one axes the field expects are then put back so the result always
 * has the full rank.
 */
public class ReshapeEngine
{
	private static final Logger m_oLogger = LogManager.getLogger(ReshapeEngine.class);

	/**
	 * True if the rank two transpose fallback may be used
	 */
	private final boolean m_bTranspose;


	/**
	 * Creates an engine using the configured transpose setting
	 */
	public ReshapeEngine()
	{
		this(SkelConfig.getInstance().allowTranspose());
	}


	public ReshapeEngine(boolean bTranspose)
	{
		m_bTranspose = bTranspose;
	}


	/**
	 * Aligns an array to a field's shape
	 * @param sName field the data is for, used in messages
	 * @param oData incoming array
	 * @param oDims names of the input axes in order, or null
	 * @param oTargetDims coordinates of the field in canonical order
	 * @param nTarget shape of the field
	 * @return an array of the target shape
	 * @throws IrreconcilableShapeException if no allowed step gives the
	 * target shape
	 */
	public NumericArray align(String sName, NumericArray oData, List<String> oDims, List<String> oTargetDims, int[] nTarget)
	{
		int[] nGiven = oData.getShape();
		if (oDims == null && Arrays.equals(nGiven, nTarget))
			return oData;

		NumericArray oWork = oData;
		if (oDims != null)
		{
			oWork = reorder(sName, oData, oDims, oTargetDims, nTarget);
			if (Arrays.equals(oWork.getShape(), nTarget))
				return oWork;
		}

		int[] nSqueezed = Shapes.squeeze(oWork.getShape());
		int[] nExpected = Shapes.squeeze(nTarget);
		if (Arrays.equals(nSqueezed, nExpected))
		{
			m_oLogger.debug("{}: expanding {} to {}", sName, Shapes.toString(oWork.getShape()), Shapes.toString(nTarget));
			return oWork.reshape(nTarget);
		}

		if (m_bTranspose && nSqueezed.length == 2 && nExpected.length == 2
			&& nSqueezed[0] == nExpected[1] && nSqueezed[1] == nExpected[0])
		{
			m_oLogger.debug("{}: transposing {} to {}", sName, Shapes.toString(nSqueezed), Shapes.toString(nTarget));
			return oWork.squeeze().transpose().reshape(nTarget);
		}

		throw new IrreconcilableShapeException(sName, nGiven, nTarget);
	}


	/**
	 * Drops trivial named axes and permutes the others into canonical order
	 */
	private NumericArray reorder(String sName, NumericArray oData, List<String> oDims, List<String> oTargetDims, int[] nTarget)
	{
		int[] nGiven = oData.getShape();
		if (oDims.size() != nGiven.length || new HashSet(oDims).size() != oDims.size())
			throw new IrreconcilableShapeException(sName, nGiven, nTarget);

		ArrayList<String> oKeptDims = new ArrayList();
		ArrayList<Integer> oKeptLens = new ArrayList();
		for (int nAxis = 0; nAxis < nGiven.length; nAxis++)
		{
			String sDim = oDims.get(nAxis);
			int nTargetAxis = oTargetDims.indexOf(sDim);
			boolean bTrivial = nTargetAxis < 0 || nTarget[nTargetAxis] == 1;
			if (bTrivial && nGiven[nAxis] == 1)
				continue;
			if (nTargetAxis < 0)
				throw new IrreconcilableShapeException(sName, nGiven, nTarget);
			oKeptDims.add(sDim);
			oKeptLens.add(nGiven[nAxis]);
		}

		NumericArray oWork = oData;
		if (oKeptDims.size() != nGiven.length)
		{
			int[] nKept = new int[oKeptLens.size()];
			for (int nIndex = 0; nIndex < nKept.length; nIndex++)
				nKept[nIndex] = oKeptLens.get(nIndex);
			oWork = oWork.reshape(nKept);
		}

		ArrayList<String> oOrdered = new ArrayList();
		for (String sDim : oTargetDims)
		{
			if (oKeptDims.contains(sDim))
				oOrdered.add(sDim);
		}
		if (!oOrdered.equals(oKeptDims))
		{
			int[] nAxes = new int[oOrdered.size()];
			for (int nIndex = 0; nIndex < nAxes.length; nIndex++)
				nAxes[nIndex] = oKeptDims.indexOf(oOrdered.get(nIndex));
			m_oLogger.debug("{}: permuting axes {} to {}", sName, oKeptDims, oOrdered);
			oWork = oWork.permute(nAxes);
		}

		int[] nShape = oWork.getShape();
		if (Arrays.equals(Shapes.squeeze(nShape), Shapes.squeeze(nTarget)) && oOrdered.size() <= nTarget.length)
		{
			int[] nFull = new int[nTarget.length];
			Arrays.fill(nFull, 1);
			for (int nIndex = 0; nIndex < oOrdered.size(); nIndex++)
				nFull[oTargetDims.indexOf(oOrdered.get(nIndex))] = nShape[nIndex];
			if (Arrays.equals(nFull, nTarget))
				return oWork.reshape(nTarget);
		}
		return oWork;
	}
}
