package geoskel.array;

import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * N-dimensional numeric array used for every field value a container holds.
 * The container code only uses this interface, so an array may be backed by
 * concrete storage ({@link EagerArray}) or by a deferred computation
 * ({@link LazyArray}). Shapes are always known without computing values.
 * Arrays are never modified in place; every operation returns a new array.
 */
public interface NumericArray
{
	/**
	 * @return lengths of the dimensions, outermost first
	 */
	int[] getShape();


	int getRank();


	/**
	 * @return total number of elements
	 */
	int getSize();


	/**
	 * @return true if the values are stored as integers
	 */
	boolean isInteger();


	/**
	 * @return true if the values of this array have already been computed
	 */
	boolean isRealized();


	/**
	 * Applies a function to every element
	 * @param oOp element function
	 * @return array of the same shape holding doubles
	 */
	NumericArray map(DoubleUnaryOperator oOp);


	/**
	 * Combines two arrays of identical shape element by element
	 * @param oOther second operand
	 * @param oOp element function taking (this, other)
	 * @return array of the common shape holding doubles
	 */
	NumericArray combine(NumericArray oOther, DoubleBinaryOperator oOp);


	/**
	 * Reorders the axes
	 * @param nAxes for each output axis, the input axis it is taken from
	 * @return permuted array
	 */
	NumericArray permute(int[] nAxes);


	/**
	 * @return the array with all length one dimensions removed
	 */
	NumericArray squeeze();


	/**
	 * Gives the elements, in row major order, a new shape of the same size
	 * @param nShape new dimension lengths
	 * @return reshaped array
	 */
	NumericArray reshape(int[] nShape);


	/**
	 * Picks elements along one axis, in the given order
	 * @param nAxis axis to pick along
	 * @param nIndices positions along the axis
	 * @return array of the same rank with the picked positions
	 */
	NumericArray take(int nAxis, int[] nIndices);


	/**
	 * @param nAxis axis of length one
	 * @return the array without that axis
	 */
	NumericArray reduce(int nAxis);


	/**
	 * @return the rank two array with its axes swapped
	 */
	NumericArray transpose();


	/**
	 * @return the values rounded to the nearest integer, stored as integers
	 */
	NumericArray toInteger();


	/**
	 * @return the values stored as doubles
	 */
	NumericArray toDouble();


	/**
	 * Computes the values if needed
	 * @return concrete array with the same shape and values
	 */
	EagerArray realize();


	/**
	 * @return an array that computes its values only when realized
	 */
	NumericArray defer();


	/**
	 * Realizes the array and copies its values out in row major order
	 * @return flat copy of the values
	 */
	double[] toDoubleArray();
}
