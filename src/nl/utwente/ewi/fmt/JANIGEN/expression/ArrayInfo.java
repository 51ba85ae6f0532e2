package nl.utwente.ewi.fmt.JANIGEN.expression;

import java.util.List;

import nl.utwente.ewi.fmt.JANIGEN.JaniModel.JaniBaseType;

/**
 * Shape of an array: element type and the maximum size of each
 * dimension, outermost first.
 */
public class ArrayInfo
{
	public static final String ITERATOR_PREFIX = "__array_iterator_dim_";

	public final JaniBaseType elementType;
	public final List<Integer> maxSizes;

	public ArrayInfo(JaniBaseType elementType, List<Integer> maxSizes)
	{
		if (maxSizes.isEmpty())
			throw new IllegalArgumentException("Arrays need at least one dimension");
		for (Integer size : maxSizes) {
			if (size == null || size <= 0)
				throw new IllegalArgumentException("Array sizes should be positive, not: " + maxSizes);
		}
		this.elementType = elementType;
		this.maxSizes = List.copyOf(maxSizes);
	}

	public ArrayInfo(JaniBaseType elementType, int maxSize)
	{
		this(elementType, List.of(maxSize));
	}

	public int getDimensions() {
		return maxSizes.size();
	}

	public int getMaxSize() {
		return maxSizes.get(0);
	}

	/** Shape of the elements of a multi-dimensional array. */
	public ArrayInfo elementShape() {
		if (getDimensions() == 1)
			throw new IllegalStateException("Elements of a one-dimensional array are not arrays");
		return new ArrayInfo(elementType, maxSizes.subList(1, maxSizes.size()));
	}

	/** An array of maximum size filled with zero values. */
	public OperatorExpression createEmpty() {
		return createEmpty(0);
	}

	private OperatorExpression createEmpty(int dim) {
		Expression fill;
		if (dim + 1 < maxSizes.size())
			fill = createEmpty(dim + 1);
		else
			fill = ConstantExpression.zeroOf(elementType);
		return OperatorExpression.arrayCreate(ITERATOR_PREFIX + dim,
				new ConstantExpression((long)maxSizes.get(dim)), fill);
	}

	public boolean equals(Object other) {
		if (!(other instanceof ArrayInfo))
			return false;
		ArrayInfo o = (ArrayInfo)other;
		return elementType == o.elementType && maxSizes.equals(o.maxSizes);
	}

	public int hashCode() {
		return elementType.hashCode() * 31 + maxSizes.hashCode();
	}

	public String toString() {
		return elementType.janiName + maxSizes;
	}
}
