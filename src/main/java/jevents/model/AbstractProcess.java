package jevents.model;

/**
 * Holds the name shared by all processes and the parameter checks
 * applied by their constructors.
 */
public abstract class AbstractProcess implements Process
{
	private final String name;
	
	AbstractProcess(String name)
	{
		if(name == null || name.isEmpty())
			throw new InvalidParameterException("name", "must not be empty");
		this.name = name;
	}
	
	public String getName()
	{
		return name;
	}
	
	static int checkNonNegative(String parameter, int value)
	{
		if(value < 0)
			throw new InvalidParameterException(parameter, "must not be negative, was " + value);
		return value;
	}
	
	static double checkMean(String parameter, double mean)
	{
		if(!(mean > 0) || Double.isInfinite(mean))
			throw new InvalidParameterException(parameter, "must be positive and finite, was " + mean);
		return mean;
	}
	
	@Override
	public String toString()
	{
		return getClass().getSimpleName() + "(" + name + ")";
	}
}
