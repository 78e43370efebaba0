package jevents.random;

import cern.jet.random.Exponential;
import cern.jet.random.engine.RandomEngine;

/**
 * Exponential variates parameterized by their mean, drawn from a Colt
 * random engine.
 */
public class ExponentialSampler implements Sampler
{
	private final double mean;
	private final Exponential dist;
	
	public ExponentialSampler(double mean, RandomEngine rng)
	{
		if(!(mean > 0) || Double.isInfinite(mean))
			throw new IllegalArgumentException("Mean must be positive and finite.");
		
		this.mean = mean;
		dist = new Exponential(1.0 / mean, rng);
	}
	
	public double next()
	{
		return dist.nextDouble();
	}
	
	public double getMean()
	{
		return mean;
	}
	
	@Override
	public String toString()
	{
		return String.format("Exponential(mean=%f)", mean);
	}
}
