package jevents.random;

import java.util.Date;

import cern.jet.random.engine.MersenneTwister;
import cern.jet.random.engine.RandomEngine;

/**
 * Sampler factory backed by a single Colt random engine. All samplers
 * created by one factory draw from the same engine, so a factory must
 * not be shared between processes that run on different threads.
 */
public class ColtSamplerFactory implements SamplerFactory
{
	// Seeds factories built without one; seeded once from the clock
	private static final RandomEngine seedSource = new MersenneTwister(new Date());
	
	private final RandomEngine rng;
	
	public ColtSamplerFactory(RandomEngine rng)
	{
		this.rng = rng;
	}
	
	public ColtSamplerFactory(int seed)
	{
		this(new MersenneTwister(seed));
	}
	
	/**
	 * Creates a factory over a new engine whose seed is drawn from a shared
	 * clock-seeded source, so factories created within the same clock tick
	 * still get different streams.
	 */
	public ColtSamplerFactory()
	{
		this(new MersenneTwister(nextDefaultSeed()));
	}
	
	static synchronized int nextDefaultSeed()
	{
		return seedSource.nextInt();
	}
	
	public Sampler exponential(double mean)
	{
		return new ExponentialSampler(mean, rng);
	}
	
	public RandomEngine getRandomEngine()
	{
		return rng;
	}
}
