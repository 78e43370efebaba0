package jevents.random;

/**
 * Creates samplers for the distributions used by stochastic processes.
 */
public interface SamplerFactory
{
	/**
	 * Returns a sampler for the exponential distribution with density
	 * (1/mean) e^(-x/mean), x >= 0.
	 */
	public Sampler exponential(double mean);
}
