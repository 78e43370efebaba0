package jevents.random;

/**
 * Source of real-valued random variates. Each call to {@link #next()}
 * produces a fresh sample, independent of earlier ones.
 */
public interface Sampler
{
	public double next();
}
