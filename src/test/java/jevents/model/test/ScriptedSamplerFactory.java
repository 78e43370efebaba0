package jevents.model.test;

import java.util.*;

import jevents.random.*;

/**
 * Hands out samplers that replay fixed values. The first sampler requested
 * replays {@code durations}, the second {@code interarrivals}, and so on
 * alternately, matching the order in which a stochastic process asks for
 * them.
 */
class ScriptedSamplerFactory implements SamplerFactory
{
	private final double[] durations;
	private final double[] interarrivals;
	
	List<Double> requestedMeans = new ArrayList<Double>();
	
	ScriptedSamplerFactory(double[] durations, double[] interarrivals)
	{
		this.durations = durations;
		this.interarrivals = interarrivals;
	}
	
	public Sampler exponential(double mean)
	{
		double[] values = requestedMeans.size() % 2 == 0 ? durations : interarrivals;
		requestedMeans.add(mean);
		return new ScriptedSampler(values);
	}
	
	static class ScriptedSampler implements Sampler
	{
		private final double[] values;
		private int next = 0;
		
		ScriptedSampler(double[] values)
		{
			this.values = values;
		}
		
		public double next()
		{
			if(next >= values.length)
				throw new IllegalStateException("Script exhausted after " + values.length + " samples");
			return values[next++];
		}
	}
}
